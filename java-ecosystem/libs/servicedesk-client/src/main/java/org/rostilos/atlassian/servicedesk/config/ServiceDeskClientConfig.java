package org.rostilos.atlassian.servicedesk.config;

import org.rostilos.atlassian.restcore.AtlassianRestClient;
import org.rostilos.atlassian.restcore.HttpAuthorizedClientFactory;
import org.rostilos.atlassian.restcore.model.EAtlassianProduct;
import org.rostilos.atlassian.servicedesk.ServiceDeskClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

@Configuration
@ComponentScan(basePackages = {"org.rostilos.atlassian.restcore", "org.rostilos.atlassian.servicedesk"})
public class ServiceDeskClientConfig {

    @Bean
    public ServiceDeskClient serviceDeskClient(
            HttpAuthorizedClientFactory httpAuthorizedClientFactory,
            @Value("${atlassian.servicedesk.url}") String url,
            @Value("${atlassian.servicedesk.username}") String username,
            @Value("${atlassian.servicedesk.api-token}") String apiToken,
            @Value("${atlassian.servicedesk.advanced-mode:false}") boolean advancedMode
    ) {
        return new ServiceDeskClient(
                new AtlassianRestClient(
                        httpAuthorizedClientFactory.createClient(username, apiToken, EAtlassianProduct.JIRA_SERVICE_DESK.getId()),
                        url),
                advancedMode);
    }
}
