package org.rostilos.atlassian.bitbucket.config;

import org.rostilos.atlassian.bitbucket.cloud.BitbucketCloud;
import org.rostilos.atlassian.bitbucket.cloud.BitbucketCloudConfig;
import org.rostilos.atlassian.restcore.AtlassianRestClient;
import org.rostilos.atlassian.restcore.HttpAuthorizedClientFactory;
import org.rostilos.atlassian.restcore.model.EAtlassianProduct;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

/**
 * Wires a {@link BitbucketCloud} from {@code atlassian.bitbucket.*} properties.
 * An access token takes precedence over an OAuth consumer key/secret pair.
 */
@Configuration
@ComponentScan(basePackages = {"org.rostilos.atlassian.restcore", "org.rostilos.atlassian.bitbucket.cloud"})
public class BitbucketCloudClientConfig {

    @Bean
    public BitbucketCloud bitbucketCloud(
            HttpAuthorizedClientFactory httpAuthorizedClientFactory,
            @Value("${atlassian.bitbucket.api-url:" + BitbucketCloudConfig.BITBUCKET_API_BASE + "}") String apiUrl,
            @Value("${atlassian.bitbucket.access-token:}") String accessToken,
            @Value("${atlassian.bitbucket.client-id:}") String clientId,
            @Value("${atlassian.bitbucket.client-secret:}") String clientSecret
    ) {
        if (!accessToken.isBlank()) {
            return new BitbucketCloud(new AtlassianRestClient(
                    httpAuthorizedClientFactory.createClientWithBearerToken(accessToken), apiUrl));
        }
        return new BitbucketCloud(new AtlassianRestClient(
                httpAuthorizedClientFactory.createClient(clientId, clientSecret, EAtlassianProduct.BITBUCKET_CLOUD.getId()),
                apiUrl));
    }
}
