package org.rostilos.atlassian.servicedesk.config;

import okhttp3.OkHttpClient;
import org.junit.jupiter.api.Test;
import org.rostilos.atlassian.restcore.HttpAuthorizedClientFactory;
import org.rostilos.atlassian.servicedesk.ServiceDeskClient;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;
import org.springframework.core.env.MapPropertySource;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ServiceDeskClientConfigTest {

    @Test
    void testContext_WiresClientFromProperties() {
        try (AnnotationConfigApplicationContext context = new AnnotationConfigApplicationContext()) {
            context.getEnvironment().getPropertySources().addFirst(new MapPropertySource("test", Map.of(
                    "atlassian.servicedesk.url", "https://example.atlassian.net",
                    "atlassian.servicedesk.username", "agent@example.com",
                    "atlassian.servicedesk.api-token", "api-token",
                    "atlassian.servicedesk.advanced-mode", "true",
                    "atlassian.http.timeout.read", "5")));
            context.register(ServiceDeskClientConfig.class);
            context.refresh();

            ServiceDeskClient client = context.getBean(ServiceDeskClient.class);

            assertThat(client.isAdvancedMode()).isTrue();
            assertThat(client.getClient().getBaseUrl().toString()).isEqualTo("https://example.atlassian.net/");
            assertThat(context.getBean(OkHttpClient.Builder.class).build().readTimeoutMillis()).isEqualTo(5_000);
            assertThat(context.getBean(HttpAuthorizedClientFactory.class)
                    .createClient("agent@example.com", "api-token", "jira-service-desk")
                    .interceptors()).hasSize(1);
            assertThat(context.getBean(HttpAuthorizedClientFactory.class)
                    .createClientWithBearerToken("token")
                    .readTimeoutMillis()).isEqualTo(5_000);
        }
    }
}
