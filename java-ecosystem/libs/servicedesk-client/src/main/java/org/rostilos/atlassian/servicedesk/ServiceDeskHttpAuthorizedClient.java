package org.rostilos.atlassian.servicedesk;

import okhttp3.Credentials;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import org.rostilos.atlassian.restcore.HttpAuthorizedClient;
import org.rostilos.atlassian.restcore.model.EAtlassianProduct;
import org.springframework.stereotype.Component;

/**
 * Jira Cloud authenticates REST calls with HTTP basic auth: account e-mail plus API token.
 */
@Component
public class ServiceDeskHttpAuthorizedClient implements HttpAuthorizedClient {
    private final OkHttpClient.Builder clientBuilder;

    public ServiceDeskHttpAuthorizedClient(OkHttpClient.Builder clientBuilder) {
        this.clientBuilder = clientBuilder;
    }

    @Override
    public EAtlassianProduct getProduct() {
        return EAtlassianProduct.JIRA_SERVICE_DESK;
    }

    /**
     * @param username     account e-mail
     * @param apiToken     API token of that account
     */
    @Override
    public OkHttpClient createClient(String username, String apiToken) {
        String credential = Credentials.basic(username, apiToken);
        return clientBuilder.build().newBuilder()
                .addInterceptor(chain -> {
                    Request authorized = chain.request().newBuilder()
                            .header("Authorization", credential)
                            .build();
                    return chain.proceed(authorized);
                })
                .build();
    }
}
