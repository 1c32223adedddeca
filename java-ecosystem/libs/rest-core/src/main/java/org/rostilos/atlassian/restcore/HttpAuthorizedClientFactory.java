package org.rostilos.atlassian.restcore;

import okhttp3.Credentials;
import okhttp3.OkHttpClient;
import org.rostilos.atlassian.restcore.model.EAtlassianProduct;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Entry point for authorized Atlassian HTTP clients.
 * <p>
 * Credential pairs are dispatched to the {@link HttpAuthorizedClient} registered for the product.
 * Ready-made tokens and basic-auth pairs are applied directly. Every client derives from the shared
 * {@link OkHttpClient.Builder}, so the {@code atlassian.http.timeout.*} settings apply to all of them.
 */
@Component
public class HttpAuthorizedClientFactory {
    private static final String AUTHORIZATION_HEADER = "Authorization";

    private final Map<EAtlassianProduct, HttpAuthorizedClient> productClients = new EnumMap<>(EAtlassianProduct.class);
    private final OkHttpClient.Builder clientBuilder;

    public HttpAuthorizedClientFactory(List<HttpAuthorizedClient> productClients, OkHttpClient.Builder clientBuilder) {
        for (HttpAuthorizedClient productClient : productClients) {
            HttpAuthorizedClient previous = this.productClients.put(productClient.getProduct(), productClient);
            if (previous != null) {
                throw new IllegalStateException("Duplicate authorized client for " + productClient.getProduct());
            }
        }
        this.clientBuilder = clientBuilder;
    }

    /**
     * Authorizes with the product's own scheme, e.g. OAuth client credentials for Bitbucket Cloud.
     *
     * @param productId product id or enum name, see {@link EAtlassianProduct#fromId}
     */
    public OkHttpClient createClient(String clientId, String clientSecret, String productId) {
        requireText(clientId, "No ClientId has been set for Atlassian connections");
        requireText(clientSecret, "No ClientSecret has been set for Atlassian connections");
        EAtlassianProduct product = EAtlassianProduct.fromId(productId);
        HttpAuthorizedClient productClient = productClients.get(product);
        if (productClient == null) {
            throw new IllegalArgumentException("No factory for Atlassian product: " + productId);
        }
        return productClient.createClient(clientId, clientSecret);
    }

    /**
     * @param accessToken OAuth2 access token or Bitbucket repository/workspace access token
     */
    public OkHttpClient createClientWithBearerToken(String accessToken) {
        requireText(accessToken, "Access token cannot be null or empty");
        return withAuthorization("Bearer " + accessToken);
    }

    /**
     * Jira Cloud e-mail plus API token, or a Bitbucket app password.
     */
    public OkHttpClient createClientWithBasicAuth(String username, String secret) {
        requireText(username, "Username cannot be null or empty");
        requireText(secret, "Secret cannot be null or empty");
        return withAuthorization(Credentials.basic(username, secret));
    }

    private OkHttpClient withAuthorization(String authorization) {
        return clientBuilder.build().newBuilder()
                .addInterceptor(chain -> chain.proceed(chain.request().newBuilder()
                        .header(AUTHORIZATION_HEADER, authorization)
                        .build()))
                .build();
    }

    private static void requireText(String value, String message) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(message);
        }
    }
}
