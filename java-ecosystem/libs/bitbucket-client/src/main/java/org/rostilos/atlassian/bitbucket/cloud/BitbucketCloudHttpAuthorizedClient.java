package org.rostilos.atlassian.bitbucket.cloud;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.*;
import org.rostilos.atlassian.restcore.AtlassianClientException;
import org.rostilos.atlassian.restcore.HttpAuthorizedClient;
import org.rostilos.atlassian.restcore.model.EAtlassianProduct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;

import static java.lang.String.format;

/**
 * Exchanges an OAuth consumer key/secret for an access token (client credentials grant)
 * and returns a client that sends it as a bearer token.
 */
@Component
public class BitbucketCloudHttpAuthorizedClient implements HttpAuthorizedClient {
    private static final Logger log = LoggerFactory.getLogger(BitbucketCloudHttpAuthorizedClient.class);

    private final OkHttpClient.Builder clientBuilder;
    private final ObjectMapper objectMapper;
    private final String tokenUrl;

    @Autowired
    public BitbucketCloudHttpAuthorizedClient(OkHttpClient.Builder clientBuilder) {
        this(clientBuilder, new ObjectMapper(), BitbucketCloudConfig.OAUTH_TOKEN_URL);
    }

    public BitbucketCloudHttpAuthorizedClient(
            OkHttpClient.Builder clientBuilder,
            ObjectMapper objectMapper,
            String tokenUrl
    ) {
        this.clientBuilder = clientBuilder;
        this.objectMapper = objectMapper;
        this.tokenUrl = tokenUrl;
    }

    @Override
    public EAtlassianProduct getProduct() {
        return EAtlassianProduct.BITBUCKET_CLOUD;
    }

    @Override
    public OkHttpClient createClient(String clientId, String clientSecret) {
        OkHttpClient baseClient = clientBuilder.build();
        String bearerToken = negotiateBearerToken(clientId, clientSecret, baseClient);
        return createAuthorisingClient(baseClient, bearerToken);
    }

    public OkHttpClient createAuthorisingClient(OkHttpClient baseClient, String bearerToken) {
        return baseClient.newBuilder()
                .addInterceptor(chain -> {
                    Request newRequest = chain.request().newBuilder()
                            .header("Authorization", format("Bearer %s", bearerToken))
                            .build();
                    return chain.proceed(newRequest);
                })
                .build();
    }

    private String negotiateBearerToken(String clientId, String clientSecret, OkHttpClient okHttpClient) {
        Request request = new Request.Builder()
                .header("Authorization", Credentials.basic(clientId, clientSecret))
                .header("Accept", "application/json")
                .url(tokenUrl)
                .post(new FormBody.Builder()
                        .add("grant_type", "client_credentials")
                        .build())
                .build();

        try (Response response = okHttpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            String payload = body != null ? body.string() : "";
            if (!response.isSuccessful()) {
                throw new AtlassianClientException("Failed to authenticate: " + response.code() + " - " + payload);
            }

            JsonNode node = objectMapper.readTree(payload);
            JsonNode token = node.get("access_token");
            if (token == null || token.isNull()) {
                throw new AtlassianClientException("Token response did not contain an access_token");
            }
            log.debug("Obtained Bitbucket Cloud access token, expires in {}s", node.path("expires_in").asInt());
            return token.asText();
        } catch (IOException ex) {
            throw new AtlassianClientException("Could not retrieve bearer token", ex);
        }
    }
}
