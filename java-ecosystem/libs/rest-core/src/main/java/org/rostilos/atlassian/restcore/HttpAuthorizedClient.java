package org.rostilos.atlassian.restcore;

import okhttp3.OkHttpClient;
import org.rostilos.atlassian.restcore.model.EAtlassianProduct;

/**
 * Product specific way of turning credentials into an authorized {@link OkHttpClient}.
 */
public interface HttpAuthorizedClient {
    EAtlassianProduct getProduct();
    OkHttpClient createClient(String clientId, String clientSecret);
}
