package org.rostilos.atlassian.restcore.model;

import java.util.Locale;

/**
 * Atlassian products a client can be authorized against.
 */
public enum EAtlassianProduct {
    BITBUCKET_CLOUD("bitbucket-cloud"),
    JIRA_SERVICE_DESK("jira-service-desk");

    private final String id;

    EAtlassianProduct(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }

    public static EAtlassianProduct fromId(String productId) {
        if (productId == null) {
            throw new IllegalArgumentException("Product ID cannot be null");
        }

        String normalized = productId.toLowerCase(Locale.ENGLISH).replace('_', '-');
        for (EAtlassianProduct product : values()) {
            if (product.id.equals(normalized)) {
                return product;
            }
        }
        throw new IllegalArgumentException("Unknown Atlassian product: " + productId);
    }
}
