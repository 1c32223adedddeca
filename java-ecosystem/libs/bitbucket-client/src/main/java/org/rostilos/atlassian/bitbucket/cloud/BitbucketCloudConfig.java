package org.rostilos.atlassian.bitbucket.cloud;

public final class BitbucketCloudConfig {
    public static final String BITBUCKET_API_BASE = "https://api.bitbucket.org/2.0";
    public static final String OAUTH_TOKEN_URL = "https://bitbucket.org/site/oauth2/access_token";

    private BitbucketCloudConfig() {
    }
}
