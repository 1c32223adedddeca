package org.rostilos.atlassian.restcore;

/**
 * Raised when an Atlassian endpoint answers with a non-2xx status.
 * The message is the server supplied error text when the body carried one.
 */
public class AtlassianApiException extends AtlassianClientException {

    private final String operation;
    private final int statusCode;
    private final String responseBody;
    private final String serverMessage;

    public AtlassianApiException(String operation, int statusCode, String responseBody, String serverMessage) {
        super(buildMessage(operation, statusCode, responseBody, serverMessage));
        this.operation = operation;
        this.statusCode = statusCode;
        this.responseBody = responseBody;
        this.serverMessage = serverMessage;
    }

    private static String buildMessage(String operation, int statusCode, String responseBody, String serverMessage) {
        if (serverMessage != null && !serverMessage.isBlank()) {
            return serverMessage;
        }
        return String.format("Atlassian API error during %s: HTTP %d - %s", operation, statusCode, responseBody);
    }

    public String getOperation() {
        return operation;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getResponseBody() {
        return responseBody;
    }

    public String getServerMessage() {
        return serverMessage;
    }

    public boolean isNotFound() {
        return statusCode == 404;
    }

    public boolean isUnauthorized() {
        return statusCode == 401;
    }

    public boolean isForbidden() {
        return statusCode == 403;
    }
}
