package org.rostilos.atlassian.restcore;

/**
 * Base exception for failures raised by the Atlassian REST clients.
 */
public class AtlassianClientException extends RuntimeException {

    public AtlassianClientException(String message) {
        super(message);
    }

    public AtlassianClientException(String message, Throwable cause) {
        super(message, cause);
    }
}
