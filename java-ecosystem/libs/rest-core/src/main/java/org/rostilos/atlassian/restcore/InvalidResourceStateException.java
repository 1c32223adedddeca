package org.rostilos.atlassian.restcore;

/**
 * Thrown before any request is issued when the locally cached state of a resource
 * does not allow the requested action.
 */
public class InvalidResourceStateException extends AtlassianClientException {

    public InvalidResourceStateException(String message) {
        super(message);
    }
}
