package org.rostilos.atlassian.restcore;

public class ResourceNotFoundException extends AtlassianApiException {

    public ResourceNotFoundException(String operation, String responseBody, String serverMessage) {
        super(operation, 404, responseBody, serverMessage);
    }
}
