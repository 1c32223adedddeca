package org.rostilos.atlassian.bitbucket.cloud.pullrequests;

import com.fasterxml.jackson.databind.JsonNode;
import org.rostilos.atlassian.restcore.resource.EndpointReference;
import org.rostilos.atlassian.restcore.resource.ResourceCollection;

public class PullRequestComments extends ResourceCollection<Comment> {

    public PullRequestComments(EndpointReference endpoint) {
        super(endpoint);
    }

    @Override
    protected Comment wrap(EndpointReference itemEndpoint, JsonNode data) {
        return new Comment(itemEndpoint, data);
    }
}
