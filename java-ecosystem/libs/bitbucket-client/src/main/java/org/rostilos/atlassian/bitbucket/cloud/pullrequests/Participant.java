package org.rostilos.atlassian.bitbucket.cloud.pullrequests;

import com.fasterxml.jackson.databind.JsonNode;
import org.rostilos.atlassian.bitbucket.cloud.common.User;
import org.rostilos.atlassian.bitbucket.model.EParticipantRole;
import org.rostilos.atlassian.bitbucket.model.EParticipantState;
import org.rostilos.atlassian.restcore.resource.EndpointReference;
import org.rostilos.atlassian.restcore.resource.ResourceObject;

import java.time.OffsetDateTime;

/**
 * Entry of a pull request's {@code participants} list. Embedded only, never fetched on its own.
 */
public class Participant extends ResourceObject {
    public static final String TYPE = "participant";

    public Participant(EndpointReference endpoint, JsonNode data) {
        super(endpoint, data, TYPE);
    }

    public User getUser() {
        JsonNode user = data().node("user");
        return user != null && user.isObject() ? new User(null, user) : null;
    }

    public EParticipantRole getRole() {
        return EParticipantRole.fromValue(data().text("role"));
    }

    public boolean isParticipant() {
        return getRole() == EParticipantRole.PARTICIPANT;
    }

    public boolean isReviewer() {
        return getRole() == EParticipantRole.REVIEWER;
    }

    public EParticipantState getState() {
        return EParticipantState.fromValue(data().text("state"));
    }

    public boolean hasApproved() {
        return getState() == EParticipantState.APPROVED;
    }

    public boolean hasChangesRequested() {
        return getState() == EParticipantState.CHANGES_REQUESTED;
    }

    public boolean isApproved() {
        return Boolean.TRUE.equals(data().bool("approved"));
    }

    public OffsetDateTime getParticipatedOn() {
        return data().time("participated_on");
    }
}
