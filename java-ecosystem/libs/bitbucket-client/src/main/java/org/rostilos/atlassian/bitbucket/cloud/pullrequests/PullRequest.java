package org.rostilos.atlassian.bitbucket.cloud.pullrequests;

import com.fasterxml.jackson.databind.JsonNode;
import org.rostilos.atlassian.bitbucket.cloud.common.Commit;
import org.rostilos.atlassian.bitbucket.cloud.common.User;
import org.rostilos.atlassian.bitbucket.cloud.dto.request.ApproveRequest;
import org.rostilos.atlassian.bitbucket.cloud.dto.request.CreateCommentRequest;
import org.rostilos.atlassian.bitbucket.cloud.dto.request.MergeRequest;
import org.rostilos.atlassian.bitbucket.model.EMergeStrategy;
import org.rostilos.atlassian.bitbucket.model.EPullRequestState;
import org.rostilos.atlassian.restcore.InvalidResourceStateException;
import org.rostilos.atlassian.restcore.resource.EndpointReference;
import org.rostilos.atlassian.restcore.resource.FetchableReference;
import org.rostilos.atlassian.restcore.resource.ResourceObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A Bitbucket Cloud pull request.
 * <p>
 * Getters read the snapshot taken when the pull request was fetched. Actions
 * (comment, approve, unapprove, decline, merge) go to the server but leave the
 * snapshot untouched, so {@link #getState()} keeps reporting the old state after
 * a successful merge until the pull request is fetched again.
 */
public class PullRequest extends ResourceObject {
    public static final String TYPE = "pullrequest";

    private static final Logger log = LoggerFactory.getLogger(PullRequest.class);

    public PullRequest(EndpointReference endpoint, JsonNode data) {
        super(endpoint, data, TYPE);
    }

    public Integer getId() {
        return data().integer("id");
    }

    public String getTitle() {
        return data().text("title");
    }

    public String getDescription() {
        return data().text("description");
    }

    /**
     * @return the lifecycle state, or {@code null} when the server reports one this client does not know
     */
    public EPullRequestState getState() {
        return EPullRequestState.fromValue(data().text("state"));
    }

    public boolean isOpen() {
        return getState() == EPullRequestState.OPEN;
    }

    public boolean isMerged() {
        return getState() == EPullRequestState.MERGED;
    }

    public boolean isDeclined() {
        return getState() == EPullRequestState.DECLINED;
    }

    public boolean isSuperseded() {
        return getState() == EPullRequestState.SUPERSEDED;
    }

    public OffsetDateTime getCreatedOn() {
        return data().time("created_on");
    }

    public OffsetDateTime getUpdatedOn() {
        return data().time("updated_on");
    }

    public Integer getCommentCount() {
        return data().integer("comment_count");
    }

    public Integer getTaskCount() {
        return data().integer("task_count");
    }

    public String getDeclinedReason() {
        return data().text("reason");
    }

    public Boolean getCloseSourceBranch() {
        return data().bool("close_source_branch");
    }

    public String getSourceBranch() {
        return textAt("source", "branch", "name");
    }

    public String getDestinationBranch() {
        return textAt("destination", "branch", "name");
    }

    public User getAuthor() {
        JsonNode author = data().node("author");
        return author != null && author.isObject() ? new User(null, author) : null;
    }

    public User getClosedBy() {
        JsonNode closedBy = data().node("closed_by");
        return closedBy != null && closedBy.isObject() ? new User(null, closedBy) : null;
    }

    public List<Participant> getParticipants() {
        List<Participant> participants = new ArrayList<>();
        for (JsonNode participant : data().path("participants")) {
            participants.add(new Participant(null, participant));
        }
        return participants;
    }

    public List<User> getReviewers() {
        List<User> reviewers = new ArrayList<>();
        for (JsonNode reviewer : data().path("reviewers")) {
            reviewers.add(new User(null, reviewer));
        }
        return reviewers;
    }

    /**
     * Link to the merge commit. Present only once the pull request has been merged.
     */
    public Optional<FetchableReference<Commit>> getMergeCommit() {
        JsonNode href = data().path("merge_commit", "links", "self", "href");
        if (href.isMissingNode() || href.isNull() || getEndpoint() == null) {
            return Optional.empty();
        }
        EndpointReference target = new EndpointReference(getEndpoint().client(), href.asText());
        return Optional.of(new FetchableReference<>(target, Commit::new));
    }

    public PullRequestComments comments() {
        return new PullRequestComments(requireEndpoint().child("comments"));
    }

    // ========== Actions ==========

    /**
     * Posts a comment with the given markdown text.
     *
     * @throws IllegalArgumentException when the text is null or empty; nothing is sent
     */
    public Comment comment(String raw) throws IOException {
        if (raw == null || raw.isEmpty()) {
            throw new IllegalArgumentException("Comment text cannot be null or empty");
        }
        JsonNode created = postAt("comments", CreateCommentRequest.of(raw));
        EndpointReference commentEndpoint = requireEndpoint().child("comments", created.path("id").asText());
        return new Comment(commentEndpoint, created);
    }

    /**
     * @throws InvalidResourceStateException when the snapshot is not open; nothing is sent
     */
    public JsonNode approve() throws IOException {
        checkIfOpen("approve");
        log.debug("Approving pull request {}", getUrl());
        return postAt("approve", new ApproveRequest(true));
    }

    public JsonNode unapprove() throws IOException {
        checkIfOpen("unapprove");
        log.debug("Removing approval from pull request {}", getUrl());
        return deleteAt("approve");
    }

    /**
     * @throws InvalidResourceStateException when the snapshot is not open; nothing is sent
     */
    public JsonNode decline() throws IOException {
        checkIfOpen("decline");
        log.info("Declining pull request {}", getUrl());
        return postAt("decline", null);
    }

    public JsonNode merge() throws IOException {
        return merge(EMergeStrategy.MERGE_COMMIT, null);
    }

    /**
     * @param mergeStrategy wire value: {@code merge_commit}, {@code squash} or {@code fast_forward}
     * @throws IllegalArgumentException when the strategy is unknown, whatever the state
     */
    public JsonNode merge(String mergeStrategy, Boolean closeSourceBranch) throws IOException {
        return merge(EMergeStrategy.fromValue(mergeStrategy), closeSourceBranch);
    }

    /**
     * Merges the pull request.
     *
     * @param closeSourceBranch {@code null} falls back to the value stored on the pull request
     * @throws IllegalArgumentException       when the strategy is null
     * @throws InvalidResourceStateException when the snapshot is not open; nothing is sent
     */
    public JsonNode merge(EMergeStrategy mergeStrategy, Boolean closeSourceBranch) throws IOException {
        if (mergeStrategy == null) {
            throw new IllegalArgumentException("merge_strategy cannot be null");
        }
        checkIfOpen("merge");
        Boolean close = closeSourceBranch != null ? closeSourceBranch : getCloseSourceBranch();
        log.info("Merging pull request {} with strategy {}", getUrl(), mergeStrategy.getValue());
        return postAt("merge", new MergeRequest(close, mergeStrategy.getValue()));
    }

    // ========== Helper Methods ==========

    private void checkIfOpen(String action) {
        if (!isOpen()) {
            throw new InvalidResourceStateException(
                    String.format("Cannot %s pull request %s: it is %s, not OPEN",
                            action, getId(), data().text("state")));
        }
    }

    private String textAt(String... fields) {
        JsonNode node = data().path(fields);
        return node.isMissingNode() || node.isNull() ? null : node.asText();
    }
}
