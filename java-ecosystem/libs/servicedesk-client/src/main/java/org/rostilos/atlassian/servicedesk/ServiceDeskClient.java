package org.rostilos.atlassian.servicedesk;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import okhttp3.HttpUrl;
import org.rostilos.atlassian.restcore.AtlassianClientException;
import org.rostilos.atlassian.restcore.AtlassianRestClient;
import org.rostilos.atlassian.servicedesk.insight.InsightClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.rostilos.atlassian.restcore.AtlassianRestClient.encodeSegment;

/**
 * Jira Service Management REST client ({@code rest/servicedeskapi}).
 * <p>
 * Every call sends {@code X-ExperimentalApi: opt-in}. Methods return the decoded JSON as is;
 * list calls documented as "values" return only the {@code values} array unless the client
 * runs in advanced mode, in which case the whole page comes back.
 */
public class ServiceDeskClient {
    private static final Logger log = LoggerFactory.getLogger(ServiceDeskClient.class);

    public static final int DEFAULT_START = 0;
    public static final int DEFAULT_LIMIT = 50;

    static final String API = "rest/servicedeskapi/";
    static final Map<String, String> EXPERIMENTAL_HEADERS = Map.of("X-ExperimentalApi", "opt-in");
    static final Map<String, String> NO_CHECK_HEADERS = Map.of("X-Atlassian-Token", "no-check");

    private final AtlassianRestClient client;
    private final boolean advancedMode;

    public ServiceDeskClient(AtlassianRestClient client) {
        this(client, false);
    }

    public ServiceDeskClient(AtlassianRestClient client, boolean advancedMode) {
        this.client = client;
        this.advancedMode = advancedMode;
    }

    public AtlassianRestClient getClient() {
        return client;
    }

    public boolean isAdvancedMode() {
        return advancedMode;
    }

    // ========== Information ==========

    public JsonNode getInfo() throws IOException {
        return get("info");
    }

    // ========== Service desks ==========

    public JsonNode getServiceDesks() throws IOException {
        return values(get("servicedesk"));
    }

    public JsonNode getServiceDeskById(String serviceDeskId) throws IOException {
        return get("servicedesk/" + encodeSegment(serviceDeskId));
    }

    // ========== Customers ==========

    public JsonNode createCustomer(String fullName, String email) throws IOException {
        log.info("Creating customer {}", email);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("fullName", fullName);
        payload.put("email", email);
        return post("customer", payload);
    }

    public JsonNode getCustomers(String serviceDeskId, String query) throws IOException {
        return getCustomers(serviceDeskId, query, DEFAULT_START, DEFAULT_LIMIT);
    }

    /**
     * @param query matched against display name, name or e-mail; {@code null} for all customers
     */
    public JsonNode getCustomers(String serviceDeskId, String query, int start, int limit) throws IOException {
        Map<String, Object> params = page(start, limit);
        params.put("query", query);
        return get("servicedesk/" + encodeSegment(serviceDeskId) + "/customer", params);
    }

    public JsonNode addCustomers(String serviceDeskId, List<String> usernames, List<String> accountIds) throws IOException {
        log.info("Adding customers to service desk {}", serviceDeskId);
        return post("servicedesk/" + encodeSegment(serviceDeskId) + "/customer", userLists(usernames, accountIds));
    }

    public JsonNode removeCustomers(String serviceDeskId, List<String> usernames, List<String> accountIds) throws IOException {
        log.info("Removing customers from service desk {}", serviceDeskId);
        return delete("servicedesk/" + encodeSegment(serviceDeskId) + "/customer", userLists(usernames, accountIds));
    }

    // ========== Customer requests ==========

    public JsonNode getCustomerRequest(String issueIdOrKey) throws IOException {
        return get("request/" + encodeSegment(issueIdOrKey));
    }

    public JsonNode getMyCustomerRequests() throws IOException {
        return values(get("request"));
    }

    public JsonNode createCustomerRequest(String serviceDeskId, String requestTypeId,
                                          Map<String, ?> requestFieldValues) throws IOException {
        return createCustomerRequest(serviceDeskId, requestTypeId, requestFieldValues, null, null);
    }

    /**
     * @param raiseOnBehalfOf     customer to raise the request for, omitted when blank
     * @param requestParticipants omitted when empty
     */
    public JsonNode createCustomerRequest(String serviceDeskId, String requestTypeId,
                                          Map<String, ?> requestFieldValues, String raiseOnBehalfOf,
                                          List<String> requestParticipants) throws IOException {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("serviceDeskId", serviceDeskId);
        payload.put("requestTypeId", requestTypeId);
        payload.put("requestFieldValues", requestFieldValues);
        if (raiseOnBehalfOf != null && !raiseOnBehalfOf.isEmpty()) {
            payload.put("raiseOnBehalfOf", raiseOnBehalfOf);
        }
        if (requestParticipants != null && !requestParticipants.isEmpty()) {
            payload.put("requestParticipants", requestParticipants);
        }
        log.info("Creating customer request in service desk {}", serviceDeskId);
        return post("request", payload);
    }

    /**
     * @return the current status entry, an empty object when the request has none,
     * or the whole status page in advanced mode
     */
    public JsonNode getCustomerRequestStatus(String issueIdOrKey) throws IOException {
        JsonNode response = get("request/" + encodeSegment(issueIdOrKey) + "/status");
        if (advancedMode) {
            return response;
        }
        JsonNode statuses = response.path("values");
        if (statuses.isArray() && !statuses.isEmpty()) {
            return statuses.get(0).path("status");
        }
        return client.getObjectMapper().createObjectNode();
    }

    public JsonNode getCustomerTransitions(String issueIdOrKey) throws IOException {
        return get("request/" + encodeSegment(issueIdOrKey) + "/transition");
    }

    public JsonNode performTransition(String issueIdOrKey, String transitionId, String comment) throws IOException {
        Map<String, Object> additionalComment = new LinkedHashMap<>();
        additionalComment.put("body", comment);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("id", transitionId);
        payload.put("additionalComment", additionalComment);
        log.info("Performing transition {} on {}", transitionId, issueIdOrKey);
        return post("request/" + encodeSegment(issueIdOrKey) + "/transition", payload);
    }

    // ========== Request types ==========

    public JsonNode getRequestTypes(String serviceDeskId) throws IOException {
        return get("servicedesk/" + encodeSegment(serviceDeskId) + "/requesttype");
    }

    public JsonNode createRequestType(String serviceDeskId, String issueTypeId, String name,
                                      String description, String helpText) throws IOException {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("issueTypeId", issueTypeId);
        payload.put("name", name);
        payload.put("description", description);
        payload.put("helpText", helpText);
        log.info("Creating request type '{}' in service desk {}", name, serviceDeskId);
        return post("servicedesk/" + encodeSegment(serviceDeskId) + "/requesttype", payload);
    }

    // ========== Request participants ==========

    public JsonNode getRequestParticipants(String issueIdOrKey) throws IOException {
        return getRequestParticipants(issueIdOrKey, DEFAULT_START, DEFAULT_LIMIT);
    }

    public JsonNode getRequestParticipants(String issueIdOrKey, int start, int limit) throws IOException {
        return values(get("request/" + encodeSegment(issueIdOrKey) + "/participant", page(start, limit)));
    }

    public JsonNode addRequestParticipants(String issueIdOrKey, List<String> usernames, List<String> accountIds) throws IOException {
        return post("request/" + encodeSegment(issueIdOrKey) + "/participant", userLists(usernames, accountIds));
    }

    public JsonNode removeRequestParticipants(String issueIdOrKey, List<String> usernames, List<String> accountIds) throws IOException {
        return delete("request/" + encodeSegment(issueIdOrKey) + "/participant", userLists(usernames, accountIds));
    }

    // ========== Request comments ==========

    public JsonNode createRequestComment(String issueIdOrKey, String body, boolean isPublic) throws IOException {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("body", body);
        payload.put("public", isPublic);
        return post("request/" + encodeSegment(issueIdOrKey) + "/comment", payload);
    }

    public JsonNode getRequestComments(String issueIdOrKey) throws IOException {
        return get("request/" + encodeSegment(issueIdOrKey) + "/comment");
    }

    public JsonNode getRequestCommentById(String issueIdOrKey, String commentId) throws IOException {
        return get("request/" + encodeSegment(issueIdOrKey) + "/comment/" + encodeSegment(commentId));
    }

    // ========== Organizations ==========

    /**
     * @param serviceDeskId restricts the list to one service desk; {@code null} lists every organization
     */
    public JsonNode getOrganizations(String serviceDeskId, int start, int limit) throws IOException {
        String path = serviceDeskId == null ? "organization" : "servicedesk/" + encodeSegment(serviceDeskId) + "/organization";
        return get(path, page(start, limit));
    }

    public JsonNode getOrganizations(String serviceDeskId) throws IOException {
        return getOrganizations(serviceDeskId, DEFAULT_START, DEFAULT_LIMIT);
    }

    public JsonNode getOrganization(String organizationId) throws IOException {
        return get("organization/" + encodeSegment(organizationId));
    }

    public JsonNode getUsersInOrganization(String organizationId, int start, int limit) throws IOException {
        return get("organization/" + encodeSegment(organizationId) + "/user", page(start, limit));
    }

    public JsonNode getUsersInOrganization(String organizationId) throws IOException {
        return getUsersInOrganization(organizationId, DEFAULT_START, DEFAULT_LIMIT);
    }

    public JsonNode createOrganization(String name) throws IOException {
        log.info("Creating organization {}", name);
        return post("organization", Map.of("name", name));
    }

    public JsonNode addOrganization(String serviceDeskId, int organizationId) throws IOException {
        log.info("Adding organization {} to service desk {}", organizationId, serviceDeskId);
        return post("servicedesk/" + encodeSegment(serviceDeskId) + "/organization", Map.of("organizationId", organizationId));
    }

    public JsonNode removeOrganization(String serviceDeskId, int organizationId) throws IOException {
        log.info("Removing organization {} from service desk {}", organizationId, serviceDeskId);
        return delete("servicedesk/" + encodeSegment(serviceDeskId) + "/organization", Map.of("organizationId", organizationId));
    }

    public JsonNode deleteOrganization(String organizationId) throws IOException {
        log.info("Deleting organization {}", organizationId);
        return delete("organization/" + encodeSegment(organizationId), null);
    }

    public JsonNode addUsersToOrganization(String organizationId, List<String> usernames, List<String> accountIds) throws IOException {
        return post("organization/" + encodeSegment(organizationId) + "/user", userLists(usernames, accountIds));
    }

    public JsonNode removeUsersFromOrganization(String organizationId, List<String> usernames, List<String> accountIds) throws IOException {
        return delete("organization/" + encodeSegment(organizationId) + "/user", userLists(usernames, accountIds));
    }

    // ========== Attachments ==========

    /**
     * Uploads a file as a temporary attachment of the service desk.
     *
     * @return id to pass to {@link #addAttachments}
     */
    public String attachTemporaryFile(String serviceDeskId, Path file) throws IOException {
        Map<String, String> headers = new LinkedHashMap<>(EXPERIMENTAL_HEADERS);
        headers.putAll(NO_CHECK_HEADERS);
        log.debug("Uploading temporary attachment {} to service desk {}", file.getFileName(), serviceDeskId);
        JsonNode response = client.upload(API + "servicedesk/" + encodeSegment(serviceDeskId) + "/attachTemporaryFile",
                "file", file, headers);

        JsonNode attachment = response.path("temporaryAttachments").path(0).path("temporaryAttachmentId");
        if (attachment.isMissingNode() || attachment.isNull()) {
            throw new AtlassianClientException("Temporary attachment upload of " + file.getFileName()
                    + " returned no temporaryAttachmentId");
        }
        return attachment.asText();
    }

    public JsonNode addAttachments(String issueIdOrKey, List<String> temporaryAttachmentIds,
                                   boolean isPublic, String comment) throws IOException {
        Map<String, Object> additionalComment = new LinkedHashMap<>();
        additionalComment.put("body", comment);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("temporaryAttachmentIds", temporaryAttachmentIds);
        payload.put("public", isPublic);
        payload.put("additionalComment", additionalComment);
        return post("request/" + encodeSegment(issueIdOrKey) + "/attachment", payload);
    }

    public JsonNode addAttachment(String issueIdOrKey, String temporaryAttachmentId,
                                  boolean isPublic, String comment) throws IOException {
        return addAttachments(issueIdOrKey, Collections.singletonList(temporaryAttachmentId), isPublic, comment);
    }

    /**
     * Uploads every file as a temporary attachment, then attaches all of them in one comment.
     */
    public JsonNode createAttachments(String serviceDeskId, String issueIdOrKey, List<Path> files,
                                      boolean isPublic, String comment) throws IOException {
        List<String> temporaryIds = new ArrayList<>();
        for (Path file : files) {
            temporaryIds.add(attachTemporaryFile(serviceDeskId, file));
        }
        log.info("Attaching {} file(s) to {}", temporaryIds.size(), issueIdOrKey);
        return addAttachments(issueIdOrKey, temporaryIds, isPublic, comment);
    }

    public JsonNode createAttachment(String serviceDeskId, String issueIdOrKey, Path file,
                                     boolean isPublic, String comment) throws IOException {
        return createAttachments(serviceDeskId, issueIdOrKey, List.of(file), isPublic, comment);
    }

    // ========== SLA ==========

    public JsonNode getSla(String issueIdOrKey) throws IOException {
        return getSla(issueIdOrKey, DEFAULT_START, DEFAULT_LIMIT);
    }

    public JsonNode getSla(String issueIdOrKey, int start, int limit) throws IOException {
        return values(get("request/" + encodeSegment(issueIdOrKey) + "/sla", page(start, limit)));
    }

    public JsonNode getSlaById(String issueIdOrKey, String slaId) throws IOException {
        return get("request/" + encodeSegment(issueIdOrKey) + "/sla/" + encodeSegment(slaId));
    }

    // ========== Approvals ==========

    public JsonNode getApprovals(String issueIdOrKey) throws IOException {
        return getApprovals(issueIdOrKey, DEFAULT_START, DEFAULT_LIMIT);
    }

    public JsonNode getApprovals(String issueIdOrKey, int start, int limit) throws IOException {
        return values(get("request/" + encodeSegment(issueIdOrKey) + "/approval", page(start, limit)));
    }

    public JsonNode getApprovalById(String issueIdOrKey, String approvalId) throws IOException {
        return get("request/" + encodeSegment(issueIdOrKey) + "/approval/" + encodeSegment(approvalId));
    }

    /**
     * @param decision {@code approve} or {@code decline}
     */
    public JsonNode answerApproval(String issueIdOrKey, String approvalId, String decision) throws IOException {
        log.info("Answering approval {} of {} with {}", approvalId, issueIdOrKey, decision);
        return post("request/" + encodeSegment(issueIdOrKey) + "/approval/" + encodeSegment(approvalId), Map.of("decision", decision));
    }

    // ========== Queues ==========

    public JsonNode getQueueSettings(String projectKey) throws IOException {
        return get("queues/" + encodeSegment(projectKey));
    }

    public JsonNode getQueues(String serviceDeskId, boolean includeCount) throws IOException {
        return getQueues(serviceDeskId, includeCount, DEFAULT_START, DEFAULT_LIMIT);
    }

    public JsonNode getQueues(String serviceDeskId, boolean includeCount, int start, int limit) throws IOException {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("includeCount", includeCount);
        params.putAll(page(start, limit));
        return get("servicedesk/" + encodeSegment(serviceDeskId) + "/queue", params);
    }

    public JsonNode getIssuesInQueue(String serviceDeskId, String queueId) throws IOException {
        return getIssuesInQueue(serviceDeskId, queueId, DEFAULT_START, DEFAULT_LIMIT);
    }

    public JsonNode getIssuesInQueue(String serviceDeskId, String queueId, int start, int limit) throws IOException {
        return get("servicedesk/" + encodeSegment(serviceDeskId) + "/queue/" + encodeSegment(queueId) + "/issue", page(start, limit));
    }

    // ========== Plugins ==========

    /**
     * Installs a plugin jar through the Universal Plugin Manager.
     */
    public JsonNode uploadPlugin(Path pluginJar) throws IOException {
        String token = client.header("rest/plugins/1.0/", "upm-token", NO_CHECK_HEADERS);
        if (token == null) {
            throw new AtlassianClientException("Plugin manager did not return an upm-token header");
        }
        HttpUrl url = client.resolve("rest/plugins/1.0/").newBuilder()
                .addQueryParameter("token", token)
                .build();
        log.info("Uploading plugin {}", pluginJar.getFileName());
        return client.upload(url.toString(), "plugin", pluginJar, NO_CHECK_HEADERS);
    }

    // ========== Insight ==========

    /**
     * Resolves the first Insight workspace of the site and returns a client bound to it.
     */
    public InsightClient insight() throws IOException {
        return insight(resolveInsightWorkspaceId());
    }

    public InsightClient insight(String workspaceId) {
        return new InsightClient(client, workspaceId);
    }

    public List<String> getInsightWorkspaceIds() throws IOException {
        List<String> ids = new ArrayList<>();
        for (JsonNode workspace : get("insight/workspace").path("values")) {
            ids.add(workspace.path("workspaceId").asText());
        }
        return ids;
    }

    // ========== Helper Methods ==========

    private String resolveInsightWorkspaceId() throws IOException {
        List<String> ids = getInsightWorkspaceIds();
        if (ids.isEmpty()) {
            throw new AtlassianClientException("No Insight workspace is available on this site");
        }
        log.debug("Using Insight workspace {}", ids.get(0));
        return ids.get(0);
    }

    private JsonNode get(String path) throws IOException {
        return client.get(API + path, null, EXPERIMENTAL_HEADERS);
    }

    private JsonNode get(String path, Map<String, ?> params) throws IOException {
        return client.get(API + path, params, EXPERIMENTAL_HEADERS);
    }

    private JsonNode post(String path, Object body) throws IOException {
        return client.post(API + path, body, EXPERIMENTAL_HEADERS);
    }

    private JsonNode delete(String path, Object body) throws IOException {
        return client.delete(API + path, body, EXPERIMENTAL_HEADERS);
    }

    private JsonNode values(JsonNode response) {
        if (advancedMode) {
            return response;
        }
        JsonNode values = response.get("values");
        return values != null ? values : NullNode.getInstance();
    }

    private static Map<String, Object> page(int start, int limit) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("start", start);
        params.put("limit", limit);
        return params;
    }

    private static Map<String, Object> userLists(List<String> usernames, List<String> accountIds) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("usernames", usernames != null ? usernames : Collections.emptyList());
        payload.put("accountIds", accountIds != null ? accountIds : Collections.emptyList());
        return payload;
    }
}
