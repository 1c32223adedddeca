package org.rostilos.atlassian.servicedesk.insight;

import com.fasterxml.jackson.databind.JsonNode;
import org.rostilos.atlassian.restcore.AtlassianRestClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.rostilos.atlassian.restcore.AtlassianRestClient.encodeSegment;

/**
 * Insight (Assets) API of one workspace, under {@code gateway/api/jsm/insight/workspace/{id}/v1/}.
 * Obtain through {@link org.rostilos.atlassian.servicedesk.ServiceDeskClient#insight()}.
 */
public class InsightClient {
    private static final Logger log = LoggerFactory.getLogger(InsightClient.class);

    public static final int API_VERSION = 1;

    private static final Map<String, String> EXPERIMENTAL_HEADERS = Map.of("X-ExperimentalApi", "opt-in");

    private final AtlassianRestClient client;
    private final String workspaceId;
    private final String endpoint;

    public InsightClient(AtlassianRestClient client, String workspaceId) {
        if (workspaceId == null || workspaceId.isBlank()) {
            throw new IllegalArgumentException("Insight workspace id cannot be null or empty");
        }
        this.client = client;
        this.workspaceId = workspaceId;
        this.endpoint = String.format("gateway/api/jsm/insight/workspace/%s/v%d/", encodeSegment(workspaceId), API_VERSION);
    }

    public String getWorkspaceId() {
        return workspaceId;
    }

    public String getEndpoint() {
        return endpoint;
    }

    // ========== IQL ==========

    public JsonNode getIqlObjects(String iql) throws IOException {
        return getIqlObjects(iql, null, null, null, null, null, null);
    }

    /**
     * Finds objects with an Insight Query Language expression. {@code null} arguments use the server defaults.
     */
    public JsonNode getIqlObjects(String iql, Integer page, Integer resultPerPage, Boolean includeAttributes,
                                  Integer includeAttributesDeep, Boolean includeTypeAttributes,
                                  Boolean includeExtendedInfo) throws IOException {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("iql", iql);
        params.put("page", page);
        params.put("resultPerPage", resultPerPage);
        params.put("includeAttributes", includeAttributes);
        params.put("includeAttributesDeep", includeAttributesDeep);
        params.put("includeTypeAttributes", includeTypeAttributes);
        params.put("includeExtendedInfo", includeExtendedInfo);
        return client.get(endpoint + "iql/objects", params, EXPERIMENTAL_HEADERS);
    }

    // ========== Objects ==========

    public JsonNode getObject(String objectId) throws IOException {
        return client.get(endpoint + "object/" + encodeSegment(objectId), null, EXPERIMENTAL_HEADERS);
    }

    public JsonNode putObject(String objectId, String objectTypeId, JsonNode attributes,
                              Boolean hasAvatar, String avatarUuid) throws IOException {
        log.info("Updating Insight object {}", objectId);
        return client.put(endpoint + "object/" + encodeSegment(objectId),
                objectPayload(objectTypeId, attributes, hasAvatar, avatarUuid), EXPERIMENTAL_HEADERS);
    }

    /**
     * Like {@link #putObject} but takes every {@code null} argument from the object's current state.
     * Issues one GET followed by one PUT.
     */
    public JsonNode updateObject(String objectId, String objectTypeId, JsonNode attributes,
                                 Boolean hasAvatar, String avatarUuid) throws IOException {
        JsonNode current = getObject(objectId);
        return putObject(objectId,
                objectTypeId != null ? objectTypeId : textOrNull(current.path("objectType").path("id")),
                attributes != null ? attributes : current.get("attributes"),
                hasAvatar != null ? hasAvatar : boolOrNull(current.path("hasAvatar")),
                avatarUuid != null ? avatarUuid : textOrNull(current.path("avatar").path("mediaClientConfig").path("fileId")));
    }

    public JsonNode deleteObject(String objectId) throws IOException {
        log.info("Deleting Insight object {}", objectId);
        return client.delete(endpoint + "object/" + encodeSegment(objectId), null, EXPERIMENTAL_HEADERS);
    }

    public JsonNode createObject(String objectTypeId, JsonNode attributes) throws IOException {
        return createObject(objectTypeId, attributes, null, null);
    }

    public JsonNode createObject(String objectTypeId, JsonNode attributes,
                                 Boolean hasAvatar, String avatarUuid) throws IOException {
        log.info("Creating Insight object of type {}", objectTypeId);
        return client.post(endpoint + "object/create",
                objectPayload(objectTypeId, attributes, hasAvatar, avatarUuid), EXPERIMENTAL_HEADERS);
    }

    public JsonNode getObjectAttributes(String objectId) throws IOException {
        return client.get(endpoint + "object/" + encodeSegment(objectId) + "/attributes", null, EXPERIMENTAL_HEADERS);
    }

    /**
     * @param asc        ascending order, {@code null} for the Jira setting
     * @param abbreviate abbreviate history values, {@code null} for the server default
     */
    public JsonNode getObjectHistory(String objectId, Boolean asc, Boolean abbreviate) throws IOException {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("asc", asc);
        params.put("abbreviate", abbreviate);
        return client.get(endpoint + "object/" + encodeSegment(objectId) + "/history", params, EXPERIMENTAL_HEADERS);
    }

    public JsonNode getObjectReferenceInfo(String objectId) throws IOException {
        return client.get(endpoint + "object/" + encodeSegment(objectId) + "/referenceinfo", null, EXPERIMENTAL_HEADERS);
    }

    public JsonNode getObjectConnectedTickets(String objectId) throws IOException {
        return client.get(endpoint + "objectconnectedtickets/" + encodeSegment(objectId) + "/tickets", null, EXPERIMENTAL_HEADERS);
    }

    // ========== Object schemas ==========

    public JsonNode listObjectSchemas() throws IOException {
        return client.get(endpoint + "objectschema/list", null, EXPERIMENTAL_HEADERS);
    }

    public JsonNode createObjectSchema(String name, String objectSchemaKey, String description) throws IOException {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("name", name);
        payload.put("objectSchemaKey", objectSchemaKey);
        payload.put("description", description);
        log.info("Creating Insight object schema {}", objectSchemaKey);
        return client.post(endpoint + "objectschema/create", payload, EXPERIMENTAL_HEADERS);
    }

    public JsonNode getObjectSchema(String schemaId) throws IOException {
        return client.get(endpoint + "objectschema/" + encodeSegment(schemaId), null, EXPERIMENTAL_HEADERS);
    }

    public JsonNode getObjectSchemaAttributes(String schemaId) throws IOException {
        return client.get(endpoint + "objectschema/" + encodeSegment(schemaId) + "/attributes", null, EXPERIMENTAL_HEADERS);
    }

    public JsonNode getObjectSchemaObjectTypesFlat(String schemaId) throws IOException {
        return client.get(endpoint + "objectschema/" + encodeSegment(schemaId) + "/objecttypes/flat", null, EXPERIMENTAL_HEADERS);
    }

    // ========== Object types ==========

    public JsonNode getObjectType(String typeId) throws IOException {
        return client.get(endpoint + "objecttype/" + encodeSegment(typeId), null, EXPERIMENTAL_HEADERS);
    }

    /**
     * Replaces an object type. Optional fields are omitted from the body when {@code null}.
     */
    public JsonNode putObjectType(String typeId, String name, String iconId, String objectSchemaId,
                                  String description, String parentObjectTypeId,
                                  Boolean inherited, Boolean abstractObjectType) throws IOException {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("id", typeId);
        payload.put("name", name);
        payload.put("iconId", iconId);
        payload.put("objectSchemaId", objectSchemaId);
        putIfPresent(payload, "description", description);
        putIfPresent(payload, "parentObjectTypeId", parentObjectTypeId);
        putIfPresent(payload, "inherited", inherited);
        putIfPresent(payload, "abstractObjectType", abstractObjectType);
        log.info("Updating Insight object type {}", typeId);
        return client.put(endpoint + "objecttype/" + encodeSegment(typeId), payload, EXPERIMENTAL_HEADERS);
    }

    /**
     * Like {@link #putObjectType} but takes name, icon and schema from the current object type
     * when not given. Issues one GET followed by one PUT.
     */
    public JsonNode updateObjectType(String typeId, String name, String iconId, String objectSchemaId,
                                     String description, String parentObjectTypeId,
                                     Boolean inherited, Boolean abstractObjectType) throws IOException {
        JsonNode current = getObjectType(typeId);
        return putObjectType(typeId,
                name != null ? name : textOrNull(current.path("name")),
                iconId != null ? iconId : textOrNull(current.path("icon").path("id")),
                objectSchemaId != null ? objectSchemaId : textOrNull(current.path("objectSchemaId")),
                description, parentObjectTypeId, inherited, abstractObjectType);
    }

    public JsonNode getObjectTypeAttributes(String typeId) throws IOException {
        return getObjectTypeAttributes(typeId, ObjectTypeAttributeQuery.defaults());
    }

    public JsonNode getObjectTypeAttributes(String typeId, ObjectTypeAttributeQuery query) throws IOException {
        return client.get(endpoint + "objecttype/" + encodeSegment(typeId) + "/attributes", query.toParams(), EXPERIMENTAL_HEADERS);
    }

    // ========== Helper Methods ==========

    private static Map<String, Object> objectPayload(String objectTypeId, JsonNode attributes,
                                                     Boolean hasAvatar, String avatarUuid) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("objectTypeId", objectTypeId);
        payload.put("attributes", attributes);
        putIfPresent(payload, "hasAvatar", hasAvatar);
        putIfPresent(payload, "avatarUUID", avatarUuid);
        return payload;
    }

    private static void putIfPresent(Map<String, Object> payload, String key, Object value) {
        if (value != null) {
            payload.put(key, value);
        }
    }

    private static String textOrNull(JsonNode node) {
        return node.isMissingNode() || node.isNull() ? null : node.asText();
    }

    private static Boolean boolOrNull(JsonNode node) {
        return node.isMissingNode() || node.isNull() ? null : node.asBoolean();
    }
}
