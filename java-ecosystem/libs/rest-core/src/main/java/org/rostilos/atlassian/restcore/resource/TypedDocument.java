package org.rostilos.atlassian.restcore.resource;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.rostilos.atlassian.restcore.SchemaMismatchException;
import org.rostilos.atlassian.restcore.utils.Timestamps;

import java.time.OffsetDateTime;

/**
 * Read-only snapshot of a JSON object, optionally checked against a {@code type} tag.
 * <p>
 * The tag check is skipped when the document carries no tag at all, which is the
 * case for lightweight embedded sub-documents.
 */
public final class TypedDocument {

    public static final String TYPE_FIELD = "type";

    private final ObjectNode document;

    public TypedDocument(JsonNode document, String expectedType) {
        if (document == null || !document.isObject()) {
            String actual = document == null ? "null" : document.getNodeType().name().toLowerCase();
            throw new SchemaMismatchException(expectedType != null ? expectedType : "object", actual);
        }
        JsonNode tag = document.get(TYPE_FIELD);
        if (expectedType != null && tag != null && !tag.isNull() && !expectedType.equals(tag.asText())) {
            throw new SchemaMismatchException(expectedType, tag.asText());
        }
        this.document = document.deepCopy();
    }

    public String type() {
        return text(TYPE_FIELD);
    }

    public boolean has(String field) {
        return document.hasNonNull(field);
    }

    public String text(String field) {
        JsonNode node = document.get(field);
        return node == null || node.isNull() ? null : node.asText();
    }

    public Integer integer(String field) {
        JsonNode node = document.get(field);
        return node == null || node.isNull() ? null : node.asInt();
    }

    public Long longValue(String field) {
        JsonNode node = document.get(field);
        return node == null || node.isNull() ? null : node.asLong();
    }

    public Boolean bool(String field) {
        JsonNode node = document.get(field);
        return node == null || node.isNull() ? null : node.asBoolean();
    }

    /**
     * @return the child node, or {@code null} when absent
     */
    public JsonNode node(String field) {
        JsonNode node = document.get(field);
        return node == null || node.isNull() ? null : node;
    }

    /**
     * Walks nested fields; yields a missing node instead of failing on absent levels.
     */
    public JsonNode path(String... fields) {
        JsonNode current = document;
        for (String field : fields) {
            current = current.path(field);
        }
        return current;
    }

    /**
     * @throws java.time.format.DateTimeParseException when the value is malformed
     */
    public OffsetDateTime time(String field) {
        String value = text(field);
        return value == null ? null : Timestamps.parse(value);
    }

    /**
     * @return a deep copy of the underlying document
     */
    public ObjectNode raw() {
        return document.deepCopy();
    }

    @Override
    public String toString() {
        return document.toString();
    }
}
