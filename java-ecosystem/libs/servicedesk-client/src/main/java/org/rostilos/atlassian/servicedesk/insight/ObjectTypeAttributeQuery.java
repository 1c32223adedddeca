package org.rostilos.atlassian.servicedesk.insight;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Filters for listing object type attributes. {@code null} leaves the server default in place.
 */
public record ObjectTypeAttributeQuery(
        Boolean onlyValueEditable,
        Boolean orderByName,
        String query,
        Boolean includeValuesExist,
        Boolean excludeParentAttributes,
        Boolean includeChildren,
        Boolean orderByRequired
) {
    public static ObjectTypeAttributeQuery defaults() {
        return new ObjectTypeAttributeQuery(null, null, null, null, null, null, null);
    }

    Map<String, Object> toParams() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("onlyValueEditable", onlyValueEditable);
        params.put("orderByName", orderByName);
        params.put("query", query);
        params.put("includeValuesExist", includeValuesExist);
        params.put("excludeParentAttributes", excludeParentAttributes);
        params.put("includeChildren", includeChildren);
        params.put("orderByRequired", orderByRequired);
        return params;
    }
}
