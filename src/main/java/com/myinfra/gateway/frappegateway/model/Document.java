package com.myinfra.gateway.frappegateway.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A Frappe document as returned by the upstream API: an ordered JSON object.
 *
 * @param fields Field values keyed by fieldname, in upstream order
 */
public record Document(@JsonValue Map<String, Object> fields) {

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public Document {
        fields = fields == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public Object get(String fieldname) {
        return fields.get(fieldname);
    }

    /**
     * @return The document's primary key, or null when the upstream omitted it
     */
    public String name() {
        Object name = fields.get("name");
        return name != null ? name.toString() : null;
    }
}
