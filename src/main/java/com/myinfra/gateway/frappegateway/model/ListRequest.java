package com.myinfra.gateway.frappegateway.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parameters of a document list or search call.
 *
 * @param doctype  Doctype to list
 * @param fields   Fields to return; empty means the upstream default
 * @param filters  Field filters, sent as a JSON object
 * @param orderBy  Order clause, e.g. {@code "modified desc"}
 * @param pageSize Page length; 0 means the upstream default
 * @param start    Row offset
 * @param search   Free text; when present the text search endpoint is used
 */
@Builder
public record ListRequest(
        String doctype,
        List<String> fields,
        Map<String, Object> filters,
        @JsonProperty("order_by") String orderBy,
        @JsonProperty("page_length") int pageSize,
        int start,
        String search) {

    public ListRequest {
        fields = fields == null ? List.of() : List.copyOf(fields);
        filters = filters == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(filters));
    }

    public boolean hasSearchText() {
        return search != null && !search.isBlank();
    }
}
