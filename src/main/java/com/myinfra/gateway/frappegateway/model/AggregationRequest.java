package com.myinfra.gateway.frappegateway.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Grouped or aggregated list query, e.g. {@code fields=["status", "count(name) as total"]}
 * grouped by {@code status}.
 */
@Builder
public record AggregationRequest(
        String doctype,
        List<String> fields,
        Map<String, Object> filters,
        @JsonProperty("group_by") String groupBy,
        @JsonProperty("order_by") String orderBy,
        int limit) {

    public AggregationRequest {
        fields = fields == null ? List.of() : List.copyOf(fields);
        filters = filters == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(filters));
    }
}
