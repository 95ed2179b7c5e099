package com.myinfra.gateway.frappegateway.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * @param reportName Name of the query or script report
 * @param filters    Report filters
 * @param user       User to run the report as, if different from the caller
 */
@Builder
public record ReportRequest(
        @JsonProperty("report_name") String reportName,
        Map<String, Object> filters,
        String user) {

    public ReportRequest {
        filters = filters == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(filters));
    }
}
