package com.myinfra.gateway.frappegateway.service;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Logical operations against the document API. Report and aggregation calls travel
 * as POST but do not change state.
 */
@Getter
@RequiredArgsConstructor
public enum UpstreamOperation {
    GET_DOCUMENT("get document", false),
    LIST_DOCUMENTS("list documents", false),
    CREATE_DOCUMENT("create document", true),
    UPDATE_DOCUMENT("update document", true),
    DELETE_DOCUMENT("delete document", true),
    SEARCH_DOCUMENTS("search documents", false),
    RUN_AGGREGATION("aggregation query", false),
    RUN_REPORT("run report", false);

    private final String description;
    private final boolean mutating;
}
