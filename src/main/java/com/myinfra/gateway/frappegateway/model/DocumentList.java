package com.myinfra.gateway.frappegateway.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One page of documents.
 *
 * @param data       Documents in upstream order
 * @param totalCount Number of documents in this page
 * @param pageSize   Requested page size (0 when none was requested)
 * @param start      Requested offset
 * @param hasMore    Whether a full page came back, suggesting more rows exist
 */
public record DocumentList(
        List<Document> data,
        @JsonProperty("total_count") int totalCount,
        @JsonProperty("page_length") int pageSize,
        int start,
        @JsonProperty("has_more") boolean hasMore) {

    public DocumentList {
        data = data == null ? List.of() : List.copyOf(data);
    }

    public static DocumentList page(List<Document> data, int pageSize, int start) {
        List<Document> docs = data == null ? List.of() : data;
        return new DocumentList(docs, docs.size(), pageSize, start, pageSize > 0 && docs.size() == pageSize);
    }
}
