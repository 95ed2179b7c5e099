package com.myinfra.gateway.frappegateway.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.myinfra.gateway.frappegateway.model.Document;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Turns the result envelopes of list-like endpoints into an ordered list of documents.
 * <p>
 * Resource endpoints answer under {@code data}, whitelisted methods under {@code message};
 * either may hold an array of objects or one bare object.
 */
class DocumentNormalizer {

    private static final TypeReference<Map<String, Object>> FIELDS = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    DocumentNormalizer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    List<Document> normalize(JsonNode root) {
        JsonNode source = hasContent(root.get("data")) ? root.get("data") : root.get("message");
        List<Document> documents = new ArrayList<>();

        if (source == null || source.isNull()) {
            return documents;
        }
        if (source.isArray()) {
            for (JsonNode item : source) {
                if (item.isObject()) {
                    documents.add(toDocument(item));
                }
            }
        } else if (source.isObject()) {
            documents.add(toDocument(source));
        }
        return documents;
    }

    Document toDocument(JsonNode node) {
        return new Document(objectMapper.convertValue(node, FIELDS));
    }

    private static boolean hasContent(JsonNode node) {
        return node != null && !node.isNull() && !node.isMissingNode()
                && (!node.isContainerNode() || !node.isEmpty());
    }
}
