package com.myinfra.gateway.frappegateway.controller;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.myinfra.gateway.frappegateway.filter.IdentityCarrier;
import com.myinfra.gateway.frappegateway.model.AggregationRequest;
import com.myinfra.gateway.frappegateway.model.Document;
import com.myinfra.gateway.frappegateway.model.DocumentList;
import com.myinfra.gateway.frappegateway.model.Identity;
import com.myinfra.gateway.frappegateway.model.ListRequest;
import com.myinfra.gateway.frappegateway.model.ReportRequest;
import com.myinfra.gateway.frappegateway.model.ReportResult;
import com.myinfra.gateway.frappegateway.service.UpstreamClient;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * REST surface of the gateway. Each endpoint maps one-to-one onto an
 * {@link UpstreamClient} operation, passing along the identity the authentication
 * filter attached to the exchange.
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class DocumentController {

    private static final TypeReference<List<String>> FIELD_LIST = new TypeReference<>() {
    };
    private static final TypeReference<Map<String, Object>> FILTER_MAP = new TypeReference<>() {
    };

    private final UpstreamClient upstreamClient;
    private final ObjectMapper objectMapper;

    @GetMapping("/resource/{doctype}/{name}")
    public Mono<Document> getDocument(@PathVariable String doctype,
                                      @PathVariable String name,
                                      ServerWebExchange exchange) {
        return upstreamClient.getDocument(identity(exchange), doctype, name);
    }

    @GetMapping("/resource/{doctype}")
    public Mono<DocumentList> listDocuments(@PathVariable String doctype,
                                            @RequestParam(required = false) String fields,
                                            @RequestParam(required = false) String filters,
                                            @RequestParam(name = "order_by", required = false) String orderBy,
                                            @RequestParam(name = "limit_page_length", defaultValue = "20") int pageSize,
                                            @RequestParam(name = "limit_start", defaultValue = "0") int start,
                                            ServerWebExchange exchange) {
        ListRequest request = ListRequest.builder()
                .doctype(doctype)
                .fields(parse("fields", fields, FIELD_LIST))
                .filters(parse("filters", filters, FILTER_MAP))
                .orderBy(orderBy)
                .pageSize(pageSize)
                .start(start)
                .build();
        return upstreamClient.listDocuments(identity(exchange), request);
    }

    @PostMapping("/resource/{doctype}")
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<Document> createDocument(@PathVariable String doctype,
                                         @RequestBody Map<String, Object> data,
                                         ServerWebExchange exchange) {
        return upstreamClient.createDocument(identity(exchange), doctype, data);
    }

    @PutMapping("/resource/{doctype}/{name}")
    public Mono<Document> updateDocument(@PathVariable String doctype,
                                         @PathVariable String name,
                                         @RequestBody Map<String, Object> data,
                                         ServerWebExchange exchange) {
        return upstreamClient.updateDocument(identity(exchange), doctype, name, data);
    }

    @DeleteMapping("/resource/{doctype}/{name}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public Mono<Void> deleteDocument(@PathVariable String doctype,
                                     @PathVariable String name,
                                     ServerWebExchange exchange) {
        return upstreamClient.deleteDocument(identity(exchange), doctype, name);
    }

    @GetMapping("/search/{doctype}")
    public Mono<DocumentList> searchDocuments(@PathVariable String doctype,
                                              @RequestParam(required = false) String txt,
                                              @RequestParam(required = false) String filters,
                                              @RequestParam(name = "page_length", defaultValue = "20") int pageSize,
                                              ServerWebExchange exchange) {
        ListRequest request = ListRequest.builder()
                .doctype(doctype)
                .search(txt)
                .filters(parse("filters", filters, FILTER_MAP))
                .pageSize(pageSize)
                .build();
        return upstreamClient.searchDocuments(identity(exchange), request);
    }

    @PostMapping("/aggregate")
    public Mono<List<Document>> runAggregation(@RequestBody AggregationRequest request,
                                               ServerWebExchange exchange) {
        if (request.doctype() == null || request.doctype().isBlank()) {
            return Mono.error(new ResponseStatusException(HttpStatus.BAD_REQUEST, "doctype is required"));
        }
        return upstreamClient.runAggregation(identity(exchange), request);
    }

    @PostMapping("/report")
    public Mono<ReportResult> runReport(@RequestBody ReportRequest request,
                                        ServerWebExchange exchange) {
        if (request.reportName() == null || request.reportName().isBlank()) {
            return Mono.error(new ResponseStatusException(HttpStatus.BAD_REQUEST, "report_name is required"));
        }
        return upstreamClient.runReport(identity(exchange), request);
    }

    private static Identity identity(ServerWebExchange exchange) {
        return IdentityCarrier.current(exchange).orElse(null);
    }

    private <T> T parse(String parameter, String json, TypeReference<T> type) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, parameter + " must be valid JSON");
        }
    }
}
