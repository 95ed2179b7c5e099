package com.myinfra.gateway.frappegateway.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.myinfra.gateway.frappegateway.config.AppConfig;
import com.myinfra.gateway.frappegateway.config.AppConfig.AuthConfig;
import com.myinfra.gateway.frappegateway.config.AppConfig.UpstreamConfig;
import com.myinfra.gateway.frappegateway.config.ResilienceConfig;
import com.myinfra.gateway.frappegateway.exception.ConfigurationException;
import com.myinfra.gateway.frappegateway.exception.DeadlineExceededException;
import com.myinfra.gateway.frappegateway.exception.UpstreamException;
import com.myinfra.gateway.frappegateway.model.AggregationRequest;
import com.myinfra.gateway.frappegateway.model.Document;
import com.myinfra.gateway.frappegateway.model.DocumentList;
import com.myinfra.gateway.frappegateway.model.Identity;
import com.myinfra.gateway.frappegateway.model.ListRequest;
import com.myinfra.gateway.frappegateway.model.ReportColumn;
import com.myinfra.gateway.frappegateway.model.ReportRequest;
import com.myinfra.gateway.frappegateway.model.ReportResult;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.netty.channel.ChannelOption;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cloud.client.circuitbreaker.ReactiveCircuitBreaker;
import org.springframework.cloud.client.circuitbreaker.ReactiveCircuitBreakerFactory;
import org.springframework.http.HttpMethod;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeoutException;

/**
 * Client for the Frappe document API, shared by every inbound call.
 * <p>
 * Each operation takes the caller's {@link Identity} explicitly and runs the same path:
 * pick the credential, consult the document cache (single reads only), take a rate-limit
 * token, dispatch with retry. The whole path runs under the configured call timeout and
 * the upstream circuit breaker.
 */
@Slf4j
@Service
public class UpstreamClient {

    static final String SEARCH_LINK_METHOD = "frappe.desk.search.search_link";
    static final String GET_LIST_METHOD = "frappe.client.get_list";
    static final String RUN_REPORT_METHOD = "frappe.desk.query_report.run";

    private final String baseUrl;
    private final String apiPrefix;
    private final Duration callTimeout;

    private final CredentialSelector credentialSelector;
    private final RateLimiter rateLimiter;
    private final DocumentCache documentCache;
    private final RetryingDispatcher dispatcher;
    private final ReactiveCircuitBreaker circuitBreaker;
    private final ObjectMapper objectMapper;
    private final DocumentNormalizer normalizer;

    public UpstreamClient(WebClient.Builder webClientBuilder,
                          AppConfig appConfig,
                          ObjectMapper objectMapper,
                          ReactiveCircuitBreakerFactory<?, ?> circuitBreakerFactory) {
        Objects.requireNonNull(webClientBuilder, "WebClient.Builder must not be null");
        Objects.requireNonNull(appConfig, "AppConfig must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "ObjectMapper must not be null");
        Objects.requireNonNull(circuitBreakerFactory, "CircuitBreakerFactory must not be null");

        UpstreamConfig upstream = appConfig.getUpstream();
        AuthConfig auth = appConfig.getAuth();
        validate(upstream);

        this.baseUrl = trimTrailingSlash(upstream.getBaseUrl());
        this.apiPrefix = upstream.getApiPrefix() == null ? "" : upstream.getApiPrefix();
        this.callTimeout = upstream.getCallTimeout();

        this.credentialSelector = new CredentialSelector(
                auth.getSessionCookie(), auth.getCsrfHeader(), upstream.getApiKey(), upstream.getApiSecret());
        this.rateLimiter = new RateLimiter(
                upstream.getRateLimit().getRequestsPerSecond(), upstream.getRateLimit().getBurst());
        this.documentCache = new DocumentCache(upstream.getCache());
        this.normalizer = new DocumentNormalizer(objectMapper);

        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) upstream.getConnectTimeout().toMillis())
                .responseTimeout(upstream.getTimeout());

        WebClient webClient = webClientBuilder
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .build();

        this.dispatcher = new RetryingDispatcher(webClient, RetryPolicy.from(upstream.getRetry()), objectMapper);
        this.circuitBreaker = circuitBreakerFactory.create(ResilienceConfig.UPSTREAM_CIRCUIT_BREAKER);
    }

    /**
     * Fetches one document, serving repeated reads from the document cache.
     */
    public Mono<Document> getDocument(@Nullable Identity identity, String doctype, String name) {
        String target = describe(UpstreamOperation.GET_DOCUMENT, doctype, name);

        return Mono.defer(() -> {
            Document cached = documentCache.get(doctype, name).orElse(null);
            if (cached != null) {
                log.debug("Document retrieved from cache doctype={} name={}", doctype, name);
                return Mono.just(cached);
            }

            long stamp = documentCache.stamp();
            UpstreamRequest request = new UpstreamRequest(UpstreamOperation.GET_DOCUMENT, HttpMethod.GET,
                    resourceUri(doctype, name), null, target);

            return call(identity, request)
                    .map(body -> readData(body, target))
                    .doOnNext(document -> {
                        if (!documentCache.put(doctype, name, document, stamp)) {
                            log.debug("Document not cached doctype={} name={}", doctype, name);
                        }
                        log.info("Document retrieved successfully doctype={} name={}", doctype, name);
                    });
        });
    }

    public Mono<DocumentList> listDocuments(@Nullable Identity identity, ListRequest listRequest) {
        String target = describe(UpstreamOperation.LIST_DOCUMENTS, listRequest.doctype(), null);
        UpstreamRequest request = new UpstreamRequest(UpstreamOperation.LIST_DOCUMENTS, HttpMethod.GET,
                listUri(listRequest), null, target);

        return call(identity, request)
                .map(body -> DocumentList.page(normalizer.normalize(readTree(body, target)),
                        listRequest.pageSize(), listRequest.start()))
                .doOnNext(list -> log.info("Document list retrieved successfully doctype={} count={} start={}",
                        listRequest.doctype(), list.totalCount(), listRequest.start()));
    }

    /**
     * Creates a document. Every cached document of the doctype is dropped afterwards.
     */
    public Mono<Document> createDocument(@Nullable Identity identity, String doctype, Map<String, Object> data) {
        String target = describe(UpstreamOperation.CREATE_DOCUMENT, doctype, null);
        UpstreamRequest request = new UpstreamRequest(UpstreamOperation.CREATE_DOCUMENT, HttpMethod.POST,
                resourceUri(doctype, null), data, target);

        return call(identity, request)
                .map(body -> readData(body, target))
                .doOnNext(document -> {
                    documentCache.invalidateDoctype(doctype);
                    log.info("Document created successfully doctype={} name={}", doctype, document.name());
                });
    }

    public Mono<Document> updateDocument(@Nullable Identity identity, String doctype, String name,
                                         Map<String, Object> data) {
        String target = describe(UpstreamOperation.UPDATE_DOCUMENT, doctype, name);
        UpstreamRequest request = new UpstreamRequest(UpstreamOperation.UPDATE_DOCUMENT, HttpMethod.PUT,
                resourceUri(doctype, name), data, target);

        return call(identity, request)
                .map(body -> readData(body, target))
                .doOnNext(document -> {
                    documentCache.invalidate(doctype, name);
                    log.info("Document updated successfully doctype={} name={}", doctype, name);
                });
    }

    public Mono<Void> deleteDocument(@Nullable Identity identity, String doctype, String name) {
        String target = describe(UpstreamOperation.DELETE_DOCUMENT, doctype, name);
        UpstreamRequest request = new UpstreamRequest(UpstreamOperation.DELETE_DOCUMENT, HttpMethod.DELETE,
                resourceUri(doctype, name), null, target);

        return call(identity, request)
                .doOnNext(body -> {
                    documentCache.invalidate(doctype, name);
                    log.info("Document deleted successfully doctype={} name={}", doctype, name);
                })
                .then();
    }

    /**
     * Searches documents. Free text goes to the link search method; without text this is a
     * filtered list call.
     */
    public Mono<DocumentList> searchDocuments(@Nullable Identity identity, ListRequest listRequest) {
        String target = describe(UpstreamOperation.SEARCH_DOCUMENTS, listRequest.doctype(), null);
        UpstreamRequest request = listRequest.hasSearchText()
                ? new UpstreamRequest(UpstreamOperation.SEARCH_DOCUMENTS, HttpMethod.POST,
                        searchUri(listRequest), null, target)
                : new UpstreamRequest(UpstreamOperation.SEARCH_DOCUMENTS, HttpMethod.GET,
                        listUri(listRequest), null, target);

        return call(identity, request)
                .map(body -> DocumentList.page(normalizer.normalize(readTree(body, target)),
                        listRequest.pageSize(), listRequest.start()))
                .doOnNext(list -> log.info("Search completed successfully doctype={} query={} results={}",
                        listRequest.doctype(), listRequest.search(), list.totalCount()));
    }

    public Mono<List<Document>> runAggregation(@Nullable Identity identity, AggregationRequest aggregation) {
        String target = describe(UpstreamOperation.RUN_AGGREGATION, aggregation.doctype(), null);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("doctype", aggregation.doctype());
        if (!aggregation.fields().isEmpty()) {
            body.put("fields", aggregation.fields());
        }
        if (!aggregation.filters().isEmpty()) {
            body.put("filters", aggregation.filters());
        }
        if (isPresent(aggregation.groupBy())) {
            body.put("group_by", aggregation.groupBy());
        }
        if (isPresent(aggregation.orderBy())) {
            body.put("order_by", aggregation.orderBy());
        }
        if (aggregation.limit() > 0) {
            body.put("limit_page_length", aggregation.limit());
        }

        UpstreamRequest request = new UpstreamRequest(UpstreamOperation.RUN_AGGREGATION, HttpMethod.POST,
                methodUri(GET_LIST_METHOD).build().toUri(), body, target);

        return call(identity, request)
                .map(response -> normalizer.normalize(readTree(response, target)))
                .doOnNext(rows -> log.info("Aggregation query executed successfully doctype={} groupBy={} rows={}",
                        aggregation.doctype(), aggregation.groupBy(), rows.size()));
    }

    public Mono<ReportResult> runReport(@Nullable Identity identity, ReportRequest report) {
        String target = "run report " + report.reportName();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("report_name", report.reportName());
        body.put("filters", writeJson(report.filters()));
        if (isPresent(report.user())) {
            body.put("user", report.user());
        }

        UpstreamRequest request = new UpstreamRequest(UpstreamOperation.RUN_REPORT, HttpMethod.POST,
                methodUri(RUN_REPORT_METHOD).build().toUri(), body, target);

        return call(identity, request)
                .map(response -> readReport(readTree(response, target)))
                .doOnNext(result -> log.info("Report executed successfully report={} columns={} rows={}",
                        report.reportName(), result.columns().size(), result.rows().size()));
    }

    public void clearCache() {
        documentCache.clear();
    }

    /**
     * The shared outbound path: credential selection, rate limit, retrying dispatch, all
     * under the circuit breaker and the call timeout.
     */
    private Mono<String> call(@Nullable Identity identity, UpstreamRequest request) {
        Mono<String> upstreamCall = Mono.defer(() -> {
            UpstreamCredential credential = credentialSelector.select(identity, request.operation());
            return rateLimiter.acquire()
                    .then(dispatcher.dispatch(request, credential));
        });

        return circuitBreaker.run(upstreamCall, throwable -> rethrow(request, throwable))
                .timeout(callTimeout)
                .onErrorMap(TimeoutException.class,
                        e -> new DeadlineExceededException(request.target(), callTimeout, e));
    }

    /**
     * Breaker fallback. Callers see the typed failure, including {@code CallNotPermittedException}
     * while the circuit is open.
     */
    private static Mono<String> rethrow(UpstreamRequest request, Throwable throwable) {
        if (throwable instanceof CallNotPermittedException) {
            log.warn("Circuit breaker open, rejecting {}", request.target());
        }
        return Mono.error(throwable);
    }

    private URI resourceUri(String doctype, @Nullable String name) {
        Map<String, Object> vars = new HashMap<>();
        vars.put("doctype", doctype);
        UriComponentsBuilder builder = apiBuilder().pathSegment("resource", "{doctype}");
        if (name != null) {
            builder.pathSegment("{name}");
            vars.put("name", name);
        }
        return builder.encode().buildAndExpand(vars).toUri();
    }

    private URI listUri(ListRequest listRequest) {
        Map<String, Object> vars = new HashMap<>();
        vars.put("doctype", listRequest.doctype());
        UriComponentsBuilder builder = apiBuilder().pathSegment("resource", "{doctype}");

        if (!listRequest.fields().isEmpty()) {
            query(builder, vars, "fields", writeJson(listRequest.fields()));
        }
        if (!listRequest.filters().isEmpty()) {
            query(builder, vars, "filters", writeJson(listRequest.filters()));
        }
        if (isPresent(listRequest.orderBy())) {
            query(builder, vars, "order_by", listRequest.orderBy());
        }
        if (listRequest.pageSize() > 0) {
            query(builder, vars, "limit_page_length", listRequest.pageSize());
        }
        if (listRequest.start() > 0) {
            query(builder, vars, "limit_start", listRequest.start());
        }
        return builder.encode().buildAndExpand(vars).toUri();
    }

    private URI searchUri(ListRequest listRequest) {
        Map<String, Object> vars = new HashMap<>();
        UriComponentsBuilder builder = methodUri(SEARCH_LINK_METHOD);
        query(builder, vars, "txt", listRequest.search());
        query(builder, vars, "doctype", listRequest.doctype());
        if (!listRequest.filters().isEmpty()) {
            query(builder, vars, "filters", writeJson(listRequest.filters()));
        }
        if (listRequest.start() > 0) {
            query(builder, vars, "start", listRequest.start());
        }
        if (listRequest.pageSize() > 0) {
            query(builder, vars, "page_length", listRequest.pageSize());
        }
        return builder.encode().buildAndExpand(vars).toUri();
    }

    private UriComponentsBuilder methodUri(String method) {
        return apiBuilder().pathSegment("method", method);
    }

    private UriComponentsBuilder apiBuilder() {
        return UriComponentsBuilder.fromUriString(baseUrl).path(apiPrefix);
    }

    private static void query(UriComponentsBuilder builder, Map<String, Object> vars, String name, Object value) {
        builder.queryParam(name, "{" + name + "}");
        vars.put(name, value);
    }

    private Document readData(String body, String target) {
        JsonNode data = readTree(body, target).get("data");
        if (data == null || !data.isObject()) {
            throw malformed(target, "missing data object");
        }
        return normalizer.toDocument(data);
    }

    private ReportResult readReport(JsonNode root) {
        JsonNode message = root.path("message");
        List<ReportColumn> columns = new ArrayList<>();
        for (JsonNode column : message.path("columns")) {
            if (column.isTextual()) {
                columns.add(ReportColumn.parse(column.asText()));
            } else if (column.isObject()) {
                columns.add(new ReportColumn(
                        text(column, "fieldname"),
                        text(column, "label"),
                        text(column, "fieldtype"),
                        text(column, "options"),
                        column.hasNonNull("width") ? column.get("width").asInt() : null));
            }
        }

        List<Object> rows = new ArrayList<>();
        for (JsonNode row : message.path("result")) {
            rows.add(objectMapper.convertValue(row, Object.class));
        }
        return new ReportResult(columns, rows);
    }

    private JsonNode readTree(String body, String target) {
        if (body == null || body.isBlank()) {
            throw malformed(target, "empty response body");
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw malformed(target, "response is not JSON");
        }
    }

    private String writeJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value cannot be encoded as JSON: " + e.getMessage(), e);
        }
    }

    private static UpstreamException malformed(String target, String reason) {
        return new UpstreamException(target, 502, "malformed upstream response: " + reason, null, null);
    }

    private static String text(JsonNode node, String field) {
        return node.hasNonNull(field) ? node.get(field).asText() : null;
    }

    private static String describe(UpstreamOperation operation, String doctype, @Nullable String name) {
        return operation.getDescription() + " " + (name != null ? doctype + "/" + name : doctype);
    }

    private static void validate(UpstreamConfig upstream) {
        if (!isPresent(upstream.getBaseUrl())) {
            throw new ConfigurationException("base URL is required");
        }
        if (isPresent(upstream.getApiKey()) != isPresent(upstream.getApiSecret())) {
            throw new ConfigurationException("API key and API secret must be configured together");
        }
    }

    private static boolean isPresent(String value) {
        return value != null && !value.isBlank();
    }

    private static String trimTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
