package com.myinfra.gateway.frappegateway.service;

import org.springframework.http.HttpMethod;

import java.net.URI;

/**
 * One outbound call, ready to dispatch.
 *
 * @param operation Logical operation, decides whether retries are allowed
 * @param method    HTTP method
 * @param uri       Fully encoded target URI
 * @param body      JSON body, or null
 * @param target    Human readable subject for logs and errors, e.g. "get document Project/PROJ-0001"
 */
public record UpstreamRequest(UpstreamOperation operation, HttpMethod method, URI uri, Object body, String target) {
}
