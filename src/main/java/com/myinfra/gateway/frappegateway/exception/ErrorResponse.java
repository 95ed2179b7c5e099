package com.myinfra.gateway.frappegateway.exception;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Getter;

import java.time.LocalDateTime;

/**
 * Standardized immutable response model for all gateway errors.
 */
@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {

    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss")
    private final LocalDateTime timestamp;

    private final int status;

    private final String error;

    private final String message;

    private final String path;

    /**
     * Upstream operation and document the failure belongs to, e.g. "update document Task/TASK-0001".
     */
    private final String target;

    /**
     * Status the upstream answered with, when it answered at all.
     */
    private final Integer upstreamStatus;
}
