package com.growfolio.common.exception;

/*
 * 09/16/2026 - 9:34 AM
 * @author Growfolio Engineering
 */

import java.time.Duration;
import java.util.Optional;

/**
 * Failures surfaced by repositories and the remote data sources behind them.
 * <p>
 * Every failure is an {@link ApiException}; {@link ApiException#isRetryable()} tells callers whether
 * retrying the same request can succeed and whether cached data should be kept in place.
 */
public final class ApiExceptions {

    private ApiExceptions() {}

    /**
     * Base exception with error code support.
     */
    public static class ApiException extends RuntimeException {
        private final String errorCode;
        private final boolean retryable;

        public ApiException(String message, String errorCode) {
            this(message, errorCode, null, false);
        }

        public ApiException(String message, String errorCode, Throwable cause, boolean retryable) {
            super(message, cause);
            this.errorCode = errorCode;
            this.retryable = retryable;
        }

        public String getErrorCode() {
            return errorCode;
        }

        public boolean isRetryable() {
            return retryable;
        }
    }

    /**
     * Resource not found (HTTP 404).
     */
    public static class NotFoundException extends ApiException {
        private final String resourceType;
        private final String resourceId;

        public NotFoundException(String resourceType, String resourceId) {
            super(String.format("%s not found: %s", resourceType, resourceId), "NOT_FOUND");
            this.resourceType = resourceType;
            this.resourceId = resourceId;
        }

        public String getResourceType() {
            return resourceType;
        }

        public String getResourceId() {
            return resourceId;
        }
    }

    /**
     * Missing or expired credentials (HTTP 401).
     */
    public static class UnauthorizedException extends ApiException {
        public UnauthorizedException() {
            super("Authentication required", "UNAUTHORIZED");
        }
    }

    /**
     * Authenticated but not permitted (HTTP 403).
     */
    public static class ForbiddenException extends ApiException {
        public ForbiddenException() {
            super("Access denied", "FORBIDDEN");
        }
    }

    /**
     * Request rejected by the server (any other HTTP 4xx).
     */
    public static class ValidationException extends ApiException {
        private final int statusCode;

        public ValidationException(String message, int statusCode) {
            super(message, "VALIDATION_ERROR");
            this.statusCode = statusCode;
        }

        public int getStatusCode() {
            return statusCode;
        }
    }

    /**
     * Rate limit exceeded (HTTP 429).
     */
    public static class RateLimitedException extends ApiException {
        private final Duration retryAfter;

        public RateLimitedException(Duration retryAfter) {
            super(retryAfter != null
                    ? "Rate limit exceeded, retry after " + retryAfter.toSeconds() + "s"
                    : "Rate limit exceeded", "RATE_LIMITED", null, true);
            this.retryAfter = retryAfter;
        }

        public Optional<Duration> getRetryAfter() {
            return Optional.ofNullable(retryAfter);
        }
    }

    /**
     * Server side failure (HTTP 5xx).
     */
    public static class ServerErrorException extends ApiException {
        private final int statusCode;

        public ServerErrorException(int statusCode, String message) {
            super(message != null ? message : "Server error " + statusCode, "SERVER_ERROR", null, true);
            this.statusCode = statusCode;
        }

        public int getStatusCode() {
            return statusCode;
        }
    }

    /**
     * The server could not be reached: timeout, refused connection or an open circuit.
     */
    public static class ConnectivityException extends ApiException {
        public ConnectivityException(String message, Throwable cause) {
            super(message, "CONNECTIVITY", cause, true);
        }
    }

    /**
     * Response body could not be mapped onto the expected type.
     */
    public static class DecodeException extends ApiException {
        public DecodeException(String message, Throwable cause) {
            super(message, "DECODE_ERROR", cause, false);
        }
    }

    /**
     * Raised by a repository from cached state before any request is sent.
     */
    public static class DomainRuleViolationException extends ApiException {
        private final String ruleCode;

        public DomainRuleViolationException(String message, String ruleCode) {
            super(message, "DOMAIN_RULE_VIOLATION");
            this.ruleCode = ruleCode;
        }

        public String getRuleCode() {
            return ruleCode;
        }
    }
}
