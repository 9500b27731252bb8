package com.growfolio.dataclient.remote;

/*
 * 09/24/2026 - 9:24 AM
 * @author Growfolio Engineering
 */

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.growfolio.common.exception.ApiExceptions.ApiException;
import com.growfolio.common.exception.ApiExceptions.ConnectivityException;
import com.growfolio.common.exception.ApiExceptions.DecodeException;
import com.growfolio.common.exception.ApiExceptions.ForbiddenException;
import com.growfolio.common.exception.ApiExceptions.NotFoundException;
import com.growfolio.common.exception.ApiExceptions.RateLimitedException;
import com.growfolio.common.exception.ApiExceptions.ServerErrorException;
import com.growfolio.common.exception.ApiExceptions.UnauthorizedException;
import com.growfolio.common.exception.ApiExceptions.ValidationException;
import com.growfolio.common.util.JsonUtils;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.function.Supplier;

/**
 * JSON over HTTP to the Growfolio API.
 * <p>
 * Every non-2xx response and every transport failure is turned into an
 * {@link com.growfolio.common.exception.ApiExceptions.ApiException} subtype. Reads (GET) are retried on
 * retryable failures; all calls pass through the {@code growfolio-api} circuit breaker.
 */
@Slf4j
public class ApiClient {

    private final RestClient restClient;
    private final ObjectMapper mapper;
    private final String pathPrefix;
    private final CircuitBreaker circuitBreaker;
    private final Retry retry;

    public ApiClient(RestClient restClient, String apiVersion, CircuitBreaker circuitBreaker, Retry retry) {
        this.restClient = restClient;
        this.mapper = JsonUtils.newMapper();
        this.pathPrefix = "/" + apiVersion;
        this.circuitBreaker = circuitBreaker;
        this.retry = retry;
    }

    // ==================== Request methods ====================

    public <T> T get(TypeReference<T> type, String path, Object... uriVariables) {
        return get(type, Map.of(), path, uriVariables);
    }

    public <T> T get(TypeReference<T> type, Map<String, ?> query, String path, Object... uriVariables) {
        Supplier<byte[]> call = () -> exchange(HttpMethod.GET, null, query, path, uriVariables);
        return decode(guarded(Retry.decorateSupplier(retry, CircuitBreaker.decorateSupplier(circuitBreaker, call))),
                type, path);
    }

    public <T> T post(TypeReference<T> type, Object body, String path, Object... uriVariables) {
        return decode(mutate(HttpMethod.POST, body, path, uriVariables), type, path);
    }

    public <T> T put(TypeReference<T> type, Object body, String path, Object... uriVariables) {
        return decode(mutate(HttpMethod.PUT, body, path, uriVariables), type, path);
    }

    public <T> T patch(TypeReference<T> type, Object body, String path, Object... uriVariables) {
        return decode(mutate(HttpMethod.PATCH, body, path, uriVariables), type, path);
    }

    /**
     * Mutation whose response body is ignored.
     */
    public void send(HttpMethod method, Object body, String path, Object... uriVariables) {
        mutate(method, body, path, uriVariables);
    }

    public void delete(String path, Object... uriVariables) {
        mutate(HttpMethod.DELETE, null, path, uriVariables);
    }

    // ==================== Internals ====================

    private byte[] mutate(HttpMethod method, Object body, String path, Object[] uriVariables) {
        Supplier<byte[]> call = () -> exchange(method, body, Map.of(), path, uriVariables);
        return guarded(CircuitBreaker.decorateSupplier(circuitBreaker, call));
    }

    private byte[] guarded(Supplier<byte[]> call) {
        try {
            return call.get();
        } catch (CallNotPermittedException e) {
            throw new ConnectivityException("Growfolio API circuit is open", e);
        }
    }

    private byte[] exchange(HttpMethod method, Object body, Map<String, ?> query, String path, Object[] uriVariables) {
        long start = System.nanoTime();
        RestClient.RequestBodySpec request = restClient.method(method)
                .uri(builder -> {
                    builder.path(pathPrefix + path);
                    query.forEach((name, value) -> {
                        if (value != null) {
                            builder.queryParam(name, value);
                        }
                    });
                    return builder.build(uriVariables);
                });
        if (body != null) {
            request.contentType(MediaType.APPLICATION_JSON).body(serialize(body));
        }
        try {
            return request.exchange((httpRequest, response) -> {
                int status = response.getStatusCode().value();
                byte[] payload = readBody(response.getBody());
                log.debug("{} {} -> {} in {}ms", method, httpRequest.getURI().getPath(), status,
                        Duration.ofNanos(System.nanoTime() - start).toMillis());
                if (status >= 200 && status < 300) {
                    return payload;
                }
                throw classify(status, response.getHeaders(), payload, httpRequest.getURI());
            });
        } catch (ResourceAccessException e) {
            log.warn("{} {} failed: {}", method, path, e.getMessage());
            throw new ConnectivityException("Cannot reach Growfolio API: " + e.getMessage(), e);
        } catch (RestClientException e) {
            throw new ApiException("Request " + method + " " + path + " failed: " + e.getMessage(),
                    "UNKNOWN", e, false);
        }
    }

    /**
     * Map a non-2xx response onto the error taxonomy.
     */
    static ApiException classify(int status, HttpHeaders headers, byte[] payload, URI uri) {
        String message = JsonUtils.extractErrorMessage(new String(payload, StandardCharsets.UTF_8)).orElse(null);
        return switch (status) {
            case 401 -> new UnauthorizedException();
            case 403 -> new ForbiddenException();
            case 404 -> new NotFoundException(resourceType(uri), uri.getPath());
            case 429 -> new RateLimitedException(retryAfter(headers.getFirst(HttpHeaders.RETRY_AFTER)));
            default -> {
                if (status >= 400 && status < 500) {
                    yield new ValidationException(message != null ? message : "Request rejected with " + status, status);
                }
                if (status >= 500) {
                    yield new ServerErrorException(status, message);
                }
                yield new ApiException("Unexpected status code: " + status, "UNEXPECTED_STATUS");
            }
        };
    }

    private <T> T decode(byte[] payload, TypeReference<T> type, String path) {
        if (payload.length == 0) {
            throw new DecodeException("Empty response body from " + path, null);
        }
        try {
            return mapper.readValue(payload, type);
        } catch (IOException e) {
            throw new DecodeException("Cannot decode response from " + path + ": " + e.getMessage(), e);
        }
    }

    private String serialize(Object body) {
        try {
            return mapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize " + body.getClass().getSimpleName(), e);
        }
    }

    private static byte[] readBody(InputStream body) throws IOException {
        return body != null ? StreamUtils.copyToByteArray(body) : new byte[0];
    }

    private static Duration retryAfter(String header) {
        if (header == null || header.isBlank()) {
            return null;
        }
        try {
            return Duration.ofSeconds(Long.parseLong(header.trim()));
        } catch (NumberFormatException e) {
            log.debug("Ignoring non-numeric Retry-After header '{}'", header);
            return null;
        }
    }

    private static String resourceType(URI uri) {
        String[] segments = uri.getPath().split("/");
        // /v1/<resource>/...
        return segments.length > 2 ? segments[2] : uri.getPath();
    }
}
