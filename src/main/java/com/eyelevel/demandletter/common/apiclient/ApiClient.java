package com.eyelevel.demandletter.common.apiclient;

import com.eyelevel.demandletter.common.apiclient.authentication.Authentication;
import com.eyelevel.demandletter.common.apiclient.model.ApiRequest;
import com.eyelevel.demandletter.common.apiclient.model.ApiResponse;
import com.eyelevel.demandletter.exception.apiclient.*;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.lang.NonNull;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.*;
import reactor.core.publisher.Mono;

import java.net.ConnectException;
import java.net.UnknownHostException;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * Abstract base class for webhook clients, providing common functionality for making calls,
 * handling responses, and mapping exceptions. Subclasses configure the {@link WebClient} and
 * {@link Authentication} for their endpoint.
 */
@RequiredArgsConstructor
@Slf4j
public abstract class ApiClient {

    private static final int MAX_ERROR_BODY_LENGTH = 500;

    protected final WebClient webClient;
    protected final Authentication authentication;

    /**
     * Executes a call based on the provided {@link ApiRequest}, blocking the calling thread until the
     * response arrives or the request's timeout (if any) elapses.
     *
     * @param apiRequest The request to execute. Must not be null.
     *
     * @return The response of a 2xx call.
     *
     * @throws ApiException If the call fails, times out, or returns a non-2xx status.
     */
    protected ApiResponse call(@NonNull ApiRequest apiRequest) {
        Objects.requireNonNull(apiRequest, "apiRequest must not be null");
        log.info("Calling webhook with method: {} and path: {}", apiRequest.getMethod(), apiRequest.getPath());

        try {
            WebClient.RequestBodySpec requestBodySpec = configureRequest(apiRequest);
            configureHeaders(apiRequest, requestBodySpec);
            configureBody(apiRequest, requestBodySpec);

            Mono<ApiResponse> exchange = requestBodySpec.exchangeToMono(this::handleResponse);
            if (apiRequest.getTimeout() != null) {
                exchange = exchange.timeout(apiRequest.getTimeout());
            }
            ApiResponse apiResponse = exchange.onErrorMap(this::mapException).block();
            log.debug("Received response with status {}", apiResponse != null ? apiResponse.getStatusCode() : null);
            return apiResponse;

        } catch (ApiException e) {
            log.warn("Webhook call to {} failed: {}", apiRequest.getPath(), e.getMessage());
            throw e;
        } catch (Exception e) {
            if (isInterruption(e)) {
                Thread.currentThread().interrupt();
                log.warn("Webhook call to {} was interrupted while waiting for the response.", apiRequest.getPath());
                throw new RequestInterruptedException("Webhook call to " + apiRequest.getPath() + " was interrupted", e);
            }
            log.error("Exception during webhook call to {}", apiRequest.getPath(), e);
            throw mapException(e);
        }
    }

    /**
     * Reactor's {@code block()} rethrows an interrupt as an unchecked wrapper around
     * {@link InterruptedException}; depending on the version it may or may not restore the flag.
     */
    private static boolean isInterruption(Throwable error) {
        if (Thread.currentThread().isInterrupted()) {
            return true;
        }
        for (Throwable cause = error; cause != null; cause = cause.getCause()) {
            if (cause instanceof InterruptedException) {
                return true;
            }
        }
        return false;
    }

    /**
     * Maps exceptions to {@link ApiException} subclasses based on the type of exception and, for
     * {@link WebClientResponseException}, the HTTP status code.
     *
     * @param error The throwable error.
     *
     * @return A specific {@link RuntimeException} representing the error.
     */
    private RuntimeException mapException(Throwable error) {
        if (error instanceof ApiException apiException) {
            return apiException;
        }
        log.debug("Mapping exception: {}", error.toString());

        if (error instanceof WebClientResponseException webClientError) {
            return createException(webClientError.getResponseBodyAsString(), webClientError.getStatusCode().value());

        } else if (error instanceof WebClientRequestException || error instanceof ConnectException ||
                   error instanceof UnknownHostException) {
            return new ServiceUnavailableException("Failed to connect to external service: " + error.getMessage());

        } else if (error instanceof TimeoutException) {
            return new GatewayTimeoutException("Request timed out: " + error.getMessage());

        } else if (error instanceof WebClientException) {
            return new ApiException("Unexpected WebClient error: " + error.getMessage(),
                                    HttpStatus.INTERNAL_SERVER_ERROR.value(), error);

        } else {
            return new ApiException("Internal API client error: " + error.getMessage(),
                                    HttpStatus.INTERNAL_SERVER_ERROR.value(), error);
        }
    }

    private WebClient.RequestBodySpec configureRequest(ApiRequest apiRequest) {
        return webClient.method(apiRequest.getMethod())
                        .uri(uriBuilder -> uriBuilder.path(apiRequest.getPath()).build());
    }

    /**
     * Applies authentication and the request's own headers, then the accepted media type.
     */
    private void configureHeaders(ApiRequest apiRequest, WebClient.RequestBodySpec requestBodySpec) {
        authentication.applyAuthentication(apiRequest.getHeaders());
        apiRequest.getHeaders().forEach(requestBodySpec::header);
        Optional.ofNullable(apiRequest.getAcceptMediaType()).ifPresent(requestBodySpec::accept);
    }

    private void configureBody(ApiRequest apiRequest, WebClient.RequestBodySpec requestBodySpec) {
        if (apiRequest.getBody() == null) {
            return;
        }

        MediaType contentType = Optional.ofNullable(apiRequest.getContentType()).orElse(MediaType.APPLICATION_JSON);
        requestBodySpec.contentType(contentType);
        try {
            requestBodySpec.body(BodyInserters.fromValue(apiRequest.getBody()));
        } catch (Exception e) {
            log.error("Invalid request body {}", e.getMessage());
            throw new BadRequestException("Invalid request body: " + e.getMessage());
        }
    }

    /**
     * Turns a 2xx response into an {@link ApiResponse} and anything else into an error signal.
     */
    private Mono<ApiResponse> handleResponse(ClientResponse response) {
        int statusCode = response.statusCode().value();
        if (response.statusCode().is2xxSuccessful()) {
            return handleSuccessResponse(response, statusCode);
        }
        log.warn("Response was NOT successful, statusCode {}", statusCode);
        return handleErrorResponse(response, statusCode);
    }

    private Mono<ApiResponse> handleSuccessResponse(ClientResponse response, int statusCode) {
        MediaType contentType = response.headers().contentType().orElse(null);
        return response.bodyToMono(byte[].class)
                       .defaultIfEmpty(new byte[0])
                       .map(data -> ApiResponse.builder()
                                               .data(data)
                                               .contentType(contentType)
                                               .statusCode(statusCode)
                                               .build())
                       .onErrorMap(error -> {
                           log.error("Error reading successful response body", error);
                           return new ApiException("Error processing response: " + error.getMessage(), statusCode, error);
                       });
    }

    private Mono<ApiResponse> handleErrorResponse(ClientResponse response, int statusCode) {
        return response.bodyToMono(String.class)
                       .defaultIfEmpty("")
                       .flatMap(body -> Mono.error(createException(body, statusCode)));
    }

    /**
     * Creates an {@link ApiException} matching the HTTP status code, with a message that names the
     * status and an excerpt of the body.
     */
    private ApiException createException(String body, int statusCode) {
        String message = "Webhook responded with HTTP " + statusCode + describeBody(body);
        return switch (statusCode) {
            case 400 -> new BadRequestException(message);
            case 404 -> new NotFoundException(message);
            case 409 -> new ConflictException(message);
            case 500 -> new InternalServerException(message);
            case 502 -> new BadGatewayException(message);
            case 503 -> new ServiceUnavailableException(message);
            case 504 -> new GatewayTimeoutException(message);
            default -> new ApiException(message, statusCode);
        };
    }

    private static String describeBody(String body) {
        if (body == null || body.isBlank()) {
            return "";
        }
        String trimmed = body.strip();
        return ": " + (trimmed.length() > MAX_ERROR_BODY_LENGTH
                ? trimmed.substring(0, MAX_ERROR_BODY_LENGTH) + "..."
                : trimmed);
    }
}
