package com.eyelevel.demandletter.exception.handler;

import com.eyelevel.demandletter.dto.common.ErrorResponse;
import com.eyelevel.demandletter.exception.ChatDispatchException;
import com.eyelevel.demandletter.exception.apiclient.ApiException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.MultipartException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.util.Objects;

/**
 * A centralized exception handler for the entire application.
 * It converts exceptions thrown from controllers into {@code {"error": "..."}} bodies with the
 * semantically correct HTTP status code.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    // --- Domain and downstream errors ---

    /**
     * A failed chat exchange: the body also carries the placeholder reply that was recorded. (502/504)
     */
    @ExceptionHandler(ChatDispatchException.class)
    public ResponseEntity<ErrorResponse> handleChatDispatch(ChatDispatchException ex) {
        log.error("Chat Dispatch Exception: {}", ex.getMessage());
        return ResponseEntity.status(ex.getStatusCode())
                .body(new ErrorResponse(ex.getMessage(), ex.getFallbackResponse()));
    }

    /**
     * Any other {@link ApiException} answers with its own status code.
     */
    @ExceptionHandler(ApiException.class)
    public ResponseEntity<ErrorResponse> handleApiException(ApiException ex) {
        if (ex.getStatusCode() >= 500) {
            log.error("API Exception ({}): {}", ex.getStatusCode(), ex.getMessage());
        } else {
            log.warn("API Exception ({}): {}", ex.getStatusCode(), ex.getMessage());
        }
        return ResponseEntity.status(ex.getStatusCode()).body(ErrorResponse.of(ex.getMessage()));
    }

    // --- 4xx Client Error Handlers ---

    /**
     * Uploads beyond the servlet multipart limit. (413 Payload Too Large)
     */
    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ErrorResponse> handleMaxUploadSize(MaxUploadSizeExceededException ex) {
        log.warn("Handling MaxUploadSizeExceededException: {}", ex.getMessage());
        return new ResponseEntity<>(ErrorResponse.of("Uploaded files exceed the maximum allowed size."),
                HttpStatus.PAYLOAD_TOO_LARGE);
    }

    /**
     * Requests that are not multipart or whose multipart body cannot be parsed. (400 Bad Request)
     */
    @ExceptionHandler(MultipartException.class)
    public ResponseEntity<ErrorResponse> handleMultipart(MultipartException ex) {
        log.warn("Handling MultipartException: {}", ex.getMessage());
        return new ResponseEntity<>(ErrorResponse.of("Both TXT and CSV files are required"), HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(MissingServletRequestPartException.class)
    public ResponseEntity<ErrorResponse> handleMissingPart(MissingServletRequestPartException ex) {
        log.warn("Handling MissingServletRequestPartException: {}", ex.getMessage());
        return new ResponseEntity<>(ErrorResponse.of("Both TXT and CSV files are required"), HttpStatus.BAD_REQUEST);
    }

    /**
     * Handles malformed JSON or unreadable request bodies. (400 Bad Request)
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleHttpMessageNotReadable(HttpMessageNotReadableException ex) {
        log.warn("Handling HttpMessageNotReadableException: {}", ex.getMessage());
        return new ResponseEntity<>(ErrorResponse.of("The request body is missing or could not be parsed."),
                HttpStatus.BAD_REQUEST);
    }

    /**
     * Handles validation errors from @Valid on request bodies; the first field message becomes the error. (400 Bad Request)
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationExceptions(MethodArgumentNotValidException ex) {
        String errorMessage = ex.getBindingResult().getFieldErrors().stream()
                .findFirst()
                .map(FieldError::getDefaultMessage)
                .orElse("Invalid input provided.");
        log.warn("Handling validation exception: {}", errorMessage);
        return new ResponseEntity<>(ErrorResponse.of(errorMessage), HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingServletRequestParameter(MissingServletRequestParameterException ex) {
        String errorMessage = String.format("Required parameter '%s' of type '%s' is missing.",
                ex.getParameterName(), ex.getParameterType());
        log.warn("Handling MissingServletRequestParameterException: {}", errorMessage);
        return new ResponseEntity<>(ErrorResponse.of(errorMessage), HttpStatus.BAD_REQUEST);
    }

    /**
     * Handles type mismatch errors for path variables or request parameters (e.g., text for a job ID). (400 Bad Request)
     */
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        String errorMessage = String.format("Invalid value '%s' for parameter '%s'.", ex.getValue(), ex.getName());
        log.warn("Handling type mismatch exception: {}", errorMessage);
        return new ResponseEntity<>(ErrorResponse.of(errorMessage), HttpStatus.BAD_REQUEST);
    }

    /**
     * Handles unsupported HTTP methods for an existing endpoint. (405 Method Not Allowed)
     */
    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ErrorResponse> handleHttpRequestMethodNotSupported(HttpRequestMethodNotSupportedException ex) {
        String supportedMethods = String.join(", ", Objects.requireNonNullElse(ex.getSupportedMethods(), new String[0]));
        String errorMessage = String.format("Request method '%s' not supported. Supported methods are: %s",
                ex.getMethod(), supportedMethods);
        log.warn("Handling HttpRequestMethodNotSupportedException: {}", errorMessage);
        return new ResponseEntity<>(ErrorResponse.of(errorMessage), HttpStatus.METHOD_NOT_ALLOWED);
    }

    // --- 5xx Server Error Handlers ---

    /**
     * A final catch-all handler for any other unexpected exceptions. (500 Internal Server Error)
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex) {
        log.error("An unexpected internal server error occurred", ex);
        return new ResponseEntity<>(ErrorResponse.of("An unexpected internal error occurred."),
                HttpStatus.INTERNAL_SERVER_ERROR);
    }
}
