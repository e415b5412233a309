package com.iptv.gateway.infrastructure.api.controller;

import com.iptv.gateway.core.exception.AuthResponseMalformedException;
import com.iptv.gateway.core.exception.InvalidCatalogFormatException;
import com.iptv.gateway.core.exception.InvalidCredentialsException;
import com.iptv.gateway.core.exception.MissingParametersException;
import com.iptv.gateway.core.exception.ProxyFailureException;
import com.iptv.gateway.core.exception.ProxyUnsupportedContentTypeException;
import com.iptv.gateway.core.exception.ProxyUpstreamHttpException;
import com.iptv.gateway.core.exception.ProxyUpstreamTimeoutException;
import com.iptv.gateway.core.exception.UpstreamTransportException;
import com.iptv.gateway.infrastructure.api.dto.ErrorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Global exception handler for REST API.
 * Playlist, category and guide failures are answered as {@link ErrorResponse} JSON;
 * proxy failures as plain text, since proxy callers are media players.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    static final String MISSING_PARAMETERS_MESSAGE = "Required parameters: url, username, and password";

    @ExceptionHandler(MissingParametersException.class)
    public ResponseEntity<ErrorResponse> handleMissingParameters(MissingParametersException ex) {
        return error(HttpStatus.BAD_REQUEST, "MISSING_PARAMETERS", ex.getMessage());
    }

    @ExceptionHandler({MethodArgumentNotValidException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<ErrorResponse> handleInvalidBody(Exception ex) {
        return error(HttpStatus.BAD_REQUEST, "MISSING_PARAMETERS", MISSING_PARAMETERS_MESSAGE);
    }

    @ExceptionHandler(InvalidCredentialsException.class)
    public ResponseEntity<ErrorResponse> handleInvalidCredentials(InvalidCredentialsException ex) {
        return error(HttpStatus.BAD_REQUEST, "INVALID_CREDENTIALS", ex.getMessage());
    }

    @ExceptionHandler(AuthResponseMalformedException.class)
    public ResponseEntity<ErrorResponse> handleAuthResponseMalformed(AuthResponseMalformedException ex) {
        log.warn("Malformed account response: {}", ex.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, "AUTH_RESPONSE_MALFORMED", ex.getMessage());
    }

    @ExceptionHandler(UpstreamTransportException.class)
    public ResponseEntity<ErrorResponse> handleUpstreamTransport(UpstreamTransportException ex) {
        log.warn("Upstream unavailable: {}", ex.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, "UPSTREAM_TRANSPORT_ERROR", ex.getMessage());
    }

    @ExceptionHandler(InvalidCatalogFormatException.class)
    public ResponseEntity<ErrorResponse> handleInvalidCatalogFormat(InvalidCatalogFormatException ex) {
        log.error("Unexpected catalog data: {}", ex.getMessage());
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "INVALID_CATALOG_FORMAT", ex.getMessage());
    }

    @ExceptionHandler(ProxyUpstreamTimeoutException.class)
    public ResponseEntity<String> handleProxyTimeout(ProxyUpstreamTimeoutException ex) {
        log.error("Proxy timeout: {}", ex.getMessage());
        return plainText(HttpStatus.GATEWAY_TIMEOUT, "Request timed out");
    }

    @ExceptionHandler(ProxyUpstreamHttpException.class)
    public ResponseEntity<String> handleProxyUpstreamHttp(ProxyUpstreamHttpException ex) {
        return plainText(HttpStatusCode.valueOf(ex.getStatusCode()), "HTTP error: " + ex.getStatusCode());
    }

    @ExceptionHandler(ProxyUnsupportedContentTypeException.class)
    public ResponseEntity<String> handleUnsupportedContentType(ProxyUnsupportedContentTypeException ex) {
        return plainText(HttpStatus.UNSUPPORTED_MEDIA_TYPE, ex.getMessage());
    }

    @ExceptionHandler(ProxyFailureException.class)
    public ResponseEntity<String> handleProxyFailure(ProxyFailureException ex) {
        log.error("Proxy failure: {}", ex.getMessage());
        return plainText(HttpStatus.INTERNAL_SERVER_ERROR, "Proxy error: " + ex.getMessage());
    }

    private static ResponseEntity<ErrorResponse> error(HttpStatus status, String errorCode, String message) {
        return ResponseEntity.status(status).body(new ErrorResponse(errorCode, message));
    }

    private static ResponseEntity<String> plainText(HttpStatusCode status, String message) {
        return ResponseEntity.status(status)
                .contentType(MediaType.TEXT_PLAIN)
                .body(message);
    }
}
