package com.mooncell.router.web;

import com.mooncell.router.core.error.ModelResolutionException;
import com.mooncell.router.core.error.ResolutionError;
import com.mooncell.router.dto.ErrorPayload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.ServerWebInputException;

import java.time.Instant;
import java.util.stream.Collectors;

/**
 * 全局异常映射，所有客户端可见错误统一为 {@link ErrorPayload}
 */
@Slf4j
@RestControllerAdvice
public class RouterErrorHandler {

    @ExceptionHandler(ModelResolutionException.class)
    public ResponseEntity<ErrorPayload> handleResolution(ModelResolutionException ex, ServerWebExchange exchange) {
        HttpStatus status = ex.getError() == ResolutionError.PROVIDER_NOT_FOUND
                ? HttpStatus.NOT_FOUND
                : HttpStatus.BAD_REQUEST;
        return build(status, ex.getError().name(), ex.getMessage(), exchange);
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorPayload> handleValidation(WebExchangeBindException ex, ServerWebExchange exchange) {
        String message = ex.getFieldErrors().stream()
                .map(error -> error.getField() + " " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return build(HttpStatus.BAD_REQUEST, "INVALID_REQUEST",
                message.isEmpty() ? "Validation failed" : message, exchange);
    }

    @ExceptionHandler({ServerWebInputException.class, IllegalArgumentException.class})
    public ResponseEntity<ErrorPayload> handleBadRequest(Exception ex, ServerWebExchange exchange) {
        String message = ex instanceof ServerWebInputException
                ? ((ServerWebInputException) ex).getReason()
                : ex.getMessage();
        return build(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", message, exchange);
    }

    /**
     * 上游返回非 2xx，状态码和响应体不透传，只记录日志
     */
    @ExceptionHandler(WebClientResponseException.class)
    public ResponseEntity<ErrorPayload> handleUpstreamResponse(WebClientResponseException ex, ServerWebExchange exchange) {
        log.warn("Upstream responded {} for {}", ex.getStatusCode().value(), exchange.getRequest().getPath());
        return build(HttpStatus.BAD_GATEWAY, "UPSTREAM_ERROR",
                "upstream responded with status " + ex.getStatusCode().value(), exchange);
    }

    @ExceptionHandler(WebClientRequestException.class)
    public ResponseEntity<ErrorPayload> handleUpstreamRequest(WebClientRequestException ex, ServerWebExchange exchange) {
        log.warn("Upstream request failed for {}: {}", exchange.getRequest().getPath(), ex.getMessage());
        return build(HttpStatus.BAD_GATEWAY, "UPSTREAM_UNREACHABLE", "upstream request failed", exchange);
    }

    private ResponseEntity<ErrorPayload> build(HttpStatus status, String code, String message,
                                               ServerWebExchange exchange) {
        ErrorPayload body = new ErrorPayload(
                Instant.now().toString(),
                status.value(),
                status.getReasonPhrase(),
                code,
                message,
                exchange.getRequest().getPath().value());
        return ResponseEntity.status(status).body(body);
    }
}
