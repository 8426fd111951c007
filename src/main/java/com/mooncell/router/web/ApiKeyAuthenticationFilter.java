package com.mooncell.router.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mooncell.router.config.RouterProperties;
import com.mooncell.router.core.auth.ApiKeyAuthorizer;
import com.mooncell.router.dto.ErrorPayload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;

/**
 * API Key 鉴权过滤器
 * <p>
 * 受保护路径要求 {@code Authorization: Bearer <key>}，key 不存在于允许列表时直接返回 401，
 * 不会触达注册表和上游。日志中不出现 key。
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class ApiKeyAuthenticationFilter implements WebFilter {

    private static final String BEARER_PREFIX = "Bearer ";

    private final ApiKeyAuthorizer apiKeyAuthorizer;
    private final ObjectMapper objectMapper;
    private final boolean enabled;
    private final List<String> protectedPaths;

    public ApiKeyAuthenticationFilter(ApiKeyAuthorizer apiKeyAuthorizer, ObjectMapper objectMapper,
                                      RouterProperties properties) {
        this.apiKeyAuthorizer = apiKeyAuthorizer;
        this.objectMapper = objectMapper;
        this.enabled = properties.getAuth().isEnabled();
        this.protectedPaths = List.copyOf(properties.getAuth().getProtectedPaths());
        if (!enabled) {
            log.warn("API key authentication is disabled, protected paths are open");
        }
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String path = exchange.getRequest().getPath().value();
        if (!enabled || !isProtected(path)) {
            return chain.filter(exchange);
        }
        String apiKey = extractBearer(exchange.getRequest().getHeaders().getFirst(HttpHeaders.AUTHORIZATION));
        if (apiKey == null) {
            return reject(exchange, "missing bearer token");
        }
        return apiKeyAuthorizer.isAuthorized(apiKey)
                .defaultIfEmpty(false)
                .flatMap(authorized -> authorized
                        ? chain.filter(exchange)
                        : reject(exchange, "invalid api key"));
    }

    private boolean isProtected(String path) {
        for (String prefix : protectedPaths) {
            if (path.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    static String extractBearer(String header) {
        if (header == null || header.length() <= BEARER_PREFIX.length()
                || !header.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            return null;
        }
        String token = header.substring(BEARER_PREFIX.length()).trim();
        return token.isEmpty() ? null : token;
    }

    private Mono<Void> reject(ServerWebExchange exchange, String reason) {
        String path = exchange.getRequest().getPath().value();
        log.debug("Rejected request to {}: {}", path, reason);
        ServerHttpResponse response = exchange.getResponse();
        response.setStatusCode(HttpStatus.UNAUTHORIZED);
        response.getHeaders().set(HttpHeaders.WWW_AUTHENTICATE, "Bearer");
        response.getHeaders().setContentType(MediaType.APPLICATION_JSON);
        ErrorPayload body = new ErrorPayload(
                Instant.now().toString(),
                HttpStatus.UNAUTHORIZED.value(),
                HttpStatus.UNAUTHORIZED.getReasonPhrase(),
                "UNAUTHORIZED",
                reason,
                path);
        return Mono.fromCallable(() -> objectMapper.writeValueAsBytes(body))
                .flatMap(bytes -> {
                    DataBuffer buffer = response.bufferFactory().wrap(bytes);
                    return response.writeWith(Mono.just(buffer));
                });
    }
}
