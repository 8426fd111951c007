package com.mooncell.router.core.source;

import com.mooncell.router.config.RouterProperties;
import com.mooncell.router.core.error.ProviderConfigError;
import com.mooncell.router.core.error.ProviderConfigException;
import com.mooncell.router.core.model.ResolvedEndpoint;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * AI 网关地址解析
 * <p>
 * 地址格式：{@code {base-url}/{account-id}/{name}/{routingPath}}，account-id 与 name 为空时省略对应段。
 * 每次调用都重新读取配置，令牌轮换后下一次刷新即生效。
 */
@Component
@RequiredArgsConstructor
public class AiGatewayEndpointResolver implements EndpointResolver {

    private final RouterProperties properties;

    @Override
    public Mono<ResolvedEndpoint> resolve(String routingPath) {
        return Mono.fromCallable(() -> buildEndpoint(routingPath));
    }

    private ResolvedEndpoint buildEndpoint(String routingPath) {
        RouterProperties.Gateway gateway = properties.getGateway();
        if (isBlank(routingPath)) {
            throw failed("routing path is empty");
        }
        if (isBlank(gateway.getBaseUrl())) {
            throw failed("gateway base-url is not configured");
        }
        if (isBlank(gateway.getToken())) {
            throw failed("gateway token is not configured");
        }
        StringBuilder url = new StringBuilder(trimTrailingSlashes(gateway.getBaseUrl().trim()));
        appendSegment(url, gateway.getAccountId());
        appendSegment(url, gateway.getName());
        appendSegment(url, routingPath);
        return new ResolvedEndpoint(url.toString(), gateway.getToken());
    }

    private static void appendSegment(StringBuilder url, String segment) {
        if (isBlank(segment)) {
            return;
        }
        url.append('/').append(stripSlashes(segment));
    }

    private static String stripSlashes(String value) {
        int start = 0;
        while (start < value.length() && value.charAt(start) == '/') {
            start++;
        }
        return trimTrailingSlashes(value.substring(start));
    }

    private static String trimTrailingSlashes(String value) {
        int end = value.length();
        while (end > 0 && value.charAt(end - 1) == '/') {
            end--;
        }
        return value.substring(0, end);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static ProviderConfigException failed(String message) {
        return new ProviderConfigException(ProviderConfigError.ENDPOINT_RESOLUTION_FAILED, message);
    }
}
