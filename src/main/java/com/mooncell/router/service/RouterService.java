package com.mooncell.router.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.mooncell.router.api.ModelInvokeRequest;
import com.mooncell.router.core.client.InvocableModel;
import com.mooncell.router.core.registry.ProviderRegistry;
import com.mooncell.router.dto.ResolvedModelDto;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * 请求分发
 * <p>
 * 每个请求先经过注册表的新鲜度检查，再把原生请求体交给解析出的模型句柄。
 * 请求体和响应体都不做格式转换。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RouterService {

    private final ProviderRegistry providerRegistry;

    /**
     * 解析模型标识，返回不含凭据的描述
     */
    public Mono<ResolvedModelDto> describe(String model) {
        return providerRegistry.resolveFresh(model)
                .map(handle -> new ResolvedModelDto(
                        handle.getProviderId(),
                        handle.getKind().getWireName(),
                        handle.getModelName(),
                        handle.getBaseUrl()));
    }

    /**
     * 非流式调用
     */
    public Mono<JsonNode> invoke(ModelInvokeRequest request) {
        return providerRegistry.resolveFresh(request.getModel())
                .doOnNext(handle -> logDispatch(handle, false))
                .flatMap(handle -> handle.generate(request.getRequest())
                        .doOnError(e -> log.warn("Upstream call to {} failed: {}", handle, e.getMessage())));
    }

    /**
     * 流式调用，原样转发服务商的 SSE 数据块
     */
    public Flux<String> stream(ModelInvokeRequest request) {
        return providerRegistry.resolveFresh(request.getModel())
                .doOnNext(handle -> logDispatch(handle, true))
                .flatMapMany(handle -> handle.stream(request.getRequest())
                        .doOnError(e -> log.warn("Upstream stream from {} failed: {}", handle, e.getMessage())));
    }

    private void logDispatch(InvocableModel handle, boolean stream) {
        if (log.isDebugEnabled()) {
            log.debug("Dispatching {} request to {}", stream ? "stream" : "generate", handle);
        }
    }
}
