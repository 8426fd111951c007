package com.mooncell.router.core.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.mooncell.router.core.model.ProviderKind;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * 绑定到某个服务商连接的模型句柄
 * <p>
 * 请求体为服务商原生格式，网关不做任何格式转换。
 */
public interface InvocableModel {

    String getModelName();

    ProviderConnection getConnection();

    /**
     * 非流式调用，返回服务商原生响应
     */
    Mono<JsonNode> generate(JsonNode request);

    /**
     * 流式调用，返回服务商原生 SSE 数据块
     */
    Flux<String> stream(JsonNode request);

    default String getProviderId() {
        return getConnection().getProviderId();
    }

    default ProviderKind getKind() {
        return getConnection().getKind();
    }

    default String getBaseUrl() {
        return getConnection().getBaseUrl();
    }
}
