package com.mooncell.router.core.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * 基于 WebClient 的模型句柄基类
 * <p>
 * 子类只声明调用路径和请求体补全规则；路径模板中可使用 {@code {model}} 占位符。
 */
public abstract class AbstractWebClientModel implements InvocableModel {

    private final String modelName;
    private final ProviderConnection connection;
    private final WebClient webClient;

    protected AbstractWebClientModel(String modelName, ProviderConnection connection, WebClient webClient) {
        this.modelName = modelName;
        this.connection = connection;
        this.webClient = webClient;
    }

    /**
     * @param stream 是否流式调用
     * @return 相对于连接基础地址的路径模板
     */
    protected abstract String path(boolean stream);

    /**
     * 补全请求体，默认原样透传
     */
    protected JsonNode prepareBody(JsonNode request, boolean stream) {
        return request;
    }

    @Override
    public String getModelName() {
        return modelName;
    }

    @Override
    public ProviderConnection getConnection() {
        return connection;
    }

    @Override
    public Mono<JsonNode> generate(JsonNode request) {
        return Mono.defer(() -> webClient.post()
                .uri(path(false), uriVariables())
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(prepareBody(request, false))
                .retrieve()
                .bodyToMono(JsonNode.class));
    }

    @Override
    public Flux<String> stream(JsonNode request) {
        return Flux.defer(() -> webClient.post()
                .uri(path(true), uriVariables())
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.TEXT_EVENT_STREAM)
                .bodyValue(prepareBody(request, true))
                .retrieve()
                .bodyToFlux(String.class));
    }

    private Map<String, String> uriVariables() {
        return Map.of("model", modelName);
    }

    /**
     * 复制请求体并写入 model / stream 字段，供请求体中携带模型名的后端使用
     */
    protected static ObjectNode withModel(JsonNode request, String modelName, boolean stream) {
        if (request == null || !request.isObject()) {
            throw new IllegalArgumentException("request body must be a JSON object");
        }
        ObjectNode body = ((ObjectNode) request).deepCopy();
        body.put("model", modelName);
        if (stream) {
            body.put("stream", true);
        } else {
            body.remove("stream");
        }
        return body;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + connection.getProviderId() + "/" + modelName
                + " -> " + connection.getBaseUrl() + "]";
    }
}
