package com.mooncell.router.core.client;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Anthropic Messages API，模型名写入请求体
 */
public class AnthropicMessagesModel extends AbstractWebClientModel {

    public AnthropicMessagesModel(String modelName, ProviderConnection connection, WebClient webClient) {
        super(modelName, connection, webClient);
    }

    @Override
    protected String path(boolean stream) {
        return "/v1/messages";
    }

    @Override
    protected JsonNode prepareBody(JsonNode request, boolean stream) {
        return withModel(request, getModelName(), stream);
    }
}
