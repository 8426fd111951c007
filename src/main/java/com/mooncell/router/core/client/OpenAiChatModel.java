package com.mooncell.router.core.client;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * OpenAI Chat Completions 兼容接口，模型名写入请求体
 */
public class OpenAiChatModel extends AbstractWebClientModel {

    public OpenAiChatModel(String modelName, ProviderConnection connection, WebClient webClient) {
        super(modelName, connection, webClient);
    }

    @Override
    protected String path(boolean stream) {
        return "/chat/completions";
    }

    @Override
    protected JsonNode prepareBody(JsonNode request, boolean stream) {
        return withModel(request, getModelName(), stream);
    }
}
