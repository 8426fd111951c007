package com.mooncell.router.core.client;

import org.springframework.web.reactive.function.client.WebClient;

/**
 * Google Generative Language API，模型名在路径中
 */
public class GoogleGenerativeModel extends AbstractWebClientModel {

    public GoogleGenerativeModel(String modelName, ProviderConnection connection, WebClient webClient) {
        super(modelName, connection, webClient);
    }

    @Override
    protected String path(boolean stream) {
        return stream
                ? "/models/{model}:streamGenerateContent?alt=sse"
                : "/models/{model}:generateContent";
    }
}
