package com.mooncell.router.core.client;

import com.mooncell.router.config.RouterProperties;
import com.mooncell.router.core.model.ProviderKind;
import com.mooncell.router.service.ProviderWebClientManager;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

@Component
public class AnthropicClientBuilder extends AbstractProviderClientBuilder {

    static final String API_KEY_HEADER = "x-api-key";
    static final String VERSION_HEADER = "anthropic-version";
    static final String API_VERSION = "2023-06-01";

    public AnthropicClientBuilder(ProviderWebClientManager webClientManager, RouterProperties properties) {
        super(webClientManager, properties);
    }

    @Override
    public ProviderKind kind() {
        return ProviderKind.ANTHROPIC;
    }

    @Override
    protected void addCredentialHeaders(ProviderConnection.ProviderConnectionBuilder builder, String secret) {
        builder.header(API_KEY_HEADER, secret);
        builder.header(VERSION_HEADER, API_VERSION);
    }

    @Override
    protected InvocableModel createModel(String modelName, ProviderConnection connection, WebClient webClient) {
        return new AnthropicMessagesModel(modelName, connection, webClient);
    }
}
