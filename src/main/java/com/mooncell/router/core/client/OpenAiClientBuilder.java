package com.mooncell.router.core.client;

import com.mooncell.router.config.RouterProperties;
import com.mooncell.router.core.model.ProviderKind;
import com.mooncell.router.service.ProviderWebClientManager;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

@Component
public class OpenAiClientBuilder extends AbstractProviderClientBuilder {

    public OpenAiClientBuilder(ProviderWebClientManager webClientManager, RouterProperties properties) {
        super(webClientManager, properties);
    }

    @Override
    public ProviderKind kind() {
        return ProviderKind.OPENAI;
    }

    @Override
    protected void addCredentialHeaders(ProviderConnection.ProviderConnectionBuilder builder, String secret) {
        builder.header(HttpHeaders.AUTHORIZATION, "Bearer " + secret);
    }

    @Override
    protected InvocableModel createModel(String modelName, ProviderConnection connection, WebClient webClient) {
        return new OpenAiChatModel(modelName, connection, webClient);
    }
}
