package com.mooncell.router.core.client;

import com.mooncell.router.config.RouterProperties;
import com.mooncell.router.core.model.ProviderKind;
import com.mooncell.router.service.ProviderWebClientManager;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

@Component
public class GoogleClientBuilder extends AbstractProviderClientBuilder {

    static final String API_VERSION_PATH = "/v1beta";
    static final String API_KEY_HEADER = "x-goog-api-key";

    public GoogleClientBuilder(ProviderWebClientManager webClientManager, RouterProperties properties) {
        super(webClientManager, properties);
    }

    @Override
    public ProviderKind kind() {
        return ProviderKind.GOOGLE;
    }

    @Override
    protected String basePath() {
        return API_VERSION_PATH;
    }

    @Override
    protected void addCredentialHeaders(ProviderConnection.ProviderConnectionBuilder builder, String secret) {
        builder.header(API_KEY_HEADER, secret);
    }

    @Override
    protected InvocableModel createModel(String modelName, ProviderConnection connection, WebClient webClient) {
        return new GoogleGenerativeModel(modelName, connection, webClient);
    }
}
