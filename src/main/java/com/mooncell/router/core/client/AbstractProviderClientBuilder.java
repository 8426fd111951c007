package com.mooncell.router.core.client;

import com.mooncell.router.config.RouterProperties;
import com.mooncell.router.core.model.ProviderDescriptor;
import com.mooncell.router.core.model.ResolvedEndpoint;
import com.mooncell.router.service.ProviderWebClientManager;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * 构建器公共流程：组装连接信息 -> 附加网关令牌头 -> 构建 WebClient -> 返回工厂
 * <p>
 * 子类负责后端相关的基础路径、凭据头以及模型句柄类型。
 */
public abstract class AbstractProviderClientBuilder implements ProviderClientBuilder {

    private final ProviderWebClientManager webClientManager;
    private final RouterProperties properties;

    protected AbstractProviderClientBuilder(ProviderWebClientManager webClientManager, RouterProperties properties) {
        this.webClientManager = webClientManager;
        this.properties = properties;
    }

    @Override
    public final ClientFactory build(ProviderDescriptor descriptor, String secret, ResolvedEndpoint endpoint) {
        ProviderConnection.ProviderConnectionBuilder builder = ProviderConnection.builder()
                .providerId(descriptor.getProviderId())
                .kind(kind())
                .baseUrl(endpoint.getBaseUrl() + basePath())
                .credential(secret)
                .gatewayToken(endpoint.getAuthToken())
                .header(properties.getGateway().getAuthorizationHeader(), "Bearer " + endpoint.getAuthToken());
        addCredentialHeaders(builder, secret);
        ProviderConnection connection = builder.build();
        WebClient webClient = webClientManager.createWebClient(connection);
        return modelName -> createModel(modelName, connection, webClient);
    }

    /**
     * 追加在网关地址之后的路径前缀，例如版本号
     */
    protected String basePath() {
        return "";
    }

    protected abstract void addCredentialHeaders(ProviderConnection.ProviderConnectionBuilder builder, String secret);

    protected abstract InvocableModel createModel(String modelName, ProviderConnection connection, WebClient webClient);
}
