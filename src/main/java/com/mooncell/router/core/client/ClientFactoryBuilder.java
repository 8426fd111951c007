package com.mooncell.router.core.client;

import com.mooncell.router.core.error.ProviderConfigError;
import com.mooncell.router.core.error.ProviderConfigException;
import com.mooncell.router.core.model.ProviderDescriptor;
import com.mooncell.router.core.model.ProviderKind;
import com.mooncell.router.core.model.ResolvedEndpoint;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 客户端工厂构建入口
 * <p>
 * 按描述中的 kind 分发到对应的 {@link ProviderClientBuilder}。每个 {@link ProviderKind} 最多一个构建器，
 * 重复注册在启动时直接失败。未知 kind 或没有构建器的 kind 返回 UNSUPPORTED_PROVIDER_KIND，
 * 只影响该条目。
 */
@Slf4j
@Component
public class ClientFactoryBuilder {

    private final Map<ProviderKind, ProviderClientBuilder> builders;

    public ClientFactoryBuilder(List<ProviderClientBuilder> providerClientBuilders) {
        Map<ProviderKind, ProviderClientBuilder> byKind = new EnumMap<>(ProviderKind.class);
        for (ProviderClientBuilder builder : providerClientBuilders) {
            ProviderClientBuilder previous = byKind.put(builder.kind(), builder);
            if (previous != null) {
                throw new IllegalStateException("Duplicate client builder for kind " + builder.kind() + ": "
                        + previous.getClass().getSimpleName() + ", " + builder.getClass().getSimpleName());
            }
        }
        this.builders = Collections.unmodifiableMap(byKind);
        log.info("Registered client builders for kinds {}", builders.keySet());
    }

    /**
     * 解析描述中的后端类型
     *
     * @throws ProviderConfigException UNSUPPORTED_PROVIDER_KIND
     */
    public ProviderKind resolveKind(ProviderDescriptor descriptor) {
        ProviderKind kind = ProviderKind.fromWireName(descriptor.getKind())
                .orElseThrow(() -> unsupported(descriptor));
        if (!builders.containsKey(kind)) {
            throw unsupported(descriptor);
        }
        return kind;
    }

    /**
     * 为单个服务商构建客户端工厂
     *
     * @throws ProviderConfigException UNSUPPORTED_PROVIDER_KIND
     */
    public ClientFactory build(ProviderDescriptor descriptor, String secret, ResolvedEndpoint endpoint) {
        ProviderKind kind = resolveKind(descriptor);
        return builders.get(kind).build(descriptor, secret, endpoint);
    }

    public Set<ProviderKind> supportedKinds() {
        return builders.keySet();
    }

    private static ProviderConfigException unsupported(ProviderDescriptor descriptor) {
        return new ProviderConfigException(ProviderConfigError.UNSUPPORTED_PROVIDER_KIND,
                "unsupported provider kind '" + descriptor.getKind() + "'");
    }
}
