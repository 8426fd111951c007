package com.mooncell.router.service;

import com.mooncell.router.config.RouterProperties;
import com.mooncell.router.core.registry.ProviderRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * 启动预热：应用就绪后异步刷新一次注册表，避免第一个请求承担冷启动
 * <p>
 * 预热失败不影响启动，之后的请求会按退避策略重试。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RegistryWarmup {

    private final ProviderRegistry providerRegistry;
    private final RouterProperties properties;

    @EventListener(ApplicationReadyEvent.class)
    public void warmUp() {
        if (!properties.getRegistry().isWarmUp()) {
            log.info("Registry warm-up disabled, first request will load providers");
            return;
        }
        providerRegistry.refresh().subscribe(
                snapshot -> log.info("Registry warm-up finished with {} provider(s)", snapshot.size()),
                error -> log.error("Registry warm-up failed", error));
    }
}
