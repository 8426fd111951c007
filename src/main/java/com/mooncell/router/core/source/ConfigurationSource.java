package com.mooncell.router.core.source;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * 服务商配置存储（最终一致的 KV 存储）
 * <p>
 * 每个服务商一条记录，key 为 providerId，value 为序列化的描述 JSON。
 * 存储不可达时应以 {@link com.mooncell.router.core.error.ProviderConfigError#CONFIG_SOURCE_UNREACHABLE}
 * 结束，调用方据此中止整次刷新。
 */
public interface ConfigurationSource {

    /**
     * 列出全部 key
     */
    Flux<String> listKeys();

    /**
     * 读取单个 key 的值，不存在时返回空 Mono
     */
    Mono<String> get(String key);
}
