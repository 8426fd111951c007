package com.mooncell.router.core.source;

import com.mooncell.router.config.RouterProperties;
import com.mooncell.router.core.error.ProviderConfigError;
import com.mooncell.router.core.error.ProviderConfigException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * 基于 Redis hash 的配置存储
 * <p>
 * 所有服务商配置保存在同一个 hash 中（field = providerId），
 * 因此单次列举不会出现重复 key。Redis 调用是阻塞的，统一切换到 boundedElastic 线程执行。
 */
@Slf4j
@Component
public class RedisConfigurationSource implements ConfigurationSource {

    private final StringRedisTemplate stringRedisTemplate;
    private final String hashKey;

    public RedisConfigurationSource(StringRedisTemplate stringRedisTemplate, RouterProperties properties) {
        this.stringRedisTemplate = stringRedisTemplate;
        this.hashKey = properties.getConfigStore().getHashKey();
    }

    @Override
    public Flux<String> listKeys() {
        return Mono.fromCallable(() -> hashOps().keys(hashKey))
                .subscribeOn(Schedulers.boundedElastic())
                .doOnNext(keys -> log.debug("Listed {} provider config key(s) from {}", keys.size(), hashKey))
                .flatMapIterable(keys -> keys)
                .onErrorMap(e -> !(e instanceof ProviderConfigException),
                        e -> unreachable("Failed to list provider config keys from " + hashKey, e));
    }

    @Override
    public Mono<String> get(String key) {
        return Mono.fromCallable(() -> hashOps().get(hashKey, key))
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorMap(e -> !(e instanceof ProviderConfigException),
                        e -> unreachable("Failed to read provider config '" + key + "' from " + hashKey, e));
    }

    private HashOperations<String, String, String> hashOps() {
        return stringRedisTemplate.opsForHash();
    }

    private ProviderConfigException unreachable(String message, Throwable cause) {
        return new ProviderConfigException(ProviderConfigError.CONFIG_SOURCE_UNREACHABLE, message, cause);
    }
}
