package com.mooncell.router.core.auth;

import com.mooncell.router.config.RouterProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * 基于 Redis set 的 API Key 校验
 * <p>
 * 允许的 key 保存在 {@code mooncell.router.auth.keys-set-key} 指向的 set 中。
 * Redis 异常时拒绝访问，日志中只记录 set 名称。
 */
@Slf4j
@Component
public class RedisApiKeyAuthorizer implements ApiKeyAuthorizer {

    private final StringRedisTemplate stringRedisTemplate;
    private final String keysSetKey;

    public RedisApiKeyAuthorizer(StringRedisTemplate stringRedisTemplate, RouterProperties properties) {
        this.stringRedisTemplate = stringRedisTemplate;
        this.keysSetKey = properties.getAuth().getKeysSetKey();
    }

    @Override
    public Mono<Boolean> isAuthorized(String apiKey) {
        if (apiKey == null || apiKey.isBlank()) {
            return Mono.just(false);
        }
        return Mono.fromCallable(() -> Boolean.TRUE.equals(stringRedisTemplate.opsForSet().isMember(keysSetKey, apiKey)))
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorResume(e -> {
                    log.warn("API key lookup in {} failed, rejecting request: {}", keysSetKey, e.toString());
                    return Mono.just(false);
                });
    }
}
