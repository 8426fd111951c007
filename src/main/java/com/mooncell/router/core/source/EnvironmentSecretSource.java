package com.mooncell.router.core.source;

import lombok.RequiredArgsConstructor;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * 从 Spring Environment 读取密钥（环境变量、系统属性、配置文件）
 * <p>
 * 空白值视为不存在。
 */
@Component
@RequiredArgsConstructor
public class EnvironmentSecretSource implements SecretSource {

    private final Environment environment;

    @Override
    public Mono<String> get(String name) {
        if (name == null || name.isBlank()) {
            return Mono.empty();
        }
        return Mono.fromCallable(() -> environment.getProperty(name))
                .filter(value -> !value.isBlank());
    }
}
