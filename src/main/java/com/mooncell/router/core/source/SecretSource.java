package com.mooncell.router.core.source;

import reactor.core.publisher.Mono;

/**
 * 进程级密钥来源，只读
 */
public interface SecretSource {

    /**
     * 按名称读取密钥，不存在时返回空 Mono
     */
    Mono<String> get(String name);
}
