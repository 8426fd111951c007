package com.mooncell.router.core.auth;

import reactor.core.publisher.Mono;

/**
 * API Key 校验
 * <p>
 * 只判断 key 是否存在于允许列表中，不涉及权限范围。
 * 实现必须在存储不可用时返回 false（fail closed），并且不得记录 key 本身。
 */
public interface ApiKeyAuthorizer {

    Mono<Boolean> isAuthorized(String apiKey);
}
