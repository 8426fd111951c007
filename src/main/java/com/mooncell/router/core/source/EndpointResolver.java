package com.mooncell.router.core.source;

import com.mooncell.router.core.model.ResolvedEndpoint;
import reactor.core.publisher.Mono;

/**
 * 将服务商的路由路径解析为出站基础地址和网关令牌
 */
public interface EndpointResolver {

    Mono<ResolvedEndpoint> resolve(String routingPath);
}
