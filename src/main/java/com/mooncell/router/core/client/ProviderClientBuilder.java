package com.mooncell.router.core.client;

import com.mooncell.router.core.model.ProviderDescriptor;
import com.mooncell.router.core.model.ProviderKind;
import com.mooncell.router.core.model.ResolvedEndpoint;

/**
 * 单个后端类型的客户端工厂构建器
 */
public interface ProviderClientBuilder {

    /**
     * 该构建器负责的后端类型
     */
    ProviderKind kind();

    /**
     * 构建客户端工厂。只组装连接信息，不发起网络请求。
     *
     * @param descriptor 已校验的服务商描述
     * @param secret     已解析的服务商 API Key
     * @param endpoint   已解析的网关地址与令牌
     * @return 该服务商独占的客户端工厂
     */
    ClientFactory build(ProviderDescriptor descriptor, String secret, ResolvedEndpoint endpoint);
}
