package com.mooncell.router.core.model;

import lombok.Builder;
import lombok.Value;

/**
 * 配置存储中单个服务商的原始配置
 * <p>
 * providerId 即配置键，同时是客户端模型标识中的命名空间前缀。
 * kind 保留原始字符串，是否支持由 ClientFactoryBuilder 判定。
 */
@Value
@Builder
public class ProviderDescriptor {
    String providerId;
    /** 对应 JSON 字段 provider */
    String kind;
    /** 对应 JSON 字段 apiKeySecretName */
    String secretName;
    /** 对应 JSON 字段 gatewayProviderPath */
    String routingPath;
}
