package com.mooncell.router.core.client;

import com.mooncell.router.core.model.ProviderKind;
import lombok.Builder;
import lombok.Singular;
import lombok.ToString;
import lombok.Value;

import java.util.Map;

/**
 * 已鉴权的服务商连接信息，由构建器在刷新时生成，同一服务商的所有模型句柄共享。
 * 凭据和请求头不参与 toString，避免进入日志。
 */
@Value
@Builder
public class ProviderConnection {
    String providerId;
    ProviderKind kind;
    /** 该后端类型的实际调用基础地址（已包含版本前缀等） */
    String baseUrl;
    @ToString.Exclude
    String credential;
    @ToString.Exclude
    String gatewayToken;
    /** 出站默认请求头，包含凭据头和网关令牌头 */
    @Singular
    @ToString.Exclude
    Map<String, String> headers;
}
