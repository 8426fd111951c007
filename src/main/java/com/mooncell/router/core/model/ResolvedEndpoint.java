package com.mooncell.router.core.model;

import lombok.ToString;
import lombok.Value;

/**
 * 路由路径解析结果：出站基础地址 + 网关鉴权令牌。
 * 每次刷新重新计算（令牌可能轮换），不持久化。
 */
@Value
public class ResolvedEndpoint {
    String baseUrl;
    @ToString.Exclude
    String authToken;
}
