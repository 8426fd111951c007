package com.mooncell.router.core.error;

/**
 * 请求时模型解析失败的类型，均作为客户端错误返回
 */
public enum ResolutionError {
    /** 组合标识格式错误 */
    MALFORMED_IDENTIFIER,
    /** 当前快照中不存在该服务商 */
    PROVIDER_NOT_FOUND
}
