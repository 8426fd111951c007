package com.mooncell.router.core.error;

/**
 * 刷新阶段的错误类型
 * <p>
 * 除 CONFIG_SOURCE_UNREACHABLE 外都只影响单个条目：记录日志后跳过，刷新继续。
 * CONFIG_SOURCE_UNREACHABLE 中止整次刷新，保留旧快照。
 */
public enum ProviderConfigError {
    CONFIG_ENTRY_INVALID,
    SECRET_MISSING,
    ENDPOINT_RESOLUTION_FAILED,
    UNSUPPORTED_PROVIDER_KIND,
    CONFIG_SOURCE_UNREACHABLE;

    public boolean isEntryScoped() {
        return this != CONFIG_SOURCE_UNREACHABLE;
    }
}
