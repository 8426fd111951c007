package com.mooncell.router.core.registry;

import com.mooncell.router.core.error.ProviderConfigError;
import lombok.Value;

/**
 * 刷新时被跳过的配置条目及原因
 */
@Value
public class SkippedEntry {
    String providerId;
    ProviderConfigError error;
    String reason;
}
