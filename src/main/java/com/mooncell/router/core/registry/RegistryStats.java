package com.mooncell.router.core.registry;

import com.mooncell.router.core.error.ProviderConfigError;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * 刷新统计（只读视图）
 */
@Value
@Builder
public class RegistryStats {
    long successfulRefreshes;
    long failedRefreshes;
    Instant lastAttemptAt;
    Instant lastFailureAt;
    ProviderConfigError lastFailureError;
    String lastFailureMessage;
    boolean refreshInFlight;
}
