package com.mooncell.router.core.registry;

import lombok.Getter;

import java.time.Duration;
import java.time.Instant;

/**
 * 快照新鲜度策略
 * <p>
 * 快照年龄达到 ttl 即为过期。刷新失败后，需再等待 failureBackoff（默认等于 ttl）才允许下一次尝试，
 * 期间继续使用旧快照。
 */
@Getter
public class FreshnessPolicy {

    private final Duration ttl;
    private final Duration failureBackoff;

    public FreshnessPolicy(Duration ttl, Duration failureBackoff) {
        if (ttl == null || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be a non-negative duration");
        }
        if (failureBackoff != null && failureBackoff.isNegative()) {
            throw new IllegalArgumentException("failureBackoff must be a non-negative duration");
        }
        this.ttl = ttl;
        this.failureBackoff = failureBackoff == null ? ttl : failureBackoff;
    }

    public boolean isFresh(RegistrySnapshot snapshot, Instant now) {
        return !snapshot.isInitial() && snapshot.age(now).compareTo(ttl) < 0;
    }

    /**
     * 是否应该发起刷新
     *
     * @param snapshot            当前快照
     * @param lastFailedAttemptAt 最近一次失败刷新的时间，最近一次刷新成功时为 null
     * @param now                 当前时间
     */
    public boolean shouldRefresh(RegistrySnapshot snapshot, Instant lastFailedAttemptAt, Instant now) {
        if (isFresh(snapshot, now)) {
            return false;
        }
        return lastFailedAttemptAt == null
                || Duration.between(lastFailedAttemptAt, now).compareTo(failureBackoff) >= 0;
    }
}
