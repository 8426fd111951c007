package com.mooncell.router.core.registry;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FreshnessPolicyTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");
    private static final Duration TTL = Duration.ofMinutes(5);

    private final FreshnessPolicy policy = new FreshnessPolicy(TTL, null);
    private final RegistrySnapshot built = RegistrySnapshot.of(Map.of(), List.of(), T0);

    @Test
    void initialSnapshotIsNeverFresh() {
        assertFalse(policy.isFresh(RegistrySnapshot.initial(), T0));
        assertTrue(policy.shouldRefresh(RegistrySnapshot.initial(), null, T0));
    }

    @Test
    void snapshotExpiresExactlyAtTtl() {
        assertTrue(policy.isFresh(built, T0.plus(TTL).minusMillis(1)));
        assertFalse(policy.isFresh(built, T0.plus(TTL)));
        assertTrue(policy.shouldRefresh(built, null, T0.plus(TTL)));
    }

    @Test
    void failedAttemptDefersRetryForOneTtl() {
        Instant failedAt = T0.plus(TTL);

        assertEquals(TTL, policy.getFailureBackoff());
        assertFalse(policy.shouldRefresh(built, failedAt, failedAt.plusSeconds(1)));
        assertTrue(policy.shouldRefresh(built, failedAt, failedAt.plus(TTL)));
    }

    @Test
    void explicitBackoffOverridesTtl() {
        FreshnessPolicy shortBackoff = new FreshnessPolicy(TTL, Duration.ofSeconds(30));

        assertTrue(shortBackoff.shouldRefresh(RegistrySnapshot.initial(), T0, T0.plusSeconds(30)));
        assertFalse(shortBackoff.shouldRefresh(RegistrySnapshot.initial(), T0, T0.plusSeconds(29)));
    }

    @Test
    void zeroTtlAlwaysRefreshes() {
        FreshnessPolicy always = new FreshnessPolicy(Duration.ZERO, null);

        assertFalse(always.isFresh(built, T0));
        assertTrue(always.shouldRefresh(built, null, T0));
    }

    @Test
    void shouldRejectNegativeDurations() {
        assertThrows(IllegalArgumentException.class, () -> new FreshnessPolicy(Duration.ofSeconds(-1), null));
        assertThrows(IllegalArgumentException.class, () -> new FreshnessPolicy(TTL, Duration.ofSeconds(-1)));
    }
}
