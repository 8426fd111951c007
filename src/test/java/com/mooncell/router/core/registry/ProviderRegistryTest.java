package com.mooncell.router.core.registry;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mooncell.router.config.RouterProperties;
import com.mooncell.router.core.client.AnthropicClientBuilder;
import com.mooncell.router.core.client.ClientFactoryBuilder;
import com.mooncell.router.core.client.GoogleClientBuilder;
import com.mooncell.router.core.client.InvocableModel;
import com.mooncell.router.core.client.OpenAiClientBuilder;
import com.mooncell.router.core.error.ModelResolutionException;
import com.mooncell.router.core.error.ProviderConfigError;
import com.mooncell.router.core.error.ResolutionError;
import com.mooncell.router.core.model.ProviderKind;
import com.mooncell.router.core.source.AiGatewayEndpointResolver;
import com.mooncell.router.core.source.EndpointResolver;
import com.mooncell.router.core.source.EnvironmentSecretSource;
import com.mooncell.router.core.source.ProviderDescriptorParser;
import com.mooncell.router.service.ProviderWebClientManager;
import com.mooncell.router.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ProviderRegistryTest {

    private static final Duration TTL = Duration.ofMinutes(5);
    private static final String GOOGLE =
            "{\"provider\":\"google\",\"apiKeySecretName\":\"GOOGLE_KEY\",\"gatewayProviderPath\":\"google-ai-studio\"}";
    private static final String OPENAI =
            "{\"provider\":\"openai\",\"apiKeySecretName\":\"OPENAI_KEY\",\"gatewayProviderPath\":\"openai\"}";

    private InMemoryConfigurationSource configSource;
    private MockEnvironment environment;
    private RouterProperties properties;
    private MutableClock clock;
    private EndpointResolver endpointResolver;

    @BeforeEach
    void setUp() {
        configSource = new InMemoryConfigurationSource();
        environment = new MockEnvironment()
                .withProperty("GOOGLE_KEY", "abc")
                .withProperty("OPENAI_KEY", "sk-1");
        properties = new RouterProperties();
        properties.getRegistry().setTtl(TTL);
        properties.getGateway().setBaseUrl("https://gw.example");
        properties.getGateway().setToken("tok");
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        endpointResolver = new AiGatewayEndpointResolver(properties);
    }

    private ProviderRegistry newRegistry() {
        ProviderWebClientManager webClientManager = mock(ProviderWebClientManager.class);
        when(webClientManager.createWebClient(any())).thenReturn(WebClient.create());
        ClientFactoryBuilder clientFactoryBuilder = new ClientFactoryBuilder(List.of(
                new GoogleClientBuilder(webClientManager, properties),
                new OpenAiClientBuilder(webClientManager, properties),
                new AnthropicClientBuilder(webClientManager, properties)));
        return new ProviderRegistry(
                configSource,
                new EnvironmentSecretSource(environment),
                endpointResolver,
                clientFactoryBuilder,
                new ProviderDescriptorParser(new ObjectMapper()),
                properties,
                clock);
    }

    // ------------------------------------------------------------------ resolution

    @Test
    void shouldResolveGoogleProviderBehindGateway() {
        configSource.put("google-ai-studio", GOOGLE);
        ProviderRegistry registry = newRegistry();

        StepVerifier.create(registry.resolveFresh("google-ai-studio/gemini-2.0-flash"))
                .assertNext(model -> {
                    assertEquals("gemini-2.0-flash", model.getModelName());
                    assertEquals(ProviderKind.GOOGLE, model.getKind());
                    assertEquals("https://gw.example/google-ai-studio/v1beta", model.getBaseUrl());
                    assertEquals("abc", model.getConnection().getHeaders().get("x-goog-api-key"));
                    assertEquals("Bearer tok", model.getConnection().getHeaders().get("cf-aig-authorization"));
                })
                .verifyComplete();
        assertEquals(1, registry.current().size());
    }

    @Test
    void malformedIdentifierShouldFailWithoutTouchingStore() {
        ProviderRegistry registry = newRegistry();

        StepVerifier.create(registry.resolveFresh("gemini-2.0-flash"))
                .expectErrorMatches(e -> e instanceof ModelResolutionException
                        && ((ModelResolutionException) e).getError() == ResolutionError.MALFORMED_IDENTIFIER)
                .verify();
        assertEquals(0, configSource.listCalls());
    }

    @Test
    void unknownProviderShouldFailWithNotFound() {
        configSource.put("google-ai-studio", GOOGLE);
        ProviderRegistry registry = newRegistry();

        StepVerifier.create(registry.resolveFresh("openai/gpt-4o"))
                .expectErrorMatches(e -> e instanceof ModelResolutionException
                        && ((ModelResolutionException) e).getError() == ResolutionError.PROVIDER_NOT_FOUND)
                .verify();
    }

    @Test
    void resolveBeforeAnyRefreshShouldReportNotFound() {
        ProviderRegistry registry = newRegistry();

        ModelResolutionException ex = assertThrows(ModelResolutionException.class,
                () -> registry.resolve("google-ai-studio/gemini-2.0-flash"));
        assertEquals(ResolutionError.PROVIDER_NOT_FOUND, ex.getError());
        assertEquals(0, configSource.listCalls());
    }

    // ------------------------------------------------------------------ freshness

    @Test
    void freshSnapshotShouldNotBeReloaded() {
        configSource.put("google-ai-studio", GOOGLE);
        ProviderRegistry registry = newRegistry();

        registry.ensureFresh().block();
        registry.ensureFresh().block();
        clock.advance(TTL.minusSeconds(1));
        registry.ensureFresh().block();

        assertEquals(1, configSource.listCalls());
        assertTrue(registry.isFresh());
    }

    @Test
    void expiredSnapshotShouldBeReplacedAtomically() {
        configSource.put("google-ai-studio", GOOGLE);
        ProviderRegistry registry = newRegistry();
        registry.ensureFresh().block();
        RegistrySnapshot first = registry.current();

        configSource.put("openai", OPENAI);
        clock.advance(TTL);
        registry.ensureFresh().block();

        RegistrySnapshot second = registry.current();
        assertNotSame(first, second);
        assertEquals(1, first.size());
        assertEquals(2, second.size());
        assertEquals(2, configSource.listCalls());
        assertThrows(UnsupportedOperationException.class, () -> second.getProviders().remove("openai"));
    }

    @Test
    void removedProviderShouldDisappearAfterRefresh() {
        configSource.put("google-ai-studio", GOOGLE).put("openai", OPENAI);
        ProviderRegistry registry = newRegistry();
        registry.ensureFresh().block();

        configSource.remove("openai");
        clock.advance(TTL);

        StepVerifier.create(registry.resolveFresh("openai/gpt-4o"))
                .expectError(ModelResolutionException.class)
                .verify();
    }

    @Test
    void forcedRefreshShouldReloadFreshSnapshot() {
        configSource.put("google-ai-studio", GOOGLE);
        ProviderRegistry registry = newRegistry();
        registry.ensureFresh().block();

        configSource.put("openai", OPENAI);
        RegistrySnapshot refreshed = registry.refresh().block();

        assertEquals(2, refreshed.size());
        assertSame(refreshed, registry.current());
        assertEquals(2, registry.getStats().getSuccessfulRefreshes());
    }

    // ------------------------------------------------------------------ per-entry failures

    @Test
    void invalidEntryShouldBeSkippedWithoutAffectingOthers() {
        configSource.put("google-ai-studio", GOOGLE).put("broken", "{not json").put("openai", OPENAI);
        ProviderRegistry registry = newRegistry();

        registry.ensureFresh().block();

        RegistrySnapshot snapshot = registry.current();
        assertEquals(2, snapshot.size());
        assertEquals(1, snapshot.getSkipped().size());
        assertEquals("broken", snapshot.getSkipped().get(0).getProviderId());
        assertEquals(ProviderConfigError.CONFIG_ENTRY_INVALID, snapshot.getSkipped().get(0).getError());
        assertEquals("gemini-2.0-flash", registry.resolve("google-ai-studio/gemini-2.0-flash").getModelName());
        assertEquals(ProviderKind.OPENAI, registry.resolve("openai/gpt-4o").getKind());
    }

    @Test
    void eachEntryFailureShouldBeRecordedByKind() {
        configSource.put("google-ai-studio", GOOGLE)
                .put("no-secret", "{\"provider\":\"google\",\"apiKeySecretName\":\"MISSING\",\"gatewayProviderPath\":\"g\"}")
                .put("mistral", "{\"provider\":\"mistral\",\"apiKeySecretName\":\"GOOGLE_KEY\",\"gatewayProviderPath\":\"m\"}")
                .put("bad-route", "{\"provider\":\"openai\",\"apiKeySecretName\":\"OPENAI_KEY\",\"gatewayProviderPath\":\"explode\"}");
        configSource.listAlso("ghost");
        EndpointResolver delegate = endpointResolver;
        endpointResolver = routingPath -> "explode".equals(routingPath)
                ? Mono.error(new IllegalStateException("gateway lookup failed"))
                : delegate.resolve(routingPath);
        ProviderRegistry registry = newRegistry();

        registry.ensureFresh().block();

        RegistrySnapshot snapshot = registry.current();
        assertEquals(1, snapshot.size());
        Map<String, ProviderConfigError> skipped = new HashMap<>();
        snapshot.getSkipped().forEach(entry -> skipped.put(entry.getProviderId(), entry.getError()));
        assertEquals(ProviderConfigError.SECRET_MISSING, skipped.get("no-secret"));
        assertEquals(ProviderConfigError.UNSUPPORTED_PROVIDER_KIND, skipped.get("mistral"));
        assertEquals(ProviderConfigError.ENDPOINT_RESOLUTION_FAILED, skipped.get("bad-route"));
        assertEquals(ProviderConfigError.CONFIG_ENTRY_INVALID, skipped.get("ghost"));
    }

    @Test
    void skippedReasonsShouldNotContainSecrets() {
        configSource.put("no-gateway", GOOGLE);
        properties.getGateway().setToken("");
        ProviderRegistry registry = newRegistry();

        registry.ensureFresh().block();

        SkippedEntry skipped = registry.current().getSkipped().get(0);
        assertEquals(ProviderConfigError.ENDPOINT_RESOLUTION_FAILED, skipped.getError());
        assertFalse(skipped.getReason().contains("abc"));
    }

    @Test
    void duplicateKeysShouldBeLoadedOnce() {
        configSource.put("google-ai-studio", GOOGLE);
        configSource.listAlso("google-ai-studio");
        ProviderRegistry registry = newRegistry();

        registry.ensureFresh().block();

        assertEquals(1, registry.current().size());
        assertTrue(registry.current().getSkipped().isEmpty());
        assertEquals(1, configSource.getCalls("google-ai-studio"));
    }

    // ------------------------------------------------------------------ whole-refresh failures

    @Test
    void unreachableStoreShouldKeepStaleSnapshot() {
        configSource.put("google-ai-studio", GOOGLE);
        ProviderRegistry registry = newRegistry();
        registry.ensureFresh().block();
        RegistrySnapshot stale = registry.current();

        clock.advance(TTL);
        configSource.setUnreachable(true);

        StepVerifier.create(registry.resolveFresh("google-ai-studio/gemini-2.0-flash"))
                .assertNext(model -> assertEquals("google-ai-studio", model.getProviderId()))
                .verifyComplete();
        assertSame(stale, registry.current());
        RegistryStats stats = registry.getStats();
        assertEquals(1, stats.getFailedRefreshes());
        assertEquals(ProviderConfigError.CONFIG_SOURCE_UNREACHABLE, stats.getLastFailureError());
        assertFalse(stats.isRefreshInFlight());
    }

    @Test
    void failedRefreshShouldBackOffForOneTtl() {
        configSource.put("google-ai-studio", GOOGLE);
        ProviderRegistry registry = newRegistry();
        registry.ensureFresh().block();
        clock.advance(TTL);
        configSource.setUnreachable(true);

        registry.ensureFresh().block();
        registry.ensureFresh().block();
        clock.advance(TTL.minusSeconds(1));
        registry.ensureFresh().block();
        assertEquals(2, configSource.listCalls());

        configSource.setUnreachable(false);
        clock.advance(Duration.ofSeconds(1));
        registry.ensureFresh().block();

        assertEquals(3, configSource.listCalls());
        assertTrue(registry.isFresh());
        assertEquals(2, registry.getStats().getSuccessfulRefreshes());
    }

    @Test
    void listingThatThrowsShouldFailRefreshAndReleaseSlot() {
        configSource.put("google-ai-studio", GOOGLE);
        configSource.throwOnNextList();
        ProviderRegistry registry = newRegistry();

        StepVerifier.create(registry.ensureFresh())
                .verifyComplete();

        RegistryStats stats = registry.getStats();
        assertEquals(1, stats.getFailedRefreshes());
        assertEquals(ProviderConfigError.CONFIG_SOURCE_UNREACHABLE, stats.getLastFailureError());
        assertFalse(stats.isRefreshInFlight());
        assertTrue(registry.current().isInitial());

        StepVerifier.create(registry.resolveFresh("google-ai-studio/gemini-2.0-flash"))
                .expectErrorMatches(e -> e instanceof ModelResolutionException
                        && ((ModelResolutionException) e).getError() == ResolutionError.PROVIDER_NOT_FOUND)
                .verify(Duration.ofSeconds(5));

        clock.advance(TTL);
        registry.ensureFresh().block(Duration.ofSeconds(5));

        assertEquals(1, registry.current().size());
        assertEquals(2, configSource.listCalls());
    }

    @Test
    void whitespaceProviderOrModelShouldReachLookup() {
        configSource.put("google-ai-studio", GOOGLE);
        ProviderRegistry registry = newRegistry();
        registry.ensureFresh().block();

        ModelResolutionException blankProvider =
                assertThrows(ModelResolutionException.class, () -> registry.resolve(" /gemini-2.0-flash"));
        assertEquals(ResolutionError.PROVIDER_NOT_FOUND, blankProvider.getError());
        ModelResolutionException unknown =
                assertThrows(ModelResolutionException.class, () -> registry.resolve("unknown/ "));
        assertEquals(ResolutionError.PROVIDER_NOT_FOUND, unknown.getError());
        assertEquals(" ", registry.resolve("google-ai-studio/ ").getModelName());
    }

    @Test
    void readFailureShouldAbortWholeRefresh() {
        configSource.put("google-ai-studio", GOOGLE).put("openai", OPENAI);
        configSource.failOnGet("openai");
        ProviderRegistry registry = newRegistry();

        registry.ensureFresh().block();

        assertTrue(registry.current().isInitial());
        assertEquals(ProviderConfigError.CONFIG_SOURCE_UNREACHABLE, registry.getStats().getLastFailureError());
    }

    @Test
    void refreshTimeoutShouldCountAsUnreachable() {
        properties.getRegistry().setRefreshTimeout(Duration.ofMillis(50));
        configSource.put("google-ai-studio", GOOGLE);
        configSource.hold();
        ProviderRegistry registry = newRegistry();

        registry.ensureFresh().block(Duration.ofSeconds(5));

        assertTrue(registry.current().isInitial());
        RegistryStats stats = registry.getStats();
        assertEquals(ProviderConfigError.CONFIG_SOURCE_UNREACHABLE, stats.getLastFailureError());
        assertTrue(stats.getLastFailureMessage().contains("timed out"));
    }

    @Test
    void coldStartFailureShouldLeaveEmptyRegistry() {
        configSource.setUnreachable(true);
        ProviderRegistry registry = newRegistry();

        StepVerifier.create(registry.resolveFresh("google-ai-studio/gemini-2.0-flash"))
                .expectErrorMatches(e -> e instanceof ModelResolutionException
                        && ((ModelResolutionException) e).getError() == ResolutionError.PROVIDER_NOT_FOUND)
                .verify();
        assertTrue(registry.current().isInitial());
        assertFalse(registry.isFresh());
    }

    // ------------------------------------------------------------------ single flight

    @Test
    void concurrentCallersShouldShareOneRefreshAndUseStaleSnapshot() throws Exception {
        configSource.put("google-ai-studio", GOOGLE);
        ProviderRegistry registry = newRegistry();
        registry.ensureFresh().block();
        RegistrySnapshot stale = registry.current();

        clock.advance(TTL);
        configSource.put("openai", OPENAI);
        configSource.hold();

        CompletableFuture<Void> trigger = registry.ensureFresh().toFuture();
        assertTrue(registry.getStats().isRefreshInFlight());

        InvocableModel during = registry.resolveFresh("google-ai-studio/gemini-2.0-flash").block(Duration.ofSeconds(1));
        registry.ensureFresh().block(Duration.ofSeconds(1));
        assertEquals("google-ai-studio", during.getProviderId());
        assertSame(stale, registry.current());
        assertFalse(trigger.isDone());
        assertEquals(2, configSource.listCalls());

        configSource.release();
        trigger.get(5, TimeUnit.SECONDS);

        assertEquals(2, configSource.listCalls());
        assertEquals(2, registry.current().size());
        assertFalse(registry.getStats().isRefreshInFlight());
    }

    @Test
    void coldStartCallersShouldWaitForInflightRefresh() throws Exception {
        configSource.put("google-ai-studio", GOOGLE);
        configSource.hold();
        ProviderRegistry registry = newRegistry();

        CompletableFuture<Void> first = registry.ensureFresh().toFuture();
        CompletableFuture<InvocableModel> second =
                registry.resolveFresh("google-ai-studio/gemini-2.0-flash").toFuture();
        assertFalse(first.isDone());
        assertFalse(second.isDone());

        configSource.release();

        first.get(5, TimeUnit.SECONDS);
        assertEquals("gemini-2.0-flash", second.get(5, TimeUnit.SECONDS).getModelName());
        assertEquals(1, configSource.listCalls());
    }

    @Test
    void forcedRefreshShouldJoinInflightRefresh() throws Exception {
        configSource.put("google-ai-studio", GOOGLE);
        configSource.hold();
        ProviderRegistry registry = newRegistry();

        CompletableFuture<Void> lazy = registry.ensureFresh().toFuture();
        CompletableFuture<RegistrySnapshot> forced = registry.refresh().toFuture();
        configSource.release();

        lazy.get(5, TimeUnit.SECONDS);
        assertSame(registry.current(), forced.get(5, TimeUnit.SECONDS));
        assertEquals(1, configSource.listCalls());
    }

    @Test
    void statsShouldTrackAttempts() {
        configSource.put("google-ai-studio", GOOGLE);
        ProviderRegistry registry = newRegistry();
        assertNull(registry.getStats().getLastAttemptAt());

        registry.ensureFresh().block();

        RegistryStats stats = registry.getStats();
        assertEquals(clock.instant(), stats.getLastAttemptAt());
        assertEquals(1, stats.getSuccessfulRefreshes());
        assertEquals(0, stats.getFailedRefreshes());
        assertNull(stats.getLastFailureError());
    }
}
