package com.mooncell.router.core.registry;

import com.mooncell.router.config.RouterProperties;
import com.mooncell.router.core.client.ClientFactory;
import com.mooncell.router.core.client.ClientFactoryBuilder;
import com.mooncell.router.core.client.InvocableModel;
import com.mooncell.router.core.error.ModelResolutionException;
import com.mooncell.router.core.error.ProviderConfigError;
import com.mooncell.router.core.error.ProviderConfigException;
import com.mooncell.router.core.error.ResolutionError;
import com.mooncell.router.core.model.ModelIdentifier;
import com.mooncell.router.core.model.ProviderDescriptor;
import com.mooncell.router.core.model.ProviderKind;
import com.mooncell.router.core.model.ResolvedEndpoint;
import com.mooncell.router.core.source.ConfigurationSource;
import com.mooncell.router.core.source.EndpointResolver;
import com.mooncell.router.core.source.ProviderDescriptorParser;
import com.mooncell.router.core.source.SecretSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 服务商注册表
 *
 * <p>维护 providerId -> ClientFactory 的不可变快照，并在请求时把 {@code <provider>/<model>}
 * 解析为可调用的模型句柄。
 *
 * <p>刷新流程：
 * <ol>
 *   <li>从配置存储列出全部 key（重复 key 去重）</li>
 *   <li>逐个读取并解析描述，解析失败的条目跳过</li>
 *   <li>解析密钥与网关地址，缺失或失败的条目跳过</li>
 *   <li>按 kind 构建客户端工厂，不支持的 kind 跳过</li>
 *   <li>组装新快照并原子替换</li>
 * </ol>
 * 配置存储不可达或刷新超时时整次刷新放弃，继续使用旧快照。
 *
 * <p>并发约定：
 * <ul>
 *   <li>当前快照只通过 {@link AtomicReference} 整体替换，读者不会看到半成品</li>
 *   <li>同一时刻最多一次刷新（single flight），刷新期间到达的请求直接使用旧快照，不等待</li>
 *   <li>从未刷新成功过时没有旧快照可用，此时并发请求会等待进行中的刷新</li>
 *   <li>刷新与触发它的请求解耦，请求取消不会中断刷新</li>
 * </ul>
 */
@Slf4j
@Component
public class ProviderRegistry {

    private final ConfigurationSource configurationSource;
    private final SecretSource secretSource;
    private final EndpointResolver endpointResolver;
    private final ClientFactoryBuilder clientFactoryBuilder;
    private final ProviderDescriptorParser descriptorParser;
    private final FreshnessPolicy freshnessPolicy;
    private final Duration refreshTimeout;
    private final Clock clock;

    private final AtomicReference<RegistrySnapshot> current = new AtomicReference<>(RegistrySnapshot.initial());
    /** 进行中的刷新，没有刷新时为 null */
    private final AtomicReference<Mono<RegistrySnapshot>> inflight = new AtomicReference<>();

    private final AtomicLong successfulRefreshes = new AtomicLong(0);
    private final AtomicLong failedRefreshes = new AtomicLong(0);
    private volatile Instant lastAttemptAt;
    /** 最近一次刷新失败的时间，刷新成功后清空，用于失败退避 */
    private volatile Instant lastFailedAttemptAt;
    private volatile Instant lastFailureAt;
    private volatile ProviderConfigError lastFailureError;
    private volatile String lastFailureMessage;

    public ProviderRegistry(ConfigurationSource configurationSource,
                            SecretSource secretSource,
                            EndpointResolver endpointResolver,
                            ClientFactoryBuilder clientFactoryBuilder,
                            ProviderDescriptorParser descriptorParser,
                            RouterProperties properties,
                            Clock clock) {
        this.configurationSource = configurationSource;
        this.secretSource = secretSource;
        this.endpointResolver = endpointResolver;
        this.clientFactoryBuilder = clientFactoryBuilder;
        this.descriptorParser = descriptorParser;
        RouterProperties.Registry registry = properties.getRegistry();
        this.freshnessPolicy = new FreshnessPolicy(registry.getTtl(), registry.getFailureBackoff());
        this.refreshTimeout = registry.getRefreshTimeout();
        this.clock = clock;
        log.info("Provider registry initialized, ttl={}, failureBackoff={}, refreshTimeout={}",
                freshnessPolicy.getTtl(), freshnessPolicy.getFailureBackoff(), refreshTimeout);
    }

    // ------------------------------------------------------------------ resolution

    /**
     * 基于当前快照解析模型标识，不触发刷新，不挂起
     *
     * @param compositeId {@code <provider>/<model>}
     * @return 模型句柄
     * @throws ModelResolutionException MALFORMED_IDENTIFIER / PROVIDER_NOT_FOUND
     */
    public InvocableModel resolve(String compositeId) {
        return resolve(ModelIdentifier.parse(compositeId));
    }

    public InvocableModel resolve(ModelIdentifier identifier) {
        ProviderEntry entry = current.get().find(identifier.getProviderId())
                .orElseThrow(() -> new ModelResolutionException(ResolutionError.PROVIDER_NOT_FOUND,
                        "provider '" + identifier.getProviderId() + "' is not configured"));
        return entry.getClientFactory().create(identifier.getModelName());
    }

    /**
     * 请求入口：先做新鲜度检查（可能触发刷新），再解析
     * <p>
     * 格式错误的标识直接失败，不会触发刷新。
     */
    public Mono<InvocableModel> resolveFresh(String compositeId) {
        return Mono.fromCallable(() -> ModelIdentifier.parse(compositeId))
                .flatMap(identifier -> ensureFresh().then(Mono.fromCallable(() -> resolve(identifier))));
    }

    // ------------------------------------------------------------------ freshness

    /**
     * 快照过期时触发刷新，否则什么也不做
     * <p>
     * 触发刷新的调用方等待刷新完成；刷新进行中再调用时直接返回（使用旧快照）。
     */
    public Mono<Void> ensureFresh() {
        return Mono.defer(() -> {
            RegistrySnapshot snapshot = current.get();
            if (!freshnessPolicy.shouldRefresh(snapshot, lastFailedAttemptAt, clock.instant())) {
                return Mono.empty();
            }
            Mono<RegistrySnapshot> running = inflight.get();
            if (running == null) {
                Mono<RegistrySnapshot> started = tryStartRefresh();
                if (started != null) {
                    return started.then();
                }
                running = inflight.get();
            }
            if (running == null || !snapshot.isInitial()) {
                return Mono.empty();
            }
            return running.then();
        });
    }

    /**
     * 强制刷新；已有刷新在进行时复用该刷新的结果
     *
     * @return 刷新结束后的当前快照（刷新失败时为旧快照）
     */
    public Mono<RegistrySnapshot> refresh() {
        return Mono.defer(() -> {
            Mono<RegistrySnapshot> started = tryStartRefresh();
            if (started != null) {
                return started;
            }
            Mono<RegistrySnapshot> running = inflight.get();
            return running != null ? running : Mono.fromSupplier(current::get);
        });
    }

    /**
     * 抢占刷新权并启动刷新
     *
     * @return 刷新结果，抢占失败（已有刷新在进行）时返回 null
     */
    private Mono<RegistrySnapshot> tryStartRefresh() {
        Sinks.One<RegistrySnapshot> sink = Sinks.one();
        Mono<RegistrySnapshot> shared = sink.asMono();
        if (!inflight.compareAndSet(null, shared)) {
            return null;
        }
        lastAttemptAt = clock.instant();
        RegistrySnapshot previous = current.get();
        log.info("Refreshing provider registry (current: {} provider(s), built at {})",
                previous.size(), previous.isInitial() ? "never" : previous.getBuiltAt());
        // 同步抛出的异常也要进入失败分支，否则 inflight 永远不会被清理
        Mono.defer(this::loadSnapshot)
                .timeout(refreshTimeout)
                .doOnNext(this::publish)
                .onErrorResume(this::onRefreshFailure)
                .doFinally(signal -> inflight.compareAndSet(shared, null))
                .subscribe(sink::tryEmitValue, sink::tryEmitError);
        return shared;
    }

    // ------------------------------------------------------------------ refresh pipeline

    private Mono<RegistrySnapshot> loadSnapshot() {
        return Flux.defer(configurationSource::listKeys)
                .collectList()
                .flatMapMany(keys -> Flux.fromIterable(distinctKeys(keys)))
                .concatMap(this::loadEntry)
                .collectList()
                .map(this::assemble);
    }

    /**
     * 去重并保持列举顺序。存储对同一个 key 只保存一个值，去重后读取结果是确定的。
     */
    private Set<String> distinctKeys(List<String> keys) {
        Set<String> distinct = new LinkedHashSet<>(keys);
        if (distinct.size() != keys.size()) {
            log.warn("Configuration source listed {} duplicate key(s); each provider id is loaded once",
                    keys.size() - distinct.size());
        }
        return distinct;
    }

    private Mono<EntryOutcome> loadEntry(String key) {
        return Mono.defer(() -> configurationSource.get(key))
                .onErrorMap(e -> !(e instanceof ProviderConfigException),
                        e -> new ProviderConfigException(ProviderConfigError.CONFIG_SOURCE_UNREACHABLE,
                                "failed to read provider config '" + key + "'", e))
                .flatMap(raw -> buildEntry(key, raw))
                .switchIfEmpty(Mono.fromSupplier(() -> skip(key, new ProviderConfigException(
                        ProviderConfigError.CONFIG_ENTRY_INVALID, "no value stored for key"))))
                .onErrorResume(ProviderRegistry::isEntryScoped,
                        e -> Mono.just(skip(key, (ProviderConfigException) e)));
    }

    private Mono<EntryOutcome> buildEntry(String key, String raw) {
        return Mono.fromCallable(() -> descriptorParser.parse(key, raw))
                .flatMap(descriptor -> resolveSecret(descriptor)
                        .flatMap(secret -> resolveEndpoint(descriptor)
                                .map(endpoint -> EntryOutcome.built(buildProvider(descriptor, secret, endpoint)))))
                .onErrorMap(e -> !(e instanceof ProviderConfigException),
                        e -> new ProviderConfigException(ProviderConfigError.CONFIG_ENTRY_INVALID,
                                "failed to build provider: " + e.getMessage(), e));
    }

    private Mono<String> resolveSecret(ProviderDescriptor descriptor) {
        String secretName = descriptor.getSecretName();
        return Mono.defer(() -> secretSource.get(secretName))
                .onErrorMap(e -> !(e instanceof ProviderConfigException),
                        e -> new ProviderConfigException(ProviderConfigError.SECRET_MISSING,
                                "secret lookup failed for '" + secretName + "'", e))
                .switchIfEmpty(Mono.error(() -> new ProviderConfigException(ProviderConfigError.SECRET_MISSING,
                        "secret '" + secretName + "' is not defined")));
    }

    private Mono<ResolvedEndpoint> resolveEndpoint(ProviderDescriptor descriptor) {
        String routingPath = descriptor.getRoutingPath();
        return Mono.defer(() -> endpointResolver.resolve(routingPath))
                .onErrorMap(e -> !(e instanceof ProviderConfigException),
                        e -> new ProviderConfigException(ProviderConfigError.ENDPOINT_RESOLUTION_FAILED,
                                "endpoint resolution failed for '" + routingPath + "': " + e.getMessage(), e))
                .switchIfEmpty(Mono.error(() -> new ProviderConfigException(
                        ProviderConfigError.ENDPOINT_RESOLUTION_FAILED,
                        "no endpoint resolved for '" + routingPath + "'")));
    }

    private ProviderEntry buildProvider(ProviderDescriptor descriptor, String secret, ResolvedEndpoint endpoint) {
        ProviderKind kind = clientFactoryBuilder.resolveKind(descriptor);
        ClientFactory factory = clientFactoryBuilder.build(descriptor, secret, endpoint);
        return new ProviderEntry(descriptor, kind, endpoint.getBaseUrl(), factory);
    }

    private RegistrySnapshot assemble(List<EntryOutcome> outcomes) {
        Map<String, ProviderEntry> providers = new LinkedHashMap<>();
        List<SkippedEntry> skipped = new ArrayList<>();
        for (EntryOutcome outcome : outcomes) {
            if (outcome.entry != null) {
                providers.put(outcome.entry.getProviderId(), outcome.entry);
            } else {
                skipped.add(outcome.skipped);
            }
        }
        return RegistrySnapshot.of(providers, skipped, clock.instant());
    }

    private void publish(RegistrySnapshot snapshot) {
        current.set(snapshot);
        lastFailedAttemptAt = null;
        successfulRefreshes.incrementAndGet();
        if (snapshot.getSkipped().isEmpty()) {
            log.info("Provider registry refreshed: {} provider(s) {}",
                    snapshot.size(), snapshot.getProviders().keySet());
        } else {
            log.warn("Provider registry refreshed: {} provider(s) {}, {} entry(ies) skipped",
                    snapshot.size(), snapshot.getProviders().keySet(), snapshot.getSkipped().size());
        }
    }

    private Mono<RegistrySnapshot> onRefreshFailure(Throwable e) {
        ProviderConfigError error = ProviderConfigError.CONFIG_SOURCE_UNREACHABLE;
        String message;
        if (e instanceof TimeoutException) {
            message = "refresh timed out after " + refreshTimeout;
        } else if (e instanceof ProviderConfigException) {
            error = ((ProviderConfigException) e).getError();
            message = e.getMessage();
        } else {
            message = e.toString();
        }
        Instant now = clock.instant();
        lastFailedAttemptAt = now;
        lastFailureAt = now;
        lastFailureError = error;
        lastFailureMessage = message;
        failedRefreshes.incrementAndGet();

        RegistrySnapshot retained = current.get();
        log.error("Provider registry refresh failed ({}: {}), keeping snapshot with {} provider(s) built at {}",
                error, message, retained.size(), retained.isInitial() ? "never" : retained.getBuiltAt(), e);
        return Mono.just(retained);
    }

    private static boolean isEntryScoped(Throwable e) {
        return e instanceof ProviderConfigException && ((ProviderConfigException) e).getError().isEntryScoped();
    }

    private static EntryOutcome skip(String key, ProviderConfigException e) {
        log.warn("Skipping provider '{}': {} - {}", key, e.getError(), e.getMessage());
        return EntryOutcome.skipped(new SkippedEntry(key, e.getError(), e.getMessage()));
    }

    // ------------------------------------------------------------------ views

    public RegistrySnapshot current() {
        return current.get();
    }

    public boolean isFresh() {
        return freshnessPolicy.isFresh(current.get(), clock.instant());
    }

    public FreshnessPolicy getFreshnessPolicy() {
        return freshnessPolicy;
    }

    public RegistryStats getStats() {
        return RegistryStats.builder()
                .successfulRefreshes(successfulRefreshes.get())
                .failedRefreshes(failedRefreshes.get())
                .lastAttemptAt(lastAttemptAt)
                .lastFailureAt(lastFailureAt)
                .lastFailureError(lastFailureError)
                .lastFailureMessage(lastFailureMessage)
                .refreshInFlight(inflight.get() != null)
                .build();
    }

    /**
     * 单个条目的刷新结果：构建成功或被跳过，二选一
     */
    private static final class EntryOutcome {
        private final ProviderEntry entry;
        private final SkippedEntry skipped;

        private EntryOutcome(ProviderEntry entry, SkippedEntry skipped) {
            this.entry = entry;
            this.skipped = skipped;
        }

        static EntryOutcome built(ProviderEntry entry) {
            return new EntryOutcome(entry, null);
        }

        static EntryOutcome skipped(SkippedEntry skipped) {
            return new EntryOutcome(null, skipped);
        }
    }
}
