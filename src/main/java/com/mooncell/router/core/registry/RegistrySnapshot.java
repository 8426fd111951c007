package com.mooncell.router.core.registry;

import lombok.Getter;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 不可变的注册表快照：providerId -> 服务商条目，以及构建时间
 *
 * <p>快照一经发布不再修改，刷新总是构建新快照并整体替换。
 * 持有引用的读者始终看到完整的旧快照或完整的新快照。
 */
@Getter
public final class RegistrySnapshot {

    private static final RegistrySnapshot INITIAL =
            new RegistrySnapshot(Collections.emptyMap(), List.of(), Instant.EPOCH, true);

    private final Map<String, ProviderEntry> providers;
    private final List<SkippedEntry> skipped;
    private final Instant builtAt;
    /** 是否为启动时的占位快照（从未刷新成功过） */
    private final boolean initial;

    private RegistrySnapshot(Map<String, ProviderEntry> providers, List<SkippedEntry> skipped,
                             Instant builtAt, boolean initial) {
        this.providers = providers;
        this.skipped = skipped;
        this.builtAt = builtAt;
        this.initial = initial;
    }

    public static RegistrySnapshot initial() {
        return INITIAL;
    }

    /**
     * 构建新快照，入参会被复制，调用方后续修改不影响快照
     */
    public static RegistrySnapshot of(Map<String, ProviderEntry> providers, List<SkippedEntry> skipped,
                                      Instant builtAt) {
        return new RegistrySnapshot(
                Collections.unmodifiableMap(new LinkedHashMap<>(providers)),
                List.copyOf(skipped),
                builtAt,
                false);
    }

    public Optional<ProviderEntry> find(String providerId) {
        return Optional.ofNullable(providers.get(providerId));
    }

    public int size() {
        return providers.size();
    }

    public Duration age(Instant now) {
        return Duration.between(builtAt, now);
    }
}
