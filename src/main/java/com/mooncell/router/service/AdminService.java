package com.mooncell.router.service;

import com.mooncell.router.core.client.ClientFactoryBuilder;
import com.mooncell.router.core.model.ProviderKind;
import com.mooncell.router.core.registry.ProviderEntry;
import com.mooncell.router.core.registry.ProviderRegistry;
import com.mooncell.router.core.registry.RegistrySnapshot;
import com.mooncell.router.core.registry.RegistryStats;
import com.mooncell.router.core.registry.SkippedEntry;
import com.mooncell.router.dto.ProviderStatusDto;
import com.mooncell.router.dto.RegistryStatusDto;
import com.mooncell.router.dto.SkippedEntryDto;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class AdminService {

    private final ProviderRegistry providerRegistry;
    private final ClientFactoryBuilder clientFactoryBuilder;
    private final ProviderWebClientManager webClientManager;
    private final Clock clock;

    public RegistryStatusDto getStatus() {
        return toStatus(providerRegistry.current());
    }

    /**
     * 强制刷新注册表，刷新失败时返回的仍是旧快照的状态
     */
    public Mono<RegistryStatusDto> refresh() {
        log.info("手动刷新服务商注册表");
        return providerRegistry.refresh().map(this::toStatus);
    }

    private RegistryStatusDto toStatus(RegistrySnapshot snapshot) {
        RegistryStats stats = providerRegistry.getStats();
        Instant now = clock.instant();

        RegistryStatusDto dto = new RegistryStatusDto();
        dto.setFresh(providerRegistry.getFreshnessPolicy().isFresh(snapshot, now));
        dto.setInitial(snapshot.isInitial());
        if (!snapshot.isInitial()) {
            dto.setBuiltAt(snapshot.getBuiltAt().toString());
            dto.setAgeMillis(snapshot.age(now).toMillis());
        }
        dto.setTtlMillis(providerRegistry.getFreshnessPolicy().getTtl().toMillis());
        dto.setProviders(snapshot.getProviders().values().stream()
                .map(AdminService::toProviderStatus)
                .collect(Collectors.toList()));
        dto.setSkipped(snapshot.getSkipped().stream()
                .map(AdminService::toSkipped)
                .collect(Collectors.toList()));
        dto.setSuccessfulRefreshes(stats.getSuccessfulRefreshes());
        dto.setFailedRefreshes(stats.getFailedRefreshes());
        dto.setLastAttemptAt(format(stats.getLastAttemptAt()));
        dto.setLastFailureAt(format(stats.getLastFailureAt()));
        dto.setLastFailureError(stats.getLastFailureError() != null ? stats.getLastFailureError().name() : null);
        dto.setLastFailureMessage(stats.getLastFailureMessage());
        dto.setRefreshInFlight(stats.isRefreshInFlight());
        dto.setSupportedKinds(clientFactoryBuilder.supportedKinds().stream()
                .map(ProviderKind::getWireName)
                .sorted()
                .collect(Collectors.toList()));
        dto.setWebClientsBuilt(webClientManager.getCreatedClientCount());
        return dto;
    }

    private static ProviderStatusDto toProviderStatus(ProviderEntry entry) {
        return new ProviderStatusDto(
                entry.getProviderId(),
                entry.getKind().getWireName(),
                entry.getDescriptor().getRoutingPath(),
                entry.getEndpointBaseUrl());
    }

    private static SkippedEntryDto toSkipped(SkippedEntry entry) {
        return new SkippedEntryDto(entry.getProviderId(), entry.getError().name(), entry.getReason());
    }

    private static String format(Instant instant) {
        return instant != null ? instant.toString() : null;
    }
}
