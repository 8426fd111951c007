package com.mooncell.router.service;

import com.mooncell.router.config.RouterProperties;
import com.mooncell.router.core.client.ProviderConnection;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 服务商出站 WebClient 管理器
 *
 * <p>所有服务商共享同一个 Reactor Netty 连接池，每个服务商按自己的基础地址和默认请求头
 * 构建独立的 WebClient。构建过程不发起任何网络连接，连接在首次调用模型时才建立。
 *
 * <p>刷新会为每个服务商重新构建 WebClient（令牌可能轮换），旧 WebClient 只是普通对象，
 * 不持有连接，随旧快照一起被回收。
 */
@Slf4j
@Service
public class ProviderWebClientManager {

    private static final String POOL_NAME = "provider-pool";

    private final RouterProperties.Http settings;
    private final ConnectionProvider connectionProvider;
    private final HttpClient httpClient;
    /** 已构建的 WebClient 数量（累计） */
    private final AtomicLong createdClients = new AtomicLong(0);

    public ProviderWebClientManager(RouterProperties properties) {
        this.settings = properties.getHttp();
        this.connectionProvider = ConnectionProvider.builder(POOL_NAME)
                .maxConnections(settings.getMaxConnections())
                .maxIdleTime(settings.getMaxIdleTime())
                .maxLifeTime(settings.getMaxLifeTime())
                .pendingAcquireTimeout(settings.getPendingAcquireTimeout())
                .evictInBackground(Duration.ofSeconds(30))
                .build();
        long readWriteSeconds = Math.max(1L, settings.getReadWriteTimeout().getSeconds());
        this.httpClient = HttpClient.create(connectionProvider)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) settings.getConnectTimeout().toMillis())
                .option(ChannelOption.SO_KEEPALIVE, true)
                .option(ChannelOption.TCP_NODELAY, true)
                .responseTimeout(settings.getResponseTimeout())
                .doOnConnected(conn -> conn
                        .addHandlerLast(new ReadTimeoutHandler(readWriteSeconds, TimeUnit.SECONDS))
                        .addHandlerLast(new WriteTimeoutHandler(readWriteSeconds, TimeUnit.SECONDS)))
                .compress(true)
                .wiretap(false);
    }

    /**
     * 为服务商连接构建 WebClient
     *
     * @param connection 服务商连接信息（基础地址 + 出站请求头）
     * @return 绑定基础地址和默认请求头的 WebClient
     */
    public WebClient createWebClient(ProviderConnection connection) {
        WebClient webClient = WebClient.builder()
                .baseUrl(connection.getBaseUrl())
                .defaultHeaders(headers -> connection.getHeaders().forEach(headers::set))
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .codecs(configurer -> {
                    configurer.defaultCodecs().maxInMemorySize(settings.getMaxInMemorySize());
                    // 请求头里带有密钥，禁止打印请求详情
                    configurer.defaultCodecs().enableLoggingRequestDetails(false);
                })
                .build();
        createdClients.incrementAndGet();
        if (log.isDebugEnabled()) {
            log.debug("Built WebClient for provider {} ({}) at {}",
                    connection.getProviderId(), connection.getKind(), connection.getBaseUrl());
        }
        return webClient;
    }

    public long getCreatedClientCount() {
        return createdClients.get();
    }

    /**
     * 释放连接池
     */
    @PreDestroy
    public void destroy() {
        log.info("Shutting down ProviderWebClientManager, {} WebClient(s) built so far", createdClients.get());
        try {
            connectionProvider.disposeLater().block(Duration.ofSeconds(5));
        } catch (Exception e) {
            log.warn("Failed to dispose provider connection pool: {}", e.getMessage());
        }
    }
}
