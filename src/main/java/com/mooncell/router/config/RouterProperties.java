package com.mooncell.router.config;

import lombok.Data;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * 路由器配置，前缀 {@code mooncell.router}
 * <p>
 * 注意：registry.ttl 只在启动时读取一次，进程生命周期内固定。
 */
@Data
@ConfigurationProperties(prefix = "mooncell.router")
public class RouterProperties {

    private Registry registry = new Registry();
    private ConfigStore configStore = new ConfigStore();
    private Gateway gateway = new Gateway();
    private Auth auth = new Auth();
    private Http http = new Http();

    @Data
    public static class Registry {
        /** 快照最大存活时间，超过后下一次请求触发刷新 */
        private Duration ttl = Duration.ofMinutes(5);
        /** 刷新失败后的重试间隔，为空时等于 ttl */
        private Duration failureBackoff;
        /** 单次刷新的超时时间，超时视为配置源不可达 */
        private Duration refreshTimeout = Duration.ofSeconds(10);
        /** 应用启动完成后是否预热一次 */
        private boolean warmUp = true;
    }

    @Data
    public static class ConfigStore {
        /** Redis hash，field = providerId，value = 描述 JSON */
        private String hashKey = "mooncell:router:provider-config";
    }

    @Data
    public static class Gateway {
        private String baseUrl = "https://gateway.ai.cloudflare.com/v1";
        private String accountId;
        private String name;
        @ToString.Exclude
        private String token;
        /** 出站请求携带网关令牌的请求头 */
        private String authorizationHeader = "cf-aig-authorization";
    }

    @Data
    public static class Auth {
        private boolean enabled = true;
        /** Redis set，保存允许访问的 API Key */
        private String keysSetKey = "mooncell:router:api-keys";
        /** 需要鉴权的路径前缀 */
        private List<String> protectedPaths = new ArrayList<>(List.of("/v1/", "/admin/"));
    }

    @Data
    public static class Http {
        private int maxConnections = 200;
        private Duration maxIdleTime = Duration.ofSeconds(20);
        private Duration maxLifeTime = Duration.ofMinutes(10);
        private Duration pendingAcquireTimeout = Duration.ofSeconds(5);
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration responseTimeout = Duration.ofSeconds(60);
        private Duration readWriteTimeout = Duration.ofSeconds(60);
        private int maxInMemorySize = 10 * 1024 * 1024;
    }
}
