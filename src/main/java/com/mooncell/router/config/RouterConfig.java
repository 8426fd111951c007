package com.mooncell.router.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * 路由器基础配置
 *
 * <p>出站 WebClient 与连接池由 {@link com.mooncell.router.service.ProviderWebClientManager} 统一管理，
 * 这里只注册配置属性和时钟。
 */
@Configuration
@EnableConfigurationProperties(RouterProperties.class)
public class RouterConfig {

    /**
     * 注册表新鲜度判断使用的时钟，测试中可替换
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
