package com.mooncell.router.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * 支持的后端类型（封闭集合）
 * <p>
 * 每个类型对应唯一一个 {@link com.mooncell.router.core.client.ProviderClientBuilder}。
 * 新增后端 = 新增一个枚举值 + 一个构建器。
 */
public enum ProviderKind {
    GOOGLE("google"),
    OPENAI("openai"),
    ANTHROPIC("anthropic");

    /** 配置中 provider 字段使用的名称 */
    private final String wireName;

    ProviderKind(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    /**
     * 按配置名称查找类型，大小写不敏感；未知名称返回空，不做任何默认回退。
     *
     * @param name 配置中的 provider 字段
     * @return 对应类型
     */
    public static Optional<ProviderKind> fromWireName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (ProviderKind kind : values()) {
            if (kind.wireName.equals(normalized)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
