package com.mooncell.router.core.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mooncell.router.core.error.ProviderConfigError;
import com.mooncell.router.core.error.ProviderConfigException;
import com.mooncell.router.core.model.ProviderDescriptor;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * 解析配置存储中的服务商描述 JSON
 * <p>
 * 格式：{@code {"provider": "...", "apiKeySecretName": "...", "gatewayProviderPath": "..."}}，
 * 三个字段均为必填字符串，其它字段忽略。
 */
@Component
@RequiredArgsConstructor
public class ProviderDescriptorParser {

    static final String FIELD_PROVIDER = "provider";
    static final String FIELD_SECRET_NAME = "apiKeySecretName";
    static final String FIELD_ROUTING_PATH = "gatewayProviderPath";

    private final ObjectMapper objectMapper;

    /**
     * @param providerId 配置 key
     * @param raw        配置 value
     * @return 描述对象
     * @throws ProviderConfigException CONFIG_ENTRY_INVALID
     */
    public ProviderDescriptor parse(String providerId, String raw) {
        if (providerId == null || providerId.isBlank()) {
            throw invalid("provider id is empty");
        }
        if (raw == null || raw.isBlank()) {
            throw invalid("descriptor is empty");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            throw new ProviderConfigException(ProviderConfigError.CONFIG_ENTRY_INVALID,
                    "descriptor is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw invalid("descriptor must be a JSON object");
        }
        return ProviderDescriptor.builder()
                .providerId(providerId)
                .kind(requiredText(root, FIELD_PROVIDER))
                .secretName(requiredText(root, FIELD_SECRET_NAME))
                .routingPath(requiredText(root, FIELD_ROUTING_PATH))
                .build();
    }

    private static String requiredText(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || !node.isTextual() || node.asText().isBlank()) {
            throw invalid("field '" + field + "' must be a non-empty string");
        }
        return node.asText().trim();
    }

    private static ProviderConfigException invalid(String message) {
        return new ProviderConfigException(ProviderConfigError.CONFIG_ENTRY_INVALID, message);
    }
}
