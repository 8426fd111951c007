package com.mooncell.router.core.model;

import com.mooncell.router.core.error.ModelResolutionException;
import com.mooncell.router.core.error.ResolutionError;
import lombok.Value;

/**
 * 组合模型标识 {@code <providerId>/<modelName>}
 * <p>
 * 以第一个 '/' 分割，modelName 本身允许包含 '/'。
 * 两部分都不做 trim，只有空串才算缺失；纯空白的 providerId 会在查找时得到 PROVIDER_NOT_FOUND。
 */
@Value
public class ModelIdentifier {
    private static final char SEPARATOR = '/';

    String providerId;
    String modelName;

    /**
     * 解析组合标识
     *
     * @param compositeId 客户端传入的模型标识
     * @return 解析结果
     * @throws ModelResolutionException 缺少分隔符、providerId 或 modelName 为空时抛出 MALFORMED_IDENTIFIER
     */
    public static ModelIdentifier parse(String compositeId) {
        if (compositeId == null || compositeId.isEmpty()) {
            throw malformed("model identifier must not be empty");
        }
        int separator = compositeId.indexOf(SEPARATOR);
        if (separator < 0) {
            throw malformed("model identifier must look like '<provider>/<model>': " + compositeId);
        }
        String providerId = compositeId.substring(0, separator);
        String modelName = compositeId.substring(separator + 1);
        if (providerId.isEmpty()) {
            throw malformed("provider part of model identifier is empty: " + compositeId);
        }
        if (modelName.isEmpty()) {
            throw malformed("model part of model identifier is empty: " + compositeId);
        }
        return new ModelIdentifier(providerId, modelName);
    }

    private static ModelResolutionException malformed(String message) {
        return new ModelResolutionException(ResolutionError.MALFORMED_IDENTIFIER, message);
    }

    @Override
    public String toString() {
        return providerId + SEPARATOR + modelName;
    }
}
