package com.mooncell.router.api;

import com.fasterxml.jackson.databind.JsonNode;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 模型调用请求
 * <p>
 * {@code request} 为目标服务商的原生请求体，网关只补充模型名等必要字段，不做格式转换。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "模型调用请求")
public class ModelInvokeRequest {

    @NotBlank
    @Schema(description = "组合模型标识 <provider>/<model>", example = "google-ai-studio/gemini-2.0-flash",
            requiredMode = Schema.RequiredMode.REQUIRED)
    private String model;

    @NotNull
    @Schema(description = "服务商原生请求体", requiredMode = Schema.RequiredMode.REQUIRED)
    private JsonNode request;
}
