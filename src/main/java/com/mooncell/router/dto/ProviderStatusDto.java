package com.mooncell.router.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 已加载服务商的状态，不包含任何凭据
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "已加载的服务商")
public class ProviderStatusDto {

    @Schema(description = "服务商 ID（配置 key）", example = "google-ai-studio")
    private String providerId;

    @Schema(description = "后端类型", example = "google")
    private String kind;

    @Schema(description = "网关路由路径", example = "google-ai-studio")
    private String routingPath;

    @Schema(description = "解析后的网关地址")
    private String endpoint;
}
