package com.mooncell.router.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "模型标识解析结果")
public class ResolvedModelDto {

    @Schema(description = "服务商 ID", example = "google-ai-studio")
    private String providerId;

    @Schema(description = "后端类型", example = "google")
    private String kind;

    @Schema(description = "模型名称", example = "gemini-2.0-flash")
    private String model;

    @Schema(description = "实际调用的基础地址")
    private String baseUrl;
}
