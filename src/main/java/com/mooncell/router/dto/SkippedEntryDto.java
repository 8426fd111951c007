package com.mooncell.router.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "刷新时被跳过的配置条目")
public class SkippedEntryDto {

    @Schema(description = "服务商 ID（配置 key）")
    private String providerId;

    @Schema(description = "跳过原因分类", example = "SECRET_MISSING")
    private String error;

    @Schema(description = "详细原因")
    private String reason;
}
