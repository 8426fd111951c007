package com.mooncell.router.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 统一错误响应体
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "错误响应")
public class ErrorPayload {

    @Schema(description = "发生时间（ISO-8601）")
    private String timestamp;

    @Schema(description = "HTTP 状态码", example = "404")
    private int status;

    @Schema(description = "HTTP 状态说明", example = "Not Found")
    private String error;

    @Schema(description = "错误分类", example = "PROVIDER_NOT_FOUND")
    private String code;

    @Schema(description = "错误详情")
    private String message;

    @Schema(description = "请求路径")
    private String path;
}
