package com.mooncell.router.web;

import com.fasterxml.jackson.databind.JsonNode;
import com.mooncell.router.api.ModelInvokeRequest;
import com.mooncell.router.dto.ErrorPayload;
import com.mooncell.router.dto.ResolvedModelDto;
import com.mooncell.router.service.RouterService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/v1/models")
@RequiredArgsConstructor
@Tag(name = "模型路由控制器", description = "按 <provider>/<model> 把原生请求转发到对应服务商")
@SecurityRequirement(name = "apiKey")
public class GatewayController {

    private final RouterService routerService;

    /**
     * 非流式调用：请求体原样交给服务商，响应原样返回
     */
    @Operation(
        summary = "调用模型",
        description = "解析组合模型标识并以服务商原生格式调用，响应不做转换"
    )
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "成功，返回服务商原生响应"),
        @ApiResponse(responseCode = "400", description = "模型标识格式错误或请求体非法",
            content = @Content(schema = @Schema(implementation = ErrorPayload.class))),
        @ApiResponse(responseCode = "401", description = "缺少或无效的 API Key"),
        @ApiResponse(responseCode = "404", description = "服务商未配置",
            content = @Content(schema = @Schema(implementation = ErrorPayload.class))),
        @ApiResponse(responseCode = "502", description = "上游服务商调用失败")
    })
    @PostMapping(value = "/invoke", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<JsonNode> invoke(@Parameter(description = "模型调用请求") @Valid @RequestBody ModelInvokeRequest request) {
        return routerService.invoke(request);
    }

    /**
     * 流式调用：服务商的 SSE 数据块原样转发
     */
    @Operation(
        summary = "流式调用模型",
        description = "与 /invoke 相同的解析流程，以 text/event-stream 转发服务商原生数据块"
    )
    @PostMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<String> stream(@Parameter(description = "模型调用请求") @Valid @RequestBody ModelInvokeRequest request) {
        return routerService.stream(request);
    }

    @Operation(summary = "解析模型标识", description = "返回组合模型标识对应的服务商、类型和调用地址，不包含凭据")
    @GetMapping("/resolve")
    public Mono<ResolvedModelDto> resolve(
        @Parameter(description = "组合模型标识", example = "google-ai-studio/gemini-2.0-flash")
        @RequestParam("model") String model
    ) {
        return routerService.describe(model);
    }
}
