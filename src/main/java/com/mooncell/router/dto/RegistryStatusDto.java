package com.mooncell.router.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 注册表状态
 * 用于管理接口展示当前快照和刷新统计
 */
@Data
@NoArgsConstructor
@Schema(description = "服务商注册表状态")
public class RegistryStatusDto {

    @Schema(description = "快照是否在有效期内")
    private boolean fresh;

    @Schema(description = "是否从未成功刷新过")
    private boolean initial;

    @Schema(description = "快照构建时间（ISO-8601），从未刷新时为空")
    private String builtAt;

    @Schema(description = "快照年龄（毫秒），从未刷新时为空")
    private Long ageMillis;

    @Schema(description = "快照有效期（毫秒）")
    private long ttlMillis;

    @Schema(description = "已加载的服务商")
    private List<ProviderStatusDto> providers = new ArrayList<>();

    @Schema(description = "最近一次成功刷新中被跳过的条目")
    private List<SkippedEntryDto> skipped = new ArrayList<>();

    @Schema(description = "成功刷新次数")
    private long successfulRefreshes;

    @Schema(description = "失败刷新次数")
    private long failedRefreshes;

    @Schema(description = "最近一次刷新尝试时间（ISO-8601）")
    private String lastAttemptAt;

    @Schema(description = "最近一次刷新失败时间（ISO-8601）")
    private String lastFailureAt;

    @Schema(description = "最近一次刷新失败的错误分类")
    private String lastFailureError;

    @Schema(description = "最近一次刷新失败的原因")
    private String lastFailureMessage;

    @Schema(description = "当前是否有刷新在进行")
    private boolean refreshInFlight;

    @Schema(description = "已注册客户端构建器的服务商类型")
    private List<String> supportedKinds = new ArrayList<>();

    @Schema(description = "进程启动以来构建的 WebClient 数量")
    private long webClientsBuilt;
}
