package com.mooncell.router.web;

import com.mooncell.router.dto.RegistryStatusDto;
import com.mooncell.router.service.AdminService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/admin")
@RequiredArgsConstructor
@Tag(name = "管理控制器", description = "服务商注册表状态查询与刷新")
@SecurityRequirement(name = "apiKey")
public class AdminController {

    private final AdminService adminService;

    /**
     * 获取注册表状态 - 已加载服务商、被跳过的条目和刷新统计
     */
    @Operation(
        summary = "获取注册表状态",
        description = "返回当前快照的服务商列表、跳过条目、构建时间、是否过期以及刷新统计，不会触发刷新"
    )
    @GetMapping("/providers")
    public RegistryStatusDto getProviders() {
        return adminService.getStatus();
    }

    /**
     * 强制刷新注册表，通常在修改配置存储后调用
     */
    @Operation(
        summary = "刷新注册表",
        description = "立即从配置存储重新加载服务商；已有刷新在进行时复用其结果，刷新失败时保留旧快照"
    )
    @PostMapping("/providers/refresh")
    public Mono<RegistryStatusDto> refreshProviders() {
        return adminService.refresh();
    }
}
