package com.wangbin.liveprobe.api.controller;

import com.wangbin.liveprobe.common.web.result.ApiResult;
import com.wangbin.liveprobe.monitor.health.HealthSnapshot;
import com.wangbin.liveprobe.monitor.health.HealthStatus;
import com.wangbin.liveprobe.monitor.health.PollerHealthService;
import com.wangbin.liveprobe.monitor.health.SystemHealthService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 健康检查接口。
 */
@RestController
@RequiredArgsConstructor
public class HealthController {

    private final SystemHealthService systemHealthService;
    private final PollerHealthService pollerHealthService;

    @GetMapping("/health")
    public ResponseEntity<HealthStatus> health() {
        HealthStatus status = systemHealthService.getSystemHealth();
        return ResponseEntity.status(status.getStatus().httpStatus()).body(status);
    }

    @GetMapping("/health/snapshot")
    public ApiResult<HealthSnapshot> snapshot() {
        return ApiResult.success(pollerHealthService.snapshot());
    }
}
