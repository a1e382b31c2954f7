package com.wangbin.liveprobe.api.controller;

import com.wangbin.liveprobe.common.domain.dto.SessionTitleRequest;
import com.wangbin.liveprobe.common.domain.entity.Sample;
import com.wangbin.liveprobe.common.domain.entity.SessionInfo;
import com.wangbin.liveprobe.common.exception.StoreException;
import com.wangbin.liveprobe.common.web.result.ApiResult;
import com.wangbin.liveprobe.core.store.TailBatch;
import com.wangbin.liveprobe.core.store.TimeSeriesStore;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;

/**
 * 直播会话接口
 * 提供会话查询、跟随读取、历史区间查询以及停止/重命名/删除等管理操作
 */
@Slf4j
@Validated
@RestController
@RequestMapping("/api/sessions")
@RequiredArgsConstructor
public class SessionController {

    private final TimeSeriesStore store;

    @GetMapping
    public ApiResult<List<SessionInfo>> listSessions(@RequestParam(required = false) String deviceId) {
        List<SessionInfo> sessions = deviceId == null || deviceId.isBlank()
                ? store.listSessions()
                : store.listSessions(deviceId);
        ApiResult<List<SessionInfo>> result = ApiResult.success(sessions);
        result.addExtra("count", sessions.size());
        return result;
    }

    @GetMapping("/{sessionId}")
    public ApiResult<SessionInfo> getSession(@PathVariable long sessionId) {
        SessionInfo session = store.getSession(sessionId);
        if (session == null) {
            throw StoreException.sessionNotFound(sessionId);
        }
        return ApiResult.success(session);
    }

    /**
     * 跟随读取：客户端用返回的nextIndex继续轮询，closed=true后停止
     */
    @GetMapping("/{sessionId}/samples")
    public ApiResult<TailBatch> readSamples(@PathVariable long sessionId,
                                            @RequestParam(defaultValue = "0") @Min(0) int fromIndex,
                                            @RequestParam(defaultValue = "500") @Min(1) @Max(5000) int limit) {
        return ApiResult.success(store.readFrom(sessionId, fromIndex, limit));
    }

    /**
     * 历史区间查询，时间为ISO-8601格式，缺省表示不限
     */
    @GetMapping("/{sessionId}/range")
    public ApiResult<List<Sample>> range(@PathVariable long sessionId,
                                         @RequestParam(required = false)
                                         @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
                                         @RequestParam(required = false)
                                         @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to) {
        return ApiResult.success(store.range(sessionId, from, to));
    }

    @PostMapping("/{sessionId}/stop")
    public ApiResult<SessionInfo> stopSession(@PathVariable long sessionId) {
        return ApiResult.success("会话已停止", store.stopSession(sessionId));
    }

    @PostMapping("/{sessionId}/title")
    public ApiResult<SessionInfo> renameSession(@PathVariable long sessionId,
                                                @Valid @RequestBody SessionTitleRequest request) {
        return ApiResult.success(store.renameSession(sessionId, request.getTitle()));
    }

    @DeleteMapping("/{sessionId}")
    public ApiResult<Boolean> deleteSession(@PathVariable long sessionId) {
        if (!store.delete(sessionId)) {
            throw StoreException.sessionNotFound(sessionId);
        }
        return ApiResult.success("会话已删除", Boolean.TRUE);
    }

    @DeleteMapping
    public ApiResult<Integer> purgeAll() {
        int count = store.purgeAll();
        log.info("通过接口清空会话，共 {} 个", count);
        return ApiResult.success("已清空全部会话", count);
    }
}
