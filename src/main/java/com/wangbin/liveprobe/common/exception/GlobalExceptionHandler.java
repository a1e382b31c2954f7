package com.wangbin.liveprobe.common.exception;

import com.wangbin.liveprobe.common.web.result.ApiResult;
import com.wangbin.liveprobe.common.web.result.ResultCode;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.BindException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 全局异常处理器
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * 处理会话存储异常
     */
    @ExceptionHandler(StoreException.class)
    public ResponseEntity<ApiResult<?>> handleStoreException(StoreException e, HttpServletRequest request) {
        log.warn("会话存储异常: {} - {}, 请求: {}", e.getCode(), e.getMessage(), request.getRequestURI());
        ApiResult<Object> result = ApiResult.error(e.getCode(), e.getMessage());
        result.addExtra("sessionId", e.getSessionId());
        HttpStatus status = e.isNotFound() ? HttpStatus.NOT_FOUND : HttpStatus.CONFLICT;
        return ResponseEntity.status(status).body(result);
    }

    /**
     * 处理业务异常
     */
    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<ApiResult<?>> handleBusinessException(BusinessException e, HttpServletRequest request) {
        log.warn("业务异常: {} - {}", e.getCode(), e.getMessage());
        HttpStatus status = e.getResultCode() == ResultCode.DEVICE_NOT_FOUND
                ? HttpStatus.NOT_FOUND : HttpStatus.BAD_REQUEST;
        return ResponseEntity.status(status).body(ApiResult.error(e.getCode(), e.getMessage()));
    }

    /**
     * 处理参数绑定异常
     */
    @ExceptionHandler(BindException.class)
    public ResponseEntity<ApiResult<?>> handleBindException(BindException e) {
        List<FieldError> fieldErrors = e.getBindingResult().getFieldErrors();
        String message = fieldErrors.stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining("; "));

        log.warn("参数绑定异常: {}", message);
        return badRequest(message);
    }

    /**
     * 处理约束违反异常
     */
    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ApiResult<?>> handleConstraintViolationException(ConstraintViolationException e) {
        String message = e.getConstraintViolations().stream()
                .map(violation -> violation.getPropertyPath() + ": " + violation.getMessage())
                .collect(Collectors.joining("; "));

        log.warn("约束违反异常: {}", message);
        return badRequest(message);
    }

    /**
     * 处理请求参数缺失或类型不匹配
     */
    @ExceptionHandler({MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class,
            HandlerMethodValidationException.class,
            HttpMessageNotReadableException.class,
            IllegalArgumentException.class})
    public ResponseEntity<ApiResult<?>> handleIllegalArgument(Exception e) {
        log.warn("请求参数错误: {}", e.getMessage());
        return badRequest(e.getMessage());
    }

    /**
     * 处理其他异常
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResult<?>> handleException(Exception e, HttpServletRequest request) {
        log.error("请求地址: {}, 请求方法: {}, 异常信息: {}",
                request.getRequestURI(), request.getMethod(), e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiResult.error(ResultCode.SYSTEM_ERROR.getCode(), "系统内部错误，请联系管理员"));
    }

    private ResponseEntity<ApiResult<?>> badRequest(String message) {
        return ResponseEntity.badRequest().body(ApiResult.error(ResultCode.PARAM_ERROR.getCode(), message));
    }
}
