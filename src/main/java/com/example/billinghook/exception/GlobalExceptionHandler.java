package com.example.billinghook.exception;

import com.example.billinghook.filter.RequestSizeLimitFilter;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.HashMap;
import java.util.Map;

/**
 * 全局异常处理逻辑
 * 所有错误都以 JSON 返回，不向调用方泄露堆栈信息。
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(WebhookAuthenticationException.class)
    public ResponseEntity<Map<String, Object>> handleAuthentication(WebhookAuthenticationException e) {
        return error(HttpStatus.UNAUTHORIZED, "Invalid signature");
    }

    @ExceptionHandler(WebhookPayloadException.class)
    public ResponseEntity<Map<String, Object>> handlePayload(WebhookPayloadException e) {
        return error(HttpStatus.BAD_REQUEST, "Invalid JSON");
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException e) {
        return error(HttpStatus.BAD_REQUEST, "Invalid JSON");
    }

    /**
     * 分块传输的请求体在控制器读取时才超限
     */
    @ExceptionHandler(RequestSizeLimitFilter.SizeLimitExceededException.class)
    public ResponseEntity<Map<String, Object>> handleTooLarge(RequestSizeLimitFilter.SizeLimitExceededException e,
            HttpServletRequest request) {
        log.warn("Request body to {} exceeded limit after {} bytes", request.getRequestURI(), e.getBytesRead());
        return error(HttpStatus.PAYLOAD_TOO_LARGE, "Payload too large");
    }

    @ExceptionHandler(CheckoutException.class)
    public ResponseEntity<Map<String, Object>> handleCheckout(CheckoutException e) {
        return error(e.getStatus(), e.getMessage());
    }

    /**
     * 网关只应使用 POST
     */
    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<Map<String, Object>> handleMethod(HttpRequestMethodNotSupportedException e,
            HttpServletRequest request) {
        log.debug("[MethodNotAllowed] {} {}", e.getMethod(), request.getRequestURI());
        return error(HttpStatus.METHOD_NOT_ALLOWED, "Invalid method");
    }

    /**
     * 处理资源未找到异常 (404)
     * 避免像 favicon.ico 这种缺失资源在控制台打印错误堆栈
     */
    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(NoResourceFoundException e,
            HttpServletRequest request) {
        log.debug("[ResourceNotFound] Path: {}", request.getRequestURI());
        return error(HttpStatus.NOT_FOUND, "Not Found");
    }

    /**
     * 开通失败：事件保持未处理，返回 5xx 让网关按退避策略重试。
     */
    @ExceptionHandler(ProvisioningException.class)
    public ResponseEntity<Map<String, Object>> handleProvisioning(ProvisioningException e) {
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "Provisioning failed, retry later");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleException(Exception e, HttpServletRequest request) {
        log.error("[GlobalException] Path: {}, Error: {}", request.getRequestURI(), e.getMessage(), e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error");
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String message) {
        Map<String, Object> body = new HashMap<>();
        body.put("error", message);
        return new ResponseEntity<>(body, status);
    }
}
