package com.example.billinghook.exception;

import org.springframework.http.HttpStatus;

/**
 * 创建结账会话失败，携带对应的 HTTP 状态。
 */
public class CheckoutException extends RuntimeException {

    private final HttpStatus status;

    public CheckoutException(HttpStatus status, String message) {
        super(message);
        this.status = status;
    }

    public HttpStatus getStatus() {
        return status;
    }
}
