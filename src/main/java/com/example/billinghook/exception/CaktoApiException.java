package com.example.billinghook.exception;

/**
 * 调用网关 API 失败（网络错误或非 2xx 响应）。
 */
public class CaktoApiException extends RuntimeException {

    private final int statusCode;

    public CaktoApiException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public CaktoApiException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
