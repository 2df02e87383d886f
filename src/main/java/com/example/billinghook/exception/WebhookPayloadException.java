package com.example.billinghook.exception;

/**
 * 请求体不是合法的 JSON 对象。映射为 400。
 */
public class WebhookPayloadException extends RuntimeException {

    public WebhookPayloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
