package com.example.billinghook.exception;

/**
 * Webhook 签名缺失或不匹配。映射为 401，不写台账。
 */
public class WebhookAuthenticationException extends RuntimeException {

    public WebhookAuthenticationException(String message) {
        super(message);
    }
}
