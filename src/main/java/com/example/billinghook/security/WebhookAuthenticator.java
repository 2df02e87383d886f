package com.example.billinghook.security;

import com.example.billinghook.config.CaktoProperties;
import com.example.billinghook.exception.WebhookAuthenticationException;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.function.Function;

/**
 * 网关请求来源认证：优先校验请求头 HMAC 签名，失败时回退到请求体内携带的共享密钥。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WebhookAuthenticator {

    private final CaktoProperties caktoProperties;
    private final HmacVerifier hmacVerifier;

    @PostConstruct
    public void warnIfInsecure() {
        if (!caktoProperties.hasWebhookSecret()) {
            log.warn("billing.cakto.webhook-secret is not set, webhook signatures will NOT be verified");
        }
    }

    /**
     * 认证一次投递，失败时抛出 {@link WebhookAuthenticationException}。
     *
     * @param rawBody       原始请求体
     * @param headerLookup  请求头读取函数（名称忽略大小写）
     * @param payloadSecret 请求体中的 secret 字段，可为空
     */
    public void authenticate(String rawBody, Function<String, String> headerLookup, String payloadSecret) {
        String secret = caktoProperties.getWebhookSecret();
        String signature = findSignatureHeader(headerLookup);

        if (hmacVerifier.verify(secret, rawBody, signature)) {
            return;
        }

        // 回退只在配置了密钥时才有意义（未配置时上面已直接通过）
        if (caktoProperties.hasWebhookSecret() && payloadSecret != null
                && MessageDigest.isEqual(payloadSecret.getBytes(StandardCharsets.UTF_8),
                        secret.getBytes(StandardCharsets.UTF_8))) {
            log.debug("Webhook accepted through payload shared secret");
            return;
        }

        log.warn("Webhook signature rejected (header present: {})", signature != null);
        throw new WebhookAuthenticationException("Invalid signature");
    }

    private String findSignatureHeader(Function<String, String> headerLookup) {
        for (String name : caktoProperties.getSignatureHeaders()) {
            String value = headerLookup.apply(name);
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }
}
