package com.example.billinghook.service.payload;

import com.example.billinghook.config.CaktoProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.function.Function;

/**
 * 事件 ID 解析：网关提供的 ID → 请求头 → 请求体内容哈希。
 */
@Component
@RequiredArgsConstructor
public class EventIdResolver {

    private final CaktoProperties caktoProperties;

    public String resolve(CaktoPayload payload, Function<String, String> headerLookup, String rawBody) {
        if (payload.getProviderEventId() != null) {
            return payload.getProviderEventId();
        }
        for (String header : caktoProperties.getEventIdHeaders()) {
            String value = headerLookup.apply(header);
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return sha256(rawBody);
    }

    static String sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
