package com.example.billinghook.security;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

/**
 * HMAC-SHA256 验签实现，签名覆盖原始请求体。
 */
@Component
@Slf4j
public class HmacVerifier {

    private static final String HMAC_SHA256 = "HmacSHA256";
    private static final String SIGNATURE_PREFIX = "sha256=";

    /**
     * 校验 HMAC 签名。未配置密钥时直接通过（显式的非安全模式）。
     *
     * @param secret          密钥，可为空
     * @param rawBody         原始请求体
     * @param signatureHeader 签名请求头的值，可带 "sha256=" 前缀
     * @return 校验通过返回 true
     */
    public boolean verify(String secret, String rawBody, String signatureHeader) {
        if (secret == null || secret.isEmpty()) {
            return true;
        }
        if (signatureHeader == null || signatureHeader.isBlank()) {
            return false;
        }

        try {
            String expectedHash = calculateHmac(rawBody == null ? "" : rawBody, secret);

            String cleanSignature = signatureHeader.trim();
            if (cleanSignature.regionMatches(true, 0, SIGNATURE_PREFIX, 0, SIGNATURE_PREFIX.length())) {
                cleanSignature = cleanSignature.substring(SIGNATURE_PREFIX.length());
            }

            // 常量时间比较，防止计时攻击
            return MessageDigest.isEqual(
                    cleanSignature.toLowerCase(Locale.ROOT).getBytes(StandardCharsets.UTF_8),
                    expectedHash.getBytes(StandardCharsets.UTF_8));

        } catch (NoSuchAlgorithmException | InvalidKeyException e) {
            log.error("HMAC verification error", e);
            return false;
        }
    }

    /**
     * 计算 HMAC 值。
     *
     * @param data 原文
     * @param key  密钥
     * @return HMAC 十六进制字符串（小写）
     */
    public String calculateHmac(String data, String key) throws NoSuchAlgorithmException, InvalidKeyException {
        SecretKeySpec secretKey = new SecretKeySpec(key.getBytes(StandardCharsets.UTF_8), HMAC_SHA256);
        Mac mac = Mac.getInstance(HMAC_SHA256);
        mac.init(secretKey);
        byte[] hmacBytes = mac.doFinal(data.getBytes(StandardCharsets.UTF_8));
        return HexFormat.of().formatHex(hmacBytes);
    }
}
