package com.example.billinghook.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * 支付网关（CAKTO）相关配置。
 */
@ConfigurationProperties(prefix = "billing.cakto")
@Data
public class CaktoProperties {

    /**
     * Webhook 签名密钥。为空时跳过验签（仅限受信网络）。
     */
    private String webhookSecret;

    private List<String> signatureHeaders = new ArrayList<>(List.of("x-cakto-signature", "x-signature"));

    private List<String> eventIdHeaders = new ArrayList<>(List.of("x-event-id"));

    /**
     * 用于拼接报价的结账 URL 形式。
     */
    private String checkoutUrlBase = "https://pay.cakto.com.br/";

    private String apiBase;
    private String clientId;
    private String clientSecret;

    public boolean hasWebhookSecret() {
        return webhookSecret != null && !webhookSecret.isBlank();
    }

    public boolean isApiConfigured() {
        return apiBase != null && !apiBase.isBlank()
                && clientId != null && !clientId.isBlank()
                && clientSecret != null && !clientSecret.isBlank();
    }

    /**
     * 将报价 ID 转换为结账 URL 形式；已是 URL 时原样返回。
     *
     * @param offerId 报价 ID
     * @return 结账 URL
     */
    public String toCheckoutUrl(String offerId) {
        if (offerId == null || offerId.isBlank()) {
            return null;
        }
        String trimmed = offerId.trim();
        if (trimmed.regionMatches(true, 0, "http://", 0, 7) || trimmed.regionMatches(true, 0, "https://", 0, 8)) {
            return trimmed;
        }
        String base = checkoutUrlBase.endsWith("/") ? checkoutUrlBase : checkoutUrlBase + "/";
        return base + trimmed;
    }
}
