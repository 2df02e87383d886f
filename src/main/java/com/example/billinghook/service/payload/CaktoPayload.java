package com.example.billinghook.service.payload;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 从网关 Webhook 请求体中提取出的规范化字段。所有字段都可能为空。
 */
@Value
@Builder
public class CaktoPayload {

    String eventName;
    String providerEventId;

    String gatewaySubscriptionId;
    String rawStatus;
    String paymentStatus;
    LocalDateTime periodStart;
    LocalDateTime periodEnd;

    String checkoutToken;
    String customerEmail;
    String customerName;
    String customerPhone;
    String customerDocument;
    String companyName;
    Long companyId;

    String offerId;
    String offerName;
    BigDecimal offerPrice;
    String offerIntervalType;
    Integer offerInterval;

    String orderId;
    String paymentLinkUrl;

    String payloadSecret;
}
