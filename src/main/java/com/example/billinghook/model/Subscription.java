package com.example.billinghook.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;

/**
 * 公司的订阅记录。续费原地更新，不追加新行。
 */
@Entity
@Table(name = "subscriptions", indexes = @Index(name = "idx_subscription_company", columnList = "companyId"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Subscription {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    private Long userId;

    @Column(nullable = false)
    private Long companyId;

    private Long planId;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private SubscriptionStatus status = SubscriptionStatus.PENDING;

    @Column(length = 30)
    private String gateway; // 例如 "cakto"

    @Column(unique = true)
    private String gatewaySubscriptionId;

    private String gatewayOrderId;

    private String paymentLinkUrl;

    private String lastPaymentStatus;

    private LocalDateTime currentPeriodEndsAt;

    private LocalDateTime trialEndsAt;

    private String customerName;

    private String customerEmail;

    private String customerPhone;

    private String customerDocument;

    // 最近一次应用到本行的事件 ID，用于识别“已写入但未标记完成”的重试
    @Column(length = 191)
    private String lastEventId;

    @Column(length = 100)
    private String lastEventType;

    private LocalDateTime lastAppliedAt;

    @CreationTimestamp
    private LocalDateTime createdAt;

    @UpdateTimestamp
    private LocalDateTime updatedAt;
}
