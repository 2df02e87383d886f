package com.example.billinghook.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 结账会话：支付完成前创建，支付完成后绑定用户与公司。
 */
@Entity
@Table(name = "subscription_checkouts", indexes = @Index(name = "idx_checkout_email", columnList = "email"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CheckoutSession {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 64)
    private String token;

    private Long planId;

    @Column(nullable = false)
    private String email;

    private String fullName;

    private String companyName;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private CheckoutStatus status = CheckoutStatus.CREATED;

    private String gatewaySubscriptionId;

    private Long userId;

    private Long companyId;

    // 由业务代码按全局 Clock 写入，“近期完成”窗口依赖它
    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
