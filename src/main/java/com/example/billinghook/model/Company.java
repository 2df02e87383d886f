package com.example.billinghook.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;

/**
 * 租户（付费公司）。可能由试用注册等其他流程预先创建，这里只做更新。
 */
@Entity
@Table(name = "companies")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Company {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    @Column(nullable = false, unique = true)
    private String slug;

    private String email;

    private String phone;

    private Long ownerUserId;

    @Builder.Default
    private boolean active = true;

    // 公司资料向导已完成
    @Builder.Default
    private boolean completed = false;

    private Long planId;

    @Enumerated(EnumType.STRING)
    @Column(length = 20)
    private SubscriptionStatus subscriptionStatus;

    private LocalDateTime subscriptionStartDate;

    private LocalDateTime subscriptionEndDate;

    @Builder.Default
    private boolean trialActive = false;

    private LocalDateTime trialEndsAt;

    @CreationTimestamp
    private LocalDateTime createdAt;
}
