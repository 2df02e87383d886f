package com.example.billinghook.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;

/**
 * 本地身份存储中的登录账户。邮箱唯一（小写保存）。
 */
@Entity
@Table(name = "app_users")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AppUser {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(unique = true, nullable = false)
    private String email;

    @Column(nullable = false, length = 100)
    private String password; // BCrypt 编码后的密码

    private String fullName;

    @Builder.Default
    @Column(nullable = false)
    private boolean enabled = true;

    @Builder.Default
    @Column(nullable = false)
    private boolean forcePasswordChange = false;

    @Builder.Default
    @Column(nullable = false)
    private boolean mustCompleteCompanyDetails = false;

    @CreationTimestamp
    private LocalDateTime createdAt;
}
