package com.example.billinghook.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;

/**
 * 应用侧用户档案，主键与身份 ID 相同。
 */
@Entity
@Table(name = "profiles")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Profile {

    @Id
    private Long id;

    private String fullName;

    private Long companyId;

    @Builder.Default
    private boolean forcePasswordChange = false;

    // 首次登录时强制进入公司资料向导
    @Builder.Default
    private boolean mustCompleteCompanyDetails = false;

    @UpdateTimestamp
    private LocalDateTime updatedAt;
}
