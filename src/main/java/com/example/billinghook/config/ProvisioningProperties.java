package com.example.billinghook.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "billing.provisioning")
@Data
public class ProvisioningProperties {

    /**
     * 已完成的结账会话在该时间窗内仍参与仅按邮箱的回退匹配。
     */
    private Duration recentCheckoutWindow = Duration.ofHours(24);

    /**
     * 同一网关订阅在该时间窗内重复上报的开通事件（非续费）不再叠加周期。
     */
    private Duration activationMergeWindow = Duration.ofHours(24);

    private int tempPasswordLength = 12;

    private String defaultRole = "admin";
}
