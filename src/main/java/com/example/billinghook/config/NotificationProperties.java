package com.example.billinghook.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "billing.notification")
@Data
public class NotificationProperties {

    /**
     * 前端公开地址，登录链接为 {appUrl}/auth。
     */
    private String appUrl;

    private String from = "no-reply@localhost";

    private String subject = "Acesso liberado";
}
