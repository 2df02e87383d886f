package com.example.billinghook.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 管理接口（事件台账查询与重放）的访问凭据。
 */
@ConfigurationProperties(prefix = "billing.admin")
@Data
public class AdminProperties {

    private String username = "admin";

    /**
     * 未设置密码时管理接口全部拒绝访问，不再生成默认密码。
     */
    private String password;
}
