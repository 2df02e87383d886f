package com.example.billinghook.exception;

/**
 * 身份服务或数据存储调用失败。事件不会被标记为已处理，返回 5xx 让网关重试。
 */
public class ProvisioningException extends RuntimeException {

    public ProvisioningException(String message, Throwable cause) {
        super(message, cause);
    }

    public ProvisioningException(String message) {
        super(message);
    }
}
