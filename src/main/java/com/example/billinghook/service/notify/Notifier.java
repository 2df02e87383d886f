package com.example.billinghook.service.notify;

/**
 * 邮件发送通道。
 */
public interface Notifier {

    /**
     * 发送一封邮件。
     *
     * @return 是否发送成功；失败不抛异常
     */
    boolean send(String to, String subject, String html, String text);
}
