package com.example.billinghook.service.notify;

import lombok.extern.slf4j.Slf4j;

/**
 * 未配置邮件服务时使用：只记录收件人与主题，不输出正文（正文含临时密码）。
 */
@Slf4j
public class LoggingNotifier implements Notifier {

    @Override
    public boolean send(String to, String subject, String html, String text) {
        log.warn("Mail transport not configured, email '{}' to {} was not sent", subject, to);
        return false;
    }
}
