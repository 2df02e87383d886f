package com.example.billinghook.service.notify;

import com.example.billinghook.config.NotificationProperties;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 发送开通通知。尽力而为：任何失败只记录日志，不影响开通结果。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccessNotificationService {

    static final String METRIC_NAME = "billing.notification.sent";

    private final Notifier notifier;
    private final NotificationProperties notificationProperties;
    private final MeterRegistry meterRegistry;

    public boolean sendAccessEmail(AccessEmail email) {
        String appUrl = notificationProperties.getAppUrl();
        if (appUrl == null || appUrl.isBlank()) {
            log.warn("billing.notification.app-url is not set, skipping access email to {}", email.email());
            return false;
        }
        String loginUrl = AccessEmailComposer.loginUrl(appUrl.trim());

        boolean sent;
        try {
            sent = notifier.send(email.email(), notificationProperties.getSubject(),
                    AccessEmailComposer.html(email, loginUrl), AccessEmailComposer.text(email, loginUrl));
        } catch (RuntimeException e) {
            log.warn("Notifier failed for {}", email.email(), e);
            sent = false;
        }
        meterRegistry.counter(METRIC_NAME, "result", sent ? "sent" : "failed").increment();
        if (sent) {
            log.info("Access email sent to {}", email.email());
        }
        return sent;
    }
}
