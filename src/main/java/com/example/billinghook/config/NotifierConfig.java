package com.example.billinghook.config;

import com.example.billinghook.service.notify.LoggingNotifier;
import com.example.billinghook.service.notify.Notifier;
import com.example.billinghook.service.notify.SmtpNotifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.mail.javamail.JavaMailSender;

@Configuration
@Slf4j
public class NotifierConfig {

    /**
     * 配置了 spring.mail.host 时 Spring Boot 会提供 JavaMailSender，此时走 SMTP，否则只记日志。
     */
    @Bean
    public Notifier notifier(ObjectProvider<JavaMailSender> mailSender, NotificationProperties properties) {
        JavaMailSender sender = mailSender.getIfAvailable();
        if (sender == null) {
            log.info("No mail transport configured, access emails will only be logged");
            return new LoggingNotifier();
        }
        return new SmtpNotifier(sender, properties.getFrom());
    }
}
