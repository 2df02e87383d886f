package com.example.billinghook.service.notify;

import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;

/**
 * 通过 {@link JavaMailSender} 发送邮件，仅在配置了 spring.mail.host 时启用。
 */
@Slf4j
public class SmtpNotifier implements Notifier {

    private final JavaMailSender mailSender;
    private final String from;

    public SmtpNotifier(JavaMailSender mailSender, String from) {
        this.mailSender = mailSender;
        this.from = from;
    }

    @Override
    public boolean send(String to, String subject, String html, String text) {
        try {
            MimeMessage mimeMessage = mailSender.createMimeMessage();
            MimeMessageHelper helper = new MimeMessageHelper(mimeMessage, true, "UTF-8");
            helper.setFrom(from);
            helper.setTo(to);
            helper.setSubject(subject);
            helper.setText(text, html);
            mailSender.send(mimeMessage);
            log.debug("Access email sent to {}", to);
            return true;
        } catch (MailException | MessagingException e) {
            log.warn("Failed to send email to {}: {}", to, e.getMessage());
            return false;
        }
    }
}
