package com.example.billinghook.service.notify;

import org.springframework.web.util.HtmlUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * 开通通知邮件正文（葡萄牙语，面向巴西客户）。
 */
final class AccessEmailComposer {

    private AccessEmailComposer() {
    }

    static String loginUrl(String appUrl) {
        String base = appUrl.endsWith("/") ? appUrl.substring(0, appUrl.length() - 1) : appUrl;
        return base + "/auth";
    }

    static String text(AccessEmail email, String loginUrl) {
        List<String> lines = new ArrayList<>();
        lines.add("Ola " + displayName(email) + ",");
        lines.add("");
        lines.add("Sua assinatura foi ativada.");
        if (email.companyName() != null) {
            lines.add("Empresa: " + email.companyName());
        }
        lines.add("Acesse o sistema: " + loginUrl);
        lines.add("Email de acesso: " + email.email());
        lines.add(passwordLine(email));
        lines.add("");
        lines.add("No primeiro login, altere sua senha.");
        return String.join("\n", lines);
    }

    static String html(AccessEmail email, String loginUrl) {
        String url = HtmlUtils.htmlEscape(loginUrl);
        StringBuilder sb = new StringBuilder("<div>");
        sb.append("<p>Ola ").append(HtmlUtils.htmlEscape(displayName(email))).append(",</p>");
        sb.append("<p>Sua assinatura foi ativada.</p>");
        if (email.companyName() != null) {
            sb.append("<p><strong>Empresa:</strong> ").append(HtmlUtils.htmlEscape(email.companyName()))
                    .append("</p>");
        }
        sb.append("<p><strong>Login:</strong> <a href=\"").append(url).append("\">").append(url).append("</a></p>");
        sb.append("<p><strong>Email de acesso:</strong> ").append(HtmlUtils.htmlEscape(email.email()))
                .append("</p>");
        sb.append("<p>").append(HtmlUtils.htmlEscape(passwordLine(email))).append("</p>");
        sb.append("<p>No primeiro login, altere sua senha.</p>");
        return sb.append("</div>").toString();
    }

    private static String displayName(AccessEmail email) {
        return email.fullName() != null ? email.fullName() : email.email();
    }

    private static String passwordLine(AccessEmail email) {
        return email.temporaryPassword() != null
                ? "Senha temporaria: " + email.temporaryPassword()
                : "Sua conta ja existe. Use sua senha atual.";
    }
}
