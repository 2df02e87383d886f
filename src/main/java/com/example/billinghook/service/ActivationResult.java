package com.example.billinghook.service;

import com.example.billinghook.service.notify.AccessEmail;

/**
 * 开通事务的结果。
 *
 * @param outcome      终态
 * @param notification 需要在事务提交后发送的访问邮件，不需要时为 null
 */
public record ActivationResult(WebhookOutcome outcome, AccessEmail notification) {

    public static ActivationResult of(WebhookOutcome outcome) {
        return new ActivationResult(outcome, null);
    }
}
