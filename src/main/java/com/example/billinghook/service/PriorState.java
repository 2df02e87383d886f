package com.example.billinghook.service;

/**
 * 写入前的既有状态，每次处理只计算一次并贯穿整个写入过程。
 *
 * @param hadPaidSubscription      公司此前已有过付费订阅（不含试用）
 * @param checkoutAlreadyCompleted 涉及的结账会话此前已完成
 */
public record PriorState(boolean hadPaidSubscription, boolean checkoutAlreadyCompleted) {

    /**
     * 只在首次真正开通时发送访问邮件，续费不再发送。
     */
    public boolean shouldNotify() {
        return !hadPaidSubscription && !checkoutAlreadyCompleted;
    }
}
