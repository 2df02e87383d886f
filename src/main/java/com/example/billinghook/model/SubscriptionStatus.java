package com.example.billinghook.model;

import java.util.EnumSet;
import java.util.Set;

public enum SubscriptionStatus {
    PENDING,
    TRIAL,
    ACTIVE,
    CANCELED,
    EXPIRED;

    /**
     * 付费订阅的状态（试用与待支付不计入）。
     */
    public static final Set<SubscriptionStatus> PAID = EnumSet.of(ACTIVE, CANCELED, EXPIRED);
}
