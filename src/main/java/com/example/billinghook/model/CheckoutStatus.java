package com.example.billinghook.model;

import java.util.EnumSet;
import java.util.Set;

public enum CheckoutStatus {
    CREATED,
    PENDING,
    PAID,
    ACTIVE,
    COMPLETED;

    /**
     * 尚未付款的会话，同一邮箱与套餐下只允许存在一个。
     */
    public static final Set<CheckoutStatus> OPEN = EnumSet.of(CREATED, PENDING);

    /**
     * Webhook 回退匹配可以绑定的会话（含已付款但尚未开通的）。
     */
    public static final Set<CheckoutStatus> NON_TERMINAL = EnumSet.of(CREATED, PENDING, PAID);

    public static final Set<CheckoutStatus> TERMINAL = EnumSet.of(ACTIVE, COMPLETED);

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }
}
