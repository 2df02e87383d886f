package com.example.billinghook.model;

public enum BillingPeriod {
    MONTHLY(30),
    YEARLY(365);

    private final int daysPerInterval;

    BillingPeriod(int daysPerInterval) {
        this.daysPerInterval = daysPerInterval;
    }

    public int getDaysPerInterval() {
        return daysPerInterval;
    }

    /**
     * 根据网关的周期类型推断计费周期：包含 "year" 即为年付，否则按月。
     *
     * @param intervalType 周期类型，如 "month"、"yearly"
     * @return 计费周期
     */
    public static BillingPeriod fromIntervalType(String intervalType) {
        if (intervalType != null && intervalType.toLowerCase().contains("year")) {
            return YEARLY;
        }
        return MONTHLY;
    }
}
