package com.example.billinghook.service;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * 一次投递的终态。除认证与依赖失败外，所有结果都以 200 返回给网关。
 */
public enum WebhookOutcome {
    PROCESSED("PROCESSED"),
    IGNORED("IGNORED"),
    SKIPPED("SKIPPED"),
    DUPLICATE("DUPLICATE"),
    IN_FLIGHT(null);

    private final String ledgerStatus;

    WebhookOutcome(String ledgerStatus) {
        this.ledgerStatus = ledgerStatus;
    }

    /**
     * 写入台账的状态；IN_FLIGHT 不写台账。
     */
    public String getLedgerStatus() {
        return ledgerStatus;
    }

    public String metricTag() {
        return name().toLowerCase(Locale.ROOT);
    }

    public Map<String, Object> toResponseBody() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("ok", true);
        switch (this) {
            case IGNORED -> body.put("ignored", true);
            case SKIPPED -> body.put("skipped", true);
            case DUPLICATE -> body.put("duplicate", true);
            case IN_FLIGHT -> {
                body.put("duplicate", true);
                body.put("inFlight", true);
            }
            default -> {
            }
        }
        return body;
    }
}
