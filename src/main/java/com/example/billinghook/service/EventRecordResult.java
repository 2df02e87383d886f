package com.example.billinghook.service;

/**
 * 台账登记结果。
 *
 * @param isNew            本次首次登记
 * @param alreadyProcessed 已存在且已处理完毕（直接短路）
 * @param inFlight         并发登记冲突，另一次投递正在处理
 */
public record EventRecordResult(boolean isNew, boolean alreadyProcessed, boolean inFlight) {

    public static EventRecordResult recorded() {
        return new EventRecordResult(true, false, false);
    }

    /** 之前登记过但未完成，例如上次处理中途失败。 */
    public static EventRecordResult pendingRetry() {
        return new EventRecordResult(false, false, false);
    }

    public static EventRecordResult processed() {
        return new EventRecordResult(false, true, false);
    }

    public static EventRecordResult concurrent() {
        return new EventRecordResult(false, false, true);
    }
}
