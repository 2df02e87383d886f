package com.example.billinghook.service.resolve;

public enum ResolutionOutcome {
    RESOLVED,
    /** 结账会话已是终态，同一次完成的重复通知。 */
    DUPLICATE,
    /** 缺少邮箱、套餐或网关订阅 ID。 */
    SKIPPED,
    /** 本事件已写入订阅行，只差标记完成。 */
    ALREADY_APPLIED
}
