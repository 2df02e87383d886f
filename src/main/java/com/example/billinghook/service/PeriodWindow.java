package com.example.billinghook.service;

import java.time.LocalDateTime;

/**
 * 新的订阅有效期。
 *
 * @param start             起始时间
 * @param end               结束时间
 * @param activeWindowValid 处理前公司已有仍有效的付费周期（续费叠加在其结束时间之后）
 */
public record PeriodWindow(LocalDateTime start, LocalDateTime end, boolean activeWindowValid) {
}
