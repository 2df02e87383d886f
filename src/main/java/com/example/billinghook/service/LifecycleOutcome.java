package com.example.billinghook.service;

/**
 * 事件分类后的规范生命周期结果。
 */
public enum LifecycleOutcome {
    ACTIVE,
    IGNORED
}
