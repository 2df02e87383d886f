package com.example.billinghook.service.resolve;

import java.util.Optional;

/**
 * 解析链中的一条规则：命中返回值，未命中返回 empty。
 *
 * @param <C> 上下文类型
 * @param <T> 解析结果类型
 */
@FunctionalInterface
public interface ResolutionStep<C, T> {

    Optional<T> resolve(C context);
}
