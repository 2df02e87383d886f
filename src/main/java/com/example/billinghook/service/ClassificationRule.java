package com.example.billinghook.service;

import java.util.List;
import java.util.Set;

/**
 * 分类规则：每个关键词组至少命中一个词时，事件被归为 {@code outcome}。
 *
 * @param keywordGroups 关键词组（组间为与，组内为或）
 * @param outcome       命中后的结果
 */
public record ClassificationRule(List<Set<String>> keywordGroups, LifecycleOutcome outcome) {

    @SafeVarargs
    public static ClassificationRule of(LifecycleOutcome outcome, Set<String>... keywordGroups) {
        return new ClassificationRule(List.of(keywordGroups), outcome);
    }

    public boolean matches(Set<String> tokens) {
        for (Set<String> group : keywordGroups) {
            if (group.stream().noneMatch(tokens::contains)) {
                return false;
            }
        }
        return true;
    }
}
