package com.example.billinghook.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 将网关的自由格式事件名与状态字段归约为 {@link LifecycleOutcome}。
 * <p>
 * 事件名规则与状态信号相互独立，任一判定为 ACTIVE 即为 ACTIVE。
 */
@Component
@Slf4j
public class EventClassifier {

    static final List<ClassificationRule> DEFAULT_RULES = List.of(
            ClassificationRule.of(LifecycleOutcome.ACTIVE,
                    Set.of("purchase", "payment", "order"), Set.of("approved", "paid")),
            ClassificationRule.of(LifecycleOutcome.ACTIVE,
                    Set.of("subscription"), Set.of("active", "renewed")));

    // 按整词匹配而不是子串："inactive"、"unpaid" 不算激活
    static final Set<String> ACTIVE_STATUS_TOKENS = Set.of("active", "approved", "paid");

    static final Set<String> RENEWAL_TOKENS = Set.of("renewed", "renewal");

    private final List<ClassificationRule> rules;

    public EventClassifier() {
        this(DEFAULT_RULES);
    }

    EventClassifier(List<ClassificationRule> rules) {
        this.rules = rules;
    }

    public LifecycleOutcome classify(String eventName, String status) {
        Set<String> eventTokens = tokens(eventName);
        for (ClassificationRule rule : rules) {
            if (rule.matches(eventTokens)) {
                return rule.outcome();
            }
        }
        Set<String> statusTokens = tokens(status);
        if (statusTokens.stream().anyMatch(ACTIVE_STATUS_TOKENS::contains)) {
            log.debug("Event '{}' classified active from status '{}'", eventName, status);
            return LifecycleOutcome.ACTIVE;
        }
        return LifecycleOutcome.IGNORED;
    }

    /**
     * 事件名是否表示周期续费（而不是首次开通）。
     */
    public static boolean isRenewal(String eventName) {
        return tokens(eventName).stream().anyMatch(RENEWAL_TOKENS::contains);
    }

    /**
     * 规范化：拆分驼峰，转小写，空白/下划线/连字符统一为点，再按点切词。
     */
    static String normalize(String value) {
        if (value == null) {
            return "";
        }
        return value.trim()
                .replaceAll("([a-z0-9])([A-Z])", "$1.$2")
                .toLowerCase(Locale.ROOT)
                .replaceAll("[\\s_\\-:/]+", ".");
    }

    static Set<String> tokens(String value) {
        String normalized = normalize(value);
        if (normalized.isEmpty()) {
            return Set.of();
        }
        return Arrays.stream(normalized.split("\\."))
                .filter(token -> !token.isEmpty())
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
