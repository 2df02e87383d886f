package com.example.billinghook.service.resolve;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * 按顺序尝试各条规则，第一条命中的结果即为最终结果，之后的规则不再执行。
 *
 * @param <C> 上下文类型
 * @param <T> 解析结果类型
 */
@Slf4j
public final class FirstMatch<C, T> {

    private final String subject;
    private final List<NamedStep<C, T>> steps;

    private FirstMatch(String subject, List<NamedStep<C, T>> steps) {
        this.subject = subject;
        this.steps = Collections.unmodifiableList(steps);
    }

    public static <C, T> Builder<C, T> of(String subject) {
        return new Builder<>(subject);
    }

    public Optional<T> resolve(C context) {
        for (NamedStep<C, T> step : steps) {
            Optional<T> result = step.step().resolve(context);
            if (result.isPresent()) {
                log.debug("{} resolved by rule '{}'", subject, step.name());
                return result;
            }
        }
        log.debug("{} not resolved by any of {} rules", subject, steps.size());
        return Optional.empty();
    }

    public List<String> ruleNames() {
        return steps.stream().map(NamedStep::name).toList();
    }

    private record NamedStep<C, T>(String name, ResolutionStep<C, T> step) {
    }

    public static final class Builder<C, T> {

        private final String subject;
        private final List<NamedStep<C, T>> steps = new ArrayList<>();

        private Builder(String subject) {
            this.subject = subject;
        }

        public Builder<C, T> then(String name, ResolutionStep<C, T> step) {
            steps.add(new NamedStep<>(name, step));
            return this;
        }

        public FirstMatch<C, T> build() {
            return new FirstMatch<>(subject, new ArrayList<>(steps));
        }
    }
}
