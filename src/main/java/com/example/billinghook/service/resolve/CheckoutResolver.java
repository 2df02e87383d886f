package com.example.billinghook.service.resolve;

import com.example.billinghook.config.ProvisioningProperties;
import com.example.billinghook.model.CheckoutSession;
import com.example.billinghook.model.CheckoutStatus;
import com.example.billinghook.repository.CheckoutSessionRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * 结账会话解析。显式 token 优先；没有 token 时在套餐和邮箱解析之后走回退链：
 * 邮箱+套餐下最新的未完成会话（含已付款）→ 仅按邮箱的最新未完成或近期完成会话。
 */
@Component
@Slf4j
public class CheckoutResolver {

    private static final Comparator<CheckoutSession> NEWEST_FIRST = Comparator
            .comparing(CheckoutSession::getCreatedAt, Comparator.nullsFirst(Comparator.<LocalDateTime>naturalOrder()))
            .thenComparing(CheckoutSession::getId, Comparator.nullsFirst(Comparator.<Long>naturalOrder()))
            .reversed();

    private final CheckoutSessionRepository checkoutRepository;
    private final ProvisioningProperties provisioningProperties;
    private final Clock clock;
    private final FirstMatch<ResolutionContext, CheckoutSession> chain;

    public CheckoutResolver(CheckoutSessionRepository checkoutRepository,
            ProvisioningProperties provisioningProperties, Clock clock) {
        this.checkoutRepository = checkoutRepository;
        this.provisioningProperties = provisioningProperties;
        this.clock = clock;
        this.chain = FirstMatch.<ResolutionContext, CheckoutSession>of("checkout fallback")
                .then("email-and-plan", this::openForEmailAndPlan)
                .then("email-only", this::latestForEmail)
                .build();
    }

    public Optional<CheckoutSession> fallback(ResolutionContext ctx) {
        return chain.resolve(ctx);
    }

    public Optional<CheckoutSession> byToken(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        return checkoutRepository.findByToken(token.trim());
    }

    private Optional<CheckoutSession> openForEmailAndPlan(ResolutionContext ctx) {
        if (ctx.getEmail() == null || ctx.getPlan() == null) {
            return Optional.empty();
        }
        return checkoutRepository.findFirstByEmailAndPlanIdAndStatusInOrderByCreatedAtDescIdDesc(
                ctx.getEmail(), ctx.getPlan().getId(), CheckoutStatus.NON_TERMINAL);
    }

    /**
     * 已知套餐时，绑定了其他套餐的候选会话被忽略。
     */
    private Optional<CheckoutSession> latestForEmail(ResolutionContext ctx) {
        if (ctx.getEmail() == null) {
            return Optional.empty();
        }
        LocalDateTime recentSince = LocalDateTime.now(clock).minus(provisioningProperties.getRecentCheckoutWindow());
        Optional<CheckoutSession> candidate = Stream.of(
                checkoutRepository.findFirstByEmailAndStatusInOrderByCreatedAtDescIdDesc(
                        ctx.getEmail(), CheckoutStatus.NON_TERMINAL),
                checkoutRepository.findFirstByEmailAndStatusInAndUpdatedAtAfterOrderByUpdatedAtDescIdDesc(
                        ctx.getEmail(), CheckoutStatus.TERMINAL, recentSince))
                .flatMap(Optional::stream)
                .min(NEWEST_FIRST);

        if (candidate.isPresent() && ctx.getPlan() != null && candidate.get().getPlanId() != null
                && !Objects.equals(candidate.get().getPlanId(), ctx.getPlan().getId())) {
            log.debug("Ignoring checkout {} bound to another plan", candidate.get().getId());
            return Optional.empty();
        }
        return candidate;
    }
}
