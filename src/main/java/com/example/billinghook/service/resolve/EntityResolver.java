package com.example.billinghook.service.resolve;

import com.example.billinghook.model.CheckoutSession;
import com.example.billinghook.model.Plan;
import com.example.billinghook.model.Subscription;
import com.example.billinghook.repository.PlanRepository;
import com.example.billinghook.repository.SubscriptionRepository;
import com.example.billinghook.service.payload.CaktoPayload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Optional;

/**
 * 由事件字段解析出套餐、邮箱、结账会话、用户与公司。
 * <p>
 * 所有查找在重复执行时结果一致；创建操作依赖唯一键，并发重复创建会失败而不是产生两份数据。
 */
@Service
@Slf4j
public class EntityResolver {

    private final SubscriptionRepository subscriptionRepository;
    private final PlanRepository planRepository;
    private final PlanResolver planResolver;
    private final CheckoutResolver checkoutResolver;
    private final UserResolver userResolver;
    private final CompanyResolver companyResolver;
    private final FirstMatch<ResolutionContext, String> emailChain;

    public EntityResolver(SubscriptionRepository subscriptionRepository, PlanRepository planRepository,
            PlanResolver planResolver, CheckoutResolver checkoutResolver, UserResolver userResolver,
            CompanyResolver companyResolver) {
        this.subscriptionRepository = subscriptionRepository;
        this.planRepository = planRepository;
        this.planResolver = planResolver;
        this.checkoutResolver = checkoutResolver;
        this.userResolver = userResolver;
        this.companyResolver = companyResolver;
        // 结账会话中的邮箱优先，防止网关重试时换了邮箱
        this.emailChain = FirstMatch.<ResolutionContext, String>of("email")
                .then("checkout", ctx -> Optional.ofNullable(ctx.getCheckout())
                        .map(CheckoutSession::getEmail)
                        .flatMap(EntityResolver::normalizeEmail))
                .then("payload", ctx -> normalizeEmail(ctx.getPayload().getCustomerEmail()))
                .then("existing-subscription", ctx -> Optional.ofNullable(ctx.getExistingSubscription())
                        .map(Subscription::getCustomerEmail)
                        .flatMap(EntityResolver::normalizeEmail))
                .build();
    }

    public ResolutionOutcome resolve(ResolutionContext ctx) {
        CaktoPayload payload = ctx.getPayload();
        String gatewaySubscriptionId = payload.getGatewaySubscriptionId();

        if (gatewaySubscriptionId != null) {
            subscriptionRepository.findByGatewaySubscriptionId(gatewaySubscriptionId)
                    .ifPresent(ctx::setExistingSubscription);
        }
        Subscription existing = ctx.getExistingSubscription();
        if (existing != null && ctx.getEventId().equals(existing.getLastEventId())) {
            return ResolutionOutcome.ALREADY_APPLIED;
        }

        checkoutResolver.byToken(payload.getCheckoutToken()).ifPresent(ctx::setCheckout);
        planResolver.find(ctx).ifPresent(ctx::setPlan);
        emailChain.resolve(ctx).ifPresent(ctx::setEmail);

        if (ctx.getCheckout() == null) {
            checkoutResolver.fallback(ctx).ifPresent(ctx::setCheckout);
            adoptCheckoutPlan(ctx);
        }

        CheckoutSession checkout = ctx.getCheckout();
        if (checkout != null && checkout.getStatus().isTerminal()) {
            log.info("Checkout {} already {}, event {} is a duplicate completion", checkout.getId(),
                    checkout.getStatus(), ctx.getEventId());
            return ResolutionOutcome.DUPLICATE;
        }

        if (ctx.getEmail() == null || gatewaySubscriptionId == null) {
            log.info("Event {} skipped: email present={}, subscription id present={}", ctx.getEventId(),
                    ctx.getEmail() != null, gatewaySubscriptionId != null);
            return ResolutionOutcome.SKIPPED;
        }
        if (ctx.getPlan() == null && payload.getOfferId() != null) {
            ctx.setPlan(planResolver.materialize(payload));
        }
        if (ctx.getPlan() == null) {
            log.info("Event {} skipped: no plan could be resolved", ctx.getEventId());
            return ResolutionOutcome.SKIPPED;
        }

        userResolver.resolve(ctx);
        companyResolver.resolve(ctx);
        return ResolutionOutcome.RESOLVED;
    }

    private void adoptCheckoutPlan(ResolutionContext ctx) {
        CheckoutSession checkout = ctx.getCheckout();
        if (ctx.getPlan() == null && checkout != null && checkout.getPlanId() != null) {
            planRepository.findById(checkout.getPlanId()).ifPresent(ctx::setPlan);
        }
    }

    /**
     * 去空白、转小写，且必须包含 @。
     */
    static Optional<String> normalizeEmail(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String email = value.trim().toLowerCase(Locale.ROOT);
        return email.indexOf('@') > 0 ? Optional.of(email) : Optional.empty();
    }
}
