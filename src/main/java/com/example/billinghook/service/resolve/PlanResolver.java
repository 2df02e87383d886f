package com.example.billinghook.service.resolve;

import com.example.billinghook.config.CaktoProperties;
import com.example.billinghook.model.BillingPeriod;
import com.example.billinghook.model.CheckoutSession;
import com.example.billinghook.model.Plan;
import com.example.billinghook.model.Subscription;
import com.example.billinghook.repository.PlanRepository;
import com.example.billinghook.service.gateway.CaktoApiClient;
import com.example.billinghook.service.gateway.CaktoOffer;
import com.example.billinghook.service.payload.CaktoPayload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * 套餐解析：结账会话 → 报价 ID（裸 ID 与结账 URL 两种形式）→ 已有订阅的套餐；
 * 都未命中时按报价信息懒创建。
 */
@Component
@Slf4j
public class PlanResolver {

    private final PlanRepository planRepository;
    private final CaktoProperties caktoProperties;
    private final CaktoApiClient caktoApiClient;
    private final FirstMatch<ResolutionContext, Plan> chain;

    public PlanResolver(PlanRepository planRepository, CaktoProperties caktoProperties,
            CaktoApiClient caktoApiClient) {
        this.planRepository = planRepository;
        this.caktoProperties = caktoProperties;
        this.caktoApiClient = caktoApiClient;
        this.chain = FirstMatch.<ResolutionContext, Plan>of("plan")
                .then("checkout", ctx -> Optional.ofNullable(ctx.getCheckout())
                        .map(CheckoutSession::getPlanId)
                        .flatMap(planRepository::findById))
                .then("offer-id", ctx -> findByOfferId(ctx.getPayload().getOfferId()))
                .then("existing-subscription", ctx -> Optional.ofNullable(ctx.getExistingSubscription())
                        .map(Subscription::getPlanId)
                        .flatMap(planRepository::findById))
                .build();
    }

    public Optional<Plan> find(ResolutionContext ctx) {
        return chain.resolve(ctx);
    }

    public Optional<Plan> findByOfferId(String offerId) {
        if (offerId == null || offerId.isBlank()) {
            return Optional.empty();
        }
        Set<String> candidates = new LinkedHashSet<>();
        candidates.add(offerId.trim());
        candidates.add(caktoProperties.toCheckoutUrl(offerId));
        return planRepository.findFirstByCaktoPlanIdInOrderByIdAsc(candidates);
    }

    /**
     * 按事件中的报价信息创建套餐。事件未带报价名称且已配置网关 API 时，先查询报价详情补全。
     * 报价 ID 唯一约束保证并发创建时只保留一行。
     */
    public Plan materialize(CaktoPayload payload) {
        String offerId = payload.getOfferId().trim();
        Optional<Plan> existing = findByOfferId(offerId);
        if (existing.isPresent()) {
            return existing.get();
        }

        CaktoOffer offer = payload.getOfferName() == null
                ? caktoApiClient.fetchOffer(offerId).orElse(null)
                : null;

        String name = firstNonBlank(payload.getOfferName(), offer != null ? offer.name() : null, "Plano " + offerId);
        BigDecimal price = payload.getOfferPrice() != null ? payload.getOfferPrice()
                : offer != null && offer.price() != null ? offer.price() : BigDecimal.ZERO;
        String intervalType = firstNonBlank(payload.getOfferIntervalType(),
                offer != null ? offer.intervalType() : null, null);
        Integer interval = payload.getOfferInterval() != null ? payload.getOfferInterval()
                : offer != null ? offer.interval() : null;

        BillingPeriod billingPeriod = BillingPeriod.fromIntervalType(intervalType);
        int periodDays = billingPeriod.getDaysPerInterval() * Math.max(1, interval == null ? 1 : interval);

        Plan plan = planRepository.saveAndFlush(Plan.builder()
                .caktoPlanId(offerId)
                .name(name)
                .price(price)
                .billingPeriod(billingPeriod)
                .periodDays(periodDays)
                .build());
        log.info("Created plan {} for unknown offer {} ({}, {} days)", plan.getId(), offerId, billingPeriod,
                periodDays);
        return plan;
    }

    private static String firstNonBlank(String first, String second, String fallback) {
        if (first != null && !first.isBlank()) {
            return first;
        }
        if (second != null && !second.isBlank()) {
            return second;
        }
        return fallback;
    }
}
