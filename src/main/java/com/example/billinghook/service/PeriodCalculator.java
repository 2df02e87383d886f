package com.example.billinghook.service;

import com.example.billinghook.config.ProvisioningProperties;
import com.example.billinghook.model.BillingPeriod;
import com.example.billinghook.model.Company;
import com.example.billinghook.model.Plan;
import com.example.billinghook.model.Subscription;
import com.example.billinghook.model.SubscriptionStatus;
import com.example.billinghook.service.payload.CaktoPayload;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * 订阅周期计算。
 * <p>
 * 起始时间：仍有效的付费周期结束时间 → 仍有效的试用结束时间 → 事件自带的周期开始时间 → 当前时间。
 * 周期长度取套餐天数，套餐没有时按事件中的周期字段推断。
 * <p>
 * 同一次购买常被网关以多个事件上报（如 purchase_approved 与 subscription_active），
 * 这种重复开通保留当前周期，只有续费事件或时间窗外的事件才叠加。
 */
@Component
public class PeriodCalculator {

    static final int DEFAULT_PERIOD_DAYS = 30;

    private final Clock clock;
    private final ProvisioningProperties provisioningProperties;

    public PeriodCalculator(Clock clock, ProvisioningProperties provisioningProperties) {
        this.clock = clock;
        this.provisioningProperties = provisioningProperties;
    }

    /**
     * 计算本次事件应用后的周期。
     *
     * @param existing 已关联该网关订阅 ID 的订阅行，可为空
     */
    public PeriodWindow resolve(Company company, boolean companyCreated, Plan plan, CaktoPayload payload,
            Subscription existing) {
        if (!companyCreated && isRepeatedActivation(existing, payload.getEventName())) {
            LocalDateTime start = company.getSubscriptionStartDate() != null
                    ? company.getSubscriptionStartDate()
                    : LocalDateTime.now(clock);
            return new PeriodWindow(start, existing.getCurrentPeriodEndsAt(), true);
        }
        return resolveNewPeriod(company, companyCreated, plan, payload);
    }

    boolean isRepeatedActivation(Subscription existing, String eventName) {
        if (existing == null || existing.getStatus() != SubscriptionStatus.ACTIVE
                || existing.getLastAppliedAt() == null || existing.getCurrentPeriodEndsAt() == null) {
            return false;
        }
        if (EventClassifier.isRenewal(eventName) || EventClassifier.isRenewal(existing.getLastEventType())) {
            return false;
        }
        LocalDateTime now = LocalDateTime.now(clock);
        return existing.getCurrentPeriodEndsAt().isAfter(now)
                && existing.getLastAppliedAt().isAfter(now.minus(provisioningProperties.getActivationMergeWindow()));
    }

    public PeriodWindow resolveNewPeriod(Company company, boolean companyCreated, Plan plan, CaktoPayload payload) {
        LocalDateTime now = LocalDateTime.now(clock);

        boolean activeValid = !companyCreated
                && company.getSubscriptionStatus() == SubscriptionStatus.ACTIVE
                && company.getSubscriptionEndDate() != null
                && company.getSubscriptionEndDate().isAfter(now);
        boolean trialValid = !companyCreated
                && company.getTrialEndsAt() != null
                && company.getTrialEndsAt().isAfter(now);

        LocalDateTime start;
        if (activeValid) {
            start = company.getSubscriptionEndDate();
        } else if (trialValid) {
            start = company.getTrialEndsAt();
        } else if (payload.getPeriodStart() != null) {
            start = payload.getPeriodStart();
        } else {
            start = now;
        }
        return new PeriodWindow(start, start.plusDays(periodDays(plan, payload)), activeValid);
    }

    static int periodDays(Plan plan, CaktoPayload payload) {
        if (plan != null && plan.getPeriodDays() != null && plan.getPeriodDays() > 0) {
            return plan.getPeriodDays();
        }
        if (payload.getOfferIntervalType() != null || payload.getOfferInterval() != null) {
            int count = payload.getOfferInterval() == null ? 1 : Math.max(1, payload.getOfferInterval());
            return BillingPeriod.fromIntervalType(payload.getOfferIntervalType()).getDaysPerInterval() * count;
        }
        return DEFAULT_PERIOD_DAYS;
    }
}
