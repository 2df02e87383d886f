package com.example.billinghook.service;

import com.example.billinghook.config.ProvisioningProperties;
import com.example.billinghook.model.CheckoutSession;
import com.example.billinghook.model.CheckoutStatus;
import com.example.billinghook.model.Company;
import com.example.billinghook.model.CompanyUser;
import com.example.billinghook.model.Profile;
import com.example.billinghook.model.Subscription;
import com.example.billinghook.model.SubscriptionStatus;
import com.example.billinghook.model.UserRole;
import com.example.billinghook.repository.CheckoutSessionRepository;
import com.example.billinghook.repository.CompanyRepository;
import com.example.billinghook.repository.CompanyUserRepository;
import com.example.billinghook.repository.ProfileRepository;
import com.example.billinghook.repository.SubscriptionRepository;
import com.example.billinghook.repository.UserRoleRepository;
import com.example.billinghook.service.identity.IdentityProvider;
import com.example.billinghook.service.payload.CaktoPayload;
import com.example.billinghook.service.resolve.ResolutionContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * 将解析结果写入各实体。每一步都是“查找后更新或仅在不存在时插入”，重试不会产生重复数据。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ProvisioningWriter {

    public static final String GATEWAY = "cakto";

    private final ProfileRepository profileRepository;
    private final UserRoleRepository userRoleRepository;
    private final CompanyUserRepository companyUserRepository;
    private final SubscriptionRepository subscriptionRepository;
    private final CompanyRepository companyRepository;
    private final CheckoutSessionRepository checkoutRepository;
    private final IdentityProvider identityProvider;
    private final ProvisioningProperties provisioningProperties;
    private final Clock clock;

    /**
     * 在任何写入之前采集既有状态。
     */
    public PriorState capturePriorState(ResolutionContext ctx) {
        boolean hadPaid = !ctx.isCompanyCreated()
                && subscriptionRepository.existsByCompanyIdAndStatusIn(ctx.getCompany().getId(), SubscriptionStatus.PAID);
        CheckoutSession checkout = ctx.getCheckout();
        boolean checkoutCompleted = checkout != null && checkout.getStatus() == CheckoutStatus.COMPLETED;
        return new PriorState(hadPaid, checkoutCompleted);
    }

    public void apply(ResolutionContext ctx, PeriodWindow window) {
        Company company = ctx.getCompany();
        Long userId = ctx.getUserId();

        upsertProfile(ctx, company);
        grantRole(userId);
        linkMembership(company.getId(), userId);
        upsertSubscription(ctx, window);
        updateCompany(ctx, company, window);
        completeCheckout(ctx);

        log.info("Provisioned subscription {} for company {} until {}", ctx.getGatewaySubscriptionId(),
                company.getId(), window.end());
    }

    private void upsertProfile(ResolutionContext ctx, Company company) {
        boolean mustCompleteCompany = !company.isCompleted();
        Profile profile = profileRepository.findById(ctx.getUserId())
                .orElseGet(() -> Profile.builder().id(ctx.getUserId()).build());
        if (profile.getFullName() == null) {
            profile.setFullName(ctx.getDisplayName());
        }
        profile.setCompanyId(company.getId());
        if (mustCompleteCompany) {
            profile.setMustCompleteCompanyDetails(true);
        }
        if (ctx.isNewLogin()) {
            profile.setForcePasswordChange(true);
        }
        profileRepository.save(profile);
        identityProvider.updateUserMetadata(ctx.getUserId(), ctx.isNewLogin(), mustCompleteCompany);
    }

    private void grantRole(Long userId) {
        String role = provisioningProperties.getDefaultRole();
        if (!userRoleRepository.existsByUserIdAndRole(userId, role)) {
            userRoleRepository.save(UserRole.builder().userId(userId).role(role).build());
        }
    }

    private void linkMembership(Long companyId, Long userId) {
        if (!companyUserRepository.existsByCompanyIdAndUserId(companyId, userId)) {
            companyUserRepository.save(CompanyUser.builder().companyId(companyId).userId(userId).build());
        }
    }

    /**
     * 按网关订阅 ID 匹配，其次公司当前的有效订阅，都没有则新建。
     */
    private void upsertSubscription(ResolutionContext ctx, PeriodWindow window) {
        CaktoPayload payload = ctx.getPayload();
        Long companyId = ctx.getCompany().getId();

        Subscription subscription = ctx.getExistingSubscription();
        if (subscription == null) {
            subscription = subscriptionRepository
                    .findFirstByCompanyIdAndStatusOrderByUpdatedAtDescIdDesc(companyId, SubscriptionStatus.ACTIVE)
                    .orElseGet(() -> Subscription.builder().companyId(companyId).build());
        }

        subscription.setUserId(ctx.getUserId());
        subscription.setCompanyId(companyId);
        subscription.setPlanId(ctx.getPlan().getId());
        subscription.setStatus(SubscriptionStatus.ACTIVE);
        subscription.setGateway(GATEWAY);
        subscription.setGatewaySubscriptionId(ctx.getGatewaySubscriptionId());
        subscription.setCurrentPeriodEndsAt(window.end());
        subscription.setTrialEndsAt(null);
        subscription.setLastEventId(ctx.getEventId());
        subscription.setLastEventType(payload.getEventName());
        subscription.setLastAppliedAt(LocalDateTime.now(clock));
        setIfPresent(payload.getOrderId(), subscription::setGatewayOrderId);
        setIfPresent(payload.getPaymentLinkUrl(), subscription::setPaymentLinkUrl);
        setIfPresent(payload.getPaymentStatus(), subscription::setLastPaymentStatus);
        setIfPresent(payload.getCustomerName(), subscription::setCustomerName);
        setIfPresent(ctx.getEmail(), subscription::setCustomerEmail);
        setIfPresent(payload.getCustomerPhone(), subscription::setCustomerPhone);
        setIfPresent(payload.getCustomerDocument(), subscription::setCustomerDocument);
        subscriptionRepository.save(subscription);
    }

    private void updateCompany(ResolutionContext ctx, Company company, PeriodWindow window) {
        company.setPlanId(ctx.getPlan().getId());
        company.setSubscriptionStatus(SubscriptionStatus.ACTIVE);
        company.setSubscriptionEndDate(window.end());
        // 仍在有效期内的续费保留原开始时间
        if (ctx.isCompanyCreated() || !window.activeWindowValid() || company.getSubscriptionStartDate() == null) {
            company.setSubscriptionStartDate(window.start());
        }
        company.setTrialActive(false);
        if (company.getOwnerUserId() == null) {
            company.setOwnerUserId(ctx.getUserId());
        }
        if (isBlank(company.getPhone())) {
            setIfPresent(ctx.getPayload().getCustomerPhone(), company::setPhone);
        }
        if (isBlank(company.getEmail())) {
            setIfPresent(ctx.getEmail(), company::setEmail);
        }
        companyRepository.save(company);
    }

    private void completeCheckout(ResolutionContext ctx) {
        CheckoutSession checkout = ctx.getCheckout();
        if (checkout == null) {
            return;
        }
        checkout.setStatus(CheckoutStatus.COMPLETED);
        checkout.setUserId(ctx.getUserId());
        checkout.setCompanyId(ctx.getCompany().getId());
        checkout.setGatewaySubscriptionId(ctx.getGatewaySubscriptionId());
        if (checkout.getPlanId() == null) {
            checkout.setPlanId(ctx.getPlan().getId());
        }
        checkout.setUpdatedAt(LocalDateTime.now(clock));
        checkoutRepository.save(checkout);
    }

    private static void setIfPresent(String value, java.util.function.Consumer<String> setter) {
        if (!isBlank(value)) {
            setter.accept(value);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
