package com.example.billinghook.service;

import com.example.billinghook.config.CaktoProperties;
import com.example.billinghook.exception.CheckoutException;
import com.example.billinghook.model.CheckoutSession;
import com.example.billinghook.model.CheckoutStatus;
import com.example.billinghook.model.Plan;
import com.example.billinghook.repository.CheckoutSessionRepository;
import com.example.billinghook.repository.PlanRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Locale;
import java.util.UUID;

/**
 * 创建与查询结账会话。支付完成后的 Webhook 通过会话 token 或邮箱+套餐找回它。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CheckoutService {

    private final PlanRepository planRepository;
    private final CheckoutSessionRepository checkoutRepository;
    private final CaktoProperties caktoProperties;
    private final Clock clock;

    public record CreatedCheckout(String token, String checkoutUrl) {
    }

    @Transactional
    public CreatedCheckout create(Long planId, String email, String fullName, String companyName) {
        if (planId == null || email == null || email.isBlank()) {
            throw new CheckoutException(HttpStatus.BAD_REQUEST, "plan_id and email are required");
        }
        String normalizedEmail = email.trim().toLowerCase(Locale.ROOT);
        if (normalizedEmail.indexOf('@') <= 0) {
            throw new CheckoutException(HttpStatus.BAD_REQUEST, "Invalid email");
        }

        Plan plan = planRepository.findById(planId)
                .filter(Plan::isActive)
                .orElseThrow(() -> new CheckoutException(HttpStatus.NOT_FOUND, "Plan not found"));
        String checkoutUrl = caktoProperties.toCheckoutUrl(plan.getCaktoPlanId());
        if (checkoutUrl == null) {
            throw new CheckoutException(HttpStatus.NOT_FOUND, "Plan has no gateway offer");
        }

        if (checkoutRepository.existsByEmailAndPlanIdAndStatusIn(normalizedEmail, planId, CheckoutStatus.OPEN)) {
            throw new CheckoutException(HttpStatus.CONFLICT, "A pending checkout already exists for this plan");
        }

        LocalDateTime now = LocalDateTime.now(clock);
        CheckoutSession checkout = checkoutRepository.save(CheckoutSession.builder()
                .token(UUID.randomUUID().toString())
                .planId(planId)
                .email(normalizedEmail)
                .fullName(blankToNull(fullName))
                .companyName(blankToNull(companyName))
                .status(CheckoutStatus.PENDING)
                .createdAt(now)
                .updatedAt(now)
                .build());
        log.info("Created checkout {} for plan {}", checkout.getId(), planId);
        return new CreatedCheckout(checkout.getToken(), checkoutUrl);
    }

    /**
     * 按 token 查询会话，供支付成功页轮询开通进度。
     */
    @Transactional(readOnly = true)
    public CheckoutSession findByToken(String token) {
        if (token == null || token.isBlank()) {
            throw new CheckoutException(HttpStatus.BAD_REQUEST, "Missing token");
        }
        return checkoutRepository.findByToken(token.trim())
                .orElseThrow(() -> new CheckoutException(HttpStatus.NOT_FOUND, "Checkout not found"));
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
