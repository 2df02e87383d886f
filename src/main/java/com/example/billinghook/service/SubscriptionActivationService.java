package com.example.billinghook.service;

import com.example.billinghook.service.notify.AccessEmail;
import com.example.billinghook.service.payload.CaktoPayload;
import com.example.billinghook.service.resolve.EntityResolver;
import com.example.billinghook.service.resolve.ResolutionContext;
import com.example.billinghook.service.resolve.ResolutionOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * 在一个数据库事务中完成实体解析与开通写入。任何失败都整体回滚，由网关重试收敛。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SubscriptionActivationService {

    private final EntityResolver entityResolver;
    private final PeriodCalculator periodCalculator;
    private final ProvisioningWriter provisioningWriter;

    @Transactional
    public ActivationResult activate(String eventId, CaktoPayload payload) {
        ResolutionContext ctx = new ResolutionContext(eventId, payload);
        ResolutionOutcome resolution = entityResolver.resolve(ctx);

        switch (resolution) {
            case DUPLICATE:
                return ActivationResult.of(WebhookOutcome.DUPLICATE);
            case SKIPPED:
                return ActivationResult.of(WebhookOutcome.SKIPPED);
            case ALREADY_APPLIED:
                log.info("Event {} was already applied to subscription {}", eventId,
                        payload.getGatewaySubscriptionId());
                return ActivationResult.of(WebhookOutcome.PROCESSED);
            default:
                break;
        }

        PriorState prior = provisioningWriter.capturePriorState(ctx);
        PeriodWindow window = periodCalculator.resolve(ctx.getCompany(), ctx.isCompanyCreated(), ctx.getPlan(),
                payload, ctx.getExistingSubscription());
        provisioningWriter.apply(ctx, window);

        AccessEmail notification = prior.shouldNotify()
                ? new AccessEmail(ctx.getEmail(), ctx.getDisplayName(), ctx.getTemporaryPassword(),
                        ctx.getCompany().getName())
                : null;
        return new ActivationResult(WebhookOutcome.PROCESSED, notification);
    }
}
