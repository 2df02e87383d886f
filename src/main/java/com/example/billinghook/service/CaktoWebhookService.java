package com.example.billinghook.service;

import com.example.billinghook.exception.ProvisioningException;
import com.example.billinghook.exception.WebhookAuthenticationException;
import com.example.billinghook.exception.WebhookPayloadException;
import com.example.billinghook.model.WebhookEvent;
import com.example.billinghook.security.WebhookAuthenticator;
import com.example.billinghook.service.notify.AccessNotificationService;
import com.example.billinghook.service.payload.CaktoPayload;
import com.example.billinghook.service.payload.CaktoPayloadParser;
import com.example.billinghook.service.payload.EventIdResolver;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.function.Function;

/**
 * 网关 Webhook 处理流程：验签 → 台账去重 → 分类 → 解析与开通 → 通知 → 标记完成。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CaktoWebhookService {

    static final String METRIC_NAME = "billing.webhook.events";

    private final ObjectMapper objectMapper;
    private final CaktoPayloadParser payloadParser;
    private final EventIdResolver eventIdResolver;
    private final WebhookAuthenticator authenticator;
    private final WebhookEventStore eventStore;
    private final EventClassifier classifier;
    private final SubscriptionActivationService activationService;
    private final AccessNotificationService notificationService;
    private final MeterRegistry meterRegistry;

    /**
     * 处理一次投递。
     *
     * @param rawBody      原始请求体
     * @param headerLookup 请求头读取函数
     * @return 终态
     * @throws WebhookAuthenticationException 签名无效
     * @throws WebhookPayloadException        请求体不是 JSON 对象
     * @throws ProvisioningException          开通失败，事件保持未处理
     */
    public WebhookOutcome handle(String rawBody, Function<String, String> headerLookup) {
        String body = rawBody == null ? "" : rawBody;
        boolean jsonObject = isJsonObject(body);
        CaktoPayload payload = jsonObject ? payloadParser.parse(body) : null;

        try {
            authenticator.authenticate(body, headerLookup, payload != null ? payload.getPayloadSecret() : null);
        } catch (WebhookAuthenticationException e) {
            meterRegistry.counter(METRIC_NAME, "outcome", "rejected").increment();
            throw e;
        }
        if (payload == null) {
            throw new WebhookPayloadException("Invalid JSON", null);
        }

        String eventId = eventIdResolver.resolve(payload, headerLookup, body);
        return process(eventId, payload, body);
    }

    /**
     * 重放台账中尚未处理完成的事件，签名已在接收时校验过。
     */
    public WebhookOutcome replay(WebhookEvent event) {
        String body = event.getPayload() == null ? "" : event.getPayload();
        if (!isJsonObject(body)) {
            throw new WebhookPayloadException("Invalid JSON", null);
        }
        log.info("Replaying event {}", event.getEventId());
        return process(event.getEventId(), payloadParser.parse(body), body);
    }

    private WebhookOutcome process(String eventId, CaktoPayload payload, String body) {
        log.info("Webhook event {} type={} subscription={} checkout={}", eventId, payload.getEventName(),
                payload.getGatewaySubscriptionId(), payload.getCheckoutToken());

        EventRecordResult record = eventStore.recordIfNew(ProvisioningWriter.GATEWAY, eventId,
                payload.getEventName(), body);
        if (record.inFlight()) {
            return count(WebhookOutcome.IN_FLIGHT);
        }
        if (record.alreadyProcessed()) {
            log.info("Event {} already processed", eventId);
            return count(WebhookOutcome.DUPLICATE);
        }

        String status = payload.getRawStatus() != null ? payload.getRawStatus() : payload.getPaymentStatus();
        if (classifier.classify(payload.getEventName(), status) == LifecycleOutcome.IGNORED) {
            log.info("Event {} ignored (type={}, status={})", eventId, payload.getEventName(), status);
            return finish(eventId, WebhookOutcome.IGNORED);
        }

        ActivationResult result;
        try {
            result = activationService.activate(eventId, payload);
        } catch (RuntimeException e) {
            log.error("Provisioning failed for event {}", eventId, e);
            eventStore.markFailed(eventId);
            meterRegistry.counter(METRIC_NAME, "outcome", "failed").increment();
            throw new ProvisioningException("Provisioning failed for event " + eventId, e);
        }

        if (result.notification() != null) {
            notificationService.sendAccessEmail(result.notification());
        }
        return finish(eventId, result.outcome());
    }

    private WebhookOutcome finish(String eventId, WebhookOutcome outcome) {
        eventStore.markProcessed(eventId, outcome.getLedgerStatus());
        log.info("Event {} finished as {}", eventId, outcome);
        return count(outcome);
    }

    private WebhookOutcome count(WebhookOutcome outcome) {
        meterRegistry.counter(METRIC_NAME, "outcome", outcome.metricTag()).increment();
        return outcome;
    }

    private boolean isJsonObject(String body) {
        try {
            JsonNode node = objectMapper.readTree(body);
            return node != null && node.isObject();
        } catch (JsonProcessingException e) {
            return false;
        }
    }
}
