package com.example.billinghook.service;

import com.example.billinghook.model.WebhookEvent;
import com.example.billinghook.repository.WebhookEventRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Webhook 去重台账。
 * <p>
 * 先写后处理：首次见到的事件立即以未处理状态提交，processedAt 只在所有副作用完成后写入。
 * 每次写入都在独立事务中提交，不受业务事务回滚影响。
 */
@Service
@Slf4j
public class WebhookEventStore {

    public static final String STATUS_RECEIVED = "RECEIVED";
    public static final String STATUS_FAILED = "FAILED";

    private final WebhookEventRepository eventRepository;
    private final TransactionTemplate requiresNew;
    private final Clock clock;

    public WebhookEventStore(WebhookEventRepository eventRepository, PlatformTransactionManager transactionManager,
            Clock clock) {
        this.eventRepository = eventRepository;
        this.requiresNew = new TransactionTemplate(transactionManager);
        this.requiresNew.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.clock = clock;
    }

    /**
     * 登记事件。事件 ID 的唯一约束是并发投递的唯一串行化点。
     */
    public EventRecordResult recordIfNew(String gateway, String eventId, String eventType, String payload) {
        try {
            return requiresNew.execute(status -> {
                Optional<WebhookEvent> existing = eventRepository.findByEventId(eventId);
                if (existing.isPresent()) {
                    return existing.get().isProcessed()
                            ? EventRecordResult.processed()
                            : EventRecordResult.pendingRetry();
                }
                eventRepository.saveAndFlush(WebhookEvent.builder()
                        .gateway(gateway)
                        .eventId(eventId)
                        .eventType(eventType)
                        .payload(payload)
                        .receivedAt(LocalDateTime.now(clock))
                        .status(STATUS_RECEIVED)
                        .build());
                return EventRecordResult.recorded();
            });
        } catch (DataIntegrityViolationException e) {
            log.info("Event {} is being recorded by a concurrent delivery", eventId);
            return EventRecordResult.concurrent();
        }
    }

    /**
     * 写入终态。已处理的行不会被覆盖。
     */
    public void markProcessed(String eventId, String ledgerStatus) {
        requiresNew.executeWithoutResult(status -> eventRepository.findByEventId(eventId).ifPresent(event -> {
            if (event.isProcessed()) {
                return;
            }
            event.setStatus(ledgerStatus);
            event.setProcessedAt(LocalDateTime.now(clock));
            eventRepository.save(event);
        }));
    }

    /**
     * 记录一次失败的处理尝试，行保持未处理，等待网关重试或人工重放。
     */
    public void markFailed(String eventId) {
        requiresNew.executeWithoutResult(status -> eventRepository.findByEventId(eventId).ifPresent(event -> {
            if (!event.isProcessed()) {
                event.setStatus(STATUS_FAILED);
                eventRepository.save(event);
            }
        }));
    }

    public Optional<WebhookEvent> find(String eventId) {
        return eventRepository.findByEventId(eventId);
    }
}
