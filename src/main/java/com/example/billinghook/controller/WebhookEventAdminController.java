package com.example.billinghook.controller;

import com.example.billinghook.model.WebhookEvent;
import com.example.billinghook.repository.WebhookEventRepository;
import com.example.billinghook.service.CaktoWebhookService;
import com.example.billinghook.service.WebhookEventStore;
import com.example.billinghook.service.WebhookOutcome;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 事件台账管理接口：查询、统计与重放。
 */
@RestController
@RequestMapping("/api/webhook-events")
@RequiredArgsConstructor
public class WebhookEventAdminController {

    private static final List<String> STATUSES = List.of(WebhookEventStore.STATUS_RECEIVED,
            WebhookEventStore.STATUS_FAILED, "PROCESSED", "IGNORED", "SKIPPED", "DUPLICATE");

    private final WebhookEventRepository eventRepository;
    private final WebhookEventStore eventStore;
    private final CaktoWebhookService webhookService;

    /**
     * 分页查询台账，按接收时间倒序。
     *
     * @param status 可选状态过滤
     * @param page   页码（从 0 开始）
     * @param size   每页条数
     * @return 事件分页（不含原始请求体）
     */
    @GetMapping
    public Map<String, Object> list(@RequestParam(required = false) String status,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size) {
        PageRequest pageable = PageRequest.of(Math.max(page, 0), Math.min(Math.max(size, 1), 100),
                Sort.by(Sort.Direction.DESC, "receivedAt", "id"));
        Page<WebhookEvent> events = status == null || status.isBlank()
                ? eventRepository.findAll(pageable)
                : eventRepository.findByStatus(status.trim().toUpperCase(), pageable);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("content", events.getContent().stream().map(WebhookEventAdminController::summary).toList());
        body.put("page", events.getNumber());
        body.put("size", events.getSize());
        body.put("totalElements", events.getTotalElements());
        return body;
    }

    @GetMapping("/stats")
    public Map<String, Object> stats() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("total", eventRepository.count());
        for (String status : STATUSES) {
            stats.put(status.toLowerCase(), eventRepository.countByStatus(status));
        }
        return stats;
    }

    /**
     * 重放尚未处理完成的事件。
     */
    @PostMapping("/{eventId}/replay")
    public ResponseEntity<Map<String, Object>> replay(@PathVariable String eventId) {
        Optional<WebhookEvent> event = eventStore.find(eventId);
        if (event.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", "Event not found"));
        }
        if (event.get().isProcessed()) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", "Event already processed"));
        }
        WebhookOutcome outcome = webhookService.replay(event.get());
        return ResponseEntity.ok(outcome.toResponseBody());
    }

    private static Map<String, Object> summary(WebhookEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("eventId", event.getEventId());
        row.put("gateway", event.getGateway());
        row.put("eventType", event.getEventType());
        row.put("status", event.getStatus());
        row.put("receivedAt", event.getReceivedAt());
        row.put("processedAt", event.getProcessedAt());
        return row;
    }
}
