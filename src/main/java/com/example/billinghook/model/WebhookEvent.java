package com.example.billinghook.model;

import jakarta.persistence.*;
import lombok.*;
import java.time.LocalDateTime;

/**
 * 网关 Webhook 去重台账。每个 eventId 至多一行，processedAt 一旦写入即为终态。
 */
@Entity
@Table(name = "webhook_events")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WebhookEvent {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 30)
    private String gateway;

    @Column(name = "event_id", nullable = false, unique = true, length = 191)
    private String eventId;

    private String eventType;

    // 原始请求体，重放时按原样再处理
    @Column(columnDefinition = "TEXT")
    private String payload;

    private LocalDateTime receivedAt;

    @Builder.Default
    @Column(length = 20)
    private String status = "RECEIVED"; // RECEIVED, PROCESSED, IGNORED, SKIPPED, DUPLICATE

    private LocalDateTime processedAt;

    public boolean isProcessed() {
        return processedAt != null;
    }
}
