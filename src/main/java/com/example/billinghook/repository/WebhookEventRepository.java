package com.example.billinghook.repository;

import com.example.billinghook.model.WebhookEvent;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Webhook 事件台账仓储接口。
 */
@Repository
public interface WebhookEventRepository extends JpaRepository<WebhookEvent, Long> {

        /**
         * 根据网关事件 ID 查询台账行。
         *
         * @param eventId 事件 ID
         * @return 台账行
         */
        Optional<WebhookEvent> findByEventId(String eventId);

        /**
         * 按状态分页查询。
         *
         * @param status   目标状态
         * @param pageable 分页
         * @return 事件分页
         */
        Page<WebhookEvent> findByStatus(String status, Pageable pageable);

        /**
         * 按状态统计事件数
         *
         * @param status 目标状态
         * @return 指定状态的事件数量
         */
        long countByStatus(String status);
}
