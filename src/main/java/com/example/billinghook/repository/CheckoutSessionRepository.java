package com.example.billinghook.repository;

import com.example.billinghook.model.CheckoutSession;
import com.example.billinghook.model.CheckoutStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.Optional;

/**
 * 结账会话仓储接口。
 */
@Repository
public interface CheckoutSessionRepository extends JpaRepository<CheckoutSession, Long> {

    Optional<CheckoutSession> findByToken(String token);

    /**
     * 查询指定邮箱与套餐下最新的一条会话。
     *
     * @param email    邮箱
     * @param planId   套餐 ID
     * @param statuses 允许的状态
     * @return 会话
     */
    Optional<CheckoutSession> findFirstByEmailAndPlanIdAndStatusInOrderByCreatedAtDescIdDesc(
            String email, Long planId, Collection<CheckoutStatus> statuses);

    Optional<CheckoutSession> findFirstByEmailAndStatusInOrderByCreatedAtDescIdDesc(
            String email, Collection<CheckoutStatus> statuses);

    /**
     * 查询指定邮箱在某时间之后更新过的最新会话（用于“近期已完成”的匹配）。
     */
    Optional<CheckoutSession> findFirstByEmailAndStatusInAndUpdatedAtAfterOrderByUpdatedAtDescIdDesc(
            String email, Collection<CheckoutStatus> statuses, LocalDateTime updatedAfter);

    boolean existsByEmailAndPlanIdAndStatusIn(String email, Long planId, Collection<CheckoutStatus> statuses);
}
