package com.example.billinghook.repository;

import com.example.billinghook.model.Plan;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.Optional;

/**
 * 套餐仓储接口。
 */
@Repository
public interface PlanRepository extends JpaRepository<Plan, Long> {

    /**
     * 按网关报价 ID 的任一候选形式查询套餐。
     *
     * @param caktoPlanIds 候选报价 ID（裸 ID 与结账 URL）
     * @return 套餐
     */
    Optional<Plan> findFirstByCaktoPlanIdInOrderByIdAsc(Collection<String> caktoPlanIds);
}
