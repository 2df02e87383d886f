package com.example.billinghook.repository;

import com.example.billinghook.model.Subscription;
import com.example.billinghook.model.SubscriptionStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.Optional;

/**
 * 订阅仓储接口。
 */
@Repository
public interface SubscriptionRepository extends JpaRepository<Subscription, Long> {

    /**
     * 根据网关订阅 ID 查询。
     *
     * @param gatewaySubscriptionId 网关订阅 ID
     * @return 订阅
     */
    Optional<Subscription> findByGatewaySubscriptionId(String gatewaySubscriptionId);

    /**
     * 查询公司当前处于指定状态的最新订阅。
     */
    Optional<Subscription> findFirstByCompanyIdAndStatusOrderByUpdatedAtDescIdDesc(Long companyId,
            SubscriptionStatus status);

    boolean existsByCompanyIdAndStatusIn(Long companyId, Collection<SubscriptionStatus> statuses);

    long countByCompanyId(Long companyId);
}
