package com.example.billinghook.repository;

import com.example.billinghook.model.Company;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * 公司（租户）仓储接口。
 */
@Repository
public interface CompanyRepository extends JpaRepository<Company, Long> {

    boolean existsBySlug(String slug);

    Optional<Company> findFirstByEmailIgnoreCaseOrderByIdAsc(String email);

    Optional<Company> findFirstByOwnerUserIdOrderByIdAsc(Long ownerUserId);
}
