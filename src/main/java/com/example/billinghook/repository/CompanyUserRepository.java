package com.example.billinghook.repository;

import com.example.billinghook.model.CompanyUser;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface CompanyUserRepository extends JpaRepository<CompanyUser, Long> {

    boolean existsByCompanyIdAndUserId(Long companyId, Long userId);

    Optional<CompanyUser> findFirstByUserIdOrderByIdAsc(Long userId);
}
