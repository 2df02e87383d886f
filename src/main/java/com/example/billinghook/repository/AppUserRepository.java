package com.example.billinghook.repository;

import com.example.billinghook.model.AppUser;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * 用户数据访问层
 */
@Repository
public interface AppUserRepository extends JpaRepository<AppUser, Long> {

    /**
     * 根据邮箱查询用户（忽略大小写）。
     *
     * @param email 邮箱
     * @return 用户信息
     */
    Optional<AppUser> findByEmailIgnoreCase(String email);
}
