package com.example.billinghook.service.identity;

import java.util.Optional;

/**
 * 身份服务。处理流程只关心调用成败和返回的用户 ID。
 */
public interface IdentityProvider {

    Optional<Long> findUserIdByEmail(String email);

    boolean exists(Long userId);

    /**
     * 创建登录账户。
     *
     * @param email    邮箱（已规范化为小写）
     * @param password 明文临时密码
     * @param fullName 显示名称
     * @return 新用户 ID
     */
    Long createUser(String email, String password, String fullName);

    void updateUserMetadata(Long userId, boolean forcePasswordChange, boolean mustCompleteCompanyDetails);
}
