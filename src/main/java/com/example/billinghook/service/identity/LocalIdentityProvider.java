package com.example.billinghook.service.identity;

import com.example.billinghook.model.AppUser;
import com.example.billinghook.repository.AppUserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * 基于本地 app_users 表的身份服务，密码以 BCrypt 存储。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LocalIdentityProvider implements IdentityProvider {

    private final AppUserRepository userRepository;
    private final PasswordEncoder passwordEncoder;

    @Override
    public Optional<Long> findUserIdByEmail(String email) {
        return userRepository.findByEmailIgnoreCase(email).map(AppUser::getId);
    }

    @Override
    public boolean exists(Long userId) {
        return userId != null && userRepository.existsById(userId);
    }

    @Override
    public Long createUser(String email, String password, String fullName) {
        AppUser user = AppUser.builder()
                .email(email)
                .password(passwordEncoder.encode(password))
                .fullName(fullName)
                .build();
        // 邮箱唯一约束保证并发创建时只有一方成功
        Long id = userRepository.saveAndFlush(user).getId();
        log.info("Created login {} for {}", id, email);
        return id;
    }

    @Override
    public void updateUserMetadata(Long userId, boolean forcePasswordChange, boolean mustCompleteCompanyDetails) {
        userRepository.findById(userId).ifPresent(user -> {
            user.setForcePasswordChange(user.isForcePasswordChange() || forcePasswordChange);
            user.setMustCompleteCompanyDetails(mustCompleteCompanyDetails);
            userRepository.save(user);
        });
    }
}
