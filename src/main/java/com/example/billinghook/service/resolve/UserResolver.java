package com.example.billinghook.service.resolve;

import com.example.billinghook.model.CheckoutSession;
import com.example.billinghook.model.Subscription;
import com.example.billinghook.service.identity.IdentityProvider;
import com.example.billinghook.service.identity.TempPasswordGenerator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * 用户解析：结账会话绑定的用户 → 已有订阅的用户 → 按邮箱查找 → 新建（临时密码）。
 */
@Component
@Slf4j
public class UserResolver {

    private final IdentityProvider identityProvider;
    private final TempPasswordGenerator passwordGenerator;
    private final FirstMatch<ResolutionContext, Long> chain;

    public UserResolver(IdentityProvider identityProvider, TempPasswordGenerator passwordGenerator) {
        this.identityProvider = identityProvider;
        this.passwordGenerator = passwordGenerator;
        this.chain = FirstMatch.<ResolutionContext, Long>of("user")
                .then("checkout", ctx -> Optional.ofNullable(ctx.getCheckout())
                        .map(CheckoutSession::getUserId)
                        .filter(identityProvider::exists))
                .then("existing-subscription", ctx -> Optional.ofNullable(ctx.getExistingSubscription())
                        .map(Subscription::getUserId)
                        .filter(identityProvider::exists))
                .then("email", ctx -> identityProvider.findUserIdByEmail(ctx.getEmail()))
                .build();
    }

    /**
     * 解析或创建用户，结果写入上下文。新建账户时上下文带上临时密码。
     */
    public void resolve(ResolutionContext ctx) {
        Optional<Long> existing = chain.resolve(ctx);
        if (existing.isPresent()) {
            ctx.setUserId(existing.get());
            return;
        }
        String password = passwordGenerator.generate();
        Long userId = identityProvider.createUser(ctx.getEmail(), password, ctx.getDisplayName());
        ctx.setUserId(userId);
        ctx.setTemporaryPassword(password);
    }
}
