package com.example.billinghook.service.gateway;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * 网关 API 访问令牌缓存。
 * <p>
 * 令牌在到期前 60 秒视为失效。失效后只有一个调用方去获取新令牌，并发调用方等待并复用其结果；
 * 获取失败直接抛给调用方，不写入缓存。
 */
@Component
@Slf4j
public class AccessTokenCache {

    static final Duration EXPIRY_MARGIN = Duration.ofSeconds(60);

    private final Clock clock;
    private final ReentrantLock refreshLock = new ReentrantLock();
    private volatile CachedToken current;

    public AccessTokenCache(Clock clock) {
        this.clock = clock;
    }

    public String get(Supplier<AccessToken> fetcher) {
        CachedToken snapshot = current;
        if (isUsable(snapshot)) {
            return snapshot.value();
        }
        refreshLock.lock();
        try {
            snapshot = current;
            if (isUsable(snapshot)) {
                return snapshot.value();
            }
            AccessToken fresh = fetcher.get();
            Instant expiresAt = clock.instant().plus(fresh.expiresIn()).minus(EXPIRY_MARGIN);
            current = new CachedToken(fresh.value(), expiresAt);
            log.debug("Access token refreshed, usable until {}", expiresAt);
            return fresh.value();
        } finally {
            refreshLock.unlock();
        }
    }

    public void invalidate() {
        current = null;
    }

    private boolean isUsable(CachedToken token) {
        return token != null && token.expiresAt().isAfter(clock.instant());
    }

    /**
     * 令牌端点的返回值。
     *
     * @param value     令牌
     * @param expiresIn 有效期
     */
    public record AccessToken(String value, Duration expiresIn) {
    }

    private record CachedToken(String value, Instant expiresAt) {
    }
}
