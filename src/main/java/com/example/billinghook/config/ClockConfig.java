package com.example.billinghook.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ClockConfig {

    /**
     * 全局时间源（UTC），所有订阅周期计算都基于它。
     *
     * @return Clock
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
