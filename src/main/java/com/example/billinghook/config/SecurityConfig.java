package com.example.billinghook.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.Customizer;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.core.userdetails.User;
import org.springframework.security.core.userdetails.UserDetailsService;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.provisioning.InMemoryUserDetailsManager;
import org.springframework.security.web.SecurityFilterChain;

/**
 * Spring Security 配置
 *
 * 安全规则:
 * ✅ 开放：/hooks/** (网关 Webhook，由签名校验保护)
 * ✅ 开放：/api/checkouts (公开结账入口)
 * ✅ 开放：/actuator/health
 * 🔒 保护：/api/webhook-events/**、/api/offers 等管理接口（HTTP Basic）
 */
@Configuration
@EnableWebSecurity
@RequiredArgsConstructor
@Slf4j
public class SecurityConfig {

        private final AdminProperties adminProperties;

        @Bean
        public PasswordEncoder passwordEncoder() {
                return new BCryptPasswordEncoder();
        }

        @Bean
        public UserDetailsService adminUserDetailsService(PasswordEncoder passwordEncoder) {
                String password = adminProperties.getPassword();
                if (password == null || password.isBlank()) {
                        // 不生成默认密码：未配置时管理接口不可用
                        log.warn("billing.admin.password is not set, admin API is disabled");
                        return new InMemoryUserDetailsManager();
                }
                return new InMemoryUserDetailsManager(User.withUsername(adminProperties.getUsername())
                                .password(passwordEncoder.encode(password))
                                .roles("ADMIN")
                                .build());
        }

        @Bean
        public SecurityFilterChain filterChain(HttpSecurity http) throws Exception {
                http
                                // 第三方网关无法携带 CSRF Token
                                .csrf(csrf -> csrf.disable())
                                .sessionManagement(session -> session
                                                .sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                                .authorizeHttpRequests(auth -> auth
                                                .requestMatchers("/hooks/**", "/api/checkouts/**", "/api/checkouts",
                                                                "/actuator/health", "/error")
                                                .permitAll()
                                                .requestMatchers("/api/webhook-events/**", "/api/offers/**", "/api/offers",
                                                                "/actuator/**")
                                                .hasRole("ADMIN")
                                                .anyRequest().authenticated())
                                .httpBasic(Customizer.withDefaults());

                return http.build();
        }
}
