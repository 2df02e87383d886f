package com.example.billinghook.controller;

import com.example.billinghook.model.CheckoutSession;
import com.example.billinghook.service.CheckoutService;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * 公开的结账入口：创建会话并返回网关结账链接，支付后按 token 查询开通进度。
 */
@RestController
@RequestMapping("/api/checkouts")
@RequiredArgsConstructor
public class CheckoutController {

    private final CheckoutService checkoutService;

    @Data
    public static class CheckoutRequest {
        @JsonProperty("plan_id")
        private Long planId;
        private String email;
        @JsonProperty("full_name")
        private String fullName;
        @JsonProperty("company_name")
        private String companyName;
    }

    @PostMapping
    public ResponseEntity<Map<String, Object>> create(@RequestBody CheckoutRequest request) {
        CheckoutService.CreatedCheckout created = checkoutService.create(request.getPlanId(), request.getEmail(),
                request.getFullName(), request.getCompanyName());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("token", created.token());
        body.put("checkout_url", created.checkoutUrl());
        return ResponseEntity.ok(body);
    }

    /**
     * 支付成功页轮询：Webhook 绑定用户之前返回 202。
     */
    @GetMapping("/{token}")
    public ResponseEntity<Map<String, Object>> status(@PathVariable String token) {
        CheckoutSession checkout = checkoutService.findByToken(token);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", checkout.getStatus().name().toLowerCase(Locale.ROOT));
        if (checkout.getUserId() == null) {
            body.put("ready", false);
            body.put("error", "Checkout not ready");
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(body);
        }
        body.put("ready", true);
        body.put("user_id", checkout.getUserId());
        body.put("company_id", checkout.getCompanyId());
        return ResponseEntity.ok(body);
    }
}
