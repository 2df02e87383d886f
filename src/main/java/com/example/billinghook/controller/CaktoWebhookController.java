package com.example.billinghook.controller;

import com.example.billinghook.service.CaktoWebhookService;
import com.example.billinghook.service.WebhookOutcome;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * 网关 Webhook 入口。请求体按原始字符串接收，签名基于原始字节计算。
 */
@RestController
@RequestMapping("/hooks")
@RequiredArgsConstructor
public class CaktoWebhookController {

    private final CaktoWebhookService webhookService;

    @PostMapping("/cakto")
    public ResponseEntity<Map<String, Object>> receive(HttpServletRequest request,
            @RequestBody(required = false) String body) {
        WebhookOutcome outcome = webhookService.handle(body, request::getHeader);
        return ResponseEntity.ok(outcome.toResponseBody());
    }
}
