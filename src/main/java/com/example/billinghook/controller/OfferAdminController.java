package com.example.billinghook.controller;

import com.example.billinghook.service.gateway.CaktoApiClient;
import com.example.billinghook.service.gateway.CaktoOffer;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * 管理接口：列出网关上的有效报价，便于配置套餐的 caktoPlanId。
 */
@RestController
@RequestMapping("/api/offers")
@RequiredArgsConstructor
public class OfferAdminController {

    private final CaktoApiClient caktoApiClient;

    @GetMapping
    public ResponseEntity<Map<String, Object>> list() {
        if (!caktoApiClient.isEnabled()) {
            return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                    .body(Map.of("error", "Gateway API is not configured"));
        }
        List<CaktoOffer> offers = caktoApiClient.listActiveOffers();
        return ResponseEntity.ok(Map.of("offers", offers));
    }
}
