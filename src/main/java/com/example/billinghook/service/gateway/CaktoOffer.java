package com.example.billinghook.service.gateway;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/**
 * 网关报价（套餐）详情。
 */
public record CaktoOffer(String id, String name, BigDecimal price, String intervalType, Integer interval,
        String status, @JsonProperty("checkout_url") String checkoutUrl) {
}
