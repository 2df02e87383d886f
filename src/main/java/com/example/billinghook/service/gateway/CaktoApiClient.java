package com.example.billinghook.service.gateway;

import com.example.billinghook.config.CaktoProperties;
import com.example.billinghook.exception.CaktoApiException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.math.BigDecimal;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Optional;

/**
 * 网关 REST API 客户端（OAuth client_credentials）：报价详情与报价列表。
 */
@Service
@Slf4j
public class CaktoApiClient {

    private static final Duration DEFAULT_TOKEN_TTL = Duration.ofSeconds(3600);

    private final HttpClient httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(5))
            .build();

    private final CaktoProperties caktoProperties;
    private final AccessTokenCache tokenCache;
    private final ObjectMapper objectMapper;

    public CaktoApiClient(CaktoProperties caktoProperties, AccessTokenCache tokenCache, ObjectMapper objectMapper) {
        this.caktoProperties = caktoProperties;
        this.tokenCache = tokenCache;
        this.objectMapper = objectMapper;
    }

    public boolean isEnabled() {
        return caktoProperties.isApiConfigured();
    }

    /**
     * 查询报价详情。在开通事务内调用，因此只请求一次：失败时记录日志并返回 empty，
     * 由调用方按事件中的信息补全。
     */
    public Optional<CaktoOffer> fetchOffer(String offerId) {
        if (!isEnabled() || offerId == null || offerId.isBlank()) {
            return Optional.empty();
        }
        try {
            HttpResponse<String> response = get("/v1/offers/" + URLEncoder.encode(offerId, StandardCharsets.UTF_8));
            int status = response.statusCode();
            if (status == 404) {
                return Optional.empty();
            }
            if (status < 200 || status >= 300) {
                log.warn("Offer lookup for {} returned HTTP {}", offerId, status);
                return Optional.empty();
            }
            return Optional.of(parseOffer(offerId, readTree(response.body())));
        } catch (CaktoApiException e) {
            log.warn("Offer lookup for {} failed: {}", offerId, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * 列出网关上的有效报价。网络错误、401 与 5xx 指数退避重试，重试耗尽后返回空列表。
     */
    @Retryable(retryFor = CaktoApiException.class, maxAttempts = 3, backoff = @Backoff(delay = 500, multiplier = 2.0))
    public List<CaktoOffer> listActiveOffers() {
        if (!isEnabled()) {
            return List.of();
        }
        HttpResponse<String> response = get("/v1/offers?status=active");
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            log.warn("Offer listing returned HTTP {}", status);
            return List.of();
        }

        JsonNode body = readTree(response.body());
        JsonNode items = body.isArray() ? body : body.path("results");
        List<CaktoOffer> offers = new ArrayList<>();
        for (JsonNode item : items) {
            String id = firstText(item, "id", "short_id", "offer_id");
            if (id == null) {
                continue;
            }
            CaktoOffer parsed = parseOffer(id, item);
            String checkoutUrl = firstText(item, "checkoutUrl", "checkout_url", "salesPage");
            offers.add(new CaktoOffer(id, parsed.name(), parsed.price(), parsed.intervalType(), parsed.interval(),
                    parsed.status(), checkoutUrl != null ? checkoutUrl : caktoProperties.toCheckoutUrl(id)));
        }
        return offers;
    }

    @Recover
    public List<CaktoOffer> recoverOffers(CaktoApiException e) {
        log.warn("Offer listing gave up: {}", e.getMessage());
        return List.of();
    }

    /**
     * 带 Bearer token 的 GET。401 时作废缓存的 token 并抛出异常。
     */
    private HttpResponse<String> get(String path) {
        String token = tokenCache.get(this::requestToken);
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(apiUrl(path)))
                .timeout(Duration.ofSeconds(10))
                .header("Authorization", "Bearer " + token)
                .header("Accept", "application/json")
                .GET()
                .build();

        HttpResponse<String> response = send(request);
        if (response.statusCode() == 401) {
            tokenCache.invalidate();
            throw new CaktoApiException("Request to " + request.uri().getPath() + " unauthorized", 401);
        }
        if (response.statusCode() >= 500) {
            throw new CaktoApiException("Request to " + request.uri().getPath() + " failed: HTTP "
                    + response.statusCode(), response.statusCode());
        }
        return response;
    }

    AccessTokenCache.AccessToken requestToken() {
        String credentials = caktoProperties.getClientId() + ":" + caktoProperties.getClientSecret();
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(apiUrl("/oauth/token")))
                .timeout(Duration.ofSeconds(10))
                .header("Authorization", "Basic "
                        + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8)))
                .header("Content-Type", "application/x-www-form-urlencoded")
                .POST(HttpRequest.BodyPublishers.ofString("grant_type=client_credentials"))
                .build();

        HttpResponse<String> response = send(request);
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new CaktoApiException("Token request failed: HTTP " + response.statusCode(),
                    response.statusCode());
        }
        JsonNode body = readTree(response.body());
        String token = body.path("access_token").asText("");
        if (token.isEmpty()) {
            throw new CaktoApiException("Token response without access_token", response.statusCode());
        }
        long expiresIn = body.path("expires_in").asLong(0);
        return new AccessTokenCache.AccessToken(token,
                expiresIn > 0 ? Duration.ofSeconds(expiresIn) : DEFAULT_TOKEN_TTL);
    }

    static CaktoOffer parseOffer(String requestedId, JsonNode node) {
        JsonNode offer = node.has("data") && node.get("data").isObject() ? node.get("data") : node;
        String id = textOrNull(offer, "id");
        BigDecimal price = null;
        JsonNode priceNode = offer.path("price");
        if (priceNode.isNumber()) {
            price = priceNode.decimalValue();
        } else if (priceNode.isTextual()) {
            try {
                price = new BigDecimal(priceNode.asText().replace(',', '.'));
            } catch (NumberFormatException e) {
                price = null;
            }
        }
        String intervalType = Optional.ofNullable(textOrNull(offer, "intervalType"))
                .orElse(textOrNull(offer, "interval_type"));
        JsonNode intervalNode = offer.has("interval") ? offer.get("interval") : offer.path("interval_count");
        Integer interval = intervalNode.canConvertToInt() && intervalNode.asInt() > 0 ? intervalNode.asInt() : null;
        if (interval == null && intervalNode.isTextual()) {
            try {
                interval = Integer.valueOf(intervalNode.asText().trim());
            } catch (NumberFormatException e) {
                interval = null;
            }
        }
        return new CaktoOffer(id != null ? id : requestedId, textOrNull(offer, "name"), price, intervalType,
                interval, textOrNull(offer, "status"), null);
    }

    private static String firstText(JsonNode node, String... fields) {
        for (String field : fields) {
            String value = textOrNull(node, field);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }

    private HttpResponse<String> send(HttpRequest request) {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new CaktoApiException("Request to " + request.uri().getPath() + " failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CaktoApiException("Request to " + request.uri().getPath() + " interrupted", e);
        }
    }

    private JsonNode readTree(String body) {
        try {
            return objectMapper.readTree(body == null ? "{}" : body);
        } catch (IOException e) {
            throw new CaktoApiException("Unreadable response body", e);
        }
    }

    private String apiUrl(String path) {
        String base = caktoProperties.getApiBase();
        return (base.endsWith("/") ? base.substring(0, base.length() - 1) : base) + path;
    }
}
