package com.example.billinghook.service.payload;

import com.jayway.jsonpath.Configuration;
import com.jayway.jsonpath.DocumentContext;
import com.jayway.jsonpath.JsonPath;
import com.jayway.jsonpath.Option;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 网关请求体字段提取。每个逻辑字段对应一组按优先级排列的 JsonPath，取第一个非空值。
 */
@Component
@Slf4j
public class CaktoPayloadParser {

    private static final Configuration JSON_PATH_CONFIG = Configuration.defaultConfiguration()
            .addOptions(Option.SUPPRESS_EXCEPTIONS);

    private static final List<String> DATA_ROOTS = List.of("$.data", "$.payload.data", "$.object");

    /**
     * 解析请求体。调用方需先确认它是合法的 JSON 对象。
     *
     * @param rawBody 原始请求体
     * @return 规范化字段
     */
    public CaktoPayload parse(String rawBody) {
        DocumentContext ctx = JsonPath.using(JSON_PATH_CONFIG).parse(rawBody);

        String data = resolveDataRoot(ctx);
        List<String> meta = resolveMetadataRoots(ctx, data);

        return CaktoPayload.builder()
                .eventName(firstString(ctx, "$.event", "$.type", "$.event_type", "$.name"))
                .providerEventId(firstString(ctx, "$.id", "$.event_id", "$.eventId", "$.data.event_id",
                        "$.data.eventId"))
                .gatewaySubscriptionId(firstString(ctx,
                        data + ".subscription.id",
                        data + ".subscription.subscription_id",
                        data + ".subscription_id",
                        data + ".subscriptionId",
                        data + ".id",
                        data + ".refId"))
                .rawStatus(firstString(ctx, data + ".status", data + ".state"))
                .paymentStatus(firstString(ctx, data + ".payment_status", data + ".status"))
                .periodStart(firstTimestamp(ctx,
                        data + ".current_period_start",
                        data + ".current_period_starts_at",
                        data + ".current_period_start_at",
                        data + ".current_period_start_date"))
                .periodEnd(firstTimestamp(ctx,
                        data + ".current_period_end",
                        data + ".current_period_ends_at",
                        data + ".current_period_end_at",
                        data + ".current_period_end_date"))
                .checkoutToken(firstString(ctx, concat(
                        prefixed(meta, "checkout_token"),
                        prefixed(meta, "token"),
                        List.of(data + ".checkout_token"))))
                .customerEmail(firstString(ctx, concat(
                        List.of(data + ".customer.email", data + ".customer_email", data + ".email"),
                        prefixed(meta, "email"))))
                .customerName(firstString(ctx, concat(
                        List.of(data + ".customer.name", data + ".customer_name"),
                        prefixed(meta, "full_name"),
                        prefixed(meta, "name"))))
                .customerPhone(firstString(ctx, concat(
                        List.of(data + ".customer.phone", data + ".customer_phone"),
                        prefixed(meta, "phone"))))
                .customerDocument(firstString(ctx,
                        data + ".customer.docNumber",
                        data + ".customer.document",
                        data + ".customer_document"))
                .companyName(firstString(ctx, concat(
                        prefixed(meta, "company_name"),
                        List.of(data + ".company_name"))))
                .companyId(toLong(firstString(ctx, concat(
                        prefixed(meta, "company_id"),
                        List.of(data + ".company_id")))))
                .offerId(firstString(ctx,
                        data + ".offer.id",
                        data + ".offer_id",
                        data + ".offerId",
                        data + ".plan_id"))
                .offerName(firstString(ctx, data + ".offer.name", data + ".product.name"))
                .offerPrice(toDecimal(firstString(ctx, data + ".offer.price", data + ".amount")))
                .offerIntervalType(firstString(ctx,
                        data + ".offer.intervalType",
                        data + ".offer.interval_type",
                        data + ".intervalType"))
                .offerInterval(toInteger(firstString(ctx, data + ".offer.interval", data + ".offer.interval_count")))
                .orderId(firstString(ctx, data + ".order_id", data + ".orderId", data + ".refId"))
                .paymentLinkUrl(firstString(ctx,
                        data + ".payment_link_url",
                        data + ".checkout_url",
                        data + ".checkoutUrl",
                        data + ".payment_url"))
                .payloadSecret(firstString(ctx, "$.secret", "$.data.secret"))
                .build();
    }

    private String resolveDataRoot(DocumentContext ctx) {
        for (String root : DATA_ROOTS) {
            if (ctx.read(root) instanceof Map) {
                return root;
            }
        }
        return "$";
    }

    private List<String> resolveMetadataRoots(DocumentContext ctx, String data) {
        for (String candidate : List.of(data + ".metadata", data + ".meta", "$.metadata")) {
            if (ctx.read(candidate) instanceof Map) {
                return List.of(candidate);
            }
        }
        return List.of();
    }

    private static List<String> prefixed(List<String> roots, String field) {
        List<String> paths = new ArrayList<>(roots.size());
        for (String root : roots) {
            paths.add(root + "." + field);
        }
        return paths;
    }

    @SafeVarargs
    private static String[] concat(List<String>... groups) {
        List<String> all = new ArrayList<>();
        for (List<String> group : groups) {
            all.addAll(group);
        }
        return all.toArray(new String[0]);
    }

    private String firstString(DocumentContext ctx, String... paths) {
        for (String path : paths) {
            Object value = ctx.read(path);
            if (value instanceof String text && !text.isBlank()) {
                return text.trim();
            }
            if (value instanceof Number number) {
                return numberToString(number);
            }
        }
        return null;
    }

    private LocalDateTime firstTimestamp(DocumentContext ctx, String... paths) {
        for (String path : paths) {
            Object value = ctx.read(path);
            LocalDateTime parsed = toTimestamp(value);
            if (parsed != null) {
                return parsed;
            }
        }
        return null;
    }

    /**
     * 支持 ISO-8601（带或不带时区）、日期以及毫秒时间戳，统一换算为 UTC。
     */
    static LocalDateTime toTimestamp(Object value) {
        if (value instanceof Number number) {
            return LocalDateTime.ofInstant(Instant.ofEpochMilli(number.longValue()), ZoneOffset.UTC);
        }
        if (!(value instanceof String text) || text.isBlank()) {
            return null;
        }
        String trimmed = text.trim();
        if (trimmed.chars().allMatch(Character::isDigit)) {
            return LocalDateTime.ofInstant(Instant.ofEpochMilli(Long.parseLong(trimmed)), ZoneOffset.UTC);
        }
        try {
            return OffsetDateTime.parse(trimmed).withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime();
        } catch (DateTimeParseException ignored) {
            // fall through to zone-less forms
        }
        try {
            return LocalDateTime.parse(trimmed);
        } catch (DateTimeParseException ignored) {
            // fall through
        }
        try {
            return LocalDate.parse(trimmed).atStartOfDay();
        } catch (DateTimeParseException e) {
            log.debug("Unparseable timestamp value '{}'", trimmed);
            return null;
        }
    }

    private static String numberToString(Number number) {
        if (number instanceof Double || number instanceof Float || number instanceof BigDecimal) {
            return new BigDecimal(number.toString()).stripTrailingZeros().toPlainString();
        }
        return number.toString();
    }

    private static BigDecimal toDecimal(String value) {
        if (value == null) {
            return null;
        }
        try {
            return new BigDecimal(value.replace(',', '.'));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Integer toInteger(String value) {
        BigDecimal decimal = toDecimal(value);
        return decimal == null ? null : decimal.intValue();
    }

    private static Long toLong(String value) {
        if (value == null) {
            return null;
        }
        try {
            return Long.valueOf(value);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
