package com.example.billinghook.service;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EventClassifierTest {

    private final EventClassifier classifier = new EventClassifier();

    @ParameterizedTest
    @CsvSource({
            "purchase.approved",
            "purchase_approved",
            "Purchase Approved",
            "payment.approved",
            "payment.paid",
            "order.paid",
            "subscription.active",
            "subscription_renewed",
            "SubscriptionRenewed"
    })
    void activeEventNames(String eventName) {
        assertEquals(LifecycleOutcome.ACTIVE, classifier.classify(eventName, null));
    }

    @ParameterizedTest
    @CsvSource({
            "purchase.refused",
            "subscription.canceled",
            "subscription.inactive",
            "refund",
            "chargeback",
            "approved",
            "checkout.abandonment"
    })
    void ignoredEventNames(String eventName) {
        assertEquals(LifecycleOutcome.IGNORED, classifier.classify(eventName, null));
    }

    @Test
    void statusSignalIsIndependentOfEventName() {
        assertEquals(LifecycleOutcome.ACTIVE, classifier.classify("something.unknown", "paid"));
        assertEquals(LifecycleOutcome.ACTIVE, classifier.classify(null, "APPROVED"));
        assertEquals(LifecycleOutcome.ACTIVE, classifier.classify("subscription.canceled", "active"));
    }

    @Test
    void negativeStatusesAreNotActive() {
        assertEquals(LifecycleOutcome.IGNORED, classifier.classify("x", "unpaid"));
        assertEquals(LifecycleOutcome.IGNORED, classifier.classify("x", "inactive"));
        assertEquals(LifecycleOutcome.IGNORED, classifier.classify(null, null));
    }

    @Test
    void rulesAreData() {
        EventClassifier narrow = new EventClassifier(List.of(
                ClassificationRule.of(LifecycleOutcome.ACTIVE, Set.of("purchase"), Set.of("approved"))));

        assertEquals(LifecycleOutcome.ACTIVE, narrow.classify("purchase.approved", null));
        assertEquals(LifecycleOutcome.IGNORED, narrow.classify("order.paid", null));
    }

    @Test
    void normalizesSeparators() {
        assertEquals("purchase.approved", EventClassifier.normalize("  PURCHASE_approved "));
        assertEquals("subscription.renewed", EventClassifier.normalize("subscriptionRenewed"));
    }

    @Test
    void renewalIsWholeTokenMatch() {
        assertTrue(EventClassifier.isRenewal("subscription_renewed"));
        assertTrue(EventClassifier.isRenewal("SubscriptionRenewal"));
        assertFalse(EventClassifier.isRenewal("purchase.approved"));
        assertFalse(EventClassifier.isRenewal("unrenewed"));
        assertFalse(EventClassifier.isRenewal(null));
    }
}
