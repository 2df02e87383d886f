package com.example.billinghook.controller;

import com.example.billinghook.model.AppUser;
import com.example.billinghook.model.BillingPeriod;
import com.example.billinghook.model.CheckoutSession;
import com.example.billinghook.model.CheckoutStatus;
import com.example.billinghook.model.Company;
import com.example.billinghook.model.Plan;
import com.example.billinghook.model.Subscription;
import com.example.billinghook.model.SubscriptionStatus;
import com.example.billinghook.model.WebhookEvent;
import com.example.billinghook.repository.AppUserRepository;
import com.example.billinghook.repository.CheckoutSessionRepository;
import com.example.billinghook.repository.CompanyRepository;
import com.example.billinghook.repository.CompanyUserRepository;
import com.example.billinghook.repository.PlanRepository;
import com.example.billinghook.repository.ProfileRepository;
import com.example.billinghook.repository.SubscriptionRepository;
import com.example.billinghook.repository.UserRoleRepository;
import com.example.billinghook.repository.WebhookEventRepository;
import com.example.billinghook.security.HmacVerifier;
import com.example.billinghook.service.identity.IdentityProvider;
import com.example.billinghook.service.notify.Notifier;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.SpyBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class CaktoWebhookControllerIntegrationTest {

    private static final String SECRET = "test-secret";

    @TestConfiguration
    static class RecordingNotifierConfig {

        @Bean
        @Primary
        RecordingNotifier recordingNotifier() {
            return new RecordingNotifier();
        }
    }

    static class RecordingNotifier implements Notifier {

        final List<String[]> sent = new CopyOnWriteArrayList<>();

        @Override
        public boolean send(String to, String subject, String html, String text) {
            sent.add(new String[] { to, subject, text });
            return true;
        }
    }

    @Autowired
    private MockMvc mockMvc;
    @Autowired
    private HmacVerifier hmacVerifier;
    @Autowired
    private RecordingNotifier notifier;
    @Autowired
    private MeterRegistry meterRegistry;
    @SpyBean
    private IdentityProvider identityProvider;

    @Autowired
    private WebhookEventRepository eventRepository;
    @Autowired
    private PlanRepository planRepository;
    @Autowired
    private AppUserRepository userRepository;
    @Autowired
    private CompanyRepository companyRepository;
    @Autowired
    private CompanyUserRepository companyUserRepository;
    @Autowired
    private SubscriptionRepository subscriptionRepository;
    @Autowired
    private CheckoutSessionRepository checkoutRepository;
    @Autowired
    private ProfileRepository profileRepository;
    @Autowired
    private UserRoleRepository userRoleRepository;

    @BeforeEach
    void setUp() {
        eventRepository.deleteAll();
        subscriptionRepository.deleteAll();
        checkoutRepository.deleteAll();
        companyUserRepository.deleteAll();
        userRoleRepository.deleteAll();
        profileRepository.deleteAll();
        companyRepository.deleteAll();
        userRepository.deleteAll();
        planRepository.deleteAll();
        notifier.sent.clear();
    }

    private String purchase(String eventId, String subscriptionId, String email) {
        return """
                {"id":"%s","event":"purchase.approved","data":{"id":"%s","status":"approved",
                 "customer":{"email":"%s"},
                 "offer":{"id":"off_1","name":"Pro","price":49.9,"intervalType":"month","interval":1}}}
                """.formatted(eventId, subscriptionId, email);
    }

    private String sign(String body) throws Exception {
        return hmacVerifier.calculateHmac(body, SECRET);
    }

    private ResultActions deliver(String body) throws Exception {
        return mockMvc.perform(post("/hooks/cakto")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body)
                .header("x-cakto-signature", sign(body)));
    }

    @Test
    void firstPurchaseProvisionsEverything() throws Exception {
        LocalDateTime before = LocalDateTime.now(ZoneOffset.UTC);

        deliver(purchase("evt_1", "sub_1", "A@X.com"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ok").value(true))
                .andExpect(jsonPath("$.duplicate").doesNotExist());

        LocalDateTime after = LocalDateTime.now(ZoneOffset.UTC);

        Plan plan = planRepository.findAll().get(0);
        assertEquals("off_1", plan.getCaktoPlanId());
        assertEquals("Pro", plan.getName());
        assertEquals(BillingPeriod.MONTHLY, plan.getBillingPeriod());
        assertEquals(30, plan.getPeriodDays());

        AppUser user = userRepository.findByEmailIgnoreCase("a@x.com").orElseThrow();
        assertTrue(user.isForcePasswordChange());

        Company company = companyRepository.findAll().get(0);
        assertEquals("a", company.getSlug());
        assertEquals(user.getId(), company.getOwnerUserId());
        assertEquals(SubscriptionStatus.ACTIVE, company.getSubscriptionStatus());
        assertTrue(companyUserRepository.existsByCompanyIdAndUserId(company.getId(), user.getId()));
        assertTrue(userRoleRepository.existsByUserIdAndRole(user.getId(), "admin"));

        Subscription subscription = subscriptionRepository.findByGatewaySubscriptionId("sub_1").orElseThrow();
        assertEquals(SubscriptionStatus.ACTIVE, subscription.getStatus());
        assertEquals(plan.getId(), subscription.getPlanId());
        assertEquals("evt_1", subscription.getLastEventId());
        LocalDateTime end = subscription.getCurrentPeriodEndsAt();
        assertFalse(end.isBefore(before.plusDays(30).truncatedTo(ChronoUnit.SECONDS)));
        assertFalse(end.isAfter(after.plusDays(30).plusSeconds(1)));

        assertEquals(1, notifier.sent.size());
        assertEquals("a@x.com", notifier.sent.get(0)[0]);
        assertTrue(notifier.sent.get(0)[2].contains("Senha temporaria:"));

        WebhookEvent event = eventRepository.findByEventId("evt_1").orElseThrow();
        assertEquals("PROCESSED", event.getStatus());
        assertNotNull(event.getProcessedAt());
    }

    @Test
    void redeliveryIsAcknowledgedWithoutSideEffects() throws Exception {
        String body = purchase("evt_1", "sub_1", "a@x.com");
        deliver(body).andExpect(status().isOk());
        LocalDateTime endAfterFirst = subscriptionRepository.findByGatewaySubscriptionId("sub_1").orElseThrow()
                .getCurrentPeriodEndsAt();

        deliver(body)
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ok").value(true))
                .andExpect(jsonPath("$.duplicate").value(true));

        assertEquals(1, eventRepository.count());
        assertEquals(1, subscriptionRepository.count());
        assertEquals(1, companyRepository.count());
        assertEquals(1, notifier.sent.size());
        assertEquals(endAfterFirst, subscriptionRepository.findByGatewaySubscriptionId("sub_1").orElseThrow()
                .getCurrentPeriodEndsAt());
    }

    @Test
    void renewalExtendsFromCurrentEndWithoutEmail() throws Exception {
        deliver(purchase("evt_1", "sub_1", "a@x.com")).andExpect(status().isOk());
        LocalDateTime firstEnd = subscriptionRepository.findByGatewaySubscriptionId("sub_1").orElseThrow()
                .getCurrentPeriodEndsAt();

        String renewal = """
                {"id":"evt_2","event":"subscription.renewed","data":{"id":"sub_1","status":"active"}}
                """;
        deliver(renewal).andExpect(status().isOk()).andExpect(jsonPath("$.ok").value(true));

        Subscription subscription = subscriptionRepository.findByGatewaySubscriptionId("sub_1").orElseThrow();
        assertEquals(firstEnd.plusDays(30), subscription.getCurrentPeriodEndsAt());
        assertEquals("evt_2", subscription.getLastEventId());
        assertEquals(1, companyRepository.count());
        assertEquals(1, notifier.sent.size());
    }

    @Test
    void tamperedBodyIsRejectedBeforeAnyWrite() throws Exception {
        String original = purchase("evt_1", "sub_1", "a@x.com");
        String tampered = original.replace("a@x.com", "evil@x.com");

        mockMvc.perform(post("/hooks/cakto")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(tampered)
                        .header("x-cakto-signature", sign(original)))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("Invalid signature"));

        assertEquals(0, eventRepository.count());
        assertEquals(0, userRepository.count());
        assertTrue(notifier.sent.isEmpty());
    }

    @Test
    void prefixedSignatureHeaderIsAccepted() throws Exception {
        String body = purchase("evt_1", "sub_1", "a@x.com");

        mockMvc.perform(post("/hooks/cakto")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body)
                        .header("x-signature", "sha256=" + sign(body)))
                .andExpect(status().isOk());
    }

    @Test
    void unknownYearlyOfferCreatesYearlyPlan() throws Exception {
        String body = """
                {"id":"evt_y","event":"purchase.approved","data":{"id":"sub_y","status":"paid",
                 "customer":{"email":"y@x.com"},"offer":{"id":"off_y","intervalType":"year"}}}
                """;

        deliver(body).andExpect(status().isOk());

        Plan plan = planRepository.findAll().get(0);
        assertEquals("off_y", plan.getCaktoPlanId());
        assertEquals("Plano off_y", plan.getName());
        assertEquals(BillingPeriod.YEARLY, plan.getBillingPeriod());
        assertEquals(365, plan.getPeriodDays());
    }

    @Test
    void concurrentFirstEventsConvergeOnOneCompany() throws Exception {
        String first = purchase("evt_a", "sub_c", "c@x.com");
        String second = """
                {"id":"evt_b","event":"subscription.active","data":{"id":"sub_c","status":"active",
                 "customer":{"email":"c@x.com"},"offer":{"id":"off_1","name":"Pro"}}}
                """;

        ExecutorService pool = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Integer>> results = new ArrayList<>();
        try {
            for (String body : List.of(first, second)) {
                results.add(pool.submit(() -> {
                    start.await();
                    return deliverUntilAccepted(body);
                }));
            }
            start.countDown();
            for (Future<Integer> result : results) {
                assertEquals(200, result.get(30, TimeUnit.SECONDS));
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(1, companyRepository.count());
        assertEquals(1, userRepository.count());
        assertEquals(1, subscriptionRepository.count());
        assertEquals(1, planRepository.count());
        assertEquals(1, notifier.sent.size());
    }

    // 网关的重试行为：非 2xx 时重新投递
    private int deliverUntilAccepted(String body) throws Exception {
        int status = 0;
        for (int attempt = 0; attempt < 10; attempt++) {
            status = deliver(body).andReturn().getResponse().getStatus();
            if (status == 200) {
                return status;
            }
            Thread.sleep(50);
        }
        return status;
    }

    @Test
    void getIsNotAllowed() throws Exception {
        mockMvc.perform(get("/hooks/cakto"))
                .andExpect(status().isMethodNotAllowed())
                .andExpect(jsonPath("$.error").value("Invalid method"));
    }

    @Test
    void invalidJsonWithValidSignatureIsBadRequest() throws Exception {
        deliver("not json")
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Invalid JSON"));

        assertEquals(0, eventRepository.count());
    }

    @Test
    void nonActivatingEventIsIgnored() throws Exception {
        String body = """
                {"id":"evt_r","event":"purchase.refused","data":{"id":"sub_r","status":"refused",
                 "customer":{"email":"r@x.com"}}}
                """;

        deliver(body)
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ignored").value(true));

        assertEquals("IGNORED", eventRepository.findByEventId("evt_r").orElseThrow().getStatus());
        assertEquals(0, subscriptionRepository.count());
    }

    @Test
    void activationWithoutEmailIsSkipped() throws Exception {
        String body = """
                {"id":"evt_s","event":"purchase.approved","data":{"id":"sub_s","status":"approved",
                 "offer":{"id":"off_1"}}}
                """;

        deliver(body)
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.skipped").value(true));

        assertEquals("SKIPPED", eventRepository.findByEventId("evt_s").orElseThrow().getStatus());
        assertEquals(0, userRepository.count());
    }

    @Test
    void checkoutTokenBindsSessionAndSecondCompletionIsDuplicate() throws Exception {
        Plan plan = planRepository.save(Plan.builder().caktoPlanId("off_1").name("Pro").build());
        LocalDateTime now = LocalDateTime.now(ZoneOffset.UTC);
        CheckoutSession checkout = checkoutRepository.save(CheckoutSession.builder()
                .token("tok-1")
                .planId(plan.getId())
                .email("ana@x.com")
                .fullName("Ana Souza")
                .companyName("Loja da Ana")
                .status(CheckoutStatus.PENDING)
                .createdAt(now)
                .updatedAt(now)
                .build());

        String body = """
                {"id":"evt_t1","event":"purchase.approved","data":{"id":"sub_t","status":"approved",
                 "customer":{"email":"other@x.com"},"offer":{"id":"off_1"},
                 "metadata":{"checkout_token":"tok-1"}}}
                """;
        deliver(body).andExpect(status().isOk()).andExpect(jsonPath("$.ok").value(true));

        CheckoutSession completed = checkoutRepository.findById(checkout.getId()).orElseThrow();
        assertEquals(CheckoutStatus.COMPLETED, completed.getStatus());
        assertEquals("sub_t", completed.getGatewaySubscriptionId());
        assertNotNull(completed.getUserId());
        Company company = companyRepository.findById(completed.getCompanyId()).orElseThrow();
        assertEquals("Loja da Ana", company.getName());
        assertEquals("loja-da-ana", company.getSlug());
        assertTrue(userRepository.findByEmailIgnoreCase("ana@x.com").isPresent());
        assertEquals(1, notifier.sent.size());
        assertEquals("ana@x.com", notifier.sent.get(0)[0]);

        String again = body.replace("evt_t1", "evt_t2").replace("sub_t", "sub_t2");
        deliver(again)
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.duplicate").value(true));

        assertEquals("DUPLICATE", eventRepository.findByEventId("evt_t2").orElseThrow().getStatus());
        assertEquals(1, subscriptionRepository.count());
        assertEquals(1, notifier.sent.size());
    }

    @Test
    void outcomesAreCounted() throws Exception {
        double processedBefore = meterRegistry.counter("billing.webhook.events", "outcome", "processed").count();
        double rejectedBefore = meterRegistry.counter("billing.webhook.events", "outcome", "rejected").count();

        deliver(purchase("evt_m", "sub_m", "m@x.com")).andExpect(status().isOk());
        mockMvc.perform(post("/hooks/cakto")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}")
                        .header("x-cakto-signature", "deadbeef"))
                .andExpect(status().isUnauthorized());

        assertEquals(processedBefore + 1,
                meterRegistry.counter("billing.webhook.events", "outcome", "processed").count());
        assertEquals(rejectedBefore + 1,
                meterRegistry.counter("billing.webhook.events", "outcome", "rejected").count());
    }

    @Test
    void paidCheckoutWithoutTokenIsCompleted() throws Exception {
        Plan plan = planRepository.save(Plan.builder().caktoPlanId("off_1").name("Pro").build());
        LocalDateTime now = LocalDateTime.now(ZoneOffset.UTC);
        CheckoutSession checkout = checkoutRepository.save(CheckoutSession.builder()
                .token("tok-paid")
                .planId(plan.getId())
                .email("p@x.com")
                .companyName("Loja P")
                .status(CheckoutStatus.PAID)
                .createdAt(now)
                .updatedAt(now)
                .build());

        deliver(purchase("evt_p", "sub_p", "p@x.com"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ok").value(true));

        CheckoutSession completed = checkoutRepository.findById(checkout.getId()).orElseThrow();
        assertEquals(CheckoutStatus.COMPLETED, completed.getStatus());
        assertNotNull(completed.getUserId());
        Company company = companyRepository.findById(completed.getCompanyId()).orElseThrow();
        assertEquals("loja-p", company.getSlug());
    }

    @Test
    void trialCompanyIsReusedAndPaidPeriodStartsAtTrialEnd() throws Exception {
        LocalDateTime trialEnd = LocalDateTime.now(ZoneOffset.UTC).plusDays(5).truncatedTo(ChronoUnit.SECONDS);
        Company trial = companyRepository.save(Company.builder()
                .name("Loja Trial")
                .slug("loja-trial")
                .email("t@x.com")
                .subscriptionStatus(SubscriptionStatus.TRIAL)
                .trialActive(true)
                .trialEndsAt(trialEnd)
                .build());

        deliver(purchase("evt_tr", "sub_tr", "t@x.com")).andExpect(status().isOk());

        assertEquals(1, companyRepository.count());
        Subscription subscription = subscriptionRepository.findByGatewaySubscriptionId("sub_tr").orElseThrow();
        assertEquals(trial.getId(), subscription.getCompanyId());
        assertEquals(trialEnd.plusDays(30), subscription.getCurrentPeriodEndsAt());
        Company converted = companyRepository.findById(trial.getId()).orElseThrow();
        assertEquals(SubscriptionStatus.ACTIVE, converted.getSubscriptionStatus());
        assertFalse(converted.isTrialActive());
    }

    @Test
    void identityOutageLeavesEventRetryable() throws Exception {
        doThrow(new IllegalStateException("identity service unavailable"))
                .doCallRealMethod()
                .when(identityProvider).createUser(any(), any(), any());
        String body = purchase("evt_f", "sub_f", "f@x.com");

        deliver(body)
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("Provisioning failed, retry later"));

        WebhookEvent failed = eventRepository.findByEventId("evt_f").orElseThrow();
        assertEquals("FAILED", failed.getStatus());
        assertNull(failed.getProcessedAt());
        assertEquals(0, subscriptionRepository.count());
        assertEquals(0, companyRepository.count());
        assertTrue(notifier.sent.isEmpty());

        deliver(body)
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ok").value(true));

        WebhookEvent processed = eventRepository.findByEventId("evt_f").orElseThrow();
        assertEquals("PROCESSED", processed.getStatus());
        assertNotNull(processed.getProcessedAt());
        assertEquals(1, subscriptionRepository.count());
        assertEquals(1, notifier.sent.size());
    }

    @Test
    void secondActivationEventForSameSubscriptionDoesNotStack() throws Exception {
        deliver(purchase("evt_1", "sub_1", "a@x.com")).andExpect(status().isOk());
        LocalDateTime firstEnd = subscriptionRepository.findByGatewaySubscriptionId("sub_1").orElseThrow()
                .getCurrentPeriodEndsAt();

        String active = """
                {"id":"evt_2","event":"subscription.active","data":{"id":"sub_1","status":"active",
                 "customer":{"email":"a@x.com"},"offer":{"id":"off_1"}}}
                """;
        deliver(active).andExpect(status().isOk()).andExpect(jsonPath("$.ok").value(true));

        Subscription subscription = subscriptionRepository.findByGatewaySubscriptionId("sub_1").orElseThrow();
        assertEquals(firstEnd, subscription.getCurrentPeriodEndsAt());
        assertEquals("evt_2", subscription.getLastEventId());
        assertEquals(firstEnd, companyRepository.findAll().get(0).getSubscriptionEndDate());
        assertEquals(1, notifier.sent.size());
    }
}
