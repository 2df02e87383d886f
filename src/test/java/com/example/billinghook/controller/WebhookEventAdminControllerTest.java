package com.example.billinghook.controller;

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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.httpBasic;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class WebhookEventAdminControllerTest {

    @Autowired
    private MockMvc mockMvc;
    @Autowired
    private WebhookEventRepository eventRepository;
    @Autowired
    private SubscriptionRepository subscriptionRepository;
    @Autowired
    private CompanyRepository companyRepository;
    @Autowired
    private CompanyUserRepository companyUserRepository;
    @Autowired
    private AppUserRepository userRepository;
    @Autowired
    private ProfileRepository profileRepository;
    @Autowired
    private UserRoleRepository userRoleRepository;
    @Autowired
    private PlanRepository planRepository;
    @Autowired
    private CheckoutSessionRepository checkoutRepository;

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
    }

    private WebhookEvent seed(String eventId, String status, LocalDateTime processedAt, String payload) {
        return eventRepository.save(WebhookEvent.builder()
                .gateway("cakto")
                .eventId(eventId)
                .eventType("purchase.approved")
                .payload(payload)
                .receivedAt(LocalDateTime.now().minusMinutes(5))
                .status(status)
                .processedAt(processedAt)
                .build());
    }

    @Test
    void requiresAuthentication() throws Exception {
        mockMvc.perform(get("/api/webhook-events")).andExpect(status().isUnauthorized());
        mockMvc.perform(get("/api/webhook-events").with(httpBasic("admin", "wrong")))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void listsAndFiltersByStatus() throws Exception {
        seed("evt_1", "PROCESSED", LocalDateTime.now(), "{}");
        seed("evt_2", "FAILED", null, "{}");

        mockMvc.perform(get("/api/webhook-events").with(httpBasic("admin", "admin-pass")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalElements").value(2))
                .andExpect(jsonPath("$.content[0].payload").doesNotExist());

        mockMvc.perform(get("/api/webhook-events").param("status", "failed")
                        .with(httpBasic("admin", "admin-pass")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalElements").value(1))
                .andExpect(jsonPath("$.content[0].eventId").value("evt_2"));
    }

    @Test
    void statsCountByStatus() throws Exception {
        seed("evt_1", "PROCESSED", LocalDateTime.now(), "{}");
        seed("evt_2", "IGNORED", LocalDateTime.now(), "{}");
        seed("evt_3", "RECEIVED", null, "{}");

        mockMvc.perform(get("/api/webhook-events/stats").with(httpBasic("admin", "admin-pass")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(3))
                .andExpect(jsonPath("$.processed").value(1))
                .andExpect(jsonPath("$.ignored").value(1))
                .andExpect(jsonPath("$.received").value(1))
                .andExpect(jsonPath("$.failed").value(0));
    }

    @Test
    void replayProcessesPendingEventOnce() throws Exception {
        String payload = """
                {"id":"evt_p","event":"purchase.approved","data":{"id":"sub_p","status":"approved",
                 "customer":{"email":"p@x.com"},"offer":{"id":"off_p","name":"Pro"}}}
                """;
        seed("evt_p", "FAILED", null, payload);

        mockMvc.perform(post("/api/webhook-events/evt_p/replay").with(httpBasic("admin", "admin-pass")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ok").value(true));

        WebhookEvent event = eventRepository.findByEventId("evt_p").orElseThrow();
        assertEquals("PROCESSED", event.getStatus());
        assertTrue(subscriptionRepository.findByGatewaySubscriptionId("sub_p").isPresent());

        mockMvc.perform(post("/api/webhook-events/evt_p/replay").with(httpBasic("admin", "admin-pass")))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("Event already processed"));
    }

    @Test
    void replayUnknownEventIsNotFound() throws Exception {
        mockMvc.perform(post("/api/webhook-events/nope/replay").with(httpBasic("admin", "admin-pass")))
                .andExpect(status().isNotFound());
    }
}
