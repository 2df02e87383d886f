package com.example.billinghook.controller;

import com.example.billinghook.model.CheckoutSession;
import com.example.billinghook.model.CheckoutStatus;
import com.example.billinghook.model.Plan;
import com.example.billinghook.repository.CheckoutSessionRepository;
import com.example.billinghook.repository.PlanRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class CheckoutControllerTest {

    @Autowired
    private MockMvc mockMvc;
    @Autowired
    private PlanRepository planRepository;
    @Autowired
    private CheckoutSessionRepository checkoutRepository;

    private Plan plan;

    @BeforeEach
    void setUp() {
        checkoutRepository.deleteAll();
        planRepository.deleteAll();
        plan = planRepository.save(Plan.builder().caktoPlanId("off_1").name("Pro").build());
    }

    private ResultActions create(String json) throws Exception {
        return mockMvc.perform(post("/api/checkouts").contentType(MediaType.APPLICATION_JSON).content(json));
    }

    @Test
    void createsPendingCheckout() throws Exception {
        create("{\"plan_id\":" + plan.getId() + ",\"email\":\" Ana@X.com \",\"full_name\":\"Ana\","
                + "\"company_name\":\"Loja\"}")
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.token").isNotEmpty())
                .andExpect(jsonPath("$.checkout_url").value("https://pay.cakto.com.br/off_1"));

        CheckoutSession checkout = checkoutRepository.findAll().get(0);
        assertEquals(CheckoutStatus.PENDING, checkout.getStatus());
        assertEquals("ana@x.com", checkout.getEmail());
        assertEquals("Loja", checkout.getCompanyName());
        assertEquals(plan.getId(), checkout.getPlanId());
        assertNotNull(checkout.getCreatedAt());
    }

    @Test
    void missingEmailIsBadRequest() throws Exception {
        create("{\"plan_id\":" + plan.getId() + "}")
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").exists());
    }

    @Test
    void unknownOrInactivePlanIsNotFound() throws Exception {
        create("{\"plan_id\":999999,\"email\":\"a@x.com\"}").andExpect(status().isNotFound());

        plan.setActive(false);
        planRepository.save(plan);
        create("{\"plan_id\":" + plan.getId() + ",\"email\":\"a@x.com\"}").andExpect(status().isNotFound());
    }

    @Test
    void secondOpenCheckoutForSamePlanConflicts() throws Exception {
        String json = "{\"plan_id\":" + plan.getId() + ",\"email\":\"a@x.com\"}";
        create(json).andExpect(status().isOk());

        create(json).andExpect(status().isConflict());
        assertEquals(1, checkoutRepository.count());
    }

    @Test
    void malformedBodyIsBadRequest() throws Exception {
        create("{").andExpect(status().isBadRequest());
    }

    @Test
    void checkoutStatusIsAcceptedUntilUserBound() throws Exception {
        CheckoutSession checkout = checkoutRepository.save(CheckoutSession.builder()
                .token("tok-wait").planId(plan.getId()).email("a@x.com").status(CheckoutStatus.PENDING).build());

        mockMvc.perform(get("/api/checkouts/tok-wait"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.ready").value(false))
                .andExpect(jsonPath("$.status").value("pending"))
                .andExpect(jsonPath("$.error").value("Checkout not ready"));

        checkout.setUserId(42L);
        checkout.setCompanyId(7L);
        checkout.setStatus(CheckoutStatus.COMPLETED);
        checkoutRepository.save(checkout);

        mockMvc.perform(get("/api/checkouts/tok-wait"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ready").value(true))
                .andExpect(jsonPath("$.status").value("completed"))
                .andExpect(jsonPath("$.user_id").value(42))
                .andExpect(jsonPath("$.company_id").value(7));
    }

    @Test
    void unknownCheckoutTokenIsNotFound() throws Exception {
        mockMvc.perform(get("/api/checkouts/nope"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Checkout not found"));
    }
}
