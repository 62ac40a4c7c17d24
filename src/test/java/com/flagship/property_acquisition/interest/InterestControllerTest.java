package com.flagship.property_acquisition.interest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.property_acquisition.IntegrationTestSupport;
import com.flagship.property_acquisition.client.Client;
import com.flagship.property_acquisition.property.Property;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.math.BigDecimal;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * REST surface of the acquisition journey, end to end through MockMvc.
 */
@AutoConfigureMockMvc
class InterestControllerTest extends IntegrationTestSupport {

    private static final String HEADER = InterestController.AUTH_USER_HEADER;

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    private Client client;
    private Property property;
    private String base;

    @BeforeEach
    void setUp() {
        client = createClient("Faith Chebet");
        property = createProperty(new BigDecimal("800000.00"));
        base = "/api/clients/me/properties/" + property.getId();
    }

    private String json(Object body) throws Exception {
        return objectMapper.writeValueAsString(body);
    }

    private void commitAndSign() throws Exception {
        mockMvc.perform(post(base + "/interest").header(HEADER, client.getAuthUserId()))
                .andExpect(status().isCreated());
        mockMvc.perform(post(base + "/commitment").header(HEADER, client.getAuthUserId()))
                .andExpect(status().isOk());
        mockMvc.perform(post(base + "/agreement")
                        .header(HEADER, client.getAuthUserId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("signature", "faith chebet"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.agreement_signed_at").exists());
    }

    @Nested
    @DisplayName("Client journey")
    class ClientJourney {

        @Test
        @DisplayName("Interest, commitment, agreement and deposit start the handover")
        void fullJourney() throws Exception {
            printTestHeader("Client Journey via REST");
            commitAndSign();

            String reference = "TX-" + UUID.randomUUID();
            Map<String, Object> deposit = Map.of(
                    "amount", new BigDecimal("80000.00"),
                    "payment_reference", reference,
                    "payment_method", "MOBILE_MONEY");
            printInput("Deposit", deposit);

            MvcResult result = mockMvc.perform(post(base + "/deposit")
                            .header(HEADER, client.getAuthUserId())
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(json(deposit)))
                    .andExpect(status().isCreated())
                    .andExpect(jsonPath("$.settlement_status").value("COMPLETED"))
                    .andExpect(jsonPath("$.installment_number").value(1))
                    .andExpect(jsonPath("$.handover_outcome").value("STARTED"))
                    .andExpect(jsonPath("$.interest.status").value("IN_HANDOVER"))
                    .andReturn();
            printOutput("Response", result.getResponse().getContentAsString());

            mockMvc.perform(post(base + "/deposit")
                            .header(HEADER, client.getAuthUserId())
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(json(deposit)))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.duplicate").value(true));

            mockMvc.perform(get("/api/properties/" + property.getId() + "/handover"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.current_stage").value(3))
                    .andExpect(jsonPath("$.overall_progress").value(50))
                    .andExpect(jsonPath("$.pipeline_stages.length()").value(5))
                    .andExpect(jsonPath("$.pipeline_stages[0].stage_number").value(1));
            printSuccess("Journey completed");
        }

        @Test
        @DisplayName("A pending deposit answers 202 and is confirmed by the admin route")
        void pendingDeposit() throws Exception {
            commitAndSign();
            String reference = "PENDING-" + UUID.randomUUID();

            mockMvc.perform(post(base + "/deposit")
                            .header(HEADER, client.getAuthUserId())
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(json(Map.of(
                                    "amount", new BigDecimal("80000.00"),
                                    "payment_reference", reference,
                                    "payment_method", "BANK_TRANSFER"))))
                    .andExpect(status().isAccepted())
                    .andExpect(jsonPath("$.settlement_status").value("PENDING_VERIFICATION"));

            mockMvc.perform(post("/api/properties/" + property.getId() + "/deposits/" + reference + "/verification")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(json(Map.of("verified_by", "finance-officer"))))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.handover_outcome").value("STARTED"));
        }

        @Test
        @DisplayName("Reserving and cancelling round trip")
        void reserveAndCancel() throws Exception {
            mockMvc.perform(post(base + "/interest").header(HEADER, client.getAuthUserId()))
                    .andExpect(status().isCreated())
                    .andExpect(jsonPath("$.status").value("ACTIVE"));
            mockMvc.perform(post(base + "/reservation").header(HEADER, client.getAuthUserId()))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.status").value("RESERVED"));
            mockMvc.perform(delete(base + "/interest")
                            .header(HEADER, client.getAuthUserId())
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(json(Map.of("reason", "found another plot"))))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.status").value("INACTIVE"));
            mockMvc.perform(get(base + "/interest").header(HEADER, client.getAuthUserId()))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.status").value("INACTIVE"));
        }
    }

    @Nested
    @DisplayName("Error mapping")
    class ErrorMapping {

        @Test
        @DisplayName("Missing identity header is a 400")
        void missingHeader() throws Exception {
            mockMvc.perform(post(base + "/interest"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error").value("VALIDATION"));
        }

        @Test
        @DisplayName("Unknown auth user is a 404")
        void unknownUser() throws Exception {
            mockMvc.perform(post(base + "/interest").header(HEADER, "nobody-" + UUID.randomUUID()))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.error").value("NOT_FOUND"));
        }

        @Test
        @DisplayName("Duplicate interest is a 409")
        void duplicateInterest() throws Exception {
            mockMvc.perform(post(base + "/interest").header(HEADER, client.getAuthUserId()))
                    .andExpect(status().isCreated());
            mockMvc.perform(post(base + "/interest").header(HEADER, client.getAuthUserId()))
                    .andExpect(status().isConflict())
                    .andExpect(jsonPath("$.error").value("CONFLICT"));
        }

        @Test
        @DisplayName("Committing a property another client holds is a 409")
        void takenByOther() throws Exception {
            Client other = createClient("Other Buyer");
            mockMvc.perform(post(base + "/interest").header(HEADER, client.getAuthUserId()))
                    .andExpect(status().isCreated());
            mockMvc.perform(post(base + "/interest").header(HEADER, other.getAuthUserId()))
                    .andExpect(status().isCreated());
            mockMvc.perform(post(base + "/reservation").header(HEADER, other.getAuthUserId()))
                    .andExpect(status().isOk());

            mockMvc.perform(post(base + "/commitment").header(HEADER, client.getAuthUserId()))
                    .andExpect(status().isConflict());
        }

        @Test
        @DisplayName("Wrong signature is a 400 with the signature field")
        void wrongSignature() throws Exception {
            mockMvc.perform(post(base + "/interest").header(HEADER, client.getAuthUserId()));
            mockMvc.perform(post(base + "/commitment").header(HEADER, client.getAuthUserId()));

            mockMvc.perform(post(base + "/agreement")
                            .header(HEADER, client.getAuthUserId())
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(json(Map.of("signature", "Someone Else"))))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.details.signature").exists());
        }

        @Test
        @DisplayName("Invalid deposit body is a 400 with field details")
        void invalidDepositBody() throws Exception {
            MvcResult result = mockMvc.perform(post(base + "/deposit")
                            .header(HEADER, client.getAuthUserId())
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(json(Map.of("amount", 0))))
                    .andExpect(status().isBadRequest())
                    .andReturn();

            JsonNode body = objectMapper.readTree(result.getResponse().getContentAsString());
            assertTrue(body.get("details").has("amount"));
            assertTrue(body.get("details").has("paymentReference"));
        }

        @Test
        @DisplayName("Subdividing a property in handover is a 422")
        void subdivisionDuringHandover() throws Exception {
            commitAndSign();
            mockMvc.perform(post("/api/properties/" + property.getId() + "/handover")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(json(Map.of("client_id", client.getId(), "trigger_event", "ADMIN_MANUAL"))))
                    .andExpect(status().isCreated())
                    .andExpect(jsonPath("$.outcome").value("STARTED"));
            mockMvc.perform(post("/api/properties/" + property.getId() + "/handover")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(json(Map.of("client_id", client.getId(), "trigger_event", "ADMIN_MANUAL"))))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.outcome").value("ALREADY_IN_PROGRESS"));

            mockMvc.perform(put("/api/properties/" + property.getId() + "/subdivision")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(json(Map.of("status", "SUB_DIVISION_STARTED"))))
                    .andExpect(status().isUnprocessableEntity())
                    .andExpect(jsonPath("$.error").value("UNAVAILABLE"));

            mockMvc.perform(put("/api/properties/" + property.getId() + "/handover/stages/3")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(json(Map.of("status", "COMPLETED", "notes", "funds cleared"))))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.current_stage").value(4));
        }
    }
}
