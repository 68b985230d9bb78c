package com.flagship.pos_core.customer;

import com.flagship.pos_core.exception.ResourceNotFoundException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;
import java.util.UUID;

import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(CustomerController.class)
class CustomerControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private CreditGuard creditGuard;

    @MockBean
    private Clock clock;

    @Test
    @DisplayName("Credit status is scoped to the caller's business")
    void creditStatus() throws Exception {
        UUID businessId = UUID.randomUUID();
        UUID customerId = UUID.randomUUID();
        when(creditGuard.creditStatus(businessId, customerId)).thenReturn(new CreditStatus(
            customerId, new BigDecimal("100.00"), new BigDecimal("80.00"), new BigDecimal("20.00"), 30, false));

        mockMvc.perform(get("/api/customers/{id}/credit", customerId)
                .header("X-Business-Id", businessId.toString()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.customer_id").value(customerId.toString()))
            .andExpect(jsonPath("$.available_credit").value(20.00))
            .andExpect(jsonPath("$.credit_terms_days").value(30))
            .andExpect(jsonPath("$.credit_blocked").value(false));
    }

    @Test
    @DisplayName("Unknown customer maps to 404")
    void unknownCustomer() throws Exception {
        UUID businessId = UUID.randomUUID();
        UUID customerId = UUID.randomUUID();
        when(creditGuard.transactions(businessId, customerId))
            .thenThrow(new ResourceNotFoundException("Customer", customerId));

        mockMvc.perform(get("/api/customers/{id}/credit/transactions", customerId)
                .header("X-Business-Id", businessId.toString()))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("NOT_FOUND"));
    }

    @Test
    @DisplayName("Missing business header is rejected before lookup")
    void missingBusinessHeader() throws Exception {
        mockMvc.perform(get("/api/customers/{id}/credit", UUID.randomUUID()))
            .andExpect(status().isBadRequest());

        verifyNoInteractions(creditGuard);
    }

    @Test
    @DisplayName("Empty history returns an empty list")
    void emptyHistory() throws Exception {
        UUID businessId = UUID.randomUUID();
        UUID customerId = UUID.randomUUID();
        when(creditGuard.transactions(businessId, customerId)).thenReturn(List.of());

        mockMvc.perform(get("/api/customers/{id}/credit/transactions", customerId)
                .header("X-Business-Id", businessId.toString()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(0));
    }
}
