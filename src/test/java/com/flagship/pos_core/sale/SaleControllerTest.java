package com.flagship.pos_core.sale;

import com.flagship.pos_core.context.SaleContext;
import com.flagship.pos_core.exception.CreditLimitExceededException;
import com.flagship.pos_core.exception.InsufficientStockException;
import com.flagship.pos_core.exception.InvalidStateTransitionException;
import com.flagship.pos_core.payment.PaymentLedger;
import com.flagship.pos_core.payment.PaymentMethod;
import com.flagship.pos_core.refund.RefundProcessor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * HTTP contract of the sale endpoints: headers, validation and error mapping.
 */
@WebMvcTest(SaleController.class)
class SaleControllerTest {

    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private SaleService saleService;

    @MockBean
    private PaymentLedger paymentLedger;

    @MockBean
    private RefundProcessor refundProcessor;

    @MockBean
    private Clock clock;

    private UUID businessId;
    private UUID storefrontId;
    private UUID actorId;
    private SaleEntity sale;

    @BeforeEach
    void setUp() {
        businessId = UUID.randomUUID();
        storefrontId = UUID.randomUUID();
        actorId = UUID.randomUUID();
        sale = SaleEntity.open(businessId, storefrontId, actorId, null, SaleType.RETAIL, NOW);
        when(clock.instant()).thenReturn(NOW);
    }

    private MockHttpServletRequestBuilder withContext(MockHttpServletRequestBuilder request) {
        return request
            .header("X-Business-Id", businessId.toString())
            .header("X-Storefront-Id", storefrontId.toString())
            .header("X-Actor-Id", actorId.toString())
            .contentType(MediaType.APPLICATION_JSON);
    }

    @Test
    @DisplayName("Adding an item returns the recalculated sale")
    void addItem() throws Exception {
        UUID stockLineId = UUID.randomUUID();
        SaleItemEntity item = sale.addItem(UUID.randomUUID(), stockLineId, UUID.randomUUID(), 2,
            new BigDecimal("25.00"), new BigDecimal("10"), new BigDecimal("16"), BigDecimal.ZERO, NOW);
        when(saleService.addItem(any(SaleContext.class), eq(sale.getId()), any(AddItemCommand.class)))
            .thenReturn(item);

        mockMvc.perform(withContext(post("/api/sales/{id}/items", sale.getId()))
                .content("{\"stock_line_id\":\"" + stockLineId + "\",\"quantity\":2,"
                    + "\"discount_percentage\":10,\"tax_rate\":16}"))
            .andExpect(status().isCreated())
            .andExpect(header().exists("X-Correlation-ID"))
            .andExpect(jsonPath("$.status").value("DRAFT"))
            .andExpect(jsonPath("$.total_amount").value(52.20))
            .andExpect(jsonPath("$.items[0].stock_line_id").value(stockLineId.toString()))
            .andExpect(jsonPath("$.items[0].tax_amount").value(7.20));

        ArgumentCaptor<AddItemCommand> command = ArgumentCaptor.forClass(AddItemCommand.class);
        ArgumentCaptor<SaleContext> ctx = ArgumentCaptor.forClass(SaleContext.class);
        verify(saleService).addItem(ctx.capture(), eq(sale.getId()), command.capture());
        assertEquals(2, command.getValue().getQuantity());
        assertEquals(stockLineId, command.getValue().getStockLineId());
        assertEquals(businessId, ctx.getValue().getBusinessId());
        assertEquals(actorId, ctx.getValue().getActorId());
    }

    @Test
    void missingTenantHeaderIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/sales/{id}/abandon", sale.getId())
                .header("X-Storefront-Id", storefrontId.toString())
                .header("X-Actor-Id", actorId.toString()))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("MISSING_HEADER"));

        verifyNoInteractions(saleService);
    }

    @Test
    void invalidItemIsRejectedBeforeReachingTheService() throws Exception {
        mockMvc.perform(withContext(post("/api/sales/{id}/items", sale.getId()))
                .content("{\"stock_line_id\":\"" + UUID.randomUUID() + "\",\"quantity\":0}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("VALIDATION_FAILED"))
            .andExpect(jsonPath("$.details.quantity").exists());

        verifyNoInteractions(saleService);
    }

    @Test
    void pricesFinerThanCentsAreRejected() throws Exception {
        mockMvc.perform(withContext(post("/api/sales/{id}/items", sale.getId()))
                .content("{\"stock_line_id\":\"" + UUID.randomUUID() + "\",\"quantity\":2,"
                    + "\"unit_price\":0.125,\"tax_rate\":7.125}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("VALIDATION_FAILED"))
            .andExpect(jsonPath("$.details.unitPrice").exists())
            .andExpect(jsonPath("$.details.taxRate").exists());

        verifyNoInteractions(saleService);
    }

    @Test
    @DisplayName("Insufficient stock is a 409 with the available quantity")
    void insufficientStockIsConflict() throws Exception {
        UUID stockLineId = UUID.randomUUID();
        when(saleService.addItem(any(SaleContext.class), eq(sale.getId()), any(AddItemCommand.class)))
            .thenThrow(new InsufficientStockException("stock_line", stockLineId, 1, 3));

        mockMvc.perform(withContext(post("/api/sales/{id}/items", sale.getId()))
                .content("{\"stock_line_id\":\"" + stockLineId + "\",\"quantity\":3}"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error").value("INSUFFICIENT_STOCK"))
            .andExpect(jsonPath("$.timestamp").value("2024-03-01T10:00:00Z"));
    }

    @Test
    @DisplayName("Completion maps tenders and rejects credit over the limit with 422")
    void completeOverCreditLimit() throws Exception {
        UUID customerId = UUID.randomUUID();
        when(saleService.complete(any(SaleContext.class), eq(sale.getId()), any(CompleteSaleCommand.class)))
            .thenThrow(new CreditLimitExceededException(customerId, "Outstanding 80.00 plus 30.00 exceeds credit limit 100.00",
                new BigDecimal("100.00"), new BigDecimal("80.00"), new BigDecimal("30.00")));

        mockMvc.perform(withContext(post("/api/sales/{id}/complete", sale.getId()))
                .content("{\"payment_type\":\"CREDIT\",\"payments\":[{\"amount\":10.00,\"method\":\"CASH\"}]}"))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.error").value("CREDIT_LIMIT_EXCEEDED"));

        ArgumentCaptor<CompleteSaleCommand> command = ArgumentCaptor.forClass(CompleteSaleCommand.class);
        verify(saleService).complete(any(SaleContext.class), eq(sale.getId()), command.capture());
        assertEquals(PaymentType.CREDIT, command.getValue().getPaymentType());
        assertEquals(1, command.getValue().getPayments().size());
        assertEquals(PaymentMethod.CASH, command.getValue().getPayments().get(0).getMethod());
        assertFalse(command.getValue().isForceCredit());
    }

    @Test
    void completingTwiceIsConflict() throws Exception {
        when(saleService.complete(any(SaleContext.class), eq(sale.getId()), any(CompleteSaleCommand.class)))
            .thenThrow(new InvalidStateTransitionException(sale.getId(), SaleStatus.COMPLETED, "complete"));

        mockMvc.perform(withContext(post("/api/sales/{id}/complete", sale.getId()))
                .content("{\"payment_type\":\"CASH\",\"payments\":[{\"amount\":50.00,\"method\":\"CASH\"}]}"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error").value("INVALID_STATE_TRANSITION"))
            .andExpect(jsonPath("$.details.current_status").value("COMPLETED"));
    }

    @Test
    void refundWithoutReasonIsInvalid() throws Exception {
        mockMvc.perform(withContext(post("/api/sales/{id}/refunds", sale.getId()))
                .content("{\"items\":[{\"sale_item_id\":\"" + UUID.randomUUID() + "\",\"quantity\":1}]}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.details.reason").exists());

        verifyNoInteractions(refundProcessor);
    }
}
