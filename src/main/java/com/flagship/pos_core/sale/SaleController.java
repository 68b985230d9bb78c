package com.flagship.pos_core.sale;

import com.flagship.pos_core.context.SaleContext;
import com.flagship.pos_core.payment.PaymentLedger;
import com.flagship.pos_core.payment.PaymentLedger.PaymentRecording;
import com.flagship.pos_core.refund.RefundEntity;
import com.flagship.pos_core.refund.RefundProcessor;
import com.flagship.pos_core.sale.dto.AddItemRequest;
import com.flagship.pos_core.sale.dto.CancelSaleRequest;
import com.flagship.pos_core.sale.dto.ChangeTypeRequest;
import com.flagship.pos_core.sale.dto.CompleteSaleRequest;
import com.flagship.pos_core.sale.dto.OpenSaleRequest;
import com.flagship.pos_core.sale.dto.PaymentResponse;
import com.flagship.pos_core.sale.dto.RecordPaymentRequest;
import com.flagship.pos_core.sale.dto.RefundRequest;
import com.flagship.pos_core.sale.dto.RefundResponse;
import com.flagship.pos_core.sale.dto.SaleResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * REST surface of the sale lifecycle.
 *
 * The acting business, storefront and user arrive as headers set by the
 * gateway after authentication. Payments accept an optional Idempotency-Key;
 * a repeated key returns the original payment with 200 instead of 201.
 */
@RestController
@RequestMapping("/api/sales")
@RequiredArgsConstructor
@Slf4j
public class SaleController {

    static final String BUSINESS_HEADER = "X-Business-Id";
    static final String STOREFRONT_HEADER = "X-Storefront-Id";
    static final String ACTOR_HEADER = "X-Actor-Id";
    static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final SaleService saleService;
    private final PaymentLedger paymentLedger;
    private final RefundProcessor refundProcessor;

    @PostMapping
    public ResponseEntity<SaleResponse> openSale(
            @RequestHeader(BUSINESS_HEADER) UUID businessId,
            @RequestHeader(STOREFRONT_HEADER) UUID storefrontId,
            @RequestHeader(ACTOR_HEADER) UUID actorId,
            @Valid @RequestBody OpenSaleRequest request) {
        SaleContext ctx = SaleContext.of(businessId, storefrontId, actorId);
        SaleEntity sale = saleService.openSale(ctx, request.getCustomerId(), request.getSaleType());
        return ResponseEntity.status(HttpStatus.CREATED).body(SaleResponse.from(sale));
    }

    @GetMapping("/{id}")
    public ResponseEntity<SaleResponse> getSale(
            @RequestHeader(BUSINESS_HEADER) UUID businessId,
            @RequestHeader(STOREFRONT_HEADER) UUID storefrontId,
            @RequestHeader(ACTOR_HEADER) UUID actorId,
            @PathVariable("id") UUID id) {
        SaleContext ctx = SaleContext.of(businessId, storefrontId, actorId);
        return ResponseEntity.ok(SaleResponse.from(saleService.get(ctx, id)));
    }

    @PostMapping("/{id}/items")
    public ResponseEntity<SaleResponse> addItem(
            @RequestHeader(BUSINESS_HEADER) UUID businessId,
            @RequestHeader(STOREFRONT_HEADER) UUID storefrontId,
            @RequestHeader(ACTOR_HEADER) UUID actorId,
            @PathVariable("id") UUID id,
            @Valid @RequestBody AddItemRequest request) {
        SaleContext ctx = SaleContext.of(businessId, storefrontId, actorId);
        SaleItemEntity item = saleService.addItem(ctx, id, request.toCommand());
        return ResponseEntity.status(HttpStatus.CREATED).body(SaleResponse.from(item.getSale()));
    }

    @DeleteMapping("/{id}/items/{itemId}")
    public ResponseEntity<SaleResponse> removeItem(
            @RequestHeader(BUSINESS_HEADER) UUID businessId,
            @RequestHeader(STOREFRONT_HEADER) UUID storefrontId,
            @RequestHeader(ACTOR_HEADER) UUID actorId,
            @PathVariable("id") UUID id,
            @PathVariable("itemId") UUID itemId) {
        SaleContext ctx = SaleContext.of(businessId, storefrontId, actorId);
        return ResponseEntity.ok(SaleResponse.from(saleService.removeItem(ctx, id, itemId)));
    }

    @PutMapping("/{id}/type")
    public ResponseEntity<SaleResponse> changeType(
            @RequestHeader(BUSINESS_HEADER) UUID businessId,
            @RequestHeader(STOREFRONT_HEADER) UUID storefrontId,
            @RequestHeader(ACTOR_HEADER) UUID actorId,
            @PathVariable("id") UUID id,
            @Valid @RequestBody ChangeTypeRequest request) {
        SaleContext ctx = SaleContext.of(businessId, storefrontId, actorId);
        return ResponseEntity.ok(SaleResponse.from(saleService.changeType(ctx, id, request.getSaleType())));
    }

    @PostMapping("/{id}/complete")
    public ResponseEntity<SaleResponse> completeSale(
            @RequestHeader(BUSINESS_HEADER) UUID businessId,
            @RequestHeader(STOREFRONT_HEADER) UUID storefrontId,
            @RequestHeader(ACTOR_HEADER) UUID actorId,
            @PathVariable("id") UUID id,
            @Valid @RequestBody CompleteSaleRequest request) {
        SaleContext ctx = SaleContext.of(businessId, storefrontId, actorId);
        log.info("Received completion request for sale {}: paymentType={}", id, request.getPaymentType());
        return ResponseEntity.ok(SaleResponse.from(saleService.complete(ctx, id, request.toCommand())));
    }

    @PostMapping("/{id}/abandon")
    public ResponseEntity<SaleResponse> abandonSale(
            @RequestHeader(BUSINESS_HEADER) UUID businessId,
            @RequestHeader(STOREFRONT_HEADER) UUID storefrontId,
            @RequestHeader(ACTOR_HEADER) UUID actorId,
            @PathVariable("id") UUID id) {
        SaleContext ctx = SaleContext.of(businessId, storefrontId, actorId);
        return ResponseEntity.ok(SaleResponse.from(saleService.abandon(ctx, id)));
    }

    @PostMapping("/{id}/payments")
    public ResponseEntity<PaymentResponse> recordPayment(
            @RequestHeader(BUSINESS_HEADER) UUID businessId,
            @RequestHeader(STOREFRONT_HEADER) UUID storefrontId,
            @RequestHeader(ACTOR_HEADER) UUID actorId,
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey,
            @PathVariable("id") UUID id,
            @Valid @RequestBody RecordPaymentRequest request) {
        SaleContext ctx = SaleContext.of(businessId, storefrontId, actorId);
        log.info("Received payment for sale {}: amount={}, method={}, idempotencyKey={}",
                id, request.getAmount(), request.getMethod(), idempotencyKey);

        PaymentRecording recording = paymentLedger.recordPayment(ctx, id, request.getAmount(),
            request.getMethod(), request.getReference(), idempotencyKey);
        PaymentResponse body = PaymentResponse.from(recording.getPayment(), recording.getSale());
        if (recording.isDuplicate()) {
            return ResponseEntity.ok(body);
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(body);
    }

    @GetMapping("/{id}/payments")
    public ResponseEntity<List<PaymentResponse>> listPayments(
            @RequestHeader(BUSINESS_HEADER) UUID businessId,
            @RequestHeader(STOREFRONT_HEADER) UUID storefrontId,
            @RequestHeader(ACTOR_HEADER) UUID actorId,
            @PathVariable("id") UUID id) {
        SaleContext ctx = SaleContext.of(businessId, storefrontId, actorId);
        return ResponseEntity.ok(paymentLedger.payments(ctx, id).stream()
            .map(PaymentResponse::from)
            .toList());
    }

    @PostMapping("/{id}/refunds")
    public ResponseEntity<RefundResponse> processRefund(
            @RequestHeader(BUSINESS_HEADER) UUID businessId,
            @RequestHeader(STOREFRONT_HEADER) UUID storefrontId,
            @RequestHeader(ACTOR_HEADER) UUID actorId,
            @PathVariable("id") UUID id,
            @Valid @RequestBody RefundRequest request) {
        SaleContext ctx = SaleContext.of(businessId, storefrontId, actorId);
        RefundEntity refund = refundProcessor.processRefund(ctx, id, request.toLines(),
            request.getReason(), request.getRefundType());
        return ResponseEntity.status(HttpStatus.CREATED).body(RefundResponse.from(refund));
    }

    @GetMapping("/{id}/refunds")
    public ResponseEntity<List<RefundResponse>> listRefunds(
            @RequestHeader(BUSINESS_HEADER) UUID businessId,
            @RequestHeader(STOREFRONT_HEADER) UUID storefrontId,
            @RequestHeader(ACTOR_HEADER) UUID actorId,
            @PathVariable("id") UUID id) {
        SaleContext ctx = SaleContext.of(businessId, storefrontId, actorId);
        return ResponseEntity.ok(refundProcessor.refunds(ctx, id).stream()
            .map(RefundResponse::from)
            .toList());
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<SaleResponse> cancelSale(
            @RequestHeader(BUSINESS_HEADER) UUID businessId,
            @RequestHeader(STOREFRONT_HEADER) UUID storefrontId,
            @RequestHeader(ACTOR_HEADER) UUID actorId,
            @PathVariable("id") UUID id,
            @Valid @RequestBody CancelSaleRequest request) {
        SaleContext ctx = SaleContext.of(businessId, storefrontId, actorId);
        return ResponseEntity.ok(SaleResponse.from(refundProcessor.cancelSale(ctx, id, request.getReason())));
    }
}
