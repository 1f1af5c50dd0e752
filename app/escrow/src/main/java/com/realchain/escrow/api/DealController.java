/*
 * どこで: Escrow API
 * 何を: 出品/オファー/受渡し確定/キャンセル/参照のエンドポイントを提供する
 * なぜ: EscrowFacade を署名者・UI から呼べる REST 面として公開するため
 */
package com.realchain.escrow.api;

import com.realchain.escrow.model.DealAction;
import com.realchain.escrow.model.DealArguments;
import com.realchain.escrow.model.DealCommand;
import com.realchain.escrow.service.EscrowFacade;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.RequiredArgsConstructor;

import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1")
@RequiredArgsConstructor
@Validated
public class DealController {

    private static final String HEADER_CALLER_ID = "X-Caller-Id";
    private static final String HEADER_IDEMPOTENCY_KEY = "Idempotency-Key";
    private static final String HEADER_TRACE_ID = "X-Trace-Id";
    // caller_id / idem_key 列の長さに合わせる
    private static final int MAX_IDENTIFIER_LENGTH = 128;

    private final EscrowFacade escrowFacade;

    @PostMapping("/deals")
    public ResponseEntity<DealResponse> createListing(
            @RequestHeader(value = HEADER_CALLER_ID)
            @NotBlank(message = "X-Caller-Id is required")
            @Size(max = MAX_IDENTIFIER_LENGTH, message = "X-Caller-Id must be at most 128 characters")
            String callerId,
            @RequestHeader(value = HEADER_IDEMPOTENCY_KEY)
            @NotBlank(message = "Idempotency-Key is required")
            @Size(max = MAX_IDENTIFIER_LENGTH, message = "Idempotency-Key must be at most 128 characters")
            String idempotencyKey,
            @RequestHeader(value = HEADER_TRACE_ID, required = false) String traceId,
            @Valid @RequestBody CreateListingRequest request) {
        DealCommand command = new DealCommand(
                DealAction.CREATE_LISTING,
                null,
                callerId,
                new DealArguments(request.price(), request.propertyHash()),
                null);
        return ResponseEntity.ok(escrowFacade.dispatch(command, idempotencyKey, traceId));
    }

    @PostMapping("/deals/{deal_id}/offers")
    public ResponseEntity<DealResponse> makeOffer(
            @PathVariable("deal_id") UUID dealId,
            @RequestHeader(value = HEADER_CALLER_ID)
            @NotBlank(message = "X-Caller-Id is required")
            @Size(max = MAX_IDENTIFIER_LENGTH, message = "X-Caller-Id must be at most 128 characters")
            String callerId,
            @RequestHeader(value = HEADER_IDEMPOTENCY_KEY)
            @NotBlank(message = "Idempotency-Key is required")
            @Size(max = MAX_IDENTIFIER_LENGTH, message = "Idempotency-Key must be at most 128 characters")
            String idempotencyKey,
            @RequestHeader(value = HEADER_TRACE_ID, required = false) String traceId,
            @Valid @RequestBody DealActionRequest request) {
        return ResponseEntity.ok(
                dispatch(DealAction.MAKE_OFFER, dealId, callerId, request, null, idempotencyKey, traceId));
    }

    @PostMapping("/deals/{deal_id}/confirmations")
    public ResponseEntity<DealResponse> confirmTransfer(
            @PathVariable("deal_id") UUID dealId,
            @RequestHeader(value = HEADER_CALLER_ID)
            @NotBlank(message = "X-Caller-Id is required")
            @Size(max = MAX_IDENTIFIER_LENGTH, message = "X-Caller-Id must be at most 128 characters")
            String callerId,
            @RequestHeader(value = HEADER_IDEMPOTENCY_KEY)
            @NotBlank(message = "Idempotency-Key is required")
            @Size(max = MAX_IDENTIFIER_LENGTH, message = "Idempotency-Key must be at most 128 characters")
            String idempotencyKey,
            @RequestHeader(value = HEADER_TRACE_ID, required = false) String traceId,
            @Valid @RequestBody DealActionRequest request) {
        return ResponseEntity.ok(dispatch(
                DealAction.CONFIRM_TRANSFER,
                dealId,
                callerId,
                request,
                request.propertyHash(),
                idempotencyKey,
                traceId));
    }

    @PostMapping("/deals/{deal_id}/cancellations")
    public ResponseEntity<DealResponse> cancelDeal(
            @PathVariable("deal_id") UUID dealId,
            @RequestHeader(value = HEADER_CALLER_ID)
            @NotBlank(message = "X-Caller-Id is required")
            @Size(max = MAX_IDENTIFIER_LENGTH, message = "X-Caller-Id must be at most 128 characters")
            String callerId,
            @RequestHeader(value = HEADER_IDEMPOTENCY_KEY)
            @NotBlank(message = "Idempotency-Key is required")
            @Size(max = MAX_IDENTIFIER_LENGTH, message = "Idempotency-Key must be at most 128 characters")
            String idempotencyKey,
            @RequestHeader(value = HEADER_TRACE_ID, required = false) String traceId,
            @Valid @RequestBody DealActionRequest request) {
        return ResponseEntity.ok(
                dispatch(DealAction.CANCEL_DEAL, dealId, callerId, request, null, idempotencyKey, traceId));
    }

    @GetMapping("/deals/{deal_id}")
    public DealResponse readState(@PathVariable("deal_id") UUID dealId) {
        return escrowFacade.readState(dealId);
    }

    @GetMapping("/deals/{deal_id}/transfers")
    public DealTransfersResponse listTransfers(@PathVariable("deal_id") UUID dealId) {
        return escrowFacade.listTransfers(dealId);
    }

    @GetMapping("/deals")
    public DealsResponse listBySeller(
            @RequestParam("seller")
            @NotBlank(message = "seller is required")
            String seller) {
        return escrowFacade.listBySeller(seller);
    }

    private DealResponse dispatch(
            DealAction action,
            UUID dealId,
            String callerId,
            DealActionRequest request,
            String propertyHash,
            String idempotencyKey,
            String traceId) {
        DealCommand command = new DealCommand(
                action,
                dealId,
                callerId,
                new DealArguments(null, propertyHash),
                request.toBundle());
        return escrowFacade.dispatch(command, idempotencyKey, traceId);
    }
}
