/*
 * どこで: Escrow サービス層
 * 何を: Deal 操作の唯一の公開窓口として、状態遷移と custody/outbox/audit/idempotency の更新をまとめる
 * なぜ: 1 トランザクション内で資金移動・状態・イベントの整合性を保つため
 */
package com.realchain.escrow.service;

import com.realchain.common.TraceIds;
import com.realchain.common.event.DealEventPayload;
import com.realchain.escrow.api.ApiErrorResponse;
import com.realchain.escrow.api.CustodyTransferResponse;
import com.realchain.escrow.api.DealNotFoundException;
import com.realchain.escrow.api.DealOperationException;
import com.realchain.escrow.api.DealResponse;
import com.realchain.escrow.api.DealTransfersResponse;
import com.realchain.escrow.api.DealsResponse;
import com.realchain.escrow.api.IdempotencyConflictException;
import com.realchain.escrow.config.EscrowIdempotencyProperties;
import com.realchain.escrow.model.CustodyTransferRecord;
import com.realchain.escrow.model.DealAuditRecord;
import com.realchain.escrow.model.DealCommand;
import com.realchain.escrow.model.DealRecord;
import com.realchain.escrow.model.IdempotencyRecord;
import com.realchain.escrow.model.StateKey;
import com.realchain.escrow.repository.CustodyTransferRepository;
import com.realchain.escrow.repository.DealAuditRepository;
import com.realchain.escrow.repository.DealStateStore;
import com.realchain.escrow.repository.IdempotencyKeyRepository;
import com.realchain.escrow.repository.OutboxEventRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.RequiredArgsConstructor;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class EscrowFacade {

    private static final Logger logger = LoggerFactory.getLogger(EscrowFacade.class);
    private static final int SUCCESS_STATUS_CODE = HttpStatus.OK.value();
    private static final String RESULT_SUCCESS = "success";

    private final DealStateMachine stateMachine;
    private final DealStateStore stateStore;
    private final CustodyTransferRepository custodyTransferRepository;
    private final OutboxEventRepository outboxEventRepository;
    private final DealAuditRepository auditRepository;
    private final IdempotencyKeyRepository idempotencyKeyRepository;
    private final AdvisoryLockKeyGenerator lockKeyGenerator;
    private final RequestHasher requestHasher;
    private final EscrowMetrics metrics;
    private final ObjectMapper objectMapper;
    private final EscrowIdempotencyProperties idempotencyProperties;
    private final Clock clock;

    /**
     * action 名で DealStateMachine へ振り分け、遷移後のスナップショットを返す。
     *
     * <p>型付き失敗 ({@link DealOperationException}) はそのまま呼び出し元へ送出する。失敗応答も
     * Idempotency-Key に保存するため、この例外ではロールバックしない (ガードは書き込み前に評価済み)。
     */
    @Transactional(noRollbackFor = DealOperationException.class)
    public DealResponse dispatch(DealCommand command, String idempotencyKey, String traceId) {
        String requestHash = requestHasher.hash(command);
        String callerId = command.callerId();
        Instant now = Instant.now(clock);
        // 同じ呼び出し元・同じキーの同時実行だけを直列化する
        idempotencyKeyRepository.acquireLock(
                lockKeyGenerator.forIdempotencyKey(callerId, idempotencyKey));
        Optional<IdempotencyRecord> existing =
                idempotencyKeyRepository.findActive(callerId, idempotencyKey, now);
        if (existing.isPresent()) {
            logger.info("idempotent replay action={} callerId={} idempotencyKey={} dealId={}",
                    command.action().wireName(), callerId, idempotencyKey, existing.get().dealId());
            return reuseIdempotentResponse(existing.get(), command, requestHash);
        }
        String resolvedTraceId = TraceIds.resolve(traceId);
        String actionName = command.action().wireName();
        try {
            TransitionResult result = route(command, now);
            DealRecord deal = result.deal();
            // custody 移動は状態遷移と同一トランザクションで記録する
            List<CustodyTransferRecord> applied = new ArrayList<>();
            for (ApprovedTransfer transfer : result.transfers()) {
                applied.add(custodyTransferRepository.insert(transfer, now));
                metrics.recordCustodyTransfer(transfer.kind().name(), transfer.amount());
            }
            String eventId = UUID.randomUUID().toString();
            String payloadJson = buildPayloadJson(
                    deal, eventId, command, applied, resolvedTraceId, now);
            // outbox に保存してから非同期 publish する。deal の version が Deal 内の配信順になる
            outboxEventRepository.insert(
                    UUID.fromString(eventId),
                    command.action().eventType(),
                    deal.dealId(),
                    deal.version(),
                    payloadJson,
                    now);
            // 監査ログを保存し、後から操作の根拠を確認できるようにする
            auditRepository.insert(buildAuditRecord(result, command, idempotencyKey, now));
            DealResponse response = DealResponse.from(deal);
            storeIdempotency(command, deal.dealId(), idempotencyKey, requestHash,
                    SUCCESS_STATUS_CODE, response, now);
            metrics.recordCommand(actionName, RESULT_SUCCESS);
            logger.info("deal action applied action={} dealId={} fromStatus={} toStatus={} version={}",
                    actionName, deal.dealId(), result.fromStatus(), deal.status(), deal.version());
            return response;
        } catch (DealOperationException ex) {
            // 失敗応答も冪等に再利用できるよう、例外でも idempotency を保存する
            ApiErrorResponse errorResponse = new ApiErrorResponse(ex.code(), ex.getMessage());
            storeIdempotency(command, command.dealId(), idempotencyKey, requestHash,
                    ex.code().httpStatus().value(), errorResponse, now);
            metrics.recordCommand(actionName, ex.code().name().toLowerCase(Locale.ROOT));
            logger.warn("deal action rejected action={} dealId={} code={} message={}",
                    actionName, command.dealId(), ex.code(), ex.getMessage());
            throw ex;
        }
    }

    public DealResponse readState(UUID dealId) {
        return DealResponse.from(stateMachine.read(dealId));
    }

    public DealsResponse listBySeller(String seller) {
        List<DealResponse> deals = stateStore.findDealIdsByBytesValue(StateKey.SELLER, seller).stream()
                .map(stateMachine::read)
                .map(DealResponse::from)
                .toList();
        return new DealsResponse(seller, deals);
    }

    public DealTransfersResponse listTransfers(UUID dealId) {
        if (stateStore.load(dealId).isEmpty()) {
            throw new DealNotFoundException("deal not found: " + dealId);
        }
        List<CustodyTransferResponse> transfers = custodyTransferRepository.findByDealId(dealId).stream()
                .map(CustodyTransferResponse::from)
                .toList();
        return new DealTransfersResponse(dealId, transfers);
    }

    private TransitionResult route(DealCommand command, Instant now) {
        return switch (command.action()) {
            case CREATE_LISTING -> stateMachine.createListing(
                    UUID.randomUUID(),
                    command.callerId(),
                    requirePrice(command),
                    command.arguments().propertyHash(),
                    now);
            case MAKE_OFFER -> stateMachine.makeOffer(
                    requireDealId(command), command.callerId(), command.bundle(), now);
            case CONFIRM_TRANSFER -> stateMachine.confirmTransfer(
                    requireDealId(command),
                    command.callerId(),
                    command.bundle(),
                    command.arguments().propertyHash(),
                    now);
            case CANCEL_DEAL -> stateMachine.cancelDeal(
                    requireDealId(command), command.callerId(), command.bundle(), now);
        };
    }

    private long requirePrice(DealCommand command) {
        if (command.arguments().price() == null) {
            throw new IllegalArgumentException("price is required");
        }
        return command.arguments().price();
    }

    private UUID requireDealId(DealCommand command) {
        if (command.dealId() == null) {
            throw new IllegalArgumentException("deal_id is required");
        }
        return command.dealId();
    }

    private DealResponse reuseIdempotentResponse(
            IdempotencyRecord record, DealCommand command, String requestHash) {
        if (record.action() != command.action() || !record.requestHash().equals(requestHash)) {
            throw new IdempotencyConflictException("Idempotency-Key was already used for a different "
                    + record.action().wireName() + " request");
        }
        try {
            if (record.responseCode() == SUCCESS_STATUS_CODE) {
                return objectMapper.readValue(record.responseBodyJson(), DealResponse.class);
            }
            ApiErrorResponse errorResponse = objectMapper.readValue(record.responseBodyJson(),
                    ApiErrorResponse.class);
            throw DealOperationException.fromErrorResponse(errorResponse);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("failed to parse idempotency response", ex);
        }
    }

    private void storeIdempotency(
            DealCommand command,
            UUID dealId,
            String idempotencyKey,
            String requestHash,
            int responseCode,
            Object response,
            Instant now) {
        String responseJson;
        try {
            responseJson = objectMapper.writeValueAsString(response);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("failed to serialize idempotency response", ex);
        }
        IdempotencyRecord record = new IdempotencyRecord(
                command.callerId(),
                idempotencyKey,
                command.action(),
                dealId,
                requestHash,
                responseCode,
                responseJson,
                now,
                now.plus(Duration.ofHours(idempotencyProperties.ttlHours())));
        // advisory lock 下で未登録を確認済みなので、保存できないのはロック外の書き込みがあった場合のみ
        if (!idempotencyKeyRepository.save(record)) {
            throw new IllegalStateException(
                    "idempotency record appeared outside the lock callerId=" + command.callerId());
        }
    }

    private String buildPayloadJson(
            DealRecord deal,
            String eventId,
            DealCommand command,
            List<CustodyTransferRecord> applied,
            String traceId,
            Instant occurredAt) {
        List<DealEventPayload.Transfer> transfers = applied.stream()
                .map(t -> new DealEventPayload.Transfer(t.kind().name(), t.sender(), t.receiver(), t.amount()))
                .toList();
        DealEventPayload payload = new DealEventPayload(
                eventId,
                command.action().eventType(),
                occurredAt.toString(),
                deal.dealId().toString(),
                command.callerId(),
                deal.seller(),
                deal.buyer(),
                deal.status().name(),
                deal.price(),
                deal.propertyHash(),
                deal.version(),
                transfers,
                traceId);
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("failed to serialize outbox payload", ex);
        }
    }

    private DealAuditRecord buildAuditRecord(
            TransitionResult result,
            DealCommand command,
            String idempotencyKey,
            Instant now) {
        DealRecord deal = result.deal();
        return new DealAuditRecord(
                UUID.randomUUID(),
                now,
                deal.dealId(),
                command.action().wireName(),
                command.callerId(),
                result.fromStatus() == null ? null : result.fromStatus().name(),
                deal.status().name(),
                idempotencyKey,
                buildAuditDetail(command, result));
    }

    private String buildAuditDetail(DealCommand command, TransitionResult result) {
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("arguments", command.arguments());
        detail.put("bundle", command.bundle().transactions());
        detail.put("transfers", result.transfers().stream()
                .map(ApprovedTransfer::toString)
                .toList());
        try {
            return objectMapper.writeValueAsString(detail);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("failed to serialize audit detail", ex);
        }
    }
}
