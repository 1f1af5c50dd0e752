/*
 * どこで: Escrow サービス補助
 * 何を: Idempotency 判定用に Deal 操作要求のハッシュを生成する
 * なぜ: 同一キーで異なるリクエストを検出するため
 */
package com.realchain.escrow.service;

import com.realchain.escrow.model.BundleTransaction;
import com.realchain.escrow.model.DealCommand;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.RequiredArgsConstructor;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class RequestHasher {

    private final ObjectMapper objectMapper;

    public String hash(DealCommand command) {
        Map<String, Object> canonical = new LinkedHashMap<>();
        // 順序を固定し、同一入力で同じ JSON が出るようにする
        canonical.put("action", command.action().wireName());
        canonical.put("deal_id", command.dealId() == null ? null : command.dealId().toString());
        canonical.put("caller_id", command.callerId());
        canonical.put("price", command.arguments().price());
        canonical.put("property_hash", command.arguments().propertyHash());
        canonical.put("bundle", canonicalBundle(command.bundle().transactions()));
        try {
            String json = objectMapper.writeValueAsString(canonical);
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hashed = digest.digest(json.getBytes(StandardCharsets.UTF_8));
            return toHex(hashed);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("failed to serialize request for idempotency", ex);
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 algorithm not available", ex);
        }
    }

    private List<Map<String, Object>> canonicalBundle(List<BundleTransaction> transactions) {
        List<Map<String, Object>> canonical = new ArrayList<>(transactions.size());
        for (BundleTransaction transaction : transactions) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("type", transaction.type() == null ? null : transaction.type().name());
            entry.put("sender", transaction.sender());
            entry.put("receiver", transaction.receiver());
            entry.put("amount", transaction.amount());
            entry.put("method", transaction.method());
            canonical.add(entry);
        }
        return canonical;
    }

    private String toHex(byte[] bytes) {
        StringBuilder builder = new StringBuilder(bytes.length * 2);
        for (byte value : bytes) {
            builder.append(String.format("%02x", value));
        }
        return builder.toString();
    }
}
