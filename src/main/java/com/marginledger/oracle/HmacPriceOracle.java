package com.marginledger.oracle;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.marginledger.config.OracleProperties;
import com.marginledger.core.HmacSigner;
import com.marginledger.domain.model.PriceAttestation;
import com.marginledger.exception.ErrorCode;
import com.marginledger.exception.PriceProofException;
import java.io.IOException;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * {@link PriceOracle} for feeds that sign their attestations with a shared HMAC key.
 *
 * <p>Proof layout (UTF-8 JSON):
 * <pre>
 * {"payload": "[{\"pair\":0,\"price\":\"6512345000000\",\"decimals\":8,\"timestamp\":1700000000,\"round\":42}]",
 *  "signature": "&lt;hex HMAC-SHA256 of payload&gt;"}
 * </pre>
 * The payload is kept as a string so the signature covers its exact bytes. Prices may be
 * JSON numbers or decimal strings; they are parsed as {@link BigInteger} so feeds with 18
 * decimals are not truncated.
 */
@Component
public class HmacPriceOracle implements PriceOracle {

    private static final Logger log = LoggerFactory.getLogger(HmacPriceOracle.class);

    private final ObjectMapper objectMapper;
    private final OracleProperties oracleProperties;

    public HmacPriceOracle(ObjectMapper objectMapper, OracleProperties oracleProperties) {
        this.objectMapper = objectMapper;
        this.oracleProperties = oracleProperties;
    }

    @Override
    public List<PriceAttestation> decodeProof(byte[] proof) {
        if (proof == null || proof.length == 0) {
            throw new PriceProofException(ErrorCode.PROOF_INVALID, "Empty price proof");
        }
        if (!StringUtils.hasText(oracleProperties.getSigningKey())) {
            throw new PriceProofException(ErrorCode.PROOF_INVALID, "No oracle signing key configured");
        }

        JsonNode envelope = readTree(proof);
        JsonNode payloadNode = envelope.get("payload");
        JsonNode signatureNode = envelope.get("signature");
        if (payloadNode == null || !payloadNode.isTextual() || signatureNode == null || !signatureNode.isTextual()) {
            throw new PriceProofException(ErrorCode.PROOF_INVALID, "Proof must carry textual payload and signature");
        }

        String payload = payloadNode.asText();
        if (!HmacSigner.verify(payload, oracleProperties.getSigningKey(), signatureNode.asText())) {
            log.warn("Rejected price proof with bad signature");
            throw new PriceProofException(ErrorCode.PROOF_INVALID, "Price proof signature does not verify");
        }

        JsonNode entries = readTree(payload);
        if (!entries.isArray()) {
            throw new PriceProofException(ErrorCode.PROOF_INVALID, "Proof payload must be an array");
        }
        List<PriceAttestation> attestations = new ArrayList<>(entries.size());
        for (JsonNode entry : entries) {
            attestations.add(toAttestation(entry));
        }
        return attestations;
    }

    private JsonNode readTree(byte[] bytes) {
        try {
            return objectMapper.readTree(bytes);
        } catch (IOException e) {
            throw new PriceProofException(ErrorCode.PROOF_INVALID, "Price proof is not valid JSON", e);
        }
    }

    private JsonNode readTree(String json) {
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new PriceProofException(ErrorCode.PROOF_INVALID, "Proof payload is not valid JSON", e);
        }
    }

    private PriceAttestation toAttestation(JsonNode entry) {
        for (String field : new String[] {"pair", "price", "decimals", "timestamp"}) {
            if (!entry.hasNonNull(field)) {
                throw new PriceProofException(ErrorCode.PROOF_INVALID, "Attestation is missing " + field);
            }
        }
        JsonNode priceNode = entry.get("price");
        BigInteger price;
        try {
            price = priceNode.isTextual() ? new BigInteger(priceNode.asText()) : priceNode.bigIntegerValue();
        } catch (NumberFormatException e) {
            throw new PriceProofException(ErrorCode.PROOF_INVALID, "Attestation price is not an integer", e);
        }
        long decimals = integral(entry, "decimals");
        if (decimals < 0 || decimals > Integer.MAX_VALUE) {
            throw new PriceProofException(ErrorCode.PROOF_INVALID, "Attestation decimals out of range: " + decimals);
        }
        return PriceAttestation.builder()
                .pair(integral(entry, "pair"))
                .price(price)
                .decimals((int) decimals)
                .timestamp(integral(entry, "timestamp"))
                .round(entry.has("round") ? integral(entry, "round") : 0L)
                .build();
    }

    /** Integer-valued field; strings, fractions and values beyond a long are rejected. */
    private static long integral(JsonNode entry, String field) {
        JsonNode node = entry.get(field);
        if (node == null || !node.isIntegralNumber() || !node.canConvertToLong()) {
            throw new PriceProofException(ErrorCode.PROOF_INVALID, "Attestation " + field + " is not an integer");
        }
        return node.longValue();
    }
}
