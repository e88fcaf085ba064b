package com.marginledger.support;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.marginledger.core.HmacSigner;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Builds signed price proofs in the layout the HMAC oracle accepts. */
public final class PriceProofs {

    public static final String ORACLE_KEY = "test-oracle-key";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final List<Map<String, Object>> entries = new ArrayList<>();
    private String key = ORACLE_KEY;

    private PriceProofs() {}

    public static PriceProofs proof() {
        return new PriceProofs();
    }

    /** Six-decimal price for {@code pair}, stamped {@code timestamp} epoch seconds. */
    public static byte[] sixDecimals(long pair, long price, long timestamp) {
        return proof().entry(pair, String.valueOf(price), 6, timestamp).build();
    }

    public PriceProofs entry(long pair, String rawPrice, int decimals, long timestamp) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("pair", pair);
        entry.put("price", rawPrice);
        entry.put("decimals", decimals);
        entry.put("timestamp", timestamp);
        entry.put("round", entries.size() + 1);
        entries.add(entry);
        return this;
    }

    public PriceProofs signedWith(String signingKey) {
        this.key = signingKey;
        return this;
    }

    public byte[] build() {
        try {
            String payload = MAPPER.writeValueAsString(entries);
            Map<String, String> envelope = new LinkedHashMap<>();
            envelope.put("payload", payload);
            envelope.put("signature", HmacSigner.sign(payload, key));
            return MAPPER.writeValueAsString(envelope).getBytes(StandardCharsets.UTF_8);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException(e);
        }
    }
}
