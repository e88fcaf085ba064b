package com.marginledger.relay;

import com.marginledger.domain.enums.RelayAction;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;
import lombok.Builder;
import lombok.Value;

/**
 * A call a trader signed off-line and a relayer submits on their behalf.
 *
 * <p>The signature covers {@link #canonicalForm()}:
 * {@code trader|action|k1=v1&k2=v2|nonce|expiresAt}, parameters sorted by key. The trader,
 * every key and every value are form-encoded first, so {@code =}, {@code &} and {@code |}
 * only ever appear as separators and no two parameter maps share a canonical form.
 */
@Value
@Builder(toBuilder = true)
public class DelegatedCall {

    String trader;
    RelayAction action;
    Map<String, String> parameters;
    long nonce;
    /** Epoch seconds after which the call may no longer be dispatched. */
    long expiresAt;
    String signature;

    public String canonicalForm() {
        String params = parameters == null
                ? ""
                : new TreeMap<>(parameters).entrySet().stream()
                        .map(e -> encode(e.getKey()) + "=" + encode(e.getValue()))
                        .collect(Collectors.joining("&"));
        return String.join(
                "|", encode(trader), String.valueOf(action), params, String.valueOf(nonce), String.valueOf(expiresAt));
    }

    private static String encode(String value) {
        return value == null ? "" : URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
