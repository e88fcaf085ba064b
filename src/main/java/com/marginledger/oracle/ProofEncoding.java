package com.marginledger.oracle;

import com.marginledger.exception.ErrorCode;
import com.marginledger.exception.PriceProofException;
import java.util.Base64;

/** Price proofs travel as base64 text in request bodies and delegated-call parameters. */
public final class ProofEncoding {

    private ProofEncoding() {}

    public static byte[] decode(String base64) {
        if (base64 == null || base64.isBlank()) {
            throw new PriceProofException(ErrorCode.PROOF_INVALID, "Price proof is missing");
        }
        try {
            return Base64.getDecoder().decode(base64.trim());
        } catch (IllegalArgumentException e) {
            throw new PriceProofException(ErrorCode.PROOF_INVALID, "Price proof is not valid base64", e);
        }
    }
}
