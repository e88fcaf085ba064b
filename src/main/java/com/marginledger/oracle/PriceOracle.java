package com.marginledger.oracle;

import com.marginledger.domain.model.PriceAttestation;
import com.marginledger.exception.PriceProofException;
import java.util.List;

/**
 * Verifies an opaque price proof and decodes the attestations it carries.
 */
public interface PriceOracle {

    /**
     * @throws PriceProofException PROOF_INVALID if the proof is malformed or its
     *     signature does not verify
     */
    List<PriceAttestation> decodeProof(byte[] proof);
}
