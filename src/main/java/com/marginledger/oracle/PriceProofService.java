package com.marginledger.oracle;

import com.marginledger.config.OracleProperties;
import com.marginledger.domain.model.PriceAttestation;
import com.marginledger.domain.model.PricePoint;
import com.marginledger.exception.ErrorCode;
import com.marginledger.exception.PriceProofException;
import com.marginledger.exception.ResourceNotFoundException;
import com.marginledger.registry.AssetRegistry;
import java.math.BigInteger;
import java.time.Clock;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Turns a price proof into a fresh six-decimal reference price for one asset.
 *
 * <p>Checks, in order:
 * <ol>
 *   <li>the proof decodes and verifies ({@code PROOF_INVALID});</li>
 *   <li>it carries the asset's pair ({@code NOT_FOUND});</li>
 *   <li>its timestamp, normalized from milliseconds if above 1e12, is at most
 *       {@code maxForwardSkewSeconds} ahead ({@code PROOF_BAD_TIMESTAMP}) and at most
 *       {@code maxAgeSec} behind ({@code PROOF_TOO_OLD}) the current time;</li>
 *   <li>the raw price is positive ({@code PROOF_PRICE_ZERO});</li>
 *   <li>the price rescaled to six decimals fits a {@code long} ({@code PROOF_RANGE}).</li>
 * </ol>
 */
@Service
public class PriceProofService {

    private static final Logger log = LoggerFactory.getLogger(PriceProofService.class);

    private static final long MILLIS_THRESHOLD = 1_000_000_000_000L;
    private static final int PRICE_DECIMALS = 6;
    private static final int MAX_DECIMALS = 36;

    private final PriceOracle priceOracle;
    private final AssetRegistry assetRegistry;
    private final OracleProperties oracleProperties;
    private final Clock clock;

    public PriceProofService(
            PriceOracle priceOracle, AssetRegistry assetRegistry, OracleProperties oracleProperties, Clock clock) {
        this.priceOracle = priceOracle;
        this.assetRegistry = assetRegistry;
        this.oracleProperties = oracleProperties;
        this.clock = clock;
    }

    public PricePoint fetch(byte[] proof, int assetId) {
        return fetch(proof, assetId, oracleProperties.getMaxAgeSeconds());
    }

    public PricePoint fetch(byte[] proof, int assetId, long maxAgeSec) {
        long pairId = assetRegistry.pairIdOf(assetId);
        List<PriceAttestation> attestations = priceOracle.decodeProof(proof);
        return select(attestations, pairId, maxAgeSec);
    }

    /** Validates and normalizes the entry for {@code pairId} out of already decoded attestations. */
    public PricePoint select(List<PriceAttestation> attestations, long pairId, long maxAgeSec) {
        PriceAttestation attestation = attestations.stream()
                .filter(a -> a.getPair() == pairId)
                .findFirst()
                .orElseThrow(() -> new ResourceNotFoundException("Price attestation for pair", pairId));

        long timestamp = attestation.getTimestamp() > MILLIS_THRESHOLD
                ? attestation.getTimestamp() / 1000
                : attestation.getTimestamp();
        long now = clock.instant().getEpochSecond();
        if (timestamp > now + oracleProperties.getMaxForwardSkewSeconds()) {
            throw new PriceProofException(
                    ErrorCode.PROOF_BAD_TIMESTAMP,
                    String.format("Attestation for pair %d is %ds in the future", pairId, timestamp - now));
        }
        if (now - timestamp > maxAgeSec) {
            throw new PriceProofException(
                    ErrorCode.PROOF_TOO_OLD,
                    String.format("Attestation for pair %d is %ds old, max %ds", pairId, now - timestamp, maxAgeSec));
        }

        BigInteger raw = attestation.getPrice();
        if (raw == null || raw.signum() <= 0) {
            throw new PriceProofException(ErrorCode.PROOF_PRICE_ZERO, "Attestation price for pair " + pairId + " is not positive");
        }
        long price = rescale(raw, attestation.getDecimals(), pairId);

        log.debug("Accepted price {} for pair {} (round {}, ts {})", price, pairId, attestation.getRound(), timestamp);
        return PricePoint.builder()
                .pairId(pairId)
                .price(price)
                .timestamp(timestamp)
                .round(attestation.getRound())
                .build();
    }

    private static long rescale(BigInteger raw, int decimals, long pairId) {
        if (decimals < 0 || decimals > MAX_DECIMALS) {
            throw new PriceProofException(ErrorCode.PROOF_INVALID, "Unsupported decimals " + decimals + " for pair " + pairId);
        }
        BigInteger scaled;
        if (decimals > PRICE_DECIMALS) {
            scaled = raw.divide(BigInteger.TEN.pow(decimals - PRICE_DECIMALS));
        } else {
            scaled = raw.multiply(BigInteger.TEN.pow(PRICE_DECIMALS - decimals));
        }
        if (scaled.bitLength() > 63) {
            throw new PriceProofException(ErrorCode.PROOF_RANGE, "Price for pair " + pairId + " exceeds the price range");
        }
        if (scaled.signum() == 0) {
            throw new PriceProofException(ErrorCode.PROOF_PRICE_ZERO, "Price for pair " + pairId + " rounds to zero");
        }
        return scaled.longValue();
    }
}
