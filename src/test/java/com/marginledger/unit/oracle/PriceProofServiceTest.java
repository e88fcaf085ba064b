package com.marginledger.unit.oracle;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

import com.marginledger.config.OracleProperties;
import com.marginledger.domain.model.PriceAttestation;
import com.marginledger.domain.model.PricePoint;
import com.marginledger.exception.ErrorCode;
import com.marginledger.oracle.PriceOracle;
import com.marginledger.oracle.PriceProofService;
import com.marginledger.registry.AssetRegistry;
import com.marginledger.support.MutableClock;
import java.math.BigInteger;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Unit tests for PriceProofService: pair selection, freshness window, timestamp units and
 * decimal normalization.
 */
@ExtendWith(MockitoExtension.class)
class PriceProofServiceTest {

    private static final Instant NOW = Instant.parse("2026-01-05T12:00:00Z");
    private static final long NOW_SEC = NOW.getEpochSecond();
    private static final byte[] PROOF = {1, 2, 3};

    @Mock
    private PriceOracle priceOracle;

    @Mock
    private AssetRegistry assetRegistry;

    private PriceProofService priceProofService;

    @BeforeEach
    void setUp() {
        OracleProperties properties = new OracleProperties();
        properties.setMaxAgeSeconds(60);
        properties.setMaxForwardSkewSeconds(180);
        priceProofService = new PriceProofService(priceOracle, assetRegistry, properties, new MutableClock(NOW));
    }

    private static PriceAttestation attestation(long pair, String price, int decimals, long timestamp) {
        return PriceAttestation.builder()
                .pair(pair)
                .price(new BigInteger(price))
                .decimals(decimals)
                .timestamp(timestamp)
                .round(1)
                .build();
    }

    private PricePoint select(PriceAttestation attestation, long maxAge) {
        return priceProofService.select(List.of(attestation), attestation.getPair(), maxAge);
    }

    @Nested
    @DisplayName("Freshness")
    class Freshness {

        @Test
        @DisplayName("A 120 s old price is rejected at max age 60 and accepted at 180")
        void maxAgeIsPerCall() {
            PriceAttestation old = attestation(0, "100000000", 6, NOW_SEC - 120);

            assertThatThrownBy(() -> select(old, 60))
                    .extracting("errorCode").isEqualTo(ErrorCode.PROOF_TOO_OLD);
            assertThat(select(old, 180).getPrice()).isEqualTo(100_000000L);
        }

        @Test
        @DisplayName("Millisecond timestamps are normalized to seconds")
        void millisecondTimestamps() {
            PricePoint point = select(attestation(0, "100000000", 6, NOW_SEC * 1000 - 30_000), 60);

            assertThat(point.getTimestamp()).isEqualTo(NOW_SEC - 30);
        }

        @Test
        @DisplayName("More than the allowed skew in the future fails PROOF_BAD_TIMESTAMP")
        void futureSkew() {
            assertThat(select(attestation(0, "1", 0, NOW_SEC + 180), 60).getPrice()).isEqualTo(1_000000L);
            assertThatThrownBy(() -> select(attestation(0, "1", 0, NOW_SEC + 181), 60))
                    .extracting("errorCode").isEqualTo(ErrorCode.PROOF_BAD_TIMESTAMP);
        }

        @Test
        @DisplayName("fetch uses the configured max age")
        void fetchDefaultMaxAge() {
            when(assetRegistry.pairIdOf(3)).thenReturn(7L);
            when(priceOracle.decodeProof(PROOF)).thenReturn(List.of(attestation(7, "5000000", 6, NOW_SEC - 61)));

            assertThatThrownBy(() -> priceProofService.fetch(PROOF, 3))
                    .extracting("errorCode").isEqualTo(ErrorCode.PROOF_TOO_OLD);
        }
    }

    @Nested
    @DisplayName("Normalization")
    class Normalization {

        @Test
        @DisplayName("Eight-decimal prices are truncated to six")
        void eightDecimals() {
            assertThat(select(attestation(0, "6512345678912", 8, NOW_SEC), 60).getPrice())
                    .isEqualTo(65_123_456789L);
        }

        @Test
        @DisplayName("Two-decimal prices are scaled up to six")
        void twoDecimals() {
            assertThat(select(attestation(0, "10050", 2, NOW_SEC), 60).getPrice()).isEqualTo(100_500000L);
        }

        @Test
        @DisplayName("Eighteen-decimal prices beyond 64 bits before rescaling still fit")
        void eighteenDecimals() {
            assertThat(select(attestation(0, "2500000000000000000000", 18, NOW_SEC), 60).getPrice())
                    .isEqualTo(2500_000000L);
        }

        @Test
        @DisplayName("A rescaled price beyond 64 bits fails PROOF_RANGE")
        void range() {
            assertThatThrownBy(() -> select(attestation(0, "10000000000000000", 0, NOW_SEC), 60))
                    .extracting("errorCode").isEqualTo(ErrorCode.PROOF_RANGE);
        }

        @Test
        @DisplayName("Zero, negative or vanishing prices fail PROOF_PRICE_ZERO")
        void zeroPrice() {
            assertThatThrownBy(() -> select(attestation(0, "0", 6, NOW_SEC), 60))
                    .extracting("errorCode").isEqualTo(ErrorCode.PROOF_PRICE_ZERO);
            assertThatThrownBy(() -> select(attestation(0, "-5", 6, NOW_SEC), 60))
                    .extracting("errorCode").isEqualTo(ErrorCode.PROOF_PRICE_ZERO);
            assertThatThrownBy(() -> select(attestation(0, "99", 8, NOW_SEC), 60))
                    .extracting("errorCode").isEqualTo(ErrorCode.PROOF_PRICE_ZERO);
        }
    }

    @Test
    @DisplayName("The entry for the requested pair is chosen among several")
    void picksPair() {
        List<PriceAttestation> attestations = List.of(
                attestation(1, "100000000", 6, NOW_SEC),
                attestation(2, "200000000", 6, NOW_SEC));

        assertThat(priceProofService.select(attestations, 2, 60).getPrice()).isEqualTo(200_000000L);
    }

    @Test
    @DisplayName("A proof without the asset's pair fails NOT_FOUND")
    void missingPair() {
        assertThatThrownBy(() -> priceProofService.select(List.of(attestation(1, "1", 6, NOW_SEC)), 2, 60))
                .extracting("errorCode").isEqualTo(ErrorCode.NOT_FOUND);
    }
}
