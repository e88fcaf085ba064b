package com.marginledger.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A trader's delegated-call key and the last sequence number consumed with it.
 * Sequence numbers only move forward; a call must carry one strictly greater than
 * {@code lastNonce}.
 */
@Entity
@Table(name = "relay_keys")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RelayKeyEntity {

    @Id
    @Column(name = "trader_id", length = 64)
    private String traderId;

    @Column(name = "signing_key", nullable = false, length = 128)
    private String signingKey;

    @Column(name = "last_nonce")
    private long lastNonce;

    @Column(name = "registered_at")
    private Instant registeredAt;
}
