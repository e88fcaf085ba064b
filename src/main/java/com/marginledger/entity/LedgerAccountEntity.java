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
 * JPA entity for custody balances. {@code locked} is the part of {@code balance}
 * reserved against open orders and positions and never exceeds it.
 */
@Entity
@Table(name = "ledger_accounts")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LedgerAccountEntity {

    @Id
    @Column(name = "account_id", length = 64)
    private String accountId;

    private long balance;

    private long locked;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public long available() {
        return balance - locked;
    }
}
