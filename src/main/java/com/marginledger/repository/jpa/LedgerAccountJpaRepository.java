package com.marginledger.repository.jpa;

import com.marginledger.entity.LedgerAccountEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for custody balances. Only {@link com.marginledger.custody.CustodyLedger}
 * and the pool service write through it.
 */
@Repository
public interface LedgerAccountJpaRepository extends JpaRepository<LedgerAccountEntity, String> {

    @Query("SELECT COUNT(a) FROM LedgerAccountEntity a WHERE a.locked > a.balance")
    long countOverLocked();
}
