package com.marginledger.repository.jpa;

import com.marginledger.entity.CounterpartyPoolEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface CounterpartyPoolJpaRepository extends JpaRepository<CounterpartyPoolEntity, String> {

    /** The single pool row, created empty on first use. */
    default CounterpartyPoolEntity loadMain() {
        return findById(CounterpartyPoolEntity.MAIN_POOL_ID)
                .orElseGet(() -> save(CounterpartyPoolEntity.builder()
                        .id(CounterpartyPoolEntity.MAIN_POOL_ID)
                        .build()));
    }
}
