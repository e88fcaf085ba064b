package com.marginledger.repository.jpa;

import com.marginledger.domain.enums.TradeState;
import com.marginledger.entity.TradeEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the trades table. The position engine is its only writer.
 */
@Repository
public interface TradeJpaRepository extends JpaRepository<TradeEntity, Long> {

    List<TradeEntity> findByOwnerOrderByIdDesc(String owner);

    List<TradeEntity> findByAssetIdAndState(int assetId, TradeState state);

    long countByState(TradeState state);
}
