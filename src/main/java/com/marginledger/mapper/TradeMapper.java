package com.marginledger.mapper;

import com.marginledger.domain.model.Trade;
import com.marginledger.entity.TradeEntity;
import java.util.List;
import org.mapstruct.Mapper;

/**
 * MapStruct mapper from the trades table to the {@link Trade} snapshot handed to callers.
 * Field names line up one to one; entities never leave the engine.
 */
@Mapper
public interface TradeMapper {

    Trade toDomain(TradeEntity entity);

    List<Trade> toDomainList(List<TradeEntity> entities);
}
