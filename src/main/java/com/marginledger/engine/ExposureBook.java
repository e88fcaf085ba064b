package com.marginledger.engine;

import com.marginledger.core.FixedPoint;
import com.marginledger.domain.model.AssetExposure;
import com.marginledger.entity.AssetExposureEntity;
import com.marginledger.repository.jpa.AssetExposureJpaRepository;
import org.springframework.stereotype.Component;

/** Open-lot counters per asset and side. Written by the position engine only. */
@Component
public class ExposureBook {

    private final AssetExposureJpaRepository assetExposureJpaRepository;

    public ExposureBook(AssetExposureJpaRepository assetExposureJpaRepository) {
        this.assetExposureJpaRepository = assetExposureJpaRepository;
    }

    /** Applies signed lot deltas in one write. A no-op when both deltas are zero. */
    public void apply(int assetId, long longLotsDelta, long shortLotsDelta) {
        if (longLotsDelta == 0 && shortLotsDelta == 0) {
            return;
        }
        AssetExposureEntity exposure = assetExposureJpaRepository
                .findById(assetId)
                .orElseGet(() -> AssetExposureEntity.builder().assetId(assetId).build());
        long longLots = FixedPoint.addExact(exposure.getLongLots(), longLotsDelta, "long exposure");
        long shortLots = FixedPoint.addExact(exposure.getShortLots(), shortLotsDelta, "short exposure");
        if (longLots < 0 || shortLots < 0) {
            throw new IllegalStateException(String.format(
                    "Exposure for asset %d would go negative: long=%d short=%d", assetId, longLots, shortLots));
        }
        exposure.setLongLots(longLots);
        exposure.setShortLots(shortLots);
        assetExposureJpaRepository.save(exposure);
    }

    public AssetExposure get(int assetId) {
        return assetExposureJpaRepository
                .findById(assetId)
                .map(e -> AssetExposure.builder()
                        .assetId(assetId)
                        .longLots(e.getLongLots())
                        .shortLots(e.getShortLots())
                        .build())
                .orElseGet(() -> AssetExposure.builder().assetId(assetId).build());
    }
}
