package com.marginledger.domain.model;

import lombok.Builder;
import lombok.Value;

/** Open lots per side for one asset. */
@Value
@Builder
public class AssetExposure {

    int assetId;
    long longLots;
    long shortLots;
}
