package com.marginledger.registry;

import com.marginledger.domain.model.AssetSpec;
import com.marginledger.exception.ErrorCode;
import com.marginledger.exception.ResourceNotFoundException;
import jakarta.annotation.PostConstruct;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * {@link AssetRegistry} backed by the listings in {@link AssetRegistryProperties}.
 *
 * <p>Listings are indexed once at start-up. {@link #setMarketOpen(int, boolean)} lets an
 * operator halt or resume market orders for an asset without a restart.
 */
@Component
public class ConfiguredAssetRegistry implements AssetRegistry {

    private static final Logger log = LoggerFactory.getLogger(ConfiguredAssetRegistry.class);

    private final AssetRegistryProperties properties;
    private final Map<Integer, AssetSpec> assets = new ConcurrentHashMap<>();

    public ConfiguredAssetRegistry(AssetRegistryProperties properties) {
        this.properties = properties;
    }

    @PostConstruct
    public void init() {
        for (AssetSpec spec : properties.getAssets()) {
            if (spec.getLotDenominator() == 0) {
                throw new IllegalStateException("Asset " + spec.getAssetId() + " has a zero lot denominator");
            }
            if (assets.putIfAbsent(spec.getAssetId(), spec) != null) {
                throw new IllegalStateException("Asset " + spec.getAssetId() + " is listed twice");
            }
        }
        log.info("Asset registry loaded with {} assets", assets.size());
    }

    @Override
    public AssetSpec getAsset(int assetId) {
        AssetSpec spec = assets.get(assetId);
        if (spec == null) {
            throw new ResourceNotFoundException(ErrorCode.UNKNOWN_ASSET, "Asset", assetId);
        }
        return spec;
    }

    public void setMarketOpen(int assetId, boolean open) {
        getAsset(assetId).setMarketOpen(open);
        log.info("Market for asset {} is now {}", assetId, open ? "open" : "closed");
    }
}
