package com.marginledger.registry;

import com.marginledger.domain.model.AssetSpec;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Asset listings read from {@code ledger.registry.assets}.
 *
 * <pre>
 * ledger:
 *   registry:
 *     assets:
 *       - asset-id: 0
 *         pair-id: 0
 *         symbol: BTC/USD
 *         lot-numerator: 1
 *         lot-denominator: 1000
 *         market-open: true
 *         half-spread: 0
 *         funding-rate: 0
 * </pre>
 */
@Configuration
@ConfigurationProperties(prefix = "ledger.registry")
@Getter
@Setter
public class AssetRegistryProperties {

    private List<AssetSpec> assets = new ArrayList<>();
}
