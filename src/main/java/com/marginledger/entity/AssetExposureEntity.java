package com.marginledger.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(name = "asset_exposure")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AssetExposureEntity {

    @Id
    @Column(name = "asset_id")
    private Integer assetId;

    @Column(name = "long_lots")
    private long longLots;

    @Column(name = "short_lots")
    private long shortLots;
}
