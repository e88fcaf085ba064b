package com.marginledger.repository.jpa;

import com.marginledger.entity.AssetExposureEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface AssetExposureJpaRepository extends JpaRepository<AssetExposureEntity, Integer> {}
