package com.marginledger.repository.jpa;

import com.marginledger.entity.RelayKeyEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface RelayKeyJpaRepository extends JpaRepository<RelayKeyEntity, String> {}
