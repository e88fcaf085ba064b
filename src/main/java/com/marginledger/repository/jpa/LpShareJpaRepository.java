package com.marginledger.repository.jpa;

import com.marginledger.entity.LpShareEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface LpShareJpaRepository extends JpaRepository<LpShareEntity, String> {}
