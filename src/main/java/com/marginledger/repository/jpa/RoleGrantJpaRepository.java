package com.marginledger.repository.jpa;

import com.marginledger.domain.enums.LedgerRole;
import com.marginledger.entity.RoleGrantEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface RoleGrantJpaRepository extends JpaRepository<RoleGrantEntity, Long> {

    boolean existsByAccountIdAndRole(String accountId, LedgerRole role);

    List<RoleGrantEntity> findByAccountId(String accountId);

    List<RoleGrantEntity> findByRole(LedgerRole role);

    void deleteByAccountIdAndRole(String accountId, LedgerRole role);
}
