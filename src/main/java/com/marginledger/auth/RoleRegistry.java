package com.marginledger.auth;

import com.marginledger.core.LedgerSequencer;
import com.marginledger.domain.enums.LedgerRole;
import com.marginledger.entity.RoleGrantEntity;
import com.marginledger.exception.BusinessException;
import com.marginledger.exception.ErrorCode;
import com.marginledger.exception.UnauthorizedException;
import com.marginledger.repository.jpa.RoleGrantJpaRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Capability table: which account holds which {@link LedgerRole}.
 *
 * <p>Every privileged entry point calls {@link #require(String, LedgerRole)} before doing
 * anything else. Roles are independent rows, so the owner, the ledger controller, keepers and
 * the relayer can each be reassigned without touching the others. A single-holder role
 * ({@link LedgerRole#isSingleHolder()}) moves to the new grantee and is never left vacant.
 */
@Service
public class RoleRegistry {

    private static final Logger log = LoggerFactory.getLogger(RoleRegistry.class);

    private final RoleGrantJpaRepository roleGrantJpaRepository;
    private final LedgerSequencer ledgerSequencer;
    private final Clock clock;

    public RoleRegistry(RoleGrantJpaRepository roleGrantJpaRepository, LedgerSequencer ledgerSequencer, Clock clock) {
        this.roleGrantJpaRepository = roleGrantJpaRepository;
        this.ledgerSequencer = ledgerSequencer;
        this.clock = clock;
    }

    public boolean hasRole(String accountId, LedgerRole role) {
        if (accountId == null) {
            return false;
        }
        return roleGrantJpaRepository.existsByAccountIdAndRole(accountId, role);
    }

    /**
     * @throws UnauthorizedException if {@code caller} does not hold {@code role}
     */
    public void require(String caller, LedgerRole role) {
        if (!hasRole(caller, role)) {
            throw new UnauthorizedException(String.format("Caller %s lacks role %s", caller, role));
        }
    }

    public List<LedgerRole> rolesOf(String accountId) {
        return roleGrantJpaRepository.findByAccountId(accountId).stream()
                .map(RoleGrantEntity::getRole)
                .toList();
    }

    /**
     * Grants a role. Only the OWNER may grant. Granting an already-held role is a no-op;
     * granting OWNER or RELAYER takes it away from the current holder.
     */
    public void grant(String caller, String accountId, LedgerRole role) {
        ledgerSequencer.run(() -> {
            require(caller, LedgerRole.OWNER);
            store(accountId, role, caller);
        });
    }

    /** Revokes a role. Only the OWNER may revoke; OWNER and RELAYER can only be reassigned. */
    public void revoke(String caller, String accountId, LedgerRole role) {
        ledgerSequencer.run(() -> {
            require(caller, LedgerRole.OWNER);
            if (role.isSingleHolder()) {
                throw new BusinessException(
                        ErrorCode.BAD_REQUEST, String.format("Role %s cannot be revoked, grant it to another account", role));
            }
            roleGrantJpaRepository.deleteByAccountIdAndRole(accountId, role);
            log.info("Role {} revoked from {} by {}", role, accountId, caller);
        });
    }

    /** Start-up assignment from configuration; bypasses the OWNER check. */
    public void bootstrap(String accountId, LedgerRole role) {
        ledgerSequencer.run(() -> store(accountId, role, "bootstrap"));
    }

    private void store(String accountId, LedgerRole role, String grantedBy) {
        if (role.isSingleHolder()) {
            List<RoleGrantEntity> previous = roleGrantJpaRepository.findByRole(role).stream()
                    .filter(grant -> !grant.getAccountId().equals(accountId))
                    .toList();
            if (!previous.isEmpty()) {
                roleGrantJpaRepository.deleteAll(previous);
                log.info("Role {} moved from {} to {}", role,
                        previous.stream().map(RoleGrantEntity::getAccountId).toList(), accountId);
            }
        }
        if (roleGrantJpaRepository.existsByAccountIdAndRole(accountId, role)) {
            return;
        }
        roleGrantJpaRepository.save(RoleGrantEntity.builder()
                .accountId(accountId)
                .role(role)
                .grantedBy(grantedBy)
                .grantedAt(Instant.now(clock))
                .build());
        log.info("Role {} granted to {} by {}", role, accountId, grantedBy);
    }
}
