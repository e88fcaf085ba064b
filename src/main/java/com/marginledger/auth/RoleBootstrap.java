package com.marginledger.auth;

import com.marginledger.config.EngineProperties;
import com.marginledger.config.RoleProperties;
import com.marginledger.domain.enums.LedgerRole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Applies the configured role assignments once the application has started.
 * The engine identity is always made LEDGER_CONTROLLER: it is the only caller
 * the custody ledger accepts for lock, unlock and settle.
 */
@Component
public class RoleBootstrap implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(RoleBootstrap.class);

    private final RoleRegistry roleRegistry;
    private final RoleProperties roleProperties;
    private final EngineProperties engineProperties;

    public RoleBootstrap(RoleRegistry roleRegistry, RoleProperties roleProperties, EngineProperties engineProperties) {
        this.roleRegistry = roleRegistry;
        this.roleProperties = roleProperties;
        this.engineProperties = engineProperties;
    }

    @Override
    public void run(ApplicationArguments args) {
        roleRegistry.bootstrap(engineProperties.getIdentity(), LedgerRole.LEDGER_CONTROLLER);

        if (StringUtils.hasText(roleProperties.getOwner())) {
            roleRegistry.bootstrap(roleProperties.getOwner(), LedgerRole.OWNER);
        } else {
            log.warn("No ledger owner configured (ledger.roles.owner); role grants and fee withdrawal are disabled");
        }
        roleProperties.getKeepers().forEach(keeper -> roleRegistry.bootstrap(keeper, LedgerRole.KEEPER));
        if (StringUtils.hasText(roleProperties.getRelayer())) {
            roleRegistry.bootstrap(roleProperties.getRelayer(), LedgerRole.RELAYER);
        }
        log.info(
                "Roles bootstrapped: owner={}, keepers={}, relayer={}",
                roleProperties.getOwner(),
                roleProperties.getKeepers(),
                roleProperties.getRelayer());
    }
}
