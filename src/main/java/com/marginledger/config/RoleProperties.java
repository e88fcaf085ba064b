package com.marginledger.config;

import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Initial role assignments applied at start-up, read from the {@code ledger.roles} prefix.
 * The engine identity always receives LEDGER_CONTROLLER regardless of this list.
 */
@Configuration
@ConfigurationProperties(prefix = "ledger.roles")
@Getter
@Setter
public class RoleProperties {

    private String owner;

    private List<String> keepers = new ArrayList<>();

    private String relayer;
}
