package com.escrowmart.api.capability;

import com.escrowmart.api.config.MarketplaceProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.UUID;

/**
 * Mints the admin capability for the configured principal on first start.
 */
@Component
public class AdminBootstrap implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(AdminBootstrap.class);

    private final CapabilityService capabilityService;
    private final MarketplaceProperties properties;
    private final Clock clock;

    public AdminBootstrap(CapabilityService capabilityService, MarketplaceProperties properties, Clock clock) {
        this.capabilityService = capabilityService;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public void run(ApplicationArguments args) {
        UUID admin = properties.getAdmin().getPrincipalId();
        if (admin == null) {
            log.warn("escrowmart.admin.principal-id is not set; disputes cannot be resolved until an admin capability exists");
            return;
        }
        if (capabilityService.isAdminMinted()) {
            log.debug("Admin capability already present");
            return;
        }
        capabilityService.mintAdminCap(admin, clock.instant());
    }
}
