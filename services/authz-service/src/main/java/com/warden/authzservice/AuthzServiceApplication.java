package com.warden.authzservice;

import com.warden.authzservice.config.PolicyProperties;
import com.warden.authzservice.config.RbacProperties;
import com.warden.authzservice.config.ScopeProperties;
import com.warden.authzservice.config.ServiceProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Warden authorization service.
 *
 * <p>Hosts the authorization core behind HTTP:
 *
 * <ul>
 *   <li>role catalog and role assignment endpoints
 *   <li>session issuance with scope-version checks on every authenticated request
 *   <li>a scheduled reconciliation sweep for stale sessions and pending change events
 *   <li>Server-Sent Events push of scope changes to connected clients
 * </ul>
 */
@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties({
    ServiceProperties.class,
    ScopeProperties.class,
    PolicyProperties.class,
    RbacProperties.class
})
public class AuthzServiceApplication {

    private static final Logger log = LoggerFactory.getLogger(AuthzServiceApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(AuthzServiceApplication.class, args);
        log.info("Warden authorization service started");
    }
}
