package com.warden.authzservice.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * @param catalog Spring resource location of the role catalog YAML
 */
@ConfigurationProperties(prefix = "warden.rbac")
public record RbacProperties(String catalog) {

    public RbacProperties {
        if (catalog == null || catalog.isBlank()) {
            catalog = "classpath:rbac.yaml";
        }
    }
}
