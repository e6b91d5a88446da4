package com.warden.security;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads the role catalog from YAML.
 *
 * <pre>
 * hierarchy: [viewer, user, power_user, admin]
 * roles:
 *   viewer:
 *     description: Read-only access
 *     capabilities: ["app:read"]
 * </pre>
 *
 * Any problem surfaces as a {@link RoleCatalogException} at load time.
 */
public final class RoleCatalogLoader {

    private static final Logger log = LoggerFactory.getLogger(RoleCatalogLoader.class);

    private final YAMLMapper mapper = new YAMLMapper();

    public CapabilityCatalog load(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return load(in, path.toString());
        } catch (IOException e) {
            throw new RoleCatalogException("Cannot read role catalog " + path, e);
        }
    }

    public CapabilityCatalog load(InputStream in, String sourceName) {
        CatalogDocument document;
        try {
            document = mapper.readValue(in, CatalogDocument.class);
        } catch (JsonProcessingException e) {
            throw new RoleCatalogException(
                    "Malformed role catalog %s: %s".formatted(sourceName, e.getOriginalMessage()), e);
        } catch (IOException e) {
            throw new RoleCatalogException("Cannot read role catalog " + sourceName, e);
        }
        if (document == null || document.roles() == null || document.roles().isEmpty()) {
            throw new RoleCatalogException("Role catalog %s defines no roles".formatted(sourceName));
        }

        List<Role> roles = new ArrayList<>();
        document.roles().forEach((name, definition) -> {
            List<String> capabilities =
                    definition == null || definition.capabilities() == null
                            ? List.of()
                            : definition.capabilities();
            String description = definition == null ? null : definition.description();
            roles.add(Role.configured(name, new LinkedHashSet<>(capabilities), description));
        });
        RoleHierarchy hierarchy =
                document.hierarchy() == null
                        ? RoleHierarchy.empty()
                        : RoleHierarchy.of(document.hierarchy());

        CapabilityCatalog catalog = new CapabilityCatalog(roles, hierarchy);
        log.info("Loaded role catalog from {}: {} roles, hierarchy {}",
                sourceName, roles.size(), hierarchy.levels());
        return catalog;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record CatalogDocument(List<String> hierarchy, Map<String, RoleDocument> roles) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record RoleDocument(String description, List<String> capabilities) {}
}
