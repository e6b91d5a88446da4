package com.warden.authzservice.config;

import com.warden.scope.ChangeNotifier;
import com.warden.scope.InMemoryMembershipStore;
import com.warden.scope.InMemoryScopeStateRepository;
import com.warden.scope.InMemorySessionRepository;
import com.warden.scope.MembershipStore;
import com.warden.scope.RoleAssignmentService;
import com.warden.scope.ScopeReconciler;
import com.warden.scope.ScopeStateRepository;
import com.warden.scope.ScopeVersionManager;
import com.warden.scope.SessionConsistencyChecker;
import com.warden.scope.SessionRegistry;
import com.warden.scope.SessionRepository;
import com.warden.security.CapabilityCatalog;
import com.warden.security.CapabilityResolver;
import com.warden.security.RoleCatalogException;
import com.warden.security.RoleCatalogLoader;
import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

/**
 * Wires the framework-free authorization core into the Spring context.
 *
 * <p>Stores are in-memory and authoritative for the lifetime of the process. Each is exposed
 * through its port interface so a persistent adapter can replace it without touching the core.
 */
@Configuration
public class AuthorizationCoreConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /** Fails startup when the catalog is missing or inconsistent. */
    @Bean
    public CapabilityCatalog capabilityCatalog(RbacProperties rbac, ResourceLoader resourceLoader) {
        Resource resource = resourceLoader.getResource(rbac.catalog());
        try (InputStream in = resource.getInputStream()) {
            return new RoleCatalogLoader().load(in, rbac.catalog());
        } catch (IOException e) {
            throw new RoleCatalogException("Cannot open role catalog " + rbac.catalog(), e);
        }
    }

    @Bean
    public CapabilityResolver capabilityResolver(CapabilityCatalog catalog) {
        return new CapabilityResolver(catalog);
    }

    @Bean
    public ScopeStateRepository scopeStateRepository() {
        return new InMemoryScopeStateRepository();
    }

    @Bean
    public SessionRepository sessionRepository() {
        return new InMemorySessionRepository();
    }

    @Bean
    public MembershipStore membershipStore() {
        return new InMemoryMembershipStore();
    }

    @Bean
    public ScopeVersionManager scopeVersionManager(
            ScopeStateRepository states, SessionRepository sessions, Clock clock, ScopeProperties scope) {
        return new ScopeVersionManager(states, sessions, clock, scope.versionChecking().maxAge());
    }

    @Bean
    public RoleAssignmentService roleAssignmentService(
            CapabilityResolver resolver, MembershipStore memberships, ScopeVersionManager versions, Clock clock) {
        return new RoleAssignmentService(resolver, memberships, versions, clock);
    }

    @Bean
    public SessionRegistry sessionRegistry(
            SessionRepository sessions,
            ScopeVersionManager versions,
            RoleAssignmentService assignments,
            Clock clock,
            ScopeProperties scope) {
        return new SessionRegistry(sessions, versions, assignments, clock, scope.session().accessTokenTtl());
    }

    @Bean
    public SessionConsistencyChecker sessionConsistencyChecker(ScopeVersionManager versions) {
        return new SessionConsistencyChecker(versions);
    }

    @Bean
    public ScopeReconciler scopeReconciler(
            ScopeVersionManager versions, SessionRegistry sessions, ChangeNotifier notifier) {
        return new ScopeReconciler(versions, sessions, notifier);
    }
}
