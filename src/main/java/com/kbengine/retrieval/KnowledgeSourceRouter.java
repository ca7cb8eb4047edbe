package com.kbengine.retrieval;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.kbengine.error.PermissionException;
import com.kbengine.vector.Namespaces;

public class KnowledgeSourceRouter {
    private static final Logger log = LoggerFactory.getLogger(KnowledgeSourceRouter.class);

    private final Namespaces namespaces;
    private final EntitlementProvider entitlements;

    public KnowledgeSourceRouter(Namespaces namespaces, EntitlementProvider entitlements) {
        this.namespaces = namespaces;
        this.entitlements = entitlements;
    }

    public List<String> resolveNamespaces(Principal principal, SearchMode mode) {
        Set<String> entitled = entitlements.entitledNamespaces(principal);
        switch (mode) {
            case SYSTEM:
                return List.of(require(namespaces.system(), entitled, principal));
            case USER:
                return List.of(require(namespaces.user(principal.userId()), entitled, principal));
            case HYBRID:
            default:
                List<String> candidates = new ArrayList<>();
                candidates.add(namespaces.system());
                if (principal.tenantId() != null) {
                    candidates.add(namespaces.tenant(principal.tenantId()));
                }
                candidates.add(namespaces.user(principal.userId()));
                List<String> allowed = candidates.stream().filter(entitled::contains).toList();
                if (allowed.size() < candidates.size()) {
                    log.debug("router.filtered user={} dropped={}", principal.userId(), candidates.size() - allowed.size());
                }
                if (allowed.isEmpty()) {
                    throw new PermissionException("user " + principal.userId() + " is not entitled to any knowledge source");
                }
                return allowed;
        }
    }

    private static String require(String namespace, Set<String> entitled, Principal principal) {
        if (!entitled.contains(namespace)) {
            throw new PermissionException("user " + principal.userId() + " is not entitled to namespace " + namespace);
        }
        return namespace;
    }
}
