package com.kbengine.retrieval;

import java.util.LinkedHashSet;
import java.util.Set;

import com.kbengine.vector.Namespaces;

public class OwnScopeEntitlements implements EntitlementProvider {
    private final Namespaces namespaces;

    public OwnScopeEntitlements(Namespaces namespaces) {
        this.namespaces = namespaces;
    }

    @Override
    public Set<String> entitledNamespaces(Principal principal) {
        Set<String> entitled = new LinkedHashSet<>();
        entitled.add(namespaces.system());
        if (principal.tenantId() != null) {
            entitled.add(namespaces.tenant(principal.tenantId()));
        }
        entitled.add(namespaces.user(principal.userId()));
        return entitled;
    }
}
