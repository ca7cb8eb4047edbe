package com.kbengine.retrieval;

import java.util.Set;

@FunctionalInterface
public interface EntitlementProvider {
    Set<String> entitledNamespaces(Principal principal);
}
