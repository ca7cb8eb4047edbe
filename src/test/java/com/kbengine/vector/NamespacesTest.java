package com.kbengine.vector;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Optional;

import org.junit.jupiter.api.Test;

import com.kbengine.error.ValidationException;

class NamespacesTest {
    private final Namespaces namespaces = new Namespaces("prod");

    @Test
    void shouldPrefixEveryNamespaceWithEnvironment() {
        assertEquals("prod-system-kb", namespaces.system());
        assertEquals("prod-tenant-acme", namespaces.tenant("acme"));
        assertEquals("prod-user-42", namespaces.user("42"));
    }

    @Test
    void shouldDeriveNamespaceFromOwnerScope() {
        assertEquals("prod-system-kb", namespaces.forOwner(OwnerScope.parse("system")));
        assertEquals("prod-tenant-acme", namespaces.forOwner(OwnerScope.parse("tenant:acme")));
        assertEquals("prod-user-42", namespaces.forOwner(OwnerScope.parse("user:42")));
    }

    @Test
    void shouldClassifyNamespaces() {
        assertEquals(Optional.of(SourceKind.SYSTEM), namespaces.kindOf("prod-system-kb"));
        assertEquals(Optional.of(SourceKind.TENANT), namespaces.kindOf("prod-tenant-acme"));
        assertEquals(Optional.of(SourceKind.USER), namespaces.kindOf("prod-user-42"));
        assertTrue(namespaces.kindOf("staging-user-42").isEmpty());
    }

    @Test
    void ownerScopeShouldRoundTripThroughText() {
        assertEquals("tenant:acme", OwnerScope.tenant("acme").toString());
        assertEquals("system", OwnerScope.system().toString());
        assertThrows(ValidationException.class, () -> OwnerScope.parse("team:x"));
        assertThrows(ValidationException.class, () -> OwnerScope.parse("user:"));
    }
}
