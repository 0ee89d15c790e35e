package it.certparse.extension;

import static it.certparse.asn1.DerFixtures.contextPrimitive;
import static it.certparse.asn1.DerFixtures.integer;
import static it.certparse.asn1.DerFixtures.oid;
import static it.certparse.asn1.DerFixtures.sequence;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.Test;

class PolicyExtensionsTest {

    @Test
    void shouldParsePolicyConstraints() {
        assertEquals(new PolicyConstraints(Optional.of(0), Optional.of(3)),
            PolicyConstraints.parse(sequence(contextPrimitive(0, new byte[] {0}), contextPrimitive(1, new byte[] {3}))));
        assertEquals(new PolicyConstraints(Optional.empty(), Optional.of(1)),
            PolicyConstraints.parse(sequence(contextPrimitive(1, new byte[] {1}))));
    }

    @Test
    void shouldRejectEmptyOrOversizedPolicyConstraints() {
        assertThrows(IllegalArgumentException.class, () -> PolicyConstraints.parse(sequence()));
        assertThrows(IllegalArgumentException.class,
            () -> PolicyConstraints.parse(sequence(contextPrimitive(0, new byte[] {0x01, 0x00}))));
        assertThrows(IllegalArgumentException.class,
            () -> PolicyConstraints.parse(sequence(contextPrimitive(1, new byte[] {1}), contextPrimitive(0, new byte[] {1}))));
    }

    @Test
    void shouldParsePolicyMappings() {
        PolicyMappings mappings = PolicyMappings.parse(sequence(
            sequence(oid("1.2.3.1"), oid("1.2.4.1")),
            sequence(oid("1.2.3.2"), oid("1.2.4.2"))
        ));

        assertEquals(List.of(
            new PolicyMappings.PolicyMapping("1.2.3.1", "1.2.4.1"),
            new PolicyMappings.PolicyMapping("1.2.3.2", "1.2.4.2")
        ), mappings.mappings());
    }

    @Test
    void shouldRejectIncompletePolicyMapping() {
        assertThrows(IllegalArgumentException.class, () -> PolicyMappings.parse(sequence()));
        assertThrows(IllegalArgumentException.class, () -> PolicyMappings.parse(sequence(sequence(oid("1.2.3.1")))));
    }

    @Test
    void shouldParseInhibitAnyPolicy() {
        assertEquals(2, InhibitAnyPolicy.parse(integer(2)).skipCerts());
        assertThrows(IllegalArgumentException.class, () -> InhibitAnyPolicy.parse(integer(-1)));
        assertThrows(IllegalArgumentException.class, () -> InhibitAnyPolicy.parse(integer(300)));
        assertThrows(IllegalArgumentException.class, () -> InhibitAnyPolicy.parse(sequence(integer(1))));
    }
}
