package it.certparse.extension;

import static it.certparse.asn1.DerFixtures.ia5;
import static it.certparse.asn1.DerFixtures.oid;
import static it.certparse.asn1.DerFixtures.sequence;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

class CertificatePoliciesTest {

    private static final String DV_POLICY = "2.23.140.1.2.1";

    @Test
    void shouldListPolicyIdentifiers() {
        CertificatePolicies policies = CertificatePolicies.parse(sequence(
            sequence(oid(DV_POLICY)),
            sequence(oid(CertificatePolicies.ANY_POLICY),
                sequence(sequence(oid(CertificatePolicies.QUALIFIER_CPS), ia5("https://example.com/cps"))))
        ));

        assertEquals(List.of(DV_POLICY, CertificatePolicies.ANY_POLICY), policies.policyOids());
        assertTrue(policies.contains(CertificatePolicies.ANY_POLICY));
    }

    @Test
    void shouldAllowAnyQualifierOnSpecificPolicy() {
        CertificatePolicies policies = CertificatePolicies.parse(sequence(
            sequence(oid(DV_POLICY), sequence(sequence(oid("1.2.3.4"), ia5("opaque"))))
        ));

        assertEquals(List.of(DV_POLICY), policies.policyOids());
    }

    @Test
    void shouldRestrictAnyPolicyQualifiers() {
        byte[] value = sequence(
            sequence(oid(CertificatePolicies.ANY_POLICY), sequence(sequence(oid("1.2.3.4"), ia5("opaque"))))
        );

        assertThrows(IllegalArgumentException.class, () -> CertificatePolicies.parse(value));
    }

    @Test
    void shouldRejectDuplicatePolicies() {
        byte[] value = sequence(sequence(oid(DV_POLICY)), sequence(oid(DV_POLICY)));

        assertThrows(IllegalArgumentException.class, () -> CertificatePolicies.parse(value));
    }

    @Test
    void shouldRejectMalformedStructure() {
        assertThrows(IllegalArgumentException.class, () -> CertificatePolicies.parse(sequence()));
        assertThrows(IllegalArgumentException.class, () -> CertificatePolicies.parse(sequence(sequence())));
        assertThrows(IllegalArgumentException.class, () -> CertificatePolicies.parse(sequence(sequence(oid(DV_POLICY), sequence()))));
        assertThrows(IllegalArgumentException.class,
            () -> CertificatePolicies.parse(sequence(sequence(oid(DV_POLICY), sequence(sequence(oid("1.2.3")))))));
    }
}
