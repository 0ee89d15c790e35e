package it.certparse.extension;

import java.util.ArrayList;
import java.util.List;

import it.certparse.asn1.BerTlv;
import it.certparse.asn1.DerValues;

/**
 * <pre>
 * PolicyMappings ::= SEQUENCE SIZE (1..MAX) OF SEQUENCE {
 *      issuerDomainPolicy      CertPolicyId,
 *      subjectDomainPolicy     CertPolicyId }
 * </pre>
 */
public record PolicyMappings(List<PolicyMapping> mappings) implements CertificateExtension {

    public record PolicyMapping(String issuerDomainPolicy, String subjectDomainPolicy) {
    }

    public PolicyMappings {
        mappings = List.copyOf(mappings);
    }

    public static PolicyMappings parse(byte[] value) {
        List<PolicyMapping> mappings = new ArrayList<>();
        for (BerTlv mapping : DerValues.nonEmptySequence(value, "PolicyMappings")) {
            List<BerTlv> fields = DerValues.sequenceElements(mapping, "PolicyMapping");
            if (fields.size() != 2) {
                throw new IllegalArgumentException("PolicyMapping must hold issuer and subject domain policies");
            }
            mappings.add(new PolicyMapping(
                DerValues.readOid(fields.get(0), "issuerDomainPolicy"),
                DerValues.readOid(fields.get(1), "subjectDomainPolicy")
            ));
        }
        return new PolicyMappings(mappings);
    }

    @Override
    public ExtensionKind kind() {
        return ExtensionKind.POLICY_MAPPINGS;
    }
}
