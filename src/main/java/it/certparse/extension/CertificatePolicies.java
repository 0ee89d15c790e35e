package it.certparse.extension;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import it.certparse.asn1.BerTlv;
import it.certparse.asn1.DerValues;

/**
 * <pre>
 * certificatePolicies ::= SEQUENCE SIZE (1..MAX) OF PolicyInformation
 *
 * PolicyInformation ::= SEQUENCE {
 *      policyIdentifier   CertPolicyId,
 *      policyQualifiers   SEQUENCE SIZE (1..MAX) OF
 *                              PolicyQualifierInfo OPTIONAL }
 *
 * PolicyQualifierInfo ::= SEQUENCE {
 *      policyQualifierId  PolicyQualifierId,
 *      qualifier          ANY DEFINED BY policyQualifierId }
 * </pre>
 *
 * A policy OID may appear only once. Qualifiers of anyPolicy are limited to
 * CPS pointers and user notices; other policies may carry any qualifier.
 */
public record CertificatePolicies(List<String> policyOids) implements CertificateExtension {

    public static final String ANY_POLICY = "2.5.29.32.0";
    public static final String QUALIFIER_CPS = "1.3.6.1.5.5.7.2.1";
    public static final String QUALIFIER_USER_NOTICE = "1.3.6.1.5.5.7.2.2";

    public CertificatePolicies {
        policyOids = List.copyOf(policyOids);
    }

    public static CertificatePolicies parse(byte[] value) {
        Set<String> policies = new LinkedHashSet<>();
        for (BerTlv information : DerValues.nonEmptySequence(value, "certificatePolicies")) {
            List<BerTlv> fields = DerValues.sequenceElements(information, "PolicyInformation");
            if (fields.isEmpty() || fields.size() > 2) {
                throw new IllegalArgumentException("PolicyInformation must have one or two fields");
            }
            String policyOid = DerValues.readOid(fields.get(0), "policyIdentifier");
            if (!policies.add(policyOid)) {
                throw new IllegalArgumentException("Duplicate certificate policy " + policyOid);
            }
            if (fields.size() == 2) {
                parseQualifiers(fields.get(1), ANY_POLICY.equals(policyOid));
            }
        }
        return new CertificatePolicies(new ArrayList<>(policies));
    }

    private static void parseQualifiers(BerTlv qualifiers, boolean restrictToKnown) {
        List<BerTlv> entries = DerValues.sequenceElements(qualifiers, "policyQualifiers");
        if (entries.isEmpty()) {
            throw new IllegalArgumentException("policyQualifiers must contain at least one qualifier");
        }
        for (BerTlv entry : entries) {
            List<BerTlv> fields = DerValues.sequenceElements(entry, "PolicyQualifierInfo");
            if (fields.size() != 2) {
                throw new IllegalArgumentException("PolicyQualifierInfo must hold an id and a qualifier");
            }
            String qualifierId = DerValues.readOid(fields.get(0), "policyQualifierId");
            if (restrictToKnown && !QUALIFIER_CPS.equals(qualifierId) && !QUALIFIER_USER_NOTICE.equals(qualifierId)) {
                throw new IllegalArgumentException("Unsupported anyPolicy qualifier " + qualifierId);
            }
        }
    }

    public boolean contains(String policyOid) {
        return policyOids.contains(policyOid);
    }

    @Override
    public ExtensionKind kind() {
        return ExtensionKind.CERTIFICATE_POLICIES;
    }
}
