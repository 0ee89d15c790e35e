package it.certparse.extension;

import java.util.List;
import java.util.Optional;

import it.certparse.asn1.BerTlv;
import it.certparse.asn1.DerTags;
import it.certparse.asn1.DerValues;

/**
 * <pre>
 * PolicyConstraints ::= SEQUENCE {
 *      requireExplicitPolicy           [0] SkipCerts OPTIONAL,
 *      inhibitPolicyMapping            [1] SkipCerts OPTIONAL }
 * </pre>
 */
public record PolicyConstraints(
    Optional<Integer> requireExplicitPolicy,
    Optional<Integer> inhibitPolicyMapping
) implements CertificateExtension {

    public static PolicyConstraints parse(byte[] value) {
        List<BerTlv> fields = DerValues.singleSequence(value, "PolicyConstraints");
        int index = 0;
        Optional<Integer> requireExplicitPolicy = Optional.empty();
        if (index < fields.size() && fields.get(index).is(DerTags.CLASS_CONTEXT_SPECIFIC, false, 0)) {
            requireExplicitPolicy = Optional.of(DerValues.readUint8(fields.get(index++), "requireExplicitPolicy"));
        }
        Optional<Integer> inhibitPolicyMapping = Optional.empty();
        if (index < fields.size() && fields.get(index).is(DerTags.CLASS_CONTEXT_SPECIFIC, false, 1)) {
            inhibitPolicyMapping = Optional.of(DerValues.readUint8(fields.get(index++), "inhibitPolicyMapping"));
        }
        if (index != fields.size()) {
            throw new IllegalArgumentException("Unexpected field in PolicyConstraints");
        }
        if (requireExplicitPolicy.isEmpty() && inhibitPolicyMapping.isEmpty()) {
            throw new IllegalArgumentException("PolicyConstraints must not be an empty sequence");
        }
        return new PolicyConstraints(requireExplicitPolicy, inhibitPolicyMapping);
    }

    @Override
    public ExtensionKind kind() {
        return ExtensionKind.POLICY_CONSTRAINTS;
    }
}
