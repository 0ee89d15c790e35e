package it.certparse.extension;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import it.certparse.asn1.BerCodec;
import it.certparse.asn1.BerTlv;
import it.certparse.asn1.DerTags;
import it.certparse.asn1.DerValues;

/**
 * <pre>
 * NameConstraints ::= SEQUENCE {
 *      permittedSubtrees       [0]     GeneralSubtrees OPTIONAL,
 *      excludedSubtrees        [1]     GeneralSubtrees OPTIONAL }
 *
 * GeneralSubtrees ::= SEQUENCE SIZE (1..MAX) OF GeneralSubtree
 *
 * GeneralSubtree ::= SEQUENCE {
 *      base                    GeneralName,
 *      minimum         [0]     BaseDistance DEFAULT 0,
 *      maximum         [1]     BaseDistance OPTIONAL }
 * </pre>
 *
 * Only bases are kept: minimum must be left at its default and maximum absent.
 */
public record NameConstraints(
    Optional<GeneralNames> permittedSubtrees,
    Optional<GeneralNames> excludedSubtrees,
    boolean critical
) implements CertificateExtension {

    public static NameConstraints parse(byte[] value, boolean critical) {
        List<BerTlv> fields = DerValues.singleSequence(value, "NameConstraints");
        int index = 0;

        Optional<GeneralNames> permitted = Optional.empty();
        if (index < fields.size() && fields.get(index).is(DerTags.CLASS_CONTEXT_SPECIFIC, true, 0)) {
            permitted = Optional.of(parseSubtrees(fields.get(index++), "permittedSubtrees"));
        }
        Optional<GeneralNames> excluded = Optional.empty();
        if (index < fields.size() && fields.get(index).is(DerTags.CLASS_CONTEXT_SPECIFIC, true, 1)) {
            excluded = Optional.of(parseSubtrees(fields.get(index++), "excludedSubtrees"));
        }
        if (index != fields.size()) {
            throw new IllegalArgumentException("Unexpected field in NameConstraints");
        }
        if (permitted.isEmpty() && excluded.isEmpty()) {
            throw new IllegalArgumentException("NameConstraints must contain permitted or excluded subtrees");
        }
        return new NameConstraints(permitted, excluded, critical);
    }

    private static GeneralNames parseSubtrees(BerTlv subtreesField, String field) {
        List<BerTlv> subtrees = BerCodec.decodeAll(subtreesField.value());
        if (subtrees.isEmpty()) {
            throw new IllegalArgumentException(field + " must contain at least one subtree");
        }
        List<BerTlv> bases = new ArrayList<>();
        for (BerTlv subtree : subtrees) {
            List<BerTlv> subtreeFields = DerValues.sequenceElements(subtree, "GeneralSubtree");
            if (subtreeFields.size() != 1) {
                throw new IllegalArgumentException("GeneralSubtree minimum/maximum are not supported");
            }
            bases.add(subtreeFields.get(0));
        }
        return GeneralNames.fromElements(bases, GeneralNames.Usage.NAME_CONSTRAINTS);
    }

    @Override
    public ExtensionKind kind() {
        return ExtensionKind.NAME_CONSTRAINTS;
    }
}
