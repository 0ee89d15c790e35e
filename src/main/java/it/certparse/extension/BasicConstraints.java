package it.certparse.extension;

import java.util.List;
import java.util.Optional;

import it.certparse.asn1.BerTlv;
import it.certparse.asn1.DerTags;
import it.certparse.asn1.DerValues;

/**
 * <pre>
 * BasicConstraints ::= SEQUENCE {
 *      cA                      BOOLEAN DEFAULT FALSE,
 *      pathLenConstraint       INTEGER (0..MAX) OPTIONAL }
 * </pre>
 *
 * A path length above 255 is rejected.
 */
public record BasicConstraints(boolean ca, Optional<Integer> pathLength) implements CertificateExtension {

    public static BasicConstraints parse(byte[] value) {
        List<BerTlv> fields = DerValues.singleSequence(value, "BasicConstraints");
        int index = 0;
        boolean ca = false;
        if (index < fields.size() && fields.get(index).is(DerTags.CLASS_UNIVERSAL, false, DerTags.BOOLEAN)) {
            // An explicit FALSE is tolerated; some issuers encode the default.
            ca = DerValues.readBoolean(fields.get(index++), "cA");
        }
        Optional<Integer> pathLength = Optional.empty();
        if (index < fields.size()) {
            BerTlv pathLen = DerValues.require(fields.get(index++), DerTags.CLASS_UNIVERSAL, false, DerTags.INTEGER, "pathLenConstraint");
            pathLength = Optional.of(DerValues.readUint8(pathLen, "pathLenConstraint"));
        }
        if (index != fields.size()) {
            throw new IllegalArgumentException("Unexpected trailing field in BasicConstraints");
        }
        return new BasicConstraints(ca, pathLength);
    }

    @Override
    public ExtensionKind kind() {
        return ExtensionKind.BASIC_CONSTRAINTS;
    }
}
