package it.certparse.extension;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import it.certparse.asn1.BerCodec;
import it.certparse.asn1.BerTlv;
import it.certparse.asn1.DerTags;
import it.certparse.asn1.DerValues;

/**
 * <pre>
 * AuthorityKeyIdentifier ::= SEQUENCE {
 *      keyIdentifier             [0] KeyIdentifier           OPTIONAL,
 *      authorityCertIssuer       [1] GeneralNames            OPTIONAL,
 *      authorityCertSerialNumber [2] CertificateSerialNumber OPTIONAL  }
 * </pre>
 *
 * authorityCertIssuer and authorityCertSerialNumber are both present or both absent.
 */
public final class AuthorityKeyIdentifier implements CertificateExtension {

    private final byte[] keyIdentifier;
    private final GeneralNames authorityCertIssuer;
    private final byte[] authorityCertSerialNumber;

    AuthorityKeyIdentifier(byte[] keyIdentifier, GeneralNames authorityCertIssuer, byte[] authorityCertSerialNumber) {
        this.keyIdentifier = keyIdentifier == null ? null : keyIdentifier.clone();
        this.authorityCertIssuer = authorityCertIssuer;
        this.authorityCertSerialNumber = authorityCertSerialNumber == null ? null : authorityCertSerialNumber.clone();
    }

    public static AuthorityKeyIdentifier parse(byte[] value) {
        List<BerTlv> fields = DerValues.singleSequence(value, "AuthorityKeyIdentifier");
        int index = 0;

        byte[] keyIdentifier = null;
        if (index < fields.size() && fields.get(index).is(DerTags.CLASS_CONTEXT_SPECIFIC, false, 0)) {
            keyIdentifier = fields.get(index++).value();
        }
        GeneralNames issuer = null;
        if (index < fields.size() && fields.get(index).is(DerTags.CLASS_CONTEXT_SPECIFIC, true, 1)) {
            issuer = GeneralNames.fromElements(BerCodec.decodeAll(fields.get(index++).value()), GeneralNames.Usage.SUBJECT_ALT_NAME);
        }
        byte[] serial = null;
        if (index < fields.size() && fields.get(index).is(DerTags.CLASS_CONTEXT_SPECIFIC, false, 2)) {
            serial = DerValues.checkIntegerEncoding(fields.get(index++).value(), "authorityCertSerialNumber");
        }
        if (index != fields.size()) {
            throw new IllegalArgumentException("Unexpected field in AuthorityKeyIdentifier");
        }
        if ((issuer == null) != (serial == null)) {
            throw new IllegalArgumentException("authorityCertIssuer and authorityCertSerialNumber must be present together");
        }
        return new AuthorityKeyIdentifier(keyIdentifier, issuer, serial);
    }

    public Optional<byte[]> keyIdentifier() {
        return Optional.ofNullable(keyIdentifier).map(byte[]::clone);
    }

    public Optional<GeneralNames> authorityCertIssuer() {
        return Optional.ofNullable(authorityCertIssuer);
    }

    public Optional<byte[]> authorityCertSerialNumber() {
        return Optional.ofNullable(authorityCertSerialNumber).map(byte[]::clone);
    }

    @Override
    public ExtensionKind kind() {
        return ExtensionKind.AUTHORITY_KEY_IDENTIFIER;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AuthorityKeyIdentifier)) {
            return false;
        }
        AuthorityKeyIdentifier other = (AuthorityKeyIdentifier) o;
        return Arrays.equals(keyIdentifier, other.keyIdentifier)
            && Objects.equals(authorityCertIssuer, other.authorityCertIssuer)
            && Arrays.equals(authorityCertSerialNumber, other.authorityCertSerialNumber);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(keyIdentifier) * 31 + Arrays.hashCode(authorityCertSerialNumber);
    }
}
