package it.certparse.extension;

import java.util.Arrays;

import it.certparse.asn1.BerCodec;
import it.certparse.asn1.DerValues;

/**
 * SubjectKeyIdentifier ::= KeyIdentifier, with KeyIdentifier ::= OCTET STRING.
 */
public record SubjectKeyIdentifier(byte[] keyIdentifier) implements CertificateExtension {

    public SubjectKeyIdentifier {
        keyIdentifier = keyIdentifier.clone();
    }

    public static SubjectKeyIdentifier parse(byte[] value) {
        return new SubjectKeyIdentifier(DerValues.readOctetString(BerCodec.decodeSingle(value), "SubjectKeyIdentifier"));
    }

    @Override
    public byte[] keyIdentifier() {
        return keyIdentifier.clone();
    }

    @Override
    public ExtensionKind kind() {
        return ExtensionKind.SUBJECT_KEY_IDENTIFIER;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof SubjectKeyIdentifier)) {
            return false;
        }
        return Arrays.equals(keyIdentifier, ((SubjectKeyIdentifier) o).keyIdentifier);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(keyIdentifier);
    }

    @Override
    public String toString() {
        return "SubjectKeyIdentifier[" + keyIdentifier.length + " octets]";
    }
}
