package it.certparse.extension;

import java.util.ArrayList;
import java.util.List;

import it.certparse.asn1.BerTlv;
import it.certparse.asn1.DerValues;

/**
 * ExtKeyUsageSyntax ::= SEQUENCE SIZE (1..MAX) OF KeyPurposeId
 */
public record ExtendedKeyUsage(List<String> keyPurposes) implements CertificateExtension {

    public static final String ANY_EXTENDED_KEY_USAGE = "2.5.29.37.0";
    public static final String SERVER_AUTH = "1.3.6.1.5.5.7.3.1";
    public static final String CLIENT_AUTH = "1.3.6.1.5.5.7.3.2";
    public static final String CODE_SIGNING = "1.3.6.1.5.5.7.3.3";
    public static final String EMAIL_PROTECTION = "1.3.6.1.5.5.7.3.4";
    public static final String TIME_STAMPING = "1.3.6.1.5.5.7.3.8";
    public static final String OCSP_SIGNING = "1.3.6.1.5.5.7.3.9";

    public ExtendedKeyUsage {
        keyPurposes = List.copyOf(keyPurposes);
    }

    public static ExtendedKeyUsage parse(byte[] value) {
        List<String> purposes = new ArrayList<>();
        for (BerTlv purpose : DerValues.nonEmptySequence(value, "ExtKeyUsageSyntax")) {
            // Repeated purposes are legal and kept.
            purposes.add(DerValues.readOid(purpose, "KeyPurposeId"));
        }
        return new ExtendedKeyUsage(purposes);
    }

    public boolean permits(String keyPurpose) {
        return keyPurposes.contains(keyPurpose);
    }

    @Override
    public ExtensionKind kind() {
        return ExtensionKind.EXTENDED_KEY_USAGE;
    }
}
