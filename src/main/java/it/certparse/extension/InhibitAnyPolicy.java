package it.certparse.extension;

import it.certparse.asn1.BerCodec;
import it.certparse.asn1.BerTlv;
import it.certparse.asn1.DerTags;
import it.certparse.asn1.DerValues;

/**
 * InhibitAnyPolicy ::= SkipCerts, with SkipCerts ::= INTEGER (0..MAX) capped at 255.
 */
public record InhibitAnyPolicy(int skipCerts) implements CertificateExtension {

    public static InhibitAnyPolicy parse(byte[] value) {
        BerTlv skipCerts = DerValues.require(BerCodec.decodeSingle(value), DerTags.CLASS_UNIVERSAL, false, DerTags.INTEGER, "InhibitAnyPolicy");
        return new InhibitAnyPolicy(DerValues.readUint8(skipCerts, "InhibitAnyPolicy"));
    }

    @Override
    public ExtensionKind kind() {
        return ExtensionKind.INHIBIT_ANY_POLICY;
    }
}
