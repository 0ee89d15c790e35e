package it.certparse.cert;

import java.time.Instant;
import java.util.List;

import it.certparse.asn1.BerCodec;
import it.certparse.asn1.BerTlv;
import it.certparse.asn1.BitString;
import it.certparse.asn1.DerTags;
import it.certparse.asn1.DerValues;

/**
 * Splits a Certificate into its envelope parts and decodes the TBSCertificate.
 */
public final class TbsCertificateParser {

    static final int MAX_SERIAL_NUMBER_LENGTH = 20;

    private TbsCertificateParser() {
    }

    /**
     * <pre>
     * Certificate  ::=  SEQUENCE  {
     *      tbsCertificate       TBSCertificate,
     *      signatureAlgorithm   AlgorithmIdentifier,
     *      signatureValue       BIT STRING  }
     * </pre>
     */
    public static CertificateEnvelope parseCertificate(byte[] certificate) {
        List<BerTlv> fields = DerValues.singleSequence(certificate, "Certificate");
        if (fields.size() != 3) {
            throw new IllegalArgumentException("Certificate must have exactly three fields, found " + fields.size());
        }
        BerTlv tbs = fields.get(0);
        if (!tbs.isSequence()) {
            throw new IllegalArgumentException("tbsCertificate is not a SEQUENCE");
        }
        BerTlv signatureAlgorithm = fields.get(1);
        if (!signatureAlgorithm.isSequence()) {
            throw new IllegalArgumentException("signatureAlgorithm is not a SEQUENCE");
        }
        BitString signatureValue = DerValues.readBitString(fields.get(2), "signatureValue");
        return new CertificateEnvelope(tbs.encoded(), signatureAlgorithm.encoded(), signatureValue);
    }

    /**
     * <pre>
     * TBSCertificate  ::=  SEQUENCE  {
     *      version         [0]  EXPLICIT Version DEFAULT v1,
     *      serialNumber         CertificateSerialNumber,
     *      signature            AlgorithmIdentifier,
     *      issuer               Name,
     *      validity             Validity,
     *      subject              Name,
     *      subjectPublicKeyInfo SubjectPublicKeyInfo,
     *      issuerUniqueID  [1]  IMPLICIT UniqueIdentifier OPTIONAL,
     *      subjectUniqueID [2]  IMPLICIT UniqueIdentifier OPTIONAL,
     *      extensions      [3]  EXPLICIT Extensions OPTIONAL  }
     * </pre>
     *
     * Issuer and subject are kept as raw TLVs; their structure is checked later.
     */
    public static ParsedTbsCertificate parseTbsCertificate(byte[] tbsTlv, ParseCertificateOptions options) {
        List<BerTlv> fields = DerValues.singleSequence(tbsTlv, "TBSCertificate");
        int index = 0;

        CertificateVersion version = CertificateVersion.V1;
        if (index < fields.size() && fields.get(index).is(DerTags.CLASS_CONTEXT_SPECIFIC, true, 0)) {
            version = parseVersion(fields.get(index++), options);
        }

        BerTlv serial = DerValues.require(next(fields, index++, "serialNumber"),
            DerTags.CLASS_UNIVERSAL, false, DerTags.INTEGER, "serialNumber");
        byte[] serialNumber = DerValues.readIntegerBytes(serial, "serialNumber");
        if (!options.allowInvalidSerialNumbers()) {
            validateSerialNumber(serialNumber);
        }

        BerTlv signature = next(fields, index++, "signature");
        if (!signature.isSequence()) {
            throw new IllegalArgumentException("signature is not a SEQUENCE");
        }

        BerTlv issuer = next(fields, index++, "issuer");

        List<BerTlv> validity = DerValues.sequenceElements(next(fields, index++, "validity"), "validity");
        if (validity.size() != 2) {
            throw new IllegalArgumentException("validity must hold notBefore and notAfter");
        }
        Instant notBefore = DerValues.readTime(validity.get(0), "notBefore");
        Instant notAfter = DerValues.readTime(validity.get(1), "notAfter");

        BerTlv subject = next(fields, index++, "subject");

        BerTlv subjectPublicKeyInfo = next(fields, index++, "subjectPublicKeyInfo");
        if (!subjectPublicKeyInfo.isSequence()) {
            throw new IllegalArgumentException("subjectPublicKeyInfo is not a SEQUENCE");
        }

        BitString issuerUniqueId = null;
        if (index < fields.size() && fields.get(index).is(DerTags.CLASS_CONTEXT_SPECIFIC, false, 1)) {
            requireVersion(version, CertificateVersion.V2, "issuerUniqueID");
            issuerUniqueId = DerValues.decodeBitStringContent(fields.get(index++).value(), "issuerUniqueID");
        }

        BitString subjectUniqueId = null;
        if (index < fields.size() && fields.get(index).is(DerTags.CLASS_CONTEXT_SPECIFIC, false, 2)) {
            requireVersion(version, CertificateVersion.V2, "subjectUniqueID");
            subjectUniqueId = DerValues.decodeBitStringContent(fields.get(index++).value(), "subjectUniqueID");
        }

        byte[] extensionsTlv = null;
        if (index < fields.size() && fields.get(index).is(DerTags.CLASS_CONTEXT_SPECIFIC, true, 3)) {
            requireVersion(version, CertificateVersion.V3, "extensions");
            BerTlv extensions = BerCodec.decodeSingle(fields.get(index++).value());
            if (!extensions.isSequence()) {
                throw new IllegalArgumentException("extensions is not a SEQUENCE");
            }
            extensionsTlv = extensions.encoded();
        }

        if (index != fields.size()) {
            throw new IllegalArgumentException("Unexpected trailing field in TBSCertificate");
        }

        return new ParsedTbsCertificate(
            version,
            serialNumber,
            signature.encoded(),
            issuer.encoded(),
            notBefore,
            notAfter,
            subject.encoded(),
            subjectPublicKeyInfo.encoded(),
            issuerUniqueId,
            subjectUniqueId,
            extensionsTlv
        );
    }

    private static CertificateVersion parseVersion(BerTlv versionField, ParseCertificateOptions options) {
        BerTlv value = DerValues.require(BerCodec.decodeSingle(versionField.value()),
            DerTags.CLASS_UNIVERSAL, false, DerTags.INTEGER, "version");
        int version = DerValues.readUint8(value, "version");
        return switch (version) {
            case 0 -> {
                // v1 is the DEFAULT and must be omitted in DER.
                if (!options.allowExplicitDefaultValues()) {
                    throw new IllegalArgumentException("Explicitly encoded v1 version");
                }
                yield CertificateVersion.V1;
            }
            case 1 -> CertificateVersion.V2;
            case 2 -> CertificateVersion.V3;
            default -> throw new IllegalArgumentException("Unsupported certificate version " + version);
        };
    }

    /**
     * Zero and negative serials break RFC 5280 section 4.1.2.2 but are tolerated:
     * relying parties are expected to handle them gracefully.
     */
    private static void validateSerialNumber(byte[] serialNumber) {
        if (serialNumber.length > MAX_SERIAL_NUMBER_LENGTH) {
            throw new IllegalArgumentException("Serial number longer than " + MAX_SERIAL_NUMBER_LENGTH + " octets");
        }
    }

    private static void requireVersion(CertificateVersion actual, CertificateVersion minimum, String field) {
        if (actual.compareTo(minimum) < 0) {
            throw new IllegalArgumentException(field + " is not allowed in a " + actual + " certificate");
        }
    }

    private static BerTlv next(List<BerTlv> fields, int index, String field) {
        if (index >= fields.size()) {
            throw new IllegalArgumentException("Missing TBSCertificate field '" + field + "'");
        }
        return fields.get(index);
    }
}
