package it.certparse.cert;

import java.util.List;
import java.util.Map;

import it.certparse.asn1.BerCodec;
import it.certparse.asn1.BerTlv;
import it.certparse.asn1.DerTags;
import it.certparse.asn1.DerValues;

/**
 * Signature algorithms recognized in a certificate's AlgorithmIdentifier.
 */
public enum SignatureAlgorithm {

    RSA_PKCS1_SHA1,
    RSA_PKCS1_SHA256,
    RSA_PKCS1_SHA384,
    RSA_PKCS1_SHA512,
    ECDSA_SHA1,
    ECDSA_SHA256,
    ECDSA_SHA384,
    ECDSA_SHA512,
    RSA_PSS_SHA256,
    RSA_PSS_SHA384,
    RSA_PSS_SHA512,
    ED25519;

    static final String OID_SHA1_WITH_RSA = "1.2.840.113549.1.1.5";
    static final String OID_SHA1_WITH_RSA_OIW = "1.3.14.3.2.29";
    static final String OID_SHA256_WITH_RSA = "1.2.840.113549.1.1.11";
    static final String OID_SHA384_WITH_RSA = "1.2.840.113549.1.1.12";
    static final String OID_SHA512_WITH_RSA = "1.2.840.113549.1.1.13";
    static final String OID_ECDSA_SHA1 = "1.2.840.10045.4.1";
    static final String OID_ECDSA_SHA256 = "1.2.840.10045.4.3.2";
    static final String OID_ECDSA_SHA384 = "1.2.840.10045.4.3.3";
    static final String OID_ECDSA_SHA512 = "1.2.840.10045.4.3.4";
    static final String OID_RSA_PSS = "1.2.840.113549.1.1.10";
    static final String OID_MGF1 = "1.2.840.113549.1.1.8";
    static final String OID_ED25519 = "1.3.101.112";
    static final String OID_SHA256 = "2.16.840.1.101.3.4.2.1";
    static final String OID_SHA384 = "2.16.840.1.101.3.4.2.2";
    static final String OID_SHA512 = "2.16.840.1.101.3.4.2.3";

    private static final Map<String, SignatureAlgorithm> RSA_PKCS1 = Map.of(
        OID_SHA1_WITH_RSA, RSA_PKCS1_SHA1,
        OID_SHA1_WITH_RSA_OIW, RSA_PKCS1_SHA1,
        OID_SHA256_WITH_RSA, RSA_PKCS1_SHA256,
        OID_SHA384_WITH_RSA, RSA_PKCS1_SHA384,
        OID_SHA512_WITH_RSA, RSA_PKCS1_SHA512
    );

    private static final Map<String, SignatureAlgorithm> ECDSA = Map.of(
        OID_ECDSA_SHA1, ECDSA_SHA1,
        OID_ECDSA_SHA256, ECDSA_SHA256,
        OID_ECDSA_SHA384, ECDSA_SHA384,
        OID_ECDSA_SHA512, ECDSA_SHA512
    );

    /**
     * Parses a DER AlgorithmIdentifier:
     *
     * <pre>
     * AlgorithmIdentifier  ::=  SEQUENCE  {
     *      algorithm               OBJECT IDENTIFIER,
     *      parameters              ANY DEFINED BY algorithm OPTIONAL  }
     * </pre>
     */
    public static SignatureAlgorithm parse(byte[] algorithmIdentifierTlv) {
        List<BerTlv> fields = DerValues.singleSequence(algorithmIdentifierTlv, "AlgorithmIdentifier");
        if (fields.isEmpty() || fields.size() > 2) {
            throw new IllegalArgumentException("AlgorithmIdentifier must have one or two fields");
        }
        String oid = DerValues.readOid(fields.get(0), "algorithm");
        BerTlv parameters = fields.size() == 2 ? fields.get(1) : null;

        SignatureAlgorithm rsa = RSA_PKCS1.get(oid);
        if (rsa != null) {
            if (parameters != null && !isNull(parameters)) {
                throw new IllegalArgumentException("RSA PKCS#1 parameters must be NULL or absent");
            }
            return rsa;
        }

        SignatureAlgorithm ecdsa = ECDSA.get(oid);
        if (ecdsa != null) {
            if (parameters != null) {
                throw new IllegalArgumentException("ECDSA AlgorithmIdentifier must not carry parameters");
            }
            return ecdsa;
        }

        if (OID_ED25519.equals(oid)) {
            if (parameters != null) {
                throw new IllegalArgumentException("Ed25519 AlgorithmIdentifier must not carry parameters");
            }
            return ED25519;
        }

        if (OID_RSA_PSS.equals(oid)) {
            if (parameters == null) {
                throw new IllegalArgumentException("RSASSA-PSS requires parameters");
            }
            return parsePssParameters(parameters);
        }

        throw new IllegalArgumentException("Unsupported signature algorithm " + oid);
    }

    /**
     * <pre>
     * RSASSA-PSS-params  ::=  SEQUENCE  {
     *      hashAlgorithm      [0] HashAlgorithm DEFAULT sha1,
     *      maskGenAlgorithm   [1] MaskGenAlgorithm DEFAULT mgf1SHA1,
     *      saltLength         [2] INTEGER DEFAULT 20,
     *      trailerField       [3] TrailerField DEFAULT trailerFieldBC  }
     * </pre>
     *
     * Only SHA-256/384/512 with MGF1 over the same hash and a salt equal to the
     * digest length are accepted.
     */
    private static SignatureAlgorithm parsePssParameters(BerTlv parameters) {
        List<BerTlv> fields = DerValues.sequenceElements(parameters, "RSASSA-PSS-params");
        if (fields.size() != 3) {
            throw new IllegalArgumentException("RSASSA-PSS-params must carry hash, mask generation and salt length");
        }

        BerTlv hashField = DerValues.require(fields.get(0), DerTags.CLASS_CONTEXT_SPECIFIC, true, 0, "hashAlgorithm");
        String hashOid = parseHashAlgorithm(singleChild(hashField, "hashAlgorithm"));

        BerTlv maskGenField = DerValues.require(fields.get(1), DerTags.CLASS_CONTEXT_SPECIFIC, true, 1, "maskGenAlgorithm");
        List<BerTlv> maskGen = DerValues.sequenceElements(singleChild(maskGenField, "maskGenAlgorithm"), "MaskGenAlgorithm");
        if (maskGen.size() != 2 || !OID_MGF1.equals(DerValues.readOid(maskGen.get(0), "maskGenAlgorithm"))) {
            throw new IllegalArgumentException("RSASSA-PSS mask generation must be MGF1");
        }
        String mgfHashOid = parseHashAlgorithm(maskGen.get(1));
        if (!hashOid.equals(mgfHashOid)) {
            throw new IllegalArgumentException("RSASSA-PSS MGF1 hash differs from message hash");
        }

        BerTlv saltField = DerValues.require(fields.get(2), DerTags.CLASS_CONTEXT_SPECIFIC, true, 2, "saltLength");
        BerTlv salt = DerValues.require(singleChild(saltField, "saltLength"), DerTags.CLASS_UNIVERSAL, false, DerTags.INTEGER, "saltLength");
        int saltLength = DerValues.readUint8(salt, "saltLength");

        SignatureAlgorithm algorithm;
        int digestLength;
        switch (hashOid) {
            case OID_SHA256 -> {
                algorithm = RSA_PSS_SHA256;
                digestLength = 32;
            }
            case OID_SHA384 -> {
                algorithm = RSA_PSS_SHA384;
                digestLength = 48;
            }
            case OID_SHA512 -> {
                algorithm = RSA_PSS_SHA512;
                digestLength = 64;
            }
            default -> throw new IllegalArgumentException("Unsupported RSASSA-PSS hash " + hashOid);
        }
        if (saltLength != digestLength) {
            throw new IllegalArgumentException("RSASSA-PSS salt length " + saltLength + " does not match digest length");
        }
        return algorithm;
    }

    private static String parseHashAlgorithm(BerTlv algorithmIdentifier) {
        List<BerTlv> fields = DerValues.sequenceElements(algorithmIdentifier, "HashAlgorithm");
        if (fields.isEmpty() || fields.size() > 2) {
            throw new IllegalArgumentException("HashAlgorithm must have one or two fields");
        }
        if (fields.size() == 2 && !isNull(fields.get(1))) {
            throw new IllegalArgumentException("HashAlgorithm parameters must be NULL or absent");
        }
        return DerValues.readOid(fields.get(0), "hashAlgorithm");
    }

    private static BerTlv singleChild(BerTlv explicitlyTagged, String field) {
        List<BerTlv> children = BerCodec.decodeAll(explicitlyTagged.value());
        if (children.size() != 1) {
            throw new IllegalArgumentException(field + " must wrap exactly one element");
        }
        return children.get(0);
    }

    private static boolean isNull(BerTlv tlv) {
        return tlv.is(DerTags.CLASS_UNIVERSAL, false, DerTags.NULL) && tlv.length() == 0;
    }
}
