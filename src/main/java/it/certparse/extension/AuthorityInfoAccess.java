package it.certparse.extension;

import java.util.ArrayList;
import java.util.List;

import it.certparse.asn1.BerTlv;
import it.certparse.asn1.DerTags;
import it.certparse.asn1.DerValues;

/**
 * <pre>
 * AuthorityInfoAccessSyntax  ::=
 *         SEQUENCE SIZE (1..MAX) OF AccessDescription
 *
 * AccessDescription  ::=  SEQUENCE {
 *         accessMethod          OBJECT IDENTIFIER,
 *         accessLocation        GeneralName  }
 * </pre>
 *
 * Only URI locations of the caIssuers and ocsp methods are collected.
 */
public record AuthorityInfoAccess(List<String> caIssuersUris, List<String> ocspUris) implements CertificateExtension {

    public static final String AD_OCSP = "1.3.6.1.5.5.7.48.1";
    public static final String AD_CA_ISSUERS = "1.3.6.1.5.5.7.48.2";

    private static final int UNIFORM_RESOURCE_IDENTIFIER_TAG = 6;

    public AuthorityInfoAccess {
        caIssuersUris = List.copyOf(caIssuersUris);
        ocspUris = List.copyOf(ocspUris);
    }

    public static AuthorityInfoAccess parse(byte[] value) {
        List<String> caIssuers = new ArrayList<>();
        List<String> ocsp = new ArrayList<>();
        for (BerTlv description : DerValues.nonEmptySequence(value, "AuthorityInfoAccessSyntax")) {
            List<BerTlv> fields = DerValues.sequenceElements(description, "AccessDescription");
            if (fields.size() != 2) {
                throw new IllegalArgumentException("AccessDescription must hold accessMethod and accessLocation");
            }
            String method = DerValues.readOid(fields.get(0), "accessMethod");
            BerTlv location = fields.get(1);
            // other GeneralName arms are skipped without being decoded
            if (!location.is(DerTags.CLASS_CONTEXT_SPECIFIC, false, UNIFORM_RESOURCE_IDENTIFIER_TAG)) {
                continue;
            }
            String uri = DerValues.readIa5String(location.value(), "accessLocation");
            if (AD_CA_ISSUERS.equals(method)) {
                caIssuers.add(uri);
            } else if (AD_OCSP.equals(method)) {
                ocsp.add(uri);
            }
        }
        return new AuthorityInfoAccess(caIssuers, ocsp);
    }

    @Override
    public ExtensionKind kind() {
        return ExtensionKind.AUTHORITY_INFO_ACCESS;
    }
}
