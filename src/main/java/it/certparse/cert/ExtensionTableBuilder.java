package it.certparse.cert;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import it.certparse.asn1.BerTlv;
import it.certparse.asn1.DerTags;
import it.certparse.asn1.DerValues;
import it.certparse.extension.ParsedExtension;

/**
 * Builds the OID keyed extension table from the TBS extensions SEQUENCE.
 *
 * <pre>
 * Extensions  ::=  SEQUENCE SIZE (1..MAX) OF Extension
 *
 * Extension  ::=  SEQUENCE  {
 *      extnID      OBJECT IDENTIFIER,
 *      critical    BOOLEAN DEFAULT FALSE,
 *      extnValue   OCTET STRING  }
 * </pre>
 */
public final class ExtensionTableBuilder {

    private ExtensionTableBuilder() {
    }

    public static Map<String, ParsedExtension> build(byte[] extensionsTlv, ParseCertificateOptions options) {
        List<BerTlv> entries = DerValues.nonEmptySequence(extensionsTlv, "Extensions");
        Map<String, ParsedExtension> table = new LinkedHashMap<>();
        for (BerTlv entry : entries) {
            ParsedExtension extension = parseExtension(entry, options);
            if (table.putIfAbsent(extension.oid(), extension) != null) {
                throw new IllegalArgumentException("Duplicate extension " + extension.oid());
            }
        }
        return Collections.unmodifiableMap(table);
    }

    static ParsedExtension parseExtension(BerTlv entry, ParseCertificateOptions options) {
        List<BerTlv> fields = DerValues.sequenceElements(entry, "Extension");
        if (fields.size() < 2 || fields.size() > 3) {
            throw new IllegalArgumentException("Extension must have two or three fields, found " + fields.size());
        }

        String oid = DerValues.readOid(fields.get(0), "extnID");
        boolean critical = false;
        int index = 1;
        if (fields.size() == 3) {
            critical = DerValues.readBoolean(fields.get(index++), "critical");
            if (!critical && !options.allowExplicitDefaultValues()) {
                throw new IllegalArgumentException("Extension " + oid + " encodes the default criticality explicitly");
            }
        }

        BerTlv value = fields.get(index);
        if (!value.is(DerTags.CLASS_UNIVERSAL, false, DerTags.OCTET_STRING)) {
            throw new IllegalArgumentException("Extension " + oid + " value is not an OCTET STRING");
        }
        return new ParsedExtension(oid, critical, value.value());
    }
}
