package it.certparse.cert;

import static it.certparse.asn1.DerFixtures.bool;
import static it.certparse.asn1.DerFixtures.integer;
import static it.certparse.asn1.DerFixtures.octetString;
import static it.certparse.asn1.DerFixtures.oid;
import static it.certparse.asn1.DerFixtures.sequence;
import static it.certparse.cert.TestCertificates.extension;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;

import org.junit.jupiter.api.Test;

import it.certparse.extension.ParsedExtension;

class ExtensionTableBuilderTest {

    private static final ParseCertificateOptions DEFAULTS = ParseCertificateOptions.defaults();

    @Test
    void shouldMapExtensionsByOid() {
        byte[] extensions = sequence(
            extension("2.5.29.19", true, sequence(bool(true))),
            extension("2.5.29.14", false, octetString(new byte[] {1, 2, 3}))
        );

        Map<String, ParsedExtension> table = ExtensionTableBuilder.build(extensions, DEFAULTS);

        assertEquals(2, table.size());
        assertTrue(table.get("2.5.29.19").critical());
        assertFalse(table.get("2.5.29.14").critical());
        assertArrayEquals(octetString(new byte[] {1, 2, 3}), table.get("2.5.29.14").value());
    }

    @Test
    void shouldRejectDuplicateOidEvenWhenPayloadsDiffer() {
        byte[] extensions = sequence(
            extension("2.5.29.19", true, sequence(bool(true))),
            extension("2.5.29.19", false, sequence())
        );

        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
            () -> ExtensionTableBuilder.build(extensions, DEFAULTS));
        assertTrue(ex.getMessage().contains("Duplicate"));
    }

    @Test
    void shouldRejectEmptyExtensionsSequence() {
        assertThrows(IllegalArgumentException.class, () -> ExtensionTableBuilder.build(sequence(), DEFAULTS));
    }

    @Test
    void shouldRejectMalformedEntries() {
        byte[] missingValue = sequence(sequence(oid("2.5.29.19")));
        byte[] valueNotOctetString = sequence(sequence(oid("2.5.29.19"), integer(1)));
        byte[] criticalNotBoolean = sequence(sequence(oid("2.5.29.19"), integer(1), octetString(new byte[0])));
        byte[] tooManyFields = sequence(sequence(oid("2.5.29.19"), bool(true), octetString(new byte[0]), octetString(new byte[0])));

        assertThrows(IllegalArgumentException.class, () -> ExtensionTableBuilder.build(missingValue, DEFAULTS));
        assertThrows(IllegalArgumentException.class, () -> ExtensionTableBuilder.build(valueNotOctetString, DEFAULTS));
        assertThrows(IllegalArgumentException.class, () -> ExtensionTableBuilder.build(criticalNotBoolean, DEFAULTS));
        assertThrows(IllegalArgumentException.class, () -> ExtensionTableBuilder.build(tooManyFields, DEFAULTS));
    }

    @Test
    void shouldHonourExplicitDefaultCriticalitySetting() {
        byte[] explicitFalse = sequence(sequence(oid("2.5.29.15"), bool(false), octetString(new byte[] {0x03, 0x02, 0x07, (byte) 0x80})));

        assertThrows(IllegalArgumentException.class, () -> ExtensionTableBuilder.build(explicitFalse, DEFAULTS));

        ParseCertificateOptions lenient = new ParseCertificateOptions(false, false, true);
        assertFalse(ExtensionTableBuilder.build(explicitFalse, lenient).get("2.5.29.15").critical());
    }

    @Test
    void shouldRejectTrailingBytesAfterSequence() {
        byte[] extensions = sequence(extension("2.5.29.14", false, octetString(new byte[] {9})));
        byte[] withTrailing = new byte[extensions.length + 1];
        System.arraycopy(extensions, 0, withTrailing, 0, extensions.length);

        assertThrows(IllegalArgumentException.class, () -> ExtensionTableBuilder.build(withTrailing, DEFAULTS));
    }
}
