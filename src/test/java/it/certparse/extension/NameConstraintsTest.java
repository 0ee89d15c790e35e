package it.certparse.extension;

import static it.certparse.asn1.DerFixtures.ascii;
import static it.certparse.asn1.DerFixtures.contextConstructed;
import static it.certparse.asn1.DerFixtures.contextPrimitive;
import static it.certparse.asn1.DerFixtures.sequence;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

class NameConstraintsTest {

    @Test
    void shouldParsePermittedAndExcludedSubtrees() {
        byte[] value = sequence(
            contextConstructed(0,
                sequence(contextPrimitive(2, ascii("example.com"))),
                sequence(contextPrimitive(7, new byte[] {10, 0, 0, 0, (byte) 255, 0, 0, 0}))),
            contextConstructed(1, sequence(contextPrimitive(2, ascii("bad.example.com"))))
        );

        NameConstraints constraints = NameConstraints.parse(value, true);

        GeneralNames permitted = constraints.permittedSubtrees().orElseThrow();
        assertEquals(List.of("example.com"), permitted.dnsNames());
        IpAddressRange range = permitted.ipAddressRanges().get(0);
        assertEquals(8, range.prefixLength());
        assertArrayEquals(new byte[] {10, 0, 0, 0}, range.address());
        assertEquals(IpAddressRange.parse(new byte[] {10, 0, 0, 0, (byte) 255, 0, 0, 0}), range);
        assertNotEquals(IpAddressRange.parse(new byte[] {10, 0, 0, 0, (byte) 255, (byte) 255, 0, 0}), range);
        assertTrue(permitted.ipAddresses().isEmpty());
        assertEquals(List.of("bad.example.com"), constraints.excludedSubtrees().orElseThrow().dnsNames());
        assertTrue(constraints.critical());
    }

    @Test
    void shouldAcceptExcludedOnly() {
        NameConstraints constraints = NameConstraints.parse(
            sequence(contextConstructed(1, sequence(contextPrimitive(2, ascii("internal"))))), false);

        assertTrue(constraints.permittedSubtrees().isEmpty());
        assertEquals(List.of("internal"), constraints.excludedSubtrees().orElseThrow().dnsNames());
    }

    @Test
    void shouldRejectEmptyConstraints() {
        assertThrows(IllegalArgumentException.class, () -> NameConstraints.parse(sequence(), true));
        assertThrows(IllegalArgumentException.class, () -> NameConstraints.parse(sequence(contextConstructed(0)), true));
    }

    @Test
    void shouldRejectMinimumAndMaximum() {
        byte[] withMaximum = sequence(contextConstructed(0,
            sequence(contextPrimitive(2, ascii("example.com")), contextPrimitive(1, new byte[] {2}))));

        assertThrows(IllegalArgumentException.class, () -> NameConstraints.parse(withMaximum, true));
    }

    @Test
    void shouldRejectNonContiguousMaskOrWrongLength() {
        byte[] holeyMask = sequence(contextConstructed(0,
            sequence(contextPrimitive(7, new byte[] {10, 0, 0, 0, (byte) 255, 0, (byte) 255, 0}))));
        byte[] plainAddress = sequence(contextConstructed(0,
            sequence(contextPrimitive(7, new byte[] {10, 0, 0, 1}))));

        assertThrows(IllegalArgumentException.class, () -> NameConstraints.parse(holeyMask, true));
        assertThrows(IllegalArgumentException.class, () -> NameConstraints.parse(plainAddress, true));
    }

    @Test
    void shouldRejectFieldsOutOfOrder() {
        byte[] reversed = sequence(
            contextConstructed(1, sequence(contextPrimitive(2, ascii("a")))),
            contextConstructed(0, sequence(contextPrimitive(2, ascii("b"))))
        );

        assertThrows(IllegalArgumentException.class, () -> NameConstraints.parse(reversed, true));
    }
}
