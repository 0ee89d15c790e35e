package it.certparse.asn1;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;

import org.junit.jupiter.api.Test;

class DerValuesTest {

    @Test
    void shouldDecodeObjectIdentifiers() {
        assertEquals("1.2.840.113549.1.1.11", DerValues.readOid(BerCodec.decodeSingle(DerFixtures.oid("1.2.840.113549.1.1.11")), "oid"));
        assertEquals("2.5.29.19", DerValues.readOid(BerCodec.decodeSingle(DerFixtures.oid("2.5.29.19")), "oid"));
        assertEquals("2.999.3", DerValues.decodeOid(new byte[] {(byte) 0x88, 0x37, 0x03}));
        assertEquals("0.9.2342", DerValues.decodeOid(new byte[] {0x09, (byte) 0x92, 0x26}));
    }

    @Test
    void shouldRejectMalformedObjectIdentifiers() {
        assertThrows(IllegalArgumentException.class, () -> DerValues.decodeOid(new byte[0]));
        assertThrows(IllegalArgumentException.class, () -> DerValues.decodeOid(new byte[] {0x2A, (byte) 0x86}));
        assertThrows(IllegalArgumentException.class, () -> DerValues.decodeOid(new byte[] {0x2A, (byte) 0x80, 0x01}));
    }

    @Test
    void shouldEnforceMinimalIntegers() {
        assertArrayEquals(new byte[] {0x00, (byte) 0x80}, DerValues.checkIntegerEncoding(new byte[] {0x00, (byte) 0x80}, "n"));
        assertThrows(IllegalArgumentException.class, () -> DerValues.checkIntegerEncoding(new byte[] {0x00, 0x01}, "n"));
        assertThrows(IllegalArgumentException.class, () -> DerValues.checkIntegerEncoding(new byte[] {(byte) 0xFF, (byte) 0x80}, "n"));
        assertThrows(IllegalArgumentException.class, () -> DerValues.checkIntegerEncoding(new byte[0], "n"));
        assertTrue(DerValues.isNegative(new byte[] {(byte) 0x80}));
    }

    @Test
    void shouldReadUnsignedOctet() {
        assertEquals(0, DerValues.readUint8(BerCodec.decodeSingle(DerFixtures.integer(0)), "n"));
        assertEquals(255, DerValues.readUint8(BerCodec.decodeSingle(DerFixtures.integer(255)), "n"));
        assertThrows(IllegalArgumentException.class, () -> DerValues.readUint8(BerCodec.decodeSingle(DerFixtures.integer(256)), "n"));
        assertThrows(IllegalArgumentException.class, () -> DerValues.readUint8(BerCodec.decodeSingle(DerFixtures.integer(-1)), "n"));
    }

    @Test
    void shouldOnlyAcceptDerBooleans() {
        assertTrue(DerValues.readBoolean(BerCodec.decodeSingle(DerFixtures.bool(true)), "b"));
        assertFalse(DerValues.readBoolean(BerCodec.decodeSingle(DerFixtures.bool(false)), "b"));
        BerTlv loose = BerCodec.decodeSingle(new byte[] {0x01, 0x01, 0x01});
        assertThrows(IllegalArgumentException.class, () -> DerValues.readBoolean(loose, "b"));
    }

    @Test
    void shouldRejectBitStringWithNonZeroPadding() {
        BerTlv padded = BerCodec.decodeSingle(DerFixtures.bitString(1, (byte) 0x81));
        assertThrows(IllegalArgumentException.class, () -> DerValues.readBitString(padded, "bits"));

        BitString bits = DerValues.readBitString(BerCodec.decodeSingle(DerFixtures.bitString(1, (byte) 0x80)), "bits");
        assertEquals(7, bits.bitLength());
        assertTrue(bits.isSet(0));
        assertFalse(bits.isSet(1));
        assertEquals(new BitString(new byte[] {(byte) 0x80}, 1), bits);
        assertNotEquals(new BitString(new byte[] {(byte) 0x80}, 0), bits);
        assertNotEquals(bits, new byte[] {(byte) 0x80});
    }

    @Test
    void shouldRejectEmptyBitStringWithUnusedBits() {
        BerTlv invalid = BerCodec.decodeSingle(new byte[] {0x03, 0x01, 0x03});
        assertThrows(IllegalArgumentException.class, () -> DerValues.readBitString(invalid, "bits"));
    }

    @Test
    void shouldParseUtcAndGeneralizedTime() {
        assertEquals(Instant.parse("2024-01-01T00:00:00Z"),
            DerValues.readTime(BerCodec.decodeSingle(DerFixtures.utcTime("240101000000Z")), "t"));
        assertEquals(Instant.parse("1999-12-31T23:59:59Z"),
            DerValues.readTime(BerCodec.decodeSingle(DerFixtures.utcTime("991231235959Z")), "t"));
        assertEquals(Instant.parse("2050-06-15T12:30:00Z"),
            DerValues.readTime(BerCodec.decodeSingle(DerFixtures.generalizedTime("20500615123000Z")), "t"));
    }

    @Test
    void shouldRejectNonDerTimes() {
        assertThrows(IllegalArgumentException.class,
            () -> DerValues.readTime(BerCodec.decodeSingle(DerFixtures.utcTime("2401010000Z")), "t"));
        assertThrows(IllegalArgumentException.class,
            () -> DerValues.readTime(BerCodec.decodeSingle(DerFixtures.utcTime("241301000000Z")), "t"));
        assertThrows(IllegalArgumentException.class,
            () -> DerValues.readTime(BerCodec.decodeSingle(DerFixtures.generalizedTime("20240101000000+0100")), "t"));
        assertThrows(IllegalArgumentException.class,
            () -> DerValues.readTime(BerCodec.decodeSingle(DerFixtures.integer(1)), "t"));
    }

    @Test
    void shouldRejectNonAsciiIa5() {
        assertEquals("a.example", DerValues.readIa5String(DerFixtures.ascii("a.example"), "dns"));
        assertThrows(IllegalArgumentException.class, () -> DerValues.readIa5String(new byte[] {(byte) 0xC3, (byte) 0xA9}, "dns"));
    }
}
