package it.certparse.asn1;

import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;

/**
 * DER building blocks for tests.
 */
public final class DerFixtures {

    private DerFixtures() {
    }

    public static byte[] tlv(int tagClass, boolean constructed, int tagNumber, byte[] value) {
        return BerCodec.encode(new BerTlv(tagClass, constructed, tagNumber, 0, value.length, value));
    }

    public static byte[] universal(boolean constructed, int tagNumber, byte[] value) {
        return tlv(DerTags.CLASS_UNIVERSAL, constructed, tagNumber, value);
    }

    public static byte[] contextPrimitive(int tag, byte[] value) {
        return tlv(DerTags.CLASS_CONTEXT_SPECIFIC, false, tag, value);
    }

    public static byte[] contextConstructed(int tag, byte[]... parts) {
        return tlv(DerTags.CLASS_CONTEXT_SPECIFIC, true, tag, concat(parts));
    }

    public static byte[] sequence(byte[]... parts) {
        return universal(true, DerTags.SEQUENCE, concat(parts));
    }

    public static byte[] set(byte[]... parts) {
        return universal(true, DerTags.SET, concat(parts));
    }

    public static byte[] oid(String dotted) {
        String[] arcs = dotted.split("\\.");
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        writeArc(out, Long.parseLong(arcs[0]) * 40 + Long.parseLong(arcs[1]));
        for (int i = 2; i < arcs.length; i++) {
            writeArc(out, Long.parseLong(arcs[i]));
        }
        return universal(false, DerTags.OBJECT_IDENTIFIER, out.toByteArray());
    }

    public static byte[] integer(long value) {
        return universal(false, DerTags.INTEGER, BigInteger.valueOf(value).toByteArray());
    }

    public static byte[] bool(boolean value) {
        return universal(false, DerTags.BOOLEAN, new byte[] {value ? (byte) 0xFF : 0x00});
    }

    public static byte[] nullValue() {
        return universal(false, DerTags.NULL, new byte[0]);
    }

    public static byte[] octetString(byte[] value) {
        return universal(false, DerTags.OCTET_STRING, value);
    }

    public static byte[] bitString(int unusedBits, byte... bits) {
        byte[] content = new byte[bits.length + 1];
        content[0] = (byte) unusedBits;
        System.arraycopy(bits, 0, content, 1, bits.length);
        return universal(false, DerTags.BIT_STRING, content);
    }

    public static byte[] printable(String value) {
        return universal(false, DerTags.PRINTABLE_STRING, value.getBytes(StandardCharsets.US_ASCII));
    }

    public static byte[] utf8(String value) {
        return universal(false, DerTags.UTF8_STRING, value.getBytes(StandardCharsets.UTF_8));
    }

    public static byte[] ia5(String value) {
        return universal(false, DerTags.IA5_STRING, value.getBytes(StandardCharsets.US_ASCII));
    }

    public static byte[] utcTime(String value) {
        return universal(false, DerTags.UTC_TIME, value.getBytes(StandardCharsets.US_ASCII));
    }

    public static byte[] generalizedTime(String value) {
        return universal(false, DerTags.GENERALIZED_TIME, value.getBytes(StandardCharsets.US_ASCII));
    }

    public static byte[] ascii(String value) {
        return value.getBytes(StandardCharsets.US_ASCII);
    }

    public static byte[] concat(byte[]... parts) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (byte[] part : parts) {
            out.writeBytes(part);
        }
        return out.toByteArray();
    }

    private static void writeArc(ByteArrayOutputStream out, long arc) {
        int[] chunks = new int[10];
        int count = 0;
        long value = arc;
        do {
            chunks[count++] = (int) (value & 0x7F);
            value >>= 7;
        } while (value > 0);
        for (int i = count - 1; i >= 0; i--) {
            out.write(i == 0 ? chunks[i] : chunks[i] | 0x80);
        }
    }
}
