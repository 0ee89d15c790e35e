package it.certparse.asn1;

import java.nio.charset.StandardCharsets;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;

/**
 * Readers for the DER primitive types used by certificates. Every reader
 * throws {@link IllegalArgumentException} on a malformed value.
 */
public final class DerValues {

    private DerValues() {
    }

    public static BerTlv require(BerTlv tlv, int tagClass, boolean constructed, int tagNumber, String field) {
        if (!tlv.is(tagClass, constructed, tagNumber)) {
            throw new IllegalArgumentException(field + " has unexpected tag [class=" + tlv.tagClass()
                + ", constructed=" + tlv.constructed() + ", number=" + tlv.tagNumber() + "]");
        }
        return tlv;
    }

    public static List<BerTlv> sequenceElements(BerTlv tlv, String field) {
        require(tlv, DerTags.CLASS_UNIVERSAL, true, DerTags.SEQUENCE, field);
        return BerCodec.decodeAll(tlv.value());
    }

    /**
     * Decodes {@code payload} as exactly one SEQUENCE and returns its elements.
     */
    public static List<BerTlv> singleSequence(byte[] payload, String field) {
        return sequenceElements(BerCodec.decodeSingle(payload), field);
    }

    /**
     * Same as {@link #singleSequence(byte[], String)} but also rejects an empty sequence.
     */
    public static List<BerTlv> nonEmptySequence(byte[] payload, String field) {
        List<BerTlv> elements = singleSequence(payload, field);
        if (elements.isEmpty()) {
            throw new IllegalArgumentException(field + " must contain at least one element");
        }
        return elements;
    }

    public static String readOid(BerTlv tlv, String field) {
        require(tlv, DerTags.CLASS_UNIVERSAL, false, DerTags.OBJECT_IDENTIFIER, field);
        return decodeOid(tlv.value());
    }

    public static String decodeOid(byte[] encoded) {
        if (encoded.length == 0) {
            throw new IllegalArgumentException("OBJECT IDENTIFIER is empty");
        }
        if ((encoded[encoded.length - 1] & 0x80) != 0) {
            throw new IllegalArgumentException("OBJECT IDENTIFIER ends inside a subidentifier");
        }
        StringBuilder oid = new StringBuilder();
        long value = 0;
        boolean startOfArc = true;
        boolean firstArc = true;
        for (byte b : encoded) {
            int octet = b & 0xFF;
            if (startOfArc && octet == 0x80) {
                throw new IllegalArgumentException("OBJECT IDENTIFIER subidentifier is not minimally encoded");
            }
            if (value > (Long.MAX_VALUE >> 7)) {
                throw new IllegalArgumentException("OBJECT IDENTIFIER subidentifier too large");
            }
            value = (value << 7) | (octet & 0x7F);
            startOfArc = (octet & 0x80) == 0;
            if (!startOfArc) {
                continue;
            }
            if (firstArc) {
                if (value < 40) {
                    oid.append("0.").append(value);
                } else if (value < 80) {
                    oid.append("1.").append(value - 40);
                } else {
                    oid.append("2.").append(value - 80);
                }
                firstArc = false;
            } else {
                oid.append('.').append(value);
            }
            value = 0;
        }
        return oid.toString();
    }

    /**
     * Returns the content octets of an INTEGER after checking that it is minimally encoded.
     */
    public static byte[] readIntegerBytes(BerTlv tlv, String field) {
        return checkIntegerEncoding(tlv.value(), field);
    }

    public static byte[] checkIntegerEncoding(byte[] content, String field) {
        if (content.length == 0) {
            throw new IllegalArgumentException(field + " INTEGER is empty");
        }
        if (content.length > 1) {
            int first = content[0] & 0xFF;
            int second = content[1] & 0x80;
            if ((first == 0x00 && second == 0) || (first == 0xFF && second != 0)) {
                throw new IllegalArgumentException(field + " INTEGER is not minimally encoded");
            }
        }
        return content;
    }

    public static boolean isNegative(byte[] integerContent) {
        return integerContent.length > 0 && (integerContent[0] & 0x80) != 0;
    }

    /**
     * Reads a non-negative INTEGER that must fit in an unsigned octet, as used by
     * SkipCerts and the basic constraints path length.
     */
    public static int readUint8(BerTlv tlv, String field) {
        byte[] content = checkIntegerEncoding(tlv.value(), field);
        if (isNegative(content)) {
            throw new IllegalArgumentException(field + " must not be negative");
        }
        if (content.length > 2 || (content.length == 2 && content[0] != 0)) {
            throw new IllegalArgumentException(field + " exceeds 255");
        }
        return content[content.length - 1] & 0xFF;
    }

    public static boolean readBoolean(BerTlv tlv, String field) {
        require(tlv, DerTags.CLASS_UNIVERSAL, false, DerTags.BOOLEAN, field);
        byte[] content = tlv.value();
        if (content.length != 1) {
            throw new IllegalArgumentException(field + " BOOLEAN must be one octet");
        }
        int octet = content[0] & 0xFF;
        if (octet == 0x00) {
            return false;
        }
        if (octet == 0xFF) {
            return true;
        }
        throw new IllegalArgumentException(field + " BOOLEAN is not DER encoded");
    }

    public static byte[] readOctetString(BerTlv tlv, String field) {
        require(tlv, DerTags.CLASS_UNIVERSAL, false, DerTags.OCTET_STRING, field);
        return tlv.value();
    }

    public static BitString readBitString(BerTlv tlv, String field) {
        require(tlv, DerTags.CLASS_UNIVERSAL, false, DerTags.BIT_STRING, field);
        return decodeBitStringContent(tlv.value(), field);
    }

    public static BitString decodeBitStringContent(byte[] content, String field) {
        if (content.length == 0) {
            throw new IllegalArgumentException(field + " BIT STRING has no unused-bits octet");
        }
        int unusedBits = content[0] & 0xFF;
        if (unusedBits > 7) {
            throw new IllegalArgumentException(field + " BIT STRING declares " + unusedBits + " unused bits");
        }
        byte[] bits = new byte[content.length - 1];
        System.arraycopy(content, 1, bits, 0, bits.length);
        if (bits.length == 0 && unusedBits != 0) {
            throw new IllegalArgumentException(field + " empty BIT STRING declares unused bits");
        }
        if (bits.length > 0) {
            int padding = bits[bits.length - 1] & ((1 << unusedBits) - 1);
            if (padding != 0) {
                throw new IllegalArgumentException(field + " BIT STRING padding bits are not zero");
            }
        }
        return new BitString(bits, unusedBits);
    }

    public static Instant readTime(BerTlv tlv, String field) {
        if (tlv.is(DerTags.CLASS_UNIVERSAL, false, DerTags.UTC_TIME)) {
            return parseTime(tlv.value(), false, field);
        }
        if (tlv.is(DerTags.CLASS_UNIVERSAL, false, DerTags.GENERALIZED_TIME)) {
            return parseTime(tlv.value(), true, field);
        }
        throw new IllegalArgumentException(field + " must be UTCTime or GeneralizedTime");
    }

    private static Instant parseTime(byte[] content, boolean generalized, String field) {
        String text = new String(content, StandardCharsets.US_ASCII);
        int expectedLength = generalized ? 15 : 13;
        if (text.length() != expectedLength || text.charAt(expectedLength - 1) != 'Z') {
            throw new IllegalArgumentException(field + " time is not in DER form: " + text);
        }
        for (int i = 0; i < expectedLength - 1; i++) {
            if (text.charAt(i) < '0' || text.charAt(i) > '9') {
                throw new IllegalArgumentException(field + " time contains non-digit: " + text);
            }
        }
        int index = 0;
        int year;
        if (generalized) {
            year = Integer.parseInt(text.substring(0, 4));
            index = 4;
        } else {
            int shortYear = Integer.parseInt(text.substring(0, 2));
            year = shortYear < 50 ? 2000 + shortYear : 1900 + shortYear;
            index = 2;
        }
        int month = Integer.parseInt(text.substring(index, index + 2));
        int day = Integer.parseInt(text.substring(index + 2, index + 4));
        int hour = Integer.parseInt(text.substring(index + 4, index + 6));
        int minute = Integer.parseInt(text.substring(index + 6, index + 8));
        int second = Integer.parseInt(text.substring(index + 8, index + 10));
        try {
            return LocalDateTime.of(year, month, day, hour, minute, second).toInstant(ZoneOffset.UTC);
        } catch (DateTimeException ex) {
            throw new IllegalArgumentException(field + " time is out of range: " + text, ex);
        }
    }

    public static String readIa5String(byte[] content, String field) {
        for (byte b : content) {
            if ((b & 0x80) != 0) {
                throw new IllegalArgumentException(field + " contains non-IA5 characters");
            }
        }
        return new String(content, StandardCharsets.US_ASCII);
    }
}
