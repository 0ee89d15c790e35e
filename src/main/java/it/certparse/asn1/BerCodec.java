package it.certparse.asn1;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Tag/length/value codec restricted to the Distinguished Encoding Rules:
 * definite lengths only, in their shortest form, and minimal high tag numbers.
 */
public final class BerCodec {

    private BerCodec() {
    }

    public static List<BerTlv> decodeAll(byte[] payload) {
        List<BerTlv> result = new ArrayList<>();
        int offset = 0;
        while (offset < payload.length) {
            BerDecodeResult decoded = decodeAt(payload, offset);
            result.add(decoded.tlv());
            offset += decoded.totalLength();
        }
        return result;
    }

    public static BerTlv decodeSingle(byte[] payload) {
        BerDecodeResult decoded = decodeAt(payload, 0);
        if (decoded.totalLength() != payload.length) {
            throw new IllegalArgumentException("Trailing data after DER TLV");
        }
        return decoded.tlv();
    }

    public static byte[] encode(BerTlv tlv) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        writeTag(out, tlv.tagClass(), tlv.constructed(), tlv.tagNumber());
        writeLength(out, tlv.length());
        out.writeBytes(tlv.value());
        return out.toByteArray();
    }

    private static BerDecodeResult decodeAt(byte[] payload, int offset) {
        if (offset >= payload.length) {
            throw new IllegalArgumentException("Missing DER tag");
        }

        int index = offset;
        int firstTagOctet = payload[index++] & 0xFF;
        int tagClass = (firstTagOctet >> 6) & 0x03;
        boolean constructed = (firstTagOctet & 0x20) != 0;
        int tagNumber = firstTagOctet & 0x1F;
        if (tagNumber == 0x1F) {
            tagNumber = 0;
            boolean first = true;
            while (true) {
                if (index >= payload.length) {
                    throw new IllegalArgumentException("Truncated high-tag-number form");
                }
                int octet = payload[index++] & 0xFF;
                if (first && octet == 0x80) {
                    throw new IllegalArgumentException("High tag number has leading zero octet");
                }
                first = false;
                if (tagNumber > (Integer.MAX_VALUE >> 7)) {
                    throw new IllegalArgumentException("DER tag number too large");
                }
                tagNumber = (tagNumber << 7) | (octet & 0x7F);
                if ((octet & 0x80) == 0) {
                    break;
                }
            }
            if (tagNumber < 0x1F) {
                throw new IllegalArgumentException("High-tag-number form used for low tag number " + tagNumber);
            }
        }

        if (index >= payload.length) {
            throw new IllegalArgumentException("Missing DER length");
        }

        int firstLengthOctet = payload[index++] & 0xFF;
        int valueLength;
        if ((firstLengthOctet & 0x80) == 0) {
            valueLength = firstLengthOctet;
        } else {
            int numberOfLengthOctets = firstLengthOctet & 0x7F;
            if (numberOfLengthOctets == 0) {
                throw new IllegalArgumentException("Indefinite length is not allowed in DER");
            }
            if (numberOfLengthOctets > 4) {
                throw new IllegalArgumentException("DER length too large");
            }
            if (index + numberOfLengthOctets > payload.length) {
                throw new IllegalArgumentException("Truncated DER length");
            }
            if (payload[index] == 0) {
                throw new IllegalArgumentException("DER length has leading zero octet");
            }
            valueLength = 0;
            for (int i = 0; i < numberOfLengthOctets; i++) {
                valueLength = (valueLength << 8) | (payload[index++] & 0xFF);
            }
            if (valueLength >= 0 && valueLength < 128) {
                throw new IllegalArgumentException("DER length " + valueLength + " must use the short form");
            }
        }

        if (valueLength < 0 || valueLength > payload.length - index) {
            throw new IllegalArgumentException("DER value length exceeds available bytes");
        }

        byte[] value = Arrays.copyOfRange(payload, index, index + valueLength);
        int headerLength = index - offset;
        int totalLength = headerLength + valueLength;
        return new BerDecodeResult(new BerTlv(tagClass, constructed, tagNumber, headerLength, valueLength, value), totalLength);
    }

    private static void writeTag(ByteArrayOutputStream out, int tagClass, boolean constructed, int tagNumber) {
        int firstOctet = (tagClass & 0x03) << 6;
        if (constructed) {
            firstOctet |= 0x20;
        }
        if (tagNumber < 31) {
            out.write(firstOctet | tagNumber);
            return;
        }

        out.write(firstOctet | 0x1F);
        int[] chunks = new int[6];
        int chunkCount = 0;
        int number = tagNumber;
        do {
            chunks[chunkCount++] = number & 0x7F;
            number >>= 7;
        } while (number > 0);

        for (int i = chunkCount - 1; i >= 0; i--) {
            int octet = chunks[i];
            if (i != 0) {
                octet |= 0x80;
            }
            out.write(octet);
        }
    }

    private static void writeLength(ByteArrayOutputStream out, int length) {
        if (length < 128) {
            out.write(length);
            return;
        }

        int temp = length;
        int bytes = 0;
        byte[] lengthBuffer = new byte[4];
        while (temp > 0) {
            lengthBuffer[bytes++] = (byte) (temp & 0xFF);
            temp >>= 8;
        }
        out.write(0x80 | bytes);
        for (int i = bytes - 1; i >= 0; i--) {
            out.write(lengthBuffer[i]);
        }
    }

    private record BerDecodeResult(BerTlv tlv, int totalLength) {
    }
}
