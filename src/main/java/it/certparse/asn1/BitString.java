package it.certparse.asn1;

import java.util.Arrays;

/**
 * Decoded BIT STRING. Bit 0 is the most significant bit of the first octet.
 */
public final class BitString {

    private final byte[] bytes;
    private final int unusedBits;

    public BitString(byte[] bytes, int unusedBits) {
        if (unusedBits < 0 || unusedBits > 7) {
            throw new IllegalArgumentException("BIT STRING unused bit count out of range: " + unusedBits);
        }
        if (bytes.length == 0 && unusedBits != 0) {
            throw new IllegalArgumentException("Empty BIT STRING must not declare unused bits");
        }
        this.bytes = bytes.clone();
        this.unusedBits = unusedBits;
    }

    public byte[] bytes() {
        return bytes.clone();
    }

    public int unusedBits() {
        return unusedBits;
    }

    public int bitLength() {
        return bytes.length * 8 - unusedBits;
    }

    public boolean isSet(int bit) {
        if (bit < 0 || bit >= bitLength()) {
            return false;
        }
        return (bytes[bit / 8] & (0x80 >> (bit % 8))) != 0;
    }

    public boolean isAllZero() {
        for (byte b : bytes) {
            if (b != 0) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof BitString)) {
            return false;
        }
        BitString other = (BitString) o;
        return unusedBits == other.unusedBits && Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(bytes) + unusedBits;
    }

    @Override
    public String toString() {
        return "BitString[" + bitLength() + " bits]";
    }
}
