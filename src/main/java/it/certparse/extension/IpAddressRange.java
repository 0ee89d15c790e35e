package it.certparse.extension;

import java.util.Arrays;

/**
 * An iPAddress entry of a name constraints subtree: address plus contiguous netmask.
 */
public final class IpAddressRange {

    private final byte[] address;
    private final byte[] mask;
    private final int prefixLength;

    IpAddressRange(byte[] address, byte[] mask, int prefixLength) {
        this.address = address.clone();
        this.mask = mask.clone();
        this.prefixLength = prefixLength;
    }

    static IpAddressRange parse(byte[] value) {
        if (value.length != 8 && value.length != 32) {
            throw new IllegalArgumentException("Name constraint iPAddress must be 8 or 32 octets, found " + value.length);
        }
        int half = value.length / 2;
        byte[] address = Arrays.copyOfRange(value, 0, half);
        byte[] mask = Arrays.copyOfRange(value, half, value.length);
        return new IpAddressRange(address, mask, prefixLength(mask));
    }

    private static int prefixLength(byte[] mask) {
        int prefix = 0;
        boolean sawZero = false;
        for (byte b : mask) {
            for (int bit = 7; bit >= 0; bit--) {
                boolean set = ((b >> bit) & 1) != 0;
                if (set && sawZero) {
                    throw new IllegalArgumentException("iPAddress netmask is not contiguous");
                }
                if (set) {
                    prefix++;
                } else {
                    sawZero = true;
                }
            }
        }
        return prefix;
    }

    public byte[] address() {
        return address.clone();
    }

    public byte[] mask() {
        return mask.clone();
    }

    public int prefixLength() {
        return prefixLength;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof IpAddressRange)) {
            return false;
        }
        IpAddressRange other = (IpAddressRange) o;
        return Arrays.equals(address, other.address) && Arrays.equals(mask, other.mask);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(address) + Arrays.hashCode(mask);
    }
}
