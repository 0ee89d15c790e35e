package it.certparse.asn1;

public record BerTlv(int tagClass, boolean constructed, int tagNumber, int headerLength, int length, byte[] value) {

    public BerTlv {
        if (tagClass < 0 || tagClass > 3) {
            throw new IllegalArgumentException("Invalid ASN.1 tag class: " + tagClass);
        }
        if (tagNumber < 0) {
            throw new IllegalArgumentException("Invalid ASN.1 tag number: " + tagNumber);
        }
        if (length < 0) {
            throw new IllegalArgumentException("Invalid ASN.1 length: " + length);
        }
        if (value == null || value.length != length) {
            throw new IllegalArgumentException("ASN.1 value length mismatch");
        }
    }

    public static BerTlv universal(boolean constructed, int tagNumber, byte[] value) {
        return new BerTlv(DerTags.CLASS_UNIVERSAL, constructed, tagNumber, 0, value.length, value);
    }

    public boolean isUniversal() {
        return tagClass == DerTags.CLASS_UNIVERSAL;
    }

    public boolean isContextSpecific() {
        return tagClass == DerTags.CLASS_CONTEXT_SPECIFIC;
    }

    public boolean is(int expectedClass, boolean expectedConstructed, int expectedTagNumber) {
        return tagClass == expectedClass && constructed == expectedConstructed && tagNumber == expectedTagNumber;
    }

    public boolean isSequence() {
        return is(DerTags.CLASS_UNIVERSAL, true, DerTags.SEQUENCE);
    }

    /**
     * Full DER encoding of this element, header included.
     */
    public byte[] encoded() {
        return BerCodec.encode(this);
    }
}
