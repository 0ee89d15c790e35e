package it.certparse.extension;

import java.util.EnumSet;
import java.util.Set;

import it.certparse.asn1.BerCodec;
import it.certparse.asn1.BitString;
import it.certparse.asn1.DerValues;

/**
 * KeyUsage ::= BIT STRING. When present at least one bit must be set.
 */
public record KeyUsage(BitString bits) implements CertificateExtension {

    public static KeyUsage parse(byte[] value) {
        BitString bits = DerValues.readBitString(BerCodec.decodeSingle(value), "KeyUsage");
        if (bits.bitLength() == 0 || bits.isAllZero()) {
            throw new IllegalArgumentException("KeyUsage must assert at least one bit");
        }
        return new KeyUsage(bits);
    }

    public boolean has(KeyUsageBit bit) {
        return bits.isSet(bit.ordinal());
    }

    public Set<KeyUsageBit> asserted() {
        Set<KeyUsageBit> asserted = EnumSet.noneOf(KeyUsageBit.class);
        for (KeyUsageBit bit : KeyUsageBit.values()) {
            if (has(bit)) {
                asserted.add(bit);
            }
        }
        return asserted;
    }

    @Override
    public ExtensionKind kind() {
        return ExtensionKind.KEY_USAGE;
    }
}
