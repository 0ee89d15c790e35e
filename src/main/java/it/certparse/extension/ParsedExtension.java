package it.certparse.extension;

import java.util.Arrays;
import java.util.Objects;

/**
 * Outer envelope of one certificate extension; {@code value} holds the
 * contents of extnValue, still undecoded.
 */
public record ParsedExtension(String oid, boolean critical, byte[] value) {

    public ParsedExtension {
        if (oid == null || oid.isBlank()) {
            throw new IllegalArgumentException("Extension OID is mandatory");
        }
        value = value == null ? new byte[0] : value.clone();
    }

    @Override
    public byte[] value() {
        return value.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ParsedExtension)) {
            return false;
        }
        ParsedExtension other = (ParsedExtension) o;
        return critical == other.critical && oid.equals(other.oid) && Arrays.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(oid, critical) * 31 + Arrays.hashCode(value);
    }

    @Override
    public String toString() {
        return "ParsedExtension[oid=" + oid + ", critical=" + critical + ", length=" + value.length + "]";
    }
}
