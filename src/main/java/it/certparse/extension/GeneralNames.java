package it.certparse.extension;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import it.certparse.asn1.BerCodec;
import it.certparse.asn1.BerTlv;
import it.certparse.asn1.DerTags;
import it.certparse.asn1.DerValues;

/**
 * Decoded GeneralNames, grouped by CHOICE arm.
 *
 * <pre>
 * GeneralNames ::= SEQUENCE SIZE (1..MAX) OF GeneralName
 *
 * GeneralName ::= CHOICE {
 *      otherName                       [0]     OtherName,
 *      rfc822Name                      [1]     IA5String,
 *      dNSName                         [2]     IA5String,
 *      x400Address                     [3]     ORAddress,
 *      directoryName                   [4]     Name,
 *      ediPartyName                    [5]     EDIPartyName,
 *      uniformResourceIdentifier       [6]     IA5String,
 *      iPAddress                       [7]     OCTET STRING,
 *      registeredID                    [8]     OBJECT IDENTIFIER }
 * </pre>
 *
 * Arms that are not interpreted (otherName, x400Address, ediPartyName) keep
 * their content octets. Directory names keep the value of the Name SEQUENCE.
 * Repeated names are not rejected.
 */
public final class GeneralNames implements CertificateExtension {

    /**
     * How iPAddress entries are read: as plain addresses (subjectAltName) or
     * as address and mask pairs (name constraints).
     */
    public enum Usage {
        SUBJECT_ALT_NAME,
        NAME_CONSTRAINTS
    }

    private final Set<GeneralNameType> presentTypes;
    private final List<byte[]> otherNames;
    private final List<String> rfc822Names;
    private final List<String> dnsNames;
    private final List<byte[]> x400Addresses;
    private final List<byte[]> directoryNames;
    private final List<byte[]> ediPartyNames;
    private final List<String> uniformResourceIdentifiers;
    private final List<byte[]> ipAddresses;
    private final List<IpAddressRange> ipAddressRanges;
    private final List<String> registeredIds;

    private GeneralNames(Builder builder) {
        this.presentTypes = Collections.unmodifiableSet(EnumSet.copyOf(builder.presentTypes));
        this.otherNames = List.copyOf(builder.otherNames);
        this.rfc822Names = List.copyOf(builder.rfc822Names);
        this.dnsNames = List.copyOf(builder.dnsNames);
        this.x400Addresses = List.copyOf(builder.x400Addresses);
        this.directoryNames = List.copyOf(builder.directoryNames);
        this.ediPartyNames = List.copyOf(builder.ediPartyNames);
        this.uniformResourceIdentifiers = List.copyOf(builder.uniformResourceIdentifiers);
        this.ipAddresses = List.copyOf(builder.ipAddresses);
        this.ipAddressRanges = List.copyOf(builder.ipAddressRanges);
        this.registeredIds = List.copyOf(builder.registeredIds);
    }

    /**
     * Parses a complete GeneralNames SEQUENCE, as carried by subjectAltName.
     */
    public static GeneralNames parse(byte[] generalNamesTlv) {
        return fromElements(DerValues.nonEmptySequence(generalNamesTlv, "GeneralNames"), Usage.SUBJECT_ALT_NAME);
    }

    /**
     * Builds GeneralNames from already separated GeneralName elements, for
     * implicitly tagged occurrences such as authorityCertIssuer.
     */
    static GeneralNames fromElements(List<BerTlv> elements, Usage usage) {
        if (elements.isEmpty()) {
            throw new IllegalArgumentException("GeneralNames must contain at least one name");
        }
        Builder builder = new Builder();
        for (BerTlv element : elements) {
            builder.add(element, usage);
        }
        return builder.build();
    }

    public Set<GeneralNameType> presentTypes() {
        return presentTypes;
    }

    public boolean has(GeneralNameType type) {
        return presentTypes.contains(type);
    }

    public List<byte[]> otherNames() {
        return copies(otherNames);
    }

    public List<String> rfc822Names() {
        return rfc822Names;
    }

    public List<String> dnsNames() {
        return dnsNames;
    }

    public List<byte[]> x400Addresses() {
        return copies(x400Addresses);
    }

    public List<byte[]> directoryNames() {
        return copies(directoryNames);
    }

    public List<byte[]> ediPartyNames() {
        return copies(ediPartyNames);
    }

    public List<String> uniformResourceIdentifiers() {
        return uniformResourceIdentifiers;
    }

    public List<byte[]> ipAddresses() {
        return copies(ipAddresses);
    }

    public List<IpAddressRange> ipAddressRanges() {
        return ipAddressRanges;
    }

    public List<String> registeredIds() {
        return registeredIds;
    }

    @Override
    public ExtensionKind kind() {
        return ExtensionKind.SUBJECT_ALT_NAME;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof GeneralNames)) {
            return false;
        }
        GeneralNames other = (GeneralNames) o;
        return presentTypes.equals(other.presentTypes)
            && sameBytes(otherNames, other.otherNames)
            && rfc822Names.equals(other.rfc822Names)
            && dnsNames.equals(other.dnsNames)
            && sameBytes(x400Addresses, other.x400Addresses)
            && sameBytes(directoryNames, other.directoryNames)
            && sameBytes(ediPartyNames, other.ediPartyNames)
            && uniformResourceIdentifiers.equals(other.uniformResourceIdentifiers)
            && sameBytes(ipAddresses, other.ipAddresses)
            && ipAddressRanges.equals(other.ipAddressRanges)
            && registeredIds.equals(other.registeredIds);
    }

    @Override
    public int hashCode() {
        return presentTypes.hashCode() * 31 + dnsNames.hashCode();
    }

    @Override
    public String toString() {
        return "GeneralNames" + presentTypes;
    }

    private static List<byte[]> copies(List<byte[]> values) {
        List<byte[]> result = new ArrayList<>(values.size());
        for (byte[] value : values) {
            result.add(value.clone());
        }
        return Collections.unmodifiableList(result);
    }

    private static boolean sameBytes(List<byte[]> left, List<byte[]> right) {
        if (left.size() != right.size()) {
            return false;
        }
        for (int i = 0; i < left.size(); i++) {
            if (!Arrays.equals(left.get(i), right.get(i))) {
                return false;
            }
        }
        return true;
    }

    private static final class Builder {
        private final Set<GeneralNameType> presentTypes = EnumSet.noneOf(GeneralNameType.class);
        private final List<byte[]> otherNames = new ArrayList<>();
        private final List<String> rfc822Names = new ArrayList<>();
        private final List<String> dnsNames = new ArrayList<>();
        private final List<byte[]> x400Addresses = new ArrayList<>();
        private final List<byte[]> directoryNames = new ArrayList<>();
        private final List<byte[]> ediPartyNames = new ArrayList<>();
        private final List<String> uniformResourceIdentifiers = new ArrayList<>();
        private final List<byte[]> ipAddresses = new ArrayList<>();
        private final List<IpAddressRange> ipAddressRanges = new ArrayList<>();
        private final List<String> registeredIds = new ArrayList<>();

        void add(BerTlv element, Usage usage) {
            if (!element.isContextSpecific()) {
                throw new IllegalArgumentException("GeneralName must be context specific");
            }
            GeneralNameType type = GeneralNameType.forTag(element.tagNumber());
            byte[] value = element.value();
            switch (type) {
                case OTHER_NAME -> {
                    requireConstructed(element, true, type);
                    List<BerTlv> fields = BerCodec.decodeAll(value);
                    if (fields.size() != 2) {
                        throw new IllegalArgumentException("otherName must hold type-id and value");
                    }
                    DerValues.readOid(fields.get(0), "otherName type-id");
                    DerValues.require(fields.get(1), DerTags.CLASS_CONTEXT_SPECIFIC, true, 0, "otherName value");
                    otherNames.add(value);
                }
                case RFC822_NAME -> {
                    requireConstructed(element, false, type);
                    rfc822Names.add(DerValues.readIa5String(value, "rfc822Name"));
                }
                case DNS_NAME -> {
                    requireConstructed(element, false, type);
                    dnsNames.add(DerValues.readIa5String(value, "dNSName"));
                }
                case X400_ADDRESS -> {
                    requireConstructed(element, true, type);
                    x400Addresses.add(value);
                }
                case DIRECTORY_NAME -> {
                    requireConstructed(element, true, type);
                    BerTlv name = BerCodec.decodeSingle(value);
                    if (!name.isSequence()) {
                        throw new IllegalArgumentException("directoryName is not a Name SEQUENCE");
                    }
                    directoryNames.add(name.value());
                }
                case EDI_PARTY_NAME -> {
                    requireConstructed(element, true, type);
                    ediPartyNames.add(value);
                }
                case UNIFORM_RESOURCE_IDENTIFIER -> {
                    requireConstructed(element, false, type);
                    uniformResourceIdentifiers.add(DerValues.readIa5String(value, "uniformResourceIdentifier"));
                }
                case IP_ADDRESS -> {
                    requireConstructed(element, false, type);
                    if (usage == Usage.NAME_CONSTRAINTS) {
                        ipAddressRanges.add(IpAddressRange.parse(value));
                    } else {
                        if (value.length != 4 && value.length != 16) {
                            throw new IllegalArgumentException("iPAddress must be 4 or 16 octets, found " + value.length);
                        }
                        ipAddresses.add(value);
                    }
                }
                case REGISTERED_ID -> {
                    requireConstructed(element, false, type);
                    registeredIds.add(DerValues.decodeOid(value));
                }
                default -> throw new IllegalArgumentException("Unsupported GeneralName " + type);
            }
            presentTypes.add(type);
        }

        GeneralNames build() {
            return new GeneralNames(this);
        }

        private static void requireConstructed(BerTlv element, boolean constructed, GeneralNameType type) {
            if (element.constructed() != constructed) {
                throw new IllegalArgumentException(type + " has wrong constructed bit");
            }
        }
    }
}
