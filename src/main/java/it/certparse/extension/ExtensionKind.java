package it.certparse.extension;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The extensions decoded into typed values, in the order they are processed.
 */
public enum ExtensionKind {

    BASIC_CONSTRAINTS("2.5.29.19", BasicConstraints.class, ext -> BasicConstraints.parse(ext.value())),
    KEY_USAGE("2.5.29.15", KeyUsage.class, ext -> KeyUsage.parse(ext.value())),
    EXTENDED_KEY_USAGE("2.5.29.37", ExtendedKeyUsage.class, ext -> ExtendedKeyUsage.parse(ext.value())),
    SUBJECT_ALT_NAME("2.5.29.17", GeneralNames.class, ext -> GeneralNames.parse(ext.value())),
    NAME_CONSTRAINTS("2.5.29.30", NameConstraints.class, ext -> NameConstraints.parse(ext.value(), ext.critical())),
    AUTHORITY_INFO_ACCESS("1.3.6.1.5.5.7.1.1", AuthorityInfoAccess.class, ext -> AuthorityInfoAccess.parse(ext.value())),
    CERTIFICATE_POLICIES("2.5.29.32", CertificatePolicies.class, ext -> CertificatePolicies.parse(ext.value())),
    POLICY_CONSTRAINTS("2.5.29.36", PolicyConstraints.class, ext -> PolicyConstraints.parse(ext.value())),
    POLICY_MAPPINGS("2.5.29.33", PolicyMappings.class, ext -> PolicyMappings.parse(ext.value())),
    INHIBIT_ANY_POLICY("2.5.29.54", InhibitAnyPolicy.class, ext -> InhibitAnyPolicy.parse(ext.value())),
    SUBJECT_KEY_IDENTIFIER("2.5.29.14", SubjectKeyIdentifier.class, ext -> SubjectKeyIdentifier.parse(ext.value())),
    AUTHORITY_KEY_IDENTIFIER("2.5.29.35", AuthorityKeyIdentifier.class, ext -> AuthorityKeyIdentifier.parse(ext.value()));

    private static final Map<String, ExtensionKind> BY_OID = Arrays.stream(values())
        .collect(Collectors.toUnmodifiableMap(ExtensionKind::oid, Function.identity()));

    private final String oid;
    private final Class<? extends CertificateExtension> type;
    private final Function<ParsedExtension, CertificateExtension> decoder;

    ExtensionKind(String oid, Class<? extends CertificateExtension> type, Function<ParsedExtension, CertificateExtension> decoder) {
        this.oid = oid;
        this.type = type;
        this.decoder = decoder;
    }

    public String oid() {
        return oid;
    }

    public Class<? extends CertificateExtension> type() {
        return type;
    }

    /**
     * Decodes the extension value; throws {@link IllegalArgumentException} if it is malformed.
     */
    public CertificateExtension decode(ParsedExtension extension) {
        if (!oid.equals(extension.oid())) {
            throw new IllegalArgumentException("Extension " + extension.oid() + " is not " + name());
        }
        return decoder.apply(extension);
    }

    public static Optional<ExtensionKind> forOid(String oid) {
        return Optional.ofNullable(BY_OID.get(oid));
    }
}
