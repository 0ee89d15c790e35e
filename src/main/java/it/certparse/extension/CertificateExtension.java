package it.certparse.extension;

/**
 * Decoded value of one of the extensions this library understands.
 */
public sealed interface CertificateExtension permits
    BasicConstraints,
    KeyUsage,
    ExtendedKeyUsage,
    GeneralNames,
    NameConstraints,
    AuthorityInfoAccess,
    CertificatePolicies,
    PolicyConstraints,
    PolicyMappings,
    InhibitAnyPolicy,
    SubjectKeyIdentifier,
    AuthorityKeyIdentifier {

    ExtensionKind kind();
}
