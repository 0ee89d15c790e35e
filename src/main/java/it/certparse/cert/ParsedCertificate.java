package it.certparse.cert;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import it.certparse.asn1.BerCodec;
import it.certparse.asn1.BerTlv;
import it.certparse.asn1.BitString;
import it.certparse.compliance.CertificateFacts;
import it.certparse.compliance.CrossFieldRule;
import it.certparse.compliance.EmptySubjectAltNameRule;
import it.certparse.compliance.UnknownCriticalExtensionRule;
import it.certparse.extension.AuthorityInfoAccess;
import it.certparse.extension.AuthorityKeyIdentifier;
import it.certparse.extension.BasicConstraints;
import it.certparse.extension.CertificateExtension;
import it.certparse.extension.CertificatePolicies;
import it.certparse.extension.ExtendedKeyUsage;
import it.certparse.extension.ExtensionKind;
import it.certparse.extension.GeneralNames;
import it.certparse.extension.InhibitAnyPolicy;
import it.certparse.extension.KeyUsage;
import it.certparse.extension.NameConstraints;
import it.certparse.extension.ParsedExtension;
import it.certparse.extension.PolicyConstraints;
import it.certparse.extension.PolicyMappings;
import it.certparse.extension.SubjectKeyIdentifier;
import it.certparse.name.NameNormalizer;

/**
 * An X.509 certificate decoded from DER and checked for structural validity.
 * Instances are immutable and may be shared freely between threads.
 */
public final class ParsedCertificate {

    private static final Logger logger = LoggerFactory.getLogger(ParsedCertificate.class);

    private final byte[] derCertificate;
    private final ParsedTbsCertificate tbs;
    private final byte[] signatureAlgorithmTlv;
    private final SignatureAlgorithm signatureAlgorithm;
    private final BitString signatureValue;
    private final byte[] normalizedSubject;
    private final byte[] normalizedIssuer;
    private final Map<String, ParsedExtension> extensions;
    private final Map<ExtensionKind, CertificateExtension> decodedExtensions;

    private ParsedCertificate(
        byte[] derCertificate,
        ParsedTbsCertificate tbs,
        byte[] signatureAlgorithmTlv,
        SignatureAlgorithm signatureAlgorithm,
        BitString signatureValue,
        byte[] normalizedSubject,
        byte[] normalizedIssuer,
        Map<String, ParsedExtension> extensions,
        Map<ExtensionKind, CertificateExtension> decodedExtensions
    ) {
        this.derCertificate = derCertificate;
        this.tbs = tbs;
        this.signatureAlgorithmTlv = signatureAlgorithmTlv;
        this.signatureAlgorithm = signatureAlgorithm;
        this.signatureValue = signatureValue;
        this.normalizedSubject = normalizedSubject;
        this.normalizedIssuer = normalizedIssuer;
        this.extensions = extensions;
        this.decodedExtensions = decodedExtensions;
    }

    /**
     * Decodes one DER certificate.
     *
     * @param errors receives one entry naming the first fault on failure; may be null
     * @return the certificate, or empty if it is structurally invalid
     */
    public static Optional<ParsedCertificate> create(byte[] der, ParseCertificateOptions options, CertErrors errors) {
        CertErrors sink = errors != null ? errors : new CertErrors();
        try {
            return Optional.of(decode(der.clone(), options));
        } catch (CertificateParseException ex) {
            CertError error = ex.errors().get(0);
            sink.add(error.id(), error.detail());
            logger.debug("Rejected certificate: {}", error);
            return Optional.empty();
        }
    }

    /**
     * Decodes one certificate and appends it to {@code chain} only on success.
     */
    public static boolean createAndAddToList(
        byte[] der,
        ParseCertificateOptions options,
        List<ParsedCertificate> chain,
        CertErrors errors
    ) {
        Optional<ParsedCertificate> certificate = create(der, options, errors);
        certificate.ifPresent(chain::add);
        return certificate.isPresent();
    }

    private static ParsedCertificate decode(byte[] der, ParseCertificateOptions options) {
        CertificateEnvelope envelope = step(CertErrorId.FAILED_PARSING_CERTIFICATE,
            () -> TbsCertificateParser.parseCertificate(der));

        ParsedTbsCertificate tbs = step(CertErrorId.FAILED_PARSING_TBS_CERTIFICATE,
            () -> TbsCertificateParser.parseTbsCertificate(envelope.tbsCertificateTlv(), options));

        SignatureAlgorithm signatureAlgorithm = step(CertErrorId.FAILED_PARSING_SIGNATURE_ALGORITHM,
            () -> SignatureAlgorithm.parse(envelope.signatureAlgorithmTlv()));

        byte[] subjectValue = step(CertErrorId.FAILED_READING_ISSUER_OR_SUBJECT, () -> sequenceValue(tbs.subjectTlv()));
        byte[] normalizedSubject = step(CertErrorId.FAILED_NORMALIZING_SUBJECT, () -> NameNormalizer.normalize(subjectValue));
        byte[] issuerValue = step(CertErrorId.FAILED_READING_ISSUER_OR_SUBJECT, () -> sequenceValue(tbs.issuerTlv()));
        byte[] normalizedIssuer = step(CertErrorId.FAILED_NORMALIZING_ISSUER, () -> NameNormalizer.normalize(issuerValue));

        Map<String, ParsedExtension> extensions = Map.of();
        Map<ExtensionKind, CertificateExtension> decoded = new EnumMap<>(ExtensionKind.class);
        Optional<byte[]> extensionsTlv = tbs.extensionsTlv();
        if (extensionsTlv.isPresent()) {
            extensions = step(CertErrorId.FAILED_PARSING_EXTENSIONS,
                () -> ExtensionTableBuilder.build(extensionsTlv.get(), options));
            CertificateFacts facts = new CertificateFacts(subjectValue, extensions);
            List<CrossFieldRule> rules = rulesFor(options);

            for (ExtensionKind kind : ExtensionKind.values()) {
                ParsedExtension extension = extensions.get(kind.oid());
                if (extension == null) {
                    continue;
                }
                decoded.put(kind, step(errorIdFor(kind), () -> kind.decode(extension)));
                for (CrossFieldRule rule : rules) {
                    if (rule.trigger().filter(kind::equals).isPresent()) {
                        enforce(rule, facts);
                    }
                }
            }
            for (CrossFieldRule rule : rules) {
                if (rule.trigger().isEmpty()) {
                    enforce(rule, facts);
                }
            }
        }

        return new ParsedCertificate(
            der,
            tbs,
            envelope.signatureAlgorithmTlv(),
            signatureAlgorithm,
            envelope.signatureValue(),
            normalizedSubject,
            normalizedIssuer,
            extensions,
            Collections.unmodifiableMap(decoded)
        );
    }

    static List<CrossFieldRule> rulesFor(ParseCertificateOptions options) {
        List<CrossFieldRule> rules = new ArrayList<>();
        rules.add(new EmptySubjectAltNameRule());
        if (options.rejectUnknownCriticalExtensions()) {
            rules.add(new UnknownCriticalExtensionRule());
        }
        return rules;
    }

    static CertErrorId errorIdFor(ExtensionKind kind) {
        return switch (kind) {
            case BASIC_CONSTRAINTS -> CertErrorId.FAILED_PARSING_BASIC_CONSTRAINTS;
            case KEY_USAGE -> CertErrorId.FAILED_PARSING_KEY_USAGE;
            case EXTENDED_KEY_USAGE -> CertErrorId.FAILED_PARSING_EKU;
            case SUBJECT_ALT_NAME -> CertErrorId.FAILED_PARSING_SUBJECT_ALT_NAME;
            case NAME_CONSTRAINTS -> CertErrorId.FAILED_PARSING_NAME_CONSTRAINTS;
            case AUTHORITY_INFO_ACCESS -> CertErrorId.FAILED_PARSING_AIA;
            case CERTIFICATE_POLICIES -> CertErrorId.FAILED_PARSING_POLICIES;
            case POLICY_CONSTRAINTS -> CertErrorId.FAILED_PARSING_POLICY_CONSTRAINTS;
            case POLICY_MAPPINGS -> CertErrorId.FAILED_PARSING_POLICY_MAPPINGS;
            case INHIBIT_ANY_POLICY -> CertErrorId.FAILED_PARSING_INHIBIT_ANY_POLICY;
            case SUBJECT_KEY_IDENTIFIER -> CertErrorId.FAILED_PARSING_SUBJECT_KEY_IDENTIFIER;
            case AUTHORITY_KEY_IDENTIFIER -> CertErrorId.FAILED_PARSING_AUTHORITY_KEY_IDENTIFIER;
        };
    }

    private static void enforce(CrossFieldRule rule, CertificateFacts facts) {
        Optional<String> violation = rule.check(facts);
        if (violation.isPresent()) {
            throw new CertificateParseException(rule.errorId(), violation.get(), null);
        }
    }

    private static <T> T step(CertErrorId errorId, Supplier<T> action) {
        try {
            return action.get();
        } catch (IllegalArgumentException ex) {
            throw new CertificateParseException(errorId, ex.getMessage(), ex);
        }
    }

    /**
     * Contents of a TLV that must be a single SEQUENCE with nothing after it.
     */
    private static byte[] sequenceValue(byte[] tlv) {
        BerTlv sequence = BerCodec.decodeSingle(tlv);
        if (!sequence.isSequence()) {
            throw new IllegalArgumentException("Name is not a SEQUENCE");
        }
        return sequence.value();
    }

    /**
     * Looks up an extension by dotted OID. Absent when the certificate has no
     * such extension or no extensions at all.
     */
    public Optional<ParsedExtension> getExtension(String oid) {
        if (!tbs.hasExtensions()) {
            return Optional.empty();
        }
        return Optional.ofNullable(extensions.get(oid));
    }

    public Optional<ParsedExtension> getExtension(ExtensionKind kind) {
        return getExtension(kind.oid());
    }

    public byte[] derCertificate() {
        return derCertificate.clone();
    }

    public ParsedTbsCertificate tbs() {
        return tbs;
    }

    public byte[] signatureAlgorithmTlv() {
        return signatureAlgorithmTlv.clone();
    }

    public SignatureAlgorithm signatureAlgorithm() {
        return signatureAlgorithm;
    }

    public BitString signatureValue() {
        return signatureValue;
    }

    public byte[] normalizedSubject() {
        return normalizedSubject.clone();
    }

    public byte[] normalizedIssuer() {
        return normalizedIssuer.clone();
    }

    public Map<String, ParsedExtension> extensions() {
        return extensions;
    }

    public Map<ExtensionKind, CertificateExtension> decodedExtensions() {
        return decodedExtensions;
    }

    public Optional<BasicConstraints> basicConstraints() {
        return decoded(ExtensionKind.BASIC_CONSTRAINTS, BasicConstraints.class);
    }

    public Optional<KeyUsage> keyUsage() {
        return decoded(ExtensionKind.KEY_USAGE, KeyUsage.class);
    }

    public Optional<ExtendedKeyUsage> extendedKeyUsage() {
        return decoded(ExtensionKind.EXTENDED_KEY_USAGE, ExtendedKeyUsage.class);
    }

    public Optional<GeneralNames> subjectAltNames() {
        return decoded(ExtensionKind.SUBJECT_ALT_NAME, GeneralNames.class);
    }

    public Optional<ParsedExtension> subjectAltNamesExtension() {
        return getExtension(ExtensionKind.SUBJECT_ALT_NAME);
    }

    public Optional<NameConstraints> nameConstraints() {
        return decoded(ExtensionKind.NAME_CONSTRAINTS, NameConstraints.class);
    }

    public Optional<AuthorityInfoAccess> authorityInfoAccess() {
        return decoded(ExtensionKind.AUTHORITY_INFO_ACCESS, AuthorityInfoAccess.class);
    }

    public Optional<ParsedExtension> authorityInfoAccessExtension() {
        return getExtension(ExtensionKind.AUTHORITY_INFO_ACCESS);
    }

    public Optional<CertificatePolicies> certificatePolicies() {
        return decoded(ExtensionKind.CERTIFICATE_POLICIES, CertificatePolicies.class);
    }

    public Optional<PolicyConstraints> policyConstraints() {
        return decoded(ExtensionKind.POLICY_CONSTRAINTS, PolicyConstraints.class);
    }

    public Optional<PolicyMappings> policyMappings() {
        return decoded(ExtensionKind.POLICY_MAPPINGS, PolicyMappings.class);
    }

    public Optional<InhibitAnyPolicy> inhibitAnyPolicy() {
        return decoded(ExtensionKind.INHIBIT_ANY_POLICY, InhibitAnyPolicy.class);
    }

    public Optional<SubjectKeyIdentifier> subjectKeyIdentifier() {
        return decoded(ExtensionKind.SUBJECT_KEY_IDENTIFIER, SubjectKeyIdentifier.class);
    }

    public Optional<AuthorityKeyIdentifier> authorityKeyIdentifier() {
        return decoded(ExtensionKind.AUTHORITY_KEY_IDENTIFIER, AuthorityKeyIdentifier.class);
    }

    private <T extends CertificateExtension> Optional<T> decoded(ExtensionKind kind, Class<T> type) {
        return Optional.ofNullable(decodedExtensions.get(kind)).map(type::cast);
    }
}
