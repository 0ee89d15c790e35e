package it.certparse.cert;

/**
 * Stable identifiers for every reason a certificate can be rejected.
 */
public enum CertErrorId {

    FAILED_PARSING_CERTIFICATE("Failed parsing Certificate"),
    FAILED_PARSING_TBS_CERTIFICATE("Failed parsing TBSCertificate"),
    FAILED_PARSING_SIGNATURE_ALGORITHM("Failed parsing SignatureAlgorithm"),
    FAILED_READING_ISSUER_OR_SUBJECT("Failed reading issuer or subject"),
    FAILED_NORMALIZING_SUBJECT("Failed normalizing subject"),
    FAILED_NORMALIZING_ISSUER("Failed normalizing issuer"),
    FAILED_PARSING_EXTENSIONS("Failed parsing extensions"),
    FAILED_PARSING_BASIC_CONSTRAINTS("Failed parsing basic constraints"),
    FAILED_PARSING_KEY_USAGE("Failed parsing key usage"),
    FAILED_PARSING_EKU("Failed parsing extended key usage"),
    FAILED_PARSING_SUBJECT_ALT_NAME("Failed parsing subjectAltName"),
    SUBJECT_ALT_NAME_NOT_CRITICAL("Empty subject and subjectAltName is not critical"),
    FAILED_PARSING_NAME_CONSTRAINTS("Failed parsing name constraints"),
    FAILED_PARSING_AIA("Failed parsing authority info access"),
    FAILED_PARSING_POLICIES("Failed parsing certificate policies"),
    FAILED_PARSING_POLICY_CONSTRAINTS("Failed parsing policy constraints"),
    FAILED_PARSING_POLICY_MAPPINGS("Failed parsing policy mappings"),
    FAILED_PARSING_INHIBIT_ANY_POLICY("Failed parsing inhibit any policy"),
    FAILED_PARSING_SUBJECT_KEY_IDENTIFIER("Failed parsing subject key identifier"),
    FAILED_PARSING_AUTHORITY_KEY_IDENTIFIER("Failed parsing authority key identifier"),
    UNCONSUMED_CRITICAL_EXTENSION("Unconsumed critical extension");

    private final String description;

    CertErrorId(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
