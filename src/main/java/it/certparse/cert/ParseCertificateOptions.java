package it.certparse.cert;

/**
 * Decoder strictness settings, fixed for the duration of a parse.
 *
 * @param allowInvalidSerialNumbers accept serial numbers longer than 20 octets
 * @param rejectUnknownCriticalExtensions fail on critical extensions this decoder does not understand
 * @param allowExplicitDefaultValues accept an explicitly encoded v1 version and explicit FALSE criticality
 */
public record ParseCertificateOptions(
    boolean allowInvalidSerialNumbers,
    boolean rejectUnknownCriticalExtensions,
    boolean allowExplicitDefaultValues
) {

    public static ParseCertificateOptions defaults() {
        return new ParseCertificateOptions(false, false, false);
    }
}
