package it.certparse.compliance;

import java.util.Map;
import java.util.Optional;

import it.certparse.extension.ExtensionKind;
import it.certparse.extension.ParsedExtension;

/**
 * What the cross-field rules get to see of a certificate being decoded.
 *
 * @param subjectValue contents of the subject Name SEQUENCE
 * @param extensions extension table, empty when the certificate has none
 */
public record CertificateFacts(byte[] subjectValue, Map<String, ParsedExtension> extensions) {

    public boolean hasEmptySubject() {
        return subjectValue.length == 0;
    }

    public Optional<ParsedExtension> extension(ExtensionKind kind) {
        return Optional.ofNullable(extensions.get(kind.oid()));
    }
}
