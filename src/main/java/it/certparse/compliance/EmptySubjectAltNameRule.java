package it.certparse.compliance;

import java.util.Optional;

import it.certparse.cert.CertErrorId;
import it.certparse.extension.ExtensionKind;

/**
 * RFC 5280 section 4.1.2.6: when subject naming information lives only in
 * subjectAltName, the subject is an empty sequence and subjectAltName must be
 * critical. A certificate with an empty subject and no subjectAltName is not
 * rejected here.
 */
public final class EmptySubjectAltNameRule implements CrossFieldRule {

    @Override
    public Optional<ExtensionKind> trigger() {
        return Optional.of(ExtensionKind.SUBJECT_ALT_NAME);
    }

    @Override
    public CertErrorId errorId() {
        return CertErrorId.SUBJECT_ALT_NAME_NOT_CRITICAL;
    }

    @Override
    public Optional<String> check(CertificateFacts facts) {
        if (!facts.hasEmptySubject()) {
            return Optional.empty();
        }
        return facts.extension(ExtensionKind.SUBJECT_ALT_NAME)
            .filter(extension -> !extension.critical())
            .map(extension -> "subject is empty but subjectAltName is not marked critical");
    }
}
