package it.certparse.compliance;

import java.util.Optional;

import it.certparse.cert.CertErrorId;
import it.certparse.extension.ExtensionKind;
import it.certparse.extension.ParsedExtension;

/**
 * Rejects critical extensions that no {@link ExtensionKind} decodes. Enabled
 * through {@code ParseCertificateOptions.rejectUnknownCriticalExtensions}.
 */
public final class UnknownCriticalExtensionRule implements CrossFieldRule {

    @Override
    public Optional<ExtensionKind> trigger() {
        return Optional.empty();
    }

    @Override
    public CertErrorId errorId() {
        return CertErrorId.UNCONSUMED_CRITICAL_EXTENSION;
    }

    @Override
    public Optional<String> check(CertificateFacts facts) {
        return facts.extensions().values().stream()
            .filter(ParsedExtension::critical)
            .map(ParsedExtension::oid)
            .filter(oid -> ExtensionKind.forOid(oid).isEmpty())
            .findFirst()
            .map(oid -> "critical extension " + oid + " is not understood");
    }
}
