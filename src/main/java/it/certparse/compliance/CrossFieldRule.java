package it.certparse.compliance;

import java.util.Optional;

import it.certparse.cert.CertErrorId;
import it.certparse.extension.ExtensionKind;

/**
 * A structural rule spanning more than one certificate field.
 */
public interface CrossFieldRule {

    /**
     * Extension after whose decoding the rule runs; empty to run once every
     * known extension has been decoded.
     */
    Optional<ExtensionKind> trigger();

    CertErrorId errorId();

    /**
     * @return a description of the violation, or empty when the rule holds
     */
    Optional<String> check(CertificateFacts facts);
}
