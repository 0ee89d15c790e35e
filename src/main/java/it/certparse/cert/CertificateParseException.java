package it.certparse.cert;

import java.util.List;

/**
 * Raised when a certificate is rejected. Carries the identifier of the first
 * structural fault and the error trail recorded for the parse.
 */
public class CertificateParseException extends RuntimeException {

    private final CertErrorId errorId;
    private final transient List<CertError> errors;

    public CertificateParseException(CertErrorId errorId, String detail, Throwable cause) {
        super(detail == null ? errorId.description() : errorId.description() + ": " + detail, cause);
        this.errorId = errorId;
        this.errors = List.of(new CertError(errorId, detail));
    }

    public CertificateParseException(String message, CertErrors errors) {
        super(message + (errors.isEmpty() ? "" : ": " + errors.toDebugString()));
        this.errors = List.copyOf(errors.errors());
        this.errorId = this.errors.isEmpty() ? null : this.errors.get(this.errors.size() - 1).id();
    }

    public CertErrorId errorId() {
        return errorId;
    }

    public List<CertError> errors() {
        return errors;
    }
}
