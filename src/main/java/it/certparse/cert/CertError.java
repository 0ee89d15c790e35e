package it.certparse.cert;

public record CertError(CertErrorId id, String detail) {

    public CertError {
        if (id == null) {
            throw new IllegalArgumentException("Certificate error id is mandatory");
        }
    }

    @Override
    public String toString() {
        if (detail == null || detail.isBlank()) {
            return id.description();
        }
        return id.description() + ": " + detail;
    }
}
