package it.certparse.cert;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Ordered, append-only log of certificate errors. Not thread safe: use one
 * instance per parse.
 */
public final class CertErrors {

    private final List<CertError> errors = new ArrayList<>();

    public void add(CertErrorId id) {
        errors.add(new CertError(id, null));
    }

    public void add(CertErrorId id, String detail) {
        errors.add(new CertError(id, detail));
    }

    public List<CertError> errors() {
        return Collections.unmodifiableList(errors);
    }

    public boolean contains(CertErrorId id) {
        return errors.stream().anyMatch(error -> error.id() == id);
    }

    public boolean isEmpty() {
        return errors.isEmpty();
    }

    public String toDebugString() {
        return errors.stream().map(CertError::toString).collect(Collectors.joining("\n"));
    }
}
