package it.certparse.service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import org.springframework.stereotype.Component;

import it.certparse.cert.CertErrors;
import it.certparse.cert.CertificateParseException;
import it.certparse.cert.ParseCertificateOptions;
import it.certparse.cert.ParsedCertificate;

/**
 * Decoder bound to the application's configured {@link ParseCertificateOptions}.
 */
@Component
public class CertificateDecoder {

    private final ParseCertificateOptions options;

    public CertificateDecoder(ParseCertificateOptions options) {
        this.options = options;
    }

    public ParseCertificateOptions options() {
        return options;
    }

    public ParsedCertificate decode(byte[] der) {
        CertErrors errors = new CertErrors();
        return ParsedCertificate.create(der, options, errors)
            .orElseThrow(() -> new CertificateParseException("Certificate rejected", errors));
    }

    public Optional<ParsedCertificate> tryDecode(byte[] der, CertErrors errors) {
        return ParsedCertificate.create(der, options, errors);
    }

    /**
     * Decodes certificates in order; the first invalid one aborts the chain.
     */
    public List<ParsedCertificate> decodeChain(List<byte[]> certificates) {
        List<ParsedCertificate> chain = new ArrayList<>(certificates.size());
        for (int i = 0; i < certificates.size(); i++) {
            CertErrors errors = new CertErrors();
            if (!ParsedCertificate.createAndAddToList(certificates.get(i), options, chain, errors)) {
                throw new CertificateParseException("Certificate #" + i + " of chain rejected", errors);
            }
        }
        return Collections.unmodifiableList(chain);
    }
}
