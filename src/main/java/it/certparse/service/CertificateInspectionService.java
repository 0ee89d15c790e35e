package it.certparse.service;

import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import it.certparse.cert.CertErrors;
import it.certparse.cert.CertificateParseException;
import it.certparse.cert.ParsedCertificate;
import it.certparse.extension.BasicConstraints;
import it.certparse.extension.GeneralNames;
import it.certparse.extension.ParsedExtension;

/**
 * Reads certificate files, decodes them in order and reports what was found.
 */
@Service
public class CertificateInspectionService {

    private static final Logger logger = LoggerFactory.getLogger(CertificateInspectionService.class);

    private final CertificateFileReader fileReader;
    private final CertificateDecoder decoder;
    private final boolean skipInvalid;

    public CertificateInspectionService(
        CertificateFileReader fileReader,
        CertificateDecoder decoder,
        @Value("${certparse.chain.skip-invalid:false}") boolean skipInvalid
    ) {
        this.fileReader = fileReader;
        this.decoder = decoder;
        this.skipInvalid = skipInvalid;
    }

    public List<CertificateSummary> inspect(List<String> locations) {
        List<CertificateSummary> summaries = new ArrayList<>();
        for (String location : locations) {
            List<byte[]> certificates = fileReader.read(location);
            logger.info("Read {} certificate(s) from {}", certificates.size(), location);
            for (int i = 0; i < certificates.size(); i++) {
                summaries.add(inspectOne(location, i, certificates.get(i)));
            }
        }
        return summaries;
    }

    /**
     * Decodes a chain given as separate DER blobs. With skip-invalid enabled a
     * rejected certificate is logged and left out; otherwise it aborts the chain.
     */
    public List<ParsedCertificate> decodeChain(List<byte[]> certificates) {
        if (!skipInvalid) {
            return decoder.decodeChain(certificates);
        }
        List<ParsedCertificate> chain = new ArrayList<>();
        for (int i = 0; i < certificates.size(); i++) {
            CertErrors errors = new CertErrors();
            if (!ParsedCertificate.createAndAddToList(certificates.get(i), decoder.options(), chain, errors)) {
                logger.warn("Skipping certificate #{}: {}", i, errors.toDebugString());
            }
        }
        return List.copyOf(chain);
    }

    CertificateSummary inspectOne(String source, int index, byte[] der) {
        CertificateSummary summary = new CertificateSummary();
        summary.setSource(source);
        summary.setIndex(index);
        ParsedCertificate certificate;
        try {
            certificate = decoder.decode(der);
        } catch (CertificateParseException ex) {
            summary.setAccepted(false);
            summary.setError(ex.getMessage());
            if (skipInvalid) {
                logger.warn("Certificate {}#{} rejected: {}", source, index, ex.getMessage());
                return summary;
            }
            throw ex;
        }

        summary.setAccepted(true);
        summary.setSerialNumber(HexFormat.of().withUpperCase().formatHex(certificate.tbs().serialNumber()));
        summary.setVersion(certificate.tbs().version().name());
        summary.setSignatureAlgorithm(certificate.signatureAlgorithm().name());
        summary.setNotBefore(certificate.tbs().notBefore());
        summary.setNotAfter(certificate.tbs().notAfter());
        Optional<BasicConstraints> basicConstraints = certificate.basicConstraints();
        summary.setCa(basicConstraints.map(BasicConstraints::ca).orElse(false));
        summary.setPathLength(basicConstraints.flatMap(BasicConstraints::pathLength).orElse(null));
        summary.setDnsNames(certificate.subjectAltNames().map(GeneralNames::dnsNames).orElse(List.of()));
        summary.setExtensionOids(List.copyOf(certificate.extensions().keySet()));
        summary.setCriticalExtensionOids(certificate.extensions().values().stream()
            .filter(ParsedExtension::critical)
            .map(ParsedExtension::oid)
            .toList());
        logger.info("Certificate {}#{} serial={} algorithm={} extensions={}",
            source, index, summary.getSerialNumber(), summary.getSignatureAlgorithm(), summary.getExtensionOids());
        return summary;
    }
}
