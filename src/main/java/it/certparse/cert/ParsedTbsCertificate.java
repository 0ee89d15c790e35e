package it.certparse.cert;

import java.time.Instant;
import java.util.Optional;

import it.certparse.asn1.BitString;

/**
 * Fields of a TBSCertificate. Names and extensions are kept as complete TLVs
 * for later stages to interpret.
 */
public final class ParsedTbsCertificate {

    private final CertificateVersion version;
    private final byte[] serialNumber;
    private final byte[] signatureAlgorithmTlv;
    private final byte[] issuerTlv;
    private final Instant notBefore;
    private final Instant notAfter;
    private final byte[] subjectTlv;
    private final byte[] subjectPublicKeyInfoTlv;
    private final BitString issuerUniqueId;
    private final BitString subjectUniqueId;
    private final byte[] extensionsTlv;

    ParsedTbsCertificate(
        CertificateVersion version,
        byte[] serialNumber,
        byte[] signatureAlgorithmTlv,
        byte[] issuerTlv,
        Instant notBefore,
        Instant notAfter,
        byte[] subjectTlv,
        byte[] subjectPublicKeyInfoTlv,
        BitString issuerUniqueId,
        BitString subjectUniqueId,
        byte[] extensionsTlv
    ) {
        this.version = version;
        this.serialNumber = serialNumber.clone();
        this.signatureAlgorithmTlv = signatureAlgorithmTlv.clone();
        this.issuerTlv = issuerTlv.clone();
        this.notBefore = notBefore;
        this.notAfter = notAfter;
        this.subjectTlv = subjectTlv.clone();
        this.subjectPublicKeyInfoTlv = subjectPublicKeyInfoTlv.clone();
        this.issuerUniqueId = issuerUniqueId;
        this.subjectUniqueId = subjectUniqueId;
        this.extensionsTlv = extensionsTlv == null ? null : extensionsTlv.clone();
    }

    public CertificateVersion version() {
        return version;
    }

    /**
     * Content octets of the serial number INTEGER.
     */
    public byte[] serialNumber() {
        return serialNumber.clone();
    }

    public byte[] signatureAlgorithmTlv() {
        return signatureAlgorithmTlv.clone();
    }

    public byte[] issuerTlv() {
        return issuerTlv.clone();
    }

    public Instant notBefore() {
        return notBefore;
    }

    public Instant notAfter() {
        return notAfter;
    }

    public byte[] subjectTlv() {
        return subjectTlv.clone();
    }

    public byte[] subjectPublicKeyInfoTlv() {
        return subjectPublicKeyInfoTlv.clone();
    }

    public Optional<BitString> issuerUniqueId() {
        return Optional.ofNullable(issuerUniqueId);
    }

    public Optional<BitString> subjectUniqueId() {
        return Optional.ofNullable(subjectUniqueId);
    }

    /**
     * The Extensions SEQUENCE TLV, without the [3] wrapper.
     */
    public Optional<byte[]> extensionsTlv() {
        return Optional.ofNullable(extensionsTlv).map(byte[]::clone);
    }

    public boolean hasExtensions() {
        return extensionsTlv != null;
    }
}
