package it.certparse.cert;

import it.certparse.asn1.BitString;

/**
 * The three top level parts of a Certificate, split but not yet interpreted.
 */
public record CertificateEnvelope(byte[] tbsCertificateTlv, byte[] signatureAlgorithmTlv, BitString signatureValue) {
}
