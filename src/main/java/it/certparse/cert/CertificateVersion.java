package it.certparse.cert;

public enum CertificateVersion {
    V1,
    V2,
    V3
}
