package it.certparse.service;

import java.time.Instant;
import java.util.List;

import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class CertificateSummary {

    private String source;
    private int index;
    private boolean accepted;
    private String error;
    private String serialNumber;
    private String version;
    private String signatureAlgorithm;
    private Instant notBefore;
    private Instant notAfter;
    private boolean ca;
    private Integer pathLength;
    private List<String> dnsNames = List.of();
    private List<String> extensionOids = List.of();
    private List<String> criticalExtensionOids = List.of();
}
