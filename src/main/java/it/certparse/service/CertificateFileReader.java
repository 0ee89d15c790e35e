package it.certparse.service;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

/**
 * Loads certificates from PEM bundles or single DER files.
 */
@Component
public class CertificateFileReader {

    private static final String PEM_MARKER = "-----BEGIN ";
    private static final Pattern PEM_CERTIFICATE = Pattern.compile(
        "-----BEGIN CERTIFICATE-----([A-Za-z0-9+/=\\s]*?)-----END CERTIFICATE-----");

    private final ResourceLoader resourceLoader;

    public CertificateFileReader(ResourceLoader resourceLoader) {
        this.resourceLoader = resourceLoader;
    }

    public List<byte[]> read(String location) {
        Resource resource = resourceLoader.getResource(location);
        try (InputStream is = resource.getInputStream()) {
            return split(is.readAllBytes());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read certificates from " + location, e);
        }
    }

    static List<byte[]> split(byte[] content) {
        String text = new String(content, StandardCharsets.US_ASCII);
        if (!text.contains(PEM_MARKER)) {
            return List.of(content);
        }
        List<byte[]> certificates = new ArrayList<>();
        Matcher matcher = PEM_CERTIFICATE.matcher(text);
        while (matcher.find()) {
            certificates.add(Base64.getMimeDecoder().decode(matcher.group(1)));
        }
        if (certificates.isEmpty()) {
            throw new IllegalArgumentException("PEM content holds no CERTIFICATE block");
        }
        return certificates;
    }
}
