package it.certparse;

import java.util.Arrays;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

import it.certparse.cert.ParseCertificateOptions;
import it.certparse.service.CertificateInspectionService;
import it.certparse.service.CertificateSummary;

@SpringBootApplication
public class CertParse {

    private static final Logger logger = LoggerFactory.getLogger(CertParse.class);

    @Value("${certparse.options.allow-invalid-serial-numbers:false}")
    private boolean allowInvalidSerialNumbers;
    @Value("${certparse.options.reject-unknown-critical-extensions:false}")
    private boolean rejectUnknownCriticalExtensions;
    @Value("${certparse.options.allow-explicit-default-values:false}")
    private boolean allowExplicitDefaultValues;
    @Value("${certparse.input.paths:}")
    private String inputPaths;

    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(CertParse.class);
        app.setBanner((environment, sourceClass, out) -> out.println("certparse :: X.509 certificate decoder"));
        app.setWebApplicationType(WebApplicationType.NONE);
        app.run(args);
    }

    @Bean
    public ParseCertificateOptions parseCertificateOptions() {
        return new ParseCertificateOptions(allowInvalidSerialNumbers, rejectUnknownCriticalExtensions, allowExplicitDefaultValues);
    }

    @Bean
    public CommandLineRunner inspectCertificates(CertificateInspectionService inspectionService) {
        return args -> {
            List<String> locations = args.length > 0 ? Arrays.asList(args) : parseLocations(inputPaths);
            if (locations.isEmpty()) {
                logger.info("No certificate files given; pass paths as arguments or set certparse.input.paths");
                return;
            }
            List<CertificateSummary> summaries = inspectionService.inspect(locations);
            long accepted = summaries.stream().filter(CertificateSummary::isAccepted).count();
            logger.info("Decoded {} of {} certificate(s)", accepted, summaries.size());
        };
    }

    static List<String> parseLocations(String csv) {
        if (csv == null || csv.isBlank()) {
            return List.of();
        }
        return Arrays.stream(csv.split(","))
            .map(String::trim)
            .filter(value -> !value.isEmpty())
            .toList();
    }
}
