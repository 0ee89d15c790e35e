package it.certparse.extension;

import static it.certparse.asn1.DerFixtures.ascii;
import static it.certparse.asn1.DerFixtures.contextPrimitive;
import static it.certparse.asn1.DerFixtures.oid;
import static it.certparse.asn1.DerFixtures.sequence;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

class AuthorityInfoAccessTest {

    @Test
    void shouldCollectUrisByAccessMethod() {
        AuthorityInfoAccess aia = AuthorityInfoAccess.parse(sequence(
            sequence(oid(AuthorityInfoAccess.AD_OCSP), contextPrimitive(6, ascii("http://ocsp.example.com"))),
            sequence(oid(AuthorityInfoAccess.AD_CA_ISSUERS), contextPrimitive(6, ascii("http://ca.example.com/ca.crt"))),
            sequence(oid(AuthorityInfoAccess.AD_CA_ISSUERS), contextPrimitive(2, ascii("ca.example.com"))),
            sequence(oid("1.3.6.1.5.5.7.48.5"), contextPrimitive(6, ascii("http://other.example.com")))
        ));

        assertEquals(List.of("http://ocsp.example.com"), aia.ocspUris());
        assertEquals(List.of("http://ca.example.com/ca.crt"), aia.caIssuersUris());
    }

    @Test
    void shouldAcceptDescriptionsWithoutUris() {
        AuthorityInfoAccess aia = AuthorityInfoAccess.parse(sequence(
            sequence(oid(AuthorityInfoAccess.AD_OCSP), contextPrimitive(2, ascii("ocsp.example.com")))
        ));

        assertTrue(aia.ocspUris().isEmpty());
        assertTrue(aia.caIssuersUris().isEmpty());
    }

    @Test
    void shouldRejectMalformedDescriptions() {
        assertThrows(IllegalArgumentException.class, () -> AuthorityInfoAccess.parse(sequence()));
        assertThrows(IllegalArgumentException.class,
            () -> AuthorityInfoAccess.parse(sequence(sequence(oid(AuthorityInfoAccess.AD_OCSP)))));
        assertThrows(IllegalArgumentException.class, () -> AuthorityInfoAccess.parse(sequence(
            sequence(oid(AuthorityInfoAccess.AD_OCSP), contextPrimitive(6, new byte[] {'h', (byte) 0xE9}))
        )));
    }

    @Test
    void shouldSkipMalformedNonUriLocations() {
        AuthorityInfoAccess aia = AuthorityInfoAccess.parse(sequence(
            sequence(oid(AuthorityInfoAccess.AD_OCSP), contextPrimitive(7, new byte[3])),
            sequence(oid(AuthorityInfoAccess.AD_CA_ISSUERS), contextPrimitive(2, new byte[] {(byte) 0xFF})),
            sequence(oid(AuthorityInfoAccess.AD_CA_ISSUERS), contextPrimitive(6, ascii("http://ca.example.com/ca.crt")))
        ));

        assertTrue(aia.ocspUris().isEmpty());
        assertEquals(List.of("http://ca.example.com/ca.crt"), aia.caIssuersUris());
    }
}
