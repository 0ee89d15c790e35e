package it.certparse.extension;

import static it.certparse.asn1.DerFixtures.bool;
import static it.certparse.asn1.DerFixtures.integer;
import static it.certparse.asn1.DerFixtures.sequence;
import static it.certparse.asn1.DerFixtures.universal;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Optional;

import org.junit.jupiter.api.Test;

import it.certparse.asn1.DerTags;

class BasicConstraintsTest {

    @Test
    void shouldDefaultToEndEntity() {
        BasicConstraints constraints = BasicConstraints.parse(sequence());

        assertFalse(constraints.ca());
        assertTrue(constraints.pathLength().isEmpty());
    }

    @Test
    void shouldParseCaWithPathLength() {
        assertEquals(new BasicConstraints(true, Optional.of(0)), BasicConstraints.parse(sequence(bool(true), integer(0))));
        assertEquals(new BasicConstraints(true, Optional.of(255)), BasicConstraints.parse(sequence(bool(true), integer(255))));
        assertEquals(new BasicConstraints(true, Optional.empty()), BasicConstraints.parse(sequence(bool(true))));
    }

    @Test
    void shouldTolerateExplicitFalse() {
        assertFalse(BasicConstraints.parse(sequence(bool(false))).ca());
    }

    @Test
    void shouldRejectPathLengthOutOfRange() {
        assertThrows(IllegalArgumentException.class, () -> BasicConstraints.parse(sequence(bool(true), integer(256))));
        assertThrows(IllegalArgumentException.class, () -> BasicConstraints.parse(sequence(bool(true), integer(-1))));
    }

    @Test
    void shouldRejectMalformedStructure() {
        byte[] nonDerBoolean = universal(false, DerTags.BOOLEAN, new byte[] {0x01});

        assertThrows(IllegalArgumentException.class, () -> BasicConstraints.parse(sequence(nonDerBoolean)));
        assertThrows(IllegalArgumentException.class, () -> BasicConstraints.parse(sequence(bool(true), integer(1), integer(2))));
        assertThrows(IllegalArgumentException.class, () -> BasicConstraints.parse(sequence(integer(1), bool(true))));
        assertThrows(IllegalArgumentException.class, () -> BasicConstraints.parse(bool(true)));
    }

    @Test
    void shouldReportItsKind() {
        assertEquals(ExtensionKind.BASIC_CONSTRAINTS, BasicConstraints.parse(sequence()).kind());
    }
}
