package it.certparse.name;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

import it.certparse.asn1.BerCodec;
import it.certparse.asn1.BerTlv;
import it.certparse.asn1.DerTags;
import it.certparse.asn1.DerValues;

/**
 * Produces the comparable form of a distinguished name.
 *
 * <pre>
 * Name ::= CHOICE { rdnSequence  RDNSequence }
 * RDNSequence ::= SEQUENCE OF RelativeDistinguishedName
 * RelativeDistinguishedName ::= SET SIZE (1..MAX) OF AttributeTypeAndValue
 * AttributeTypeAndValue ::= SEQUENCE { type OID, value ANY }
 * </pre>
 *
 * Directory string values (PrintableString, TeletexString, UniversalString,
 * BMPString, UTF8String) are rewritten as UTF8String with ASCII letters
 * lowercased, inner runs of spaces collapsed and outer spaces trimmed. Other
 * value types are copied unchanged. Each RDN is re-encoded with its members
 * in DER SET OF order.
 */
public final class NameNormalizer {

    private static final Pattern PRINTABLE_STRING = Pattern.compile("^[A-Za-z0-9 '()+,\\-./:=?*&]*$");

    private NameNormalizer() {
    }

    /**
     * @param rdnSequenceValue the contents of the Name SEQUENCE, without its header
     * @return the normalized RDN sequence contents, without a SEQUENCE header
     */
    public static byte[] normalize(byte[] rdnSequenceValue) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (BerTlv rdn : BerCodec.decodeAll(rdnSequenceValue)) {
            out.writeBytes(normalizeRdn(rdn));
        }
        return out.toByteArray();
    }

    private static byte[] normalizeRdn(BerTlv rdn) {
        DerValues.require(rdn, DerTags.CLASS_UNIVERSAL, true, DerTags.SET, "RelativeDistinguishedName");
        List<BerTlv> attributes = BerCodec.decodeAll(rdn.value());
        if (attributes.isEmpty()) {
            throw new IllegalArgumentException("RelativeDistinguishedName is empty");
        }
        List<byte[]> normalized = new ArrayList<>(attributes.size());
        for (BerTlv attribute : attributes) {
            normalized.add(normalizeAttribute(attribute));
        }
        normalized.sort(Arrays::compareUnsigned);

        ByteArrayOutputStream content = new ByteArrayOutputStream();
        normalized.forEach(content::writeBytes);
        return BerTlv.universal(true, DerTags.SET, content.toByteArray()).encoded();
    }

    private static byte[] normalizeAttribute(BerTlv attribute) {
        List<BerTlv> fields = DerValues.sequenceElements(attribute, "AttributeTypeAndValue");
        if (fields.size() != 2) {
            throw new IllegalArgumentException("AttributeTypeAndValue must hold a type and a value");
        }
        BerTlv type = fields.get(0);
        DerValues.readOid(type, "AttributeType");
        BerTlv value = normalizeValue(fields.get(1));

        ByteArrayOutputStream content = new ByteArrayOutputStream();
        content.writeBytes(type.encoded());
        content.writeBytes(value.encoded());
        return BerTlv.universal(true, DerTags.SEQUENCE, content.toByteArray()).encoded();
    }

    private static BerTlv normalizeValue(BerTlv value) {
        if (!value.isUniversal() || value.constructed()) {
            return value;
        }
        String text = switch (value.tagNumber()) {
            case DerTags.PRINTABLE_STRING -> printable(value.value());
            case DerTags.UTF8_STRING -> decodeStrict(value.value(), StandardCharsets.UTF_8, "UTF8String");
            case DerTags.BMP_STRING -> bmp(value.value());
            case DerTags.UNIVERSAL_STRING -> universal(value.value());
            case DerTags.TELETEX_STRING -> new String(value.value(), StandardCharsets.ISO_8859_1);
            default -> null;
        };
        if (text == null) {
            return value;
        }
        return BerTlv.universal(false, DerTags.UTF8_STRING, caseFoldAndCollapse(text).getBytes(StandardCharsets.UTF_8));
    }

    static String caseFoldAndCollapse(String text) {
        StringBuilder folded = new StringBuilder(text.length());
        boolean pendingSpace = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == ' ') {
                pendingSpace = folded.length() > 0;
                continue;
            }
            if (pendingSpace) {
                folded.append(' ');
                pendingSpace = false;
            }
            if (c >= 'A' && c <= 'Z') {
                c = (char) (c + ('a' - 'A'));
            }
            folded.append(c);
        }
        return folded.toString();
    }

    private static String printable(byte[] value) {
        String text = new String(value, StandardCharsets.US_ASCII);
        if (!PRINTABLE_STRING.matcher(text).matches()) {
            throw new IllegalArgumentException("PrintableString contains invalid characters");
        }
        return text;
    }

    private static String bmp(byte[] value) {
        if (value.length % 2 != 0) {
            throw new IllegalArgumentException("BMPString has odd length");
        }
        String text = decodeStrict(value, StandardCharsets.UTF_16BE, "BMPString");
        for (int i = 0; i < text.length(); i++) {
            if (Character.isSurrogate(text.charAt(i))) {
                throw new IllegalArgumentException("BMPString contains surrogate code units");
            }
        }
        return text;
    }

    private static String universal(byte[] value) {
        if (value.length % 4 != 0) {
            throw new IllegalArgumentException("UniversalString length is not a multiple of four");
        }
        StringBuilder text = new StringBuilder(value.length / 4);
        ByteBuffer buffer = ByteBuffer.wrap(value);
        while (buffer.hasRemaining()) {
            int codePoint = buffer.getInt();
            if (!Character.isValidCodePoint(codePoint) || (codePoint >= 0xD800 && codePoint <= 0xDFFF)) {
                throw new IllegalArgumentException("UniversalString contains invalid code point");
            }
            text.appendCodePoint(codePoint);
        }
        return text.toString();
    }

    private static String decodeStrict(byte[] value, Charset charset, String type) {
        try {
            return charset.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(value))
                .toString();
        } catch (CharacterCodingException ex) {
            throw new IllegalArgumentException(type + " is not validly encoded", ex);
        }
    }
}
