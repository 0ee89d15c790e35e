package it.certparse.extension;

/**
 * GeneralName CHOICE arms, by context tag number.
 */
public enum GeneralNameType {
    OTHER_NAME,
    RFC822_NAME,
    DNS_NAME,
    X400_ADDRESS,
    DIRECTORY_NAME,
    EDI_PARTY_NAME,
    UNIFORM_RESOURCE_IDENTIFIER,
    IP_ADDRESS,
    REGISTERED_ID;

    public static GeneralNameType forTag(int tagNumber) {
        GeneralNameType[] types = values();
        if (tagNumber < 0 || tagNumber >= types.length) {
            throw new IllegalArgumentException("Unknown GeneralName tag [" + tagNumber + "]");
        }
        return types[tagNumber];
    }
}
