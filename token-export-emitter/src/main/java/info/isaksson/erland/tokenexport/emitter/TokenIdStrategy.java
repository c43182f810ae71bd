package info.isaksson.erland.tokenexport.emitter;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.UUID;

/**
 * Stable identifiers for extended tokens.
 *
 * <p>Deterministic ids are name-based UUID v5 values (RFC 4122) in a fixed namespace, so the same
 * variable id always yields the same uuid across exports.</p>
 */
public final class TokenIdStrategy {
    private TokenIdStrategy() {}

    public static final UUID NAMESPACE = UUID.fromString("550e8400-e29b-41d4-a716-446655440000");

    /** Identifier of a token built from one variable. */
    public static String tokenId(String variableId) {
        return nameBased(NAMESPACE, variableId).toString();
    }

    /** Identifier of the per-mode entry of an extended token's {@code sets}. */
    public static String setEntryId(String variableId, String modeName) {
        return nameBased(NAMESPACE, variableId + "-" + modeName).toString();
    }

    public static String randomId() {
        return UUID.randomUUID().toString();
    }

    /** Returns the id for {@code mode}, or null when identifiers are disabled. */
    public static String idFor(IdentifierMode mode, String variableId, String modeName) {
        switch (mode) {
            case NONE:
                return null;
            case RANDOM:
                return randomId();
            case DETERMINISTIC:
            default:
                return modeName == null ? tokenId(variableId) : setEntryId(variableId, modeName);
        }
    }

    static UUID nameBased(UUID namespace, String name) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-1");
            md.update(toBytes(namespace));
            byte[] hash = md.digest(name.getBytes(StandardCharsets.UTF_8));
            hash[6] &= 0x0f;
            hash[6] |= 0x50;
            hash[8] &= 0x3f;
            hash[8] |= (byte) 0x80;
            long msb = 0;
            long lsb = 0;
            for (int i = 0; i < 8; i++) msb = (msb << 8) | (hash[i] & 0xff);
            for (int i = 8; i < 16; i++) lsb = (lsb << 8) | (hash[i] & 0xff);
            return new UUID(msb, lsb);
        } catch (NoSuchAlgorithmException e) {
            // SHA-1 is guaranteed in the JRE.
            throw new IllegalStateException(e);
        }
    }

    private static byte[] toBytes(UUID uuid) {
        byte[] out = new byte[16];
        long msb = uuid.getMostSignificantBits();
        long lsb = uuid.getLeastSignificantBits();
        for (int i = 0; i < 8; i++) out[i] = (byte) (msb >>> (8 * (7 - i)));
        for (int i = 0; i < 8; i++) out[8 + i] = (byte) (lsb >>> (8 * (7 - i)));
        return out;
    }
}
