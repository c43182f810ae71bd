package info.isaksson.erland.tokenexport.emitter;

import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

public class TokenIdStrategyTest {

    private static final UUID DNS = UUID.fromString("6ba7b810-9dad-11d1-80b4-00c04fd430c8");

    @Test
    void nameBasedMatchesRfcVersion5() {
        UUID id = TokenIdStrategy.nameBased(DNS, "www.example.com");
        assertEquals("2ed6657d-e927-568b-95e1-2665a8aea6a2", id.toString());
        assertEquals(5, id.version());
        assertEquals(2, id.variant());
    }

    @Test
    void tokenIdsAreStablePerVariable() {
        assertEquals(TokenIdStrategy.tokenId("VariableID:1"), TokenIdStrategy.tokenId("VariableID:1"));
        assertNotEquals(TokenIdStrategy.tokenId("VariableID:1"), TokenIdStrategy.tokenId("VariableID:2"));
        assertNotEquals(TokenIdStrategy.tokenId("VariableID:1"), TokenIdStrategy.setEntryId("VariableID:1", "Dark"));
        assertEquals(TokenIdStrategy.nameBased(TokenIdStrategy.NAMESPACE, "VariableID:1-Dark").toString(),
                TokenIdStrategy.setEntryId("VariableID:1", "Dark"));
    }

    @Test
    void idForFollowsMode() {
        assertNull(TokenIdStrategy.idFor(IdentifierMode.NONE, "v", null));
        assertEquals(TokenIdStrategy.tokenId("v"), TokenIdStrategy.idFor(IdentifierMode.DETERMINISTIC, "v", null));
        assertEquals(TokenIdStrategy.setEntryId("v", "Light"), TokenIdStrategy.idFor(IdentifierMode.DETERMINISTIC, "v", "Light"));

        String random = TokenIdStrategy.idFor(IdentifierMode.RANDOM, "v", null);
        assertEquals(4, UUID.fromString(random).version());
    }
}
