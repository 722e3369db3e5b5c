package io.obscur.model;

import io.obscur.error.ValidationException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class ConversationIdsTest {
    private static final String ALICE = "a1".repeat(32);
    private static final String BOB = "0b".repeat(32);

    @Test
    void directIdsAreOrderIndependent() {
        String expected = BOB + ":" + ALICE;

        Assertions.assertEquals(expected, ConversationIds.direct(ALICE, BOB));
        Assertions.assertEquals(expected, ConversationIds.direct(BOB, ALICE));
        Assertions.assertEquals(expected, ConversationIds.direct(ALICE.toUpperCase(), " " + BOB + " "));
        Assertions.assertFalse(ConversationIds.isGroup(expected));
    }

    @Test
    void groupIdsArePrefixed() {
        Assertions.assertEquals("group:team-7", ConversationIds.group(" team-7 "));
        Assertions.assertTrue(ConversationIds.isGroup("group:team-7"));
        Assertions.assertFalse(ConversationIds.isGroup(null));
    }

    @Test
    void malformedParticipantsAreRejected() {
        Assertions.assertThrows(ValidationException.class, () -> ConversationIds.direct(ALICE, "npub1xyz"));
        Assertions.assertThrows(ValidationException.class, () -> ConversationIds.direct(null, BOB));
        Assertions.assertThrows(ValidationException.class, () -> ConversationIds.group(" "));
    }
}
