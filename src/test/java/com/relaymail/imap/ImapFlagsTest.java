package com.relaymail.imap;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * IMAP flag bitmask tests
 */
class ImapFlagsTest {

    @Test
    @DisplayName("Empty flag set renders as empty string")
    void testToImapString_Empty() {
        assertThat(ImapFlags.toImapString(0)).isEmpty();
    }

    @Test
    @DisplayName("Flags render in fixed order with \\Recent last")
    void testToImapString_Order() {
        int flags = ImapFlags.RECENT | ImapFlags.DRAFT | ImapFlags.SEEN | ImapFlags.FLAGGED;

        assertThat(ImapFlags.toImapString(flags)).isEqualTo("\\Seen \\Flagged \\Draft \\Recent");
    }

    @Test
    @DisplayName("Parse is case-insensitive, strips parentheses, ignores unknown flags")
    void testParse_Tokens() {
        int flags = ImapFlags.parse(List.of("(\\seen", "\\DELETED", "$Junk)"));

        assertThat(flags).isEqualTo(ImapFlags.SEEN | ImapFlags.DELETED);
    }

    @Test
    @DisplayName("Every combination survives render and parse")
    void testRoundTrip_AllCombinations() {
        for (int flags = 0; flags < 64; flags++) {
            assertThat(ImapFlags.parse(ImapFlags.toImapString(flags))).isEqualTo(flags);
        }
    }
}
