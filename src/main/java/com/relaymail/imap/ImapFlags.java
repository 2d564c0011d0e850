package com.relaymail.imap;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * IMAP system flags as an int bitmask
 */
public final class ImapFlags {

    public static final int SEEN = 1;
    public static final int ANSWERED = 1 << 1;
    public static final int FLAGGED = 1 << 2;
    public static final int DELETED = 1 << 3;
    public static final int DRAFT = 1 << 4;
    public static final int RECENT = 1 << 5;

    /** Flags a client may change with STORE */
    public static final String PERMANENT = "\\Seen \\Answered \\Flagged \\Deleted \\Draft";

    private static final int[] BITS = {SEEN, ANSWERED, FLAGGED, DELETED, DRAFT, RECENT};
    private static final String[] NAMES = {"\\Seen", "\\Answered", "\\Flagged", "\\Deleted", "\\Draft", "\\Recent"};

    private ImapFlags() {
    }

    public static boolean has(int flags, int flag) {
        return (flags & flag) != 0;
    }

    /**
     * "\Seen \Flagged" etc., empty string for no flags
     */
    public static String toImapString(int flags) {
        List<String> names = new ArrayList<>();
        for (int i = 0; i < BITS.length; i++) {
            if (has(flags, BITS[i])) {
                names.add(NAMES[i]);
            }
        }
        return String.join(" ", names);
    }

    /**
     * Case-insensitive. Parentheses are stripped and unknown flags ignored.
     */
    public static int parse(List<String> tokens) {
        int flags = 0;
        for (String token : tokens) {
            String name = token.replace("(", "").replace(")", "").trim();
            for (int i = 0; i < NAMES.length; i++) {
                if (NAMES[i].equalsIgnoreCase(name)) {
                    flags |= BITS[i];
                }
            }
        }
        return flags;
    }

    public static int parse(String flagList) {
        if (flagList == null || flagList.isBlank()) {
            return 0;
        }
        return parse(List.of(flagList.trim().toUpperCase(Locale.ROOT).split("\\s+")));
    }
}
