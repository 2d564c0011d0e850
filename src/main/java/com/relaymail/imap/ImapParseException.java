package com.relaymail.imap;

/**
 * A command line that cannot be parsed. The tag is kept when it could be read.
 */
public class ImapParseException extends Exception {

    private final String tag;

    public ImapParseException(String message) {
        this(null, message);
    }

    public ImapParseException(String tag, String message) {
        super(message);
        this.tag = tag;
    }

    /**
     * @return the command tag, or null if the line ended before it
     */
    public String getTag() {
        return tag;
    }
}
