package com.relaymail.imap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * One parsed IMAP command line: {@code <tag> <NAME> [arguments]}
 *
 * FETCH, STORE, SEARCH, STATUS and LIST interpret {@link #getRawArguments()} themselves,
 * the tokenized {@link #getArguments()} are for everything else.
 */
public final class ImapCommand {

    public static final int MAX_LINE_LENGTH = 8192;
    public static final int MAX_ARGUMENTS = 100;

    private final String tag;
    private final String name;
    private final List<String> arguments;
    private final String rawArguments;

    private ImapCommand(String tag, String name, List<String> arguments, String rawArguments) {
        this.tag = tag;
        this.name = name;
        this.arguments = Collections.unmodifiableList(arguments);
        this.rawArguments = rawArguments;
    }

    public static ImapCommand parse(String line) throws ImapParseException {
        if (line == null || line.isBlank()) {
            return new ImapCommand("*", "NOOP", new ArrayList<>(), "");
        }
        if (line.length() > MAX_LINE_LENGTH) {
            throw new ImapParseException("Command line too long");
        }

        String trimmed = line.strip();
        int tagEnd = trimmed.indexOf(' ');
        if (tagEnd < 0) {
            throw new ImapParseException(trimmed, "Missing command name");
        }
        String tag = trimmed.substring(0, tagEnd);

        String rest = trimmed.substring(tagEnd + 1).stripLeading();
        int nameEnd = rest.indexOf(' ');
        String name = (nameEnd < 0 ? rest : rest.substring(0, nameEnd)).toUpperCase(Locale.ROOT);
        String rawArguments = nameEnd < 0 ? "" : rest.substring(nameEnd + 1).stripLeading();

        return new ImapCommand(tag, name, tokenize(tag, rawArguments), rawArguments);
    }

    /**
     * The command carried by {@code UID <name> ...}, with the same tag
     */
    public ImapCommand subCommand() throws ImapParseException {
        if (arguments.isEmpty()) {
            throw new ImapParseException(tag, "Missing UID command");
        }
        return parse(tag + " " + rawArguments);
    }

    /**
     * Whitespace-separated tokens. Double quotes group a token; a backslash escapes the next
     * character only inside quotes.
     */
    static List<String> tokenize(String tag, String input) throws ImapParseException {
        List<String> tokens = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean inQuote = false;
        boolean inToken = false;

        for (int i = 0; i < input.length(); i++) {
            char c = input.charAt(i);
            if (inQuote) {
                if (c == '\\' && i + 1 < input.length()) {
                    current.append(input.charAt(++i));
                } else if (c == '"') {
                    inQuote = false;
                } else {
                    current.append(c);
                }
            } else if (c == '"') {
                inQuote = true;
                inToken = true;
            } else if (c == ' ' || c == '\t') {
                if (inToken) {
                    addToken(tag, tokens, current);
                    current.setLength(0);
                    inToken = false;
                }
            } else {
                current.append(c);
                inToken = true;
            }
        }
        if (inQuote) {
            throw new ImapParseException(tag, "Unterminated quoted string");
        }
        if (inToken) {
            addToken(tag, tokens, current);
        }
        return tokens;
    }

    private static void addToken(String tag, List<String> tokens, StringBuilder token) throws ImapParseException {
        if (tokens.size() >= MAX_ARGUMENTS) {
            throw new ImapParseException(tag, "Too many arguments");
        }
        tokens.add(token.toString());
    }

    public String getTag() {
        return tag;
    }

    public String getName() {
        return name;
    }

    public List<String> getArguments() {
        return arguments;
    }

    public String getRawArguments() {
        return rawArguments;
    }

    @Override
    public String toString() {
        return tag + " " + name;
    }
}
