package com.relaymail.imap;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Random;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * IMAP command line parser tests
 */
class ImapCommandTest {

    @Test
    @DisplayName("Tag kept verbatim, command name upper-cased")
    void testParse_TagAndName() throws Exception {
        ImapCommand command = ImapCommand.parse("a1B login user@example.com secret");

        assertThat(command.getTag()).isEqualTo("a1B");
        assertThat(command.getName()).isEqualTo("LOGIN");
        assertThat(command.getArguments()).containsExactly("user@example.com", "secret");
    }

    @Test
    @DisplayName("Empty or whitespace line is a NOOP with tag *")
    void testParse_EmptyLine() throws Exception {
        for (String line : new String[]{null, "", "   "}) {
            ImapCommand command = ImapCommand.parse(line);
            assertThat(command.getTag()).isEqualTo("*");
            assertThat(command.getName()).isEqualTo("NOOP");
            assertThat(command.getArguments()).isEmpty();
        }
    }

    @Test
    @DisplayName("Quoted arguments keep spaces, backslash escapes inside quotes")
    void testParse_QuotedArguments() throws Exception {
        ImapCommand command = ImapCommand.parse("A2 LOGIN \"john doe\" \"pa\\\"ss\\\\word\"");

        assertThat(command.getArguments()).containsExactly("john doe", "pa\"ss\\word");
    }

    @Test
    @DisplayName("Backslash outside quotes is literal")
    void testParse_BackslashOutsideQuotes() throws Exception {
        ImapCommand command = ImapCommand.parse("A3 STORE 1 +FLAGS (\\Seen)");

        assertThat(command.getArguments()).containsExactly("1", "+FLAGS", "(\\Seen)");
        assertThat(command.getRawArguments()).isEqualTo("1 +FLAGS (\\Seen)");
    }

    @Test
    @DisplayName("Empty quoted string is an argument")
    void testParse_EmptyQuotedString() throws Exception {
        ImapCommand command = ImapCommand.parse("A4 LIST \"\" \"*\"");

        assertThat(command.getArguments()).containsExactly("", "*");
    }

    @Test
    @DisplayName("Tag without command name is rejected")
    void testParse_TagOnly() {
        assertThatThrownBy(() -> ImapCommand.parse("A5"))
                .isInstanceOf(ImapParseException.class)
                .satisfies(e -> assertThat(((ImapParseException) e).getTag()).isEqualTo("A5"));
    }

    @Test
    @DisplayName("Line over 8192 characters is rejected")
    void testParse_LineTooLong() {
        String line = "A6 NOOP " + "x".repeat(ImapCommand.MAX_LINE_LENGTH);

        assertThatThrownBy(() -> ImapCommand.parse(line)).isInstanceOf(ImapParseException.class);
    }

    @Test
    @DisplayName("More than 100 arguments is rejected")
    void testParse_TooManyArguments() {
        String line = "A7 SEARCH" + " ALL".repeat(ImapCommand.MAX_ARGUMENTS + 1);

        assertThatThrownBy(() -> ImapCommand.parse(line))
                .isInstanceOf(ImapParseException.class)
                .hasMessage("Too many arguments");
    }

    @Test
    @DisplayName("Unterminated quote is rejected")
    void testParse_UnterminatedQuote() {
        assertThatThrownBy(() -> ImapCommand.parse("A8 LOGIN \"user pass"))
                .isInstanceOf(ImapParseException.class);
    }

    @Test
    @DisplayName("UID command carries the real command as a sub-command")
    void testSubCommand_UidFetch() throws Exception {
        ImapCommand command = ImapCommand.parse("A9 UID fetch 1:* (FLAGS)");
        ImapCommand sub = command.subCommand();

        assertThat(command.getName()).isEqualTo("UID");
        assertThat(sub.getTag()).isEqualTo("A9");
        assertThat(sub.getName()).isEqualTo("FETCH");
        assertThat(sub.getRawArguments()).isEqualTo("1:* (FLAGS)");
    }

    @Test
    @DisplayName("UID without sub-command is rejected")
    void testSubCommand_Missing() throws Exception {
        ImapCommand command = ImapCommand.parse("A10 UID");

        assertThatThrownBy(command::subCommand).isInstanceOf(ImapParseException.class);
    }

    private static final String ARGUMENT_CHARS = "aZ09.@- \"\\";
    private static final String[] NAMES = {"login", "Select", "FETCH", "uid", "Search", "authenticate"};

    private static String quote(String argument) {
        return "\"" + argument.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }

    private static String randomArgument(Random random) {
        int length = random.nextInt(4) == 0 ? 0 : random.nextInt(12);
        StringBuilder argument = new StringBuilder();
        for (int i = 0; i < length; i++) {
            argument.append(ARGUMENT_CHARS.charAt(random.nextInt(ARGUMENT_CHARS.length())));
        }
        return argument.toString();
    }

    @Test
    @DisplayName("Quoted arguments with spaces, quotes, backslashes and empty strings survive parsing")
    void testParse_QuotedRoundTrip() throws Exception {
        Random random = new Random(20240305L);

        for (int run = 0; run < 500; run++) {
            String tag = "T" + run;
            String name = NAMES[random.nextInt(NAMES.length)];
            List<String> arguments = new ArrayList<>();
            int count = random.nextInt(8);
            for (int i = 0; i < count; i++) {
                arguments.add(randomArgument(random));
            }
            String line = tag + " " + name
                    + arguments.stream().map(argument -> " " + quote(argument)).collect(Collectors.joining());

            ImapCommand command = ImapCommand.parse(line);

            assertThat(command.getTag()).as(line).isEqualTo(tag);
            assertThat(command.getName()).as(line).isEqualTo(name.toUpperCase(Locale.ROOT));
            assertThat(command.getArguments()).as(line).containsExactlyElementsOf(arguments);
        }
    }
}
