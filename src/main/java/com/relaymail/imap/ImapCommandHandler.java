package com.relaymail.imap;

import com.relaymail.config.RelayMailProperties;
import com.relaymail.domain.MailboxEntry;
import com.relaymail.protocol.ConnectionRegistry;
import com.relaymail.service.AuthenticationResult;
import com.relaymail.service.MailProtocol;
import com.relaymail.service.MailboxMessageService;
import com.relaymail.service.MessageAccessException;
import com.relaymail.service.ProtocolAuthenticator;
import com.relaymail.util.CryptoUtil;
import io.micrometer.core.instrument.MeterRegistry;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.timeout.IdleStateEvent;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Netty-based IMAP4rev2 command handler, one instance per connection
 *
 * Supported commands:
 * - Any state: CAPABILITY, NOOP, LOGOUT
 * - Not authenticated: LOGIN, AUTHENTICATE PLAIN
 * - Authenticated: ENABLE, SELECT, EXAMINE, LIST, STATUS
 * - Selected: FETCH, STORE, SEARCH, EXPUNGE, CLOSE, UNSELECT
 * - UID prefix: UID FETCH, UID STORE, UID SEARCH, UID EXPUNGE
 *
 * Only INBOX exists.
 */
@Slf4j
public class ImapCommandHandler extends SimpleChannelInboundHandler<String> {

    static final String CAPABILITIES = "IMAP4rev2 AUTH=PLAIN LITERAL+ ENABLE UNSELECT UIDPLUS CHILDREN";
    static final String INBOX = "INBOX";

    private static final DateTimeFormatter INTERNAL_DATE =
            DateTimeFormatter.ofPattern("dd-MMM-yyyy HH:mm:ss Z", Locale.US).withZone(ZoneOffset.UTC);
    private static final Set<String> ENABLEABLE = Set.of("UTF8=ACCEPT", "IMAP4REV2");

    private final ImapSession session = new ImapSession();
    private final RelayMailProperties properties;
    private final ProtocolAuthenticator authenticator;
    private final MailboxMessageService mailboxService;
    private final ConnectionRegistry connectionRegistry;
    private final MeterRegistry meterRegistry;

    public ImapCommandHandler(RelayMailProperties properties,
                              ProtocolAuthenticator authenticator,
                              MailboxMessageService mailboxService,
                              ConnectionRegistry connectionRegistry,
                              MeterRegistry meterRegistry) {
        this.properties = properties;
        this.authenticator = authenticator;
        this.mailboxService = mailboxService;
        this.connectionRegistry = connectionRegistry;
        this.meterRegistry = meterRegistry;
    }

    ImapSession getSession() {
        return session;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) {
        if (ctx.channel().remoteAddress() instanceof InetSocketAddress remoteAddr && remoteAddr.getAddress() != null) {
            session.setClientIp(remoteAddr.getAddress().getHostAddress());
        }
        meterRegistry.counter("relaymail.imap.connections").increment();
        log.info("IMAP connection from: {} ({})", session.getClientIp(), session.getConnectionId());
        respond(ctx, "* OK " + properties.getServerName() + " IMAP4rev2 server ready");
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, String line) {
        session.touch();
        if (session.getState() == ImapState.LOGOUT) {
            return;
        }

        // AUTHENTICATE continuation (client sends base64 response without tag)
        if (session.getPendingAuthTag() != null) {
            log.debug("IMAP << [AUTHENTICATE response]");
            handleAuthenticateContinuation(ctx, line);
            return;
        }

        ImapCommand command;
        try {
            command = ImapCommand.parse(line);
        } catch (ImapParseException e) {
            String tag = e.getTag() != null ? e.getTag() : "*";
            // Unparsed input may carry credentials
            log.debug("IMAP << {} [unparseable: {}]", tag, e.getMessage());
            respond(ctx, tag + " BAD " + e.getMessage());
            return;
        }
        log.debug("IMAP << {}", loggableLine(command, line));

        try {
            dispatch(ctx, command, false);
        } catch (RuntimeException e) {
            log.error("IMAP command {} failed for {}", command, session.getUsername(), e);
            respond(ctx, command.getTag() + " BAD Internal server error");
        }
    }

    private void dispatch(ChannelHandlerContext ctx, ImapCommand command, boolean uidMode) {
        String tag = command.getTag();
        switch (command.getName()) {
            // === Any state ===
            case "CAPABILITY" -> handleCapability(ctx, tag);
            case "NOOP" -> respond(ctx, tag + " OK NOOP completed");
            case "LOGOUT" -> handleLogout(ctx, tag);

            // === Not authenticated ===
            case "LOGIN" -> handleLogin(ctx, command);
            case "AUTHENTICATE" -> handleAuthenticate(ctx, command);

            // === Authenticated ===
            case "ENABLE" -> handleEnable(ctx, command);
            case "SELECT" -> handleSelect(ctx, command, false);
            case "EXAMINE" -> handleSelect(ctx, command, true);
            case "LIST" -> handleList(ctx, command);
            case "STATUS" -> handleStatus(ctx, command);

            // === Selected ===
            case "FETCH" -> handleFetch(ctx, command, uidMode);
            case "STORE" -> handleStore(ctx, command, uidMode);
            case "SEARCH" -> handleSearch(ctx, command, uidMode);
            case "EXPUNGE" -> handleExpunge(ctx, command, uidMode);
            case "CLOSE" -> handleClose(ctx, tag);
            case "UNSELECT" -> handleUnselect(ctx, tag);

            case "UID" -> handleUid(ctx, command, uidMode);

            default -> respond(ctx, tag + " BAD Unknown command: " + command.getName());
        }
    }

    // ================================================================
    // Any state
    // ================================================================

    private void handleCapability(ChannelHandlerContext ctx, String tag) {
        respond(ctx, "* CAPABILITY " + CAPABILITIES);
        respond(ctx, tag + " OK CAPABILITY completed");
    }

    private void handleLogout(ChannelHandlerContext ctx, String tag) {
        if (session.getState() == ImapState.SELECTED && !session.isReadOnly()) {
            try {
                expungePending(null);
            } catch (RuntimeException e) {
                log.error("IMAP failed to apply deletions on LOGOUT for {}", session.getUsername(), e);
            }
        }
        session.setState(ImapState.LOGOUT);
        respond(ctx, "* BYE " + properties.getServerName() + " IMAP4rev2 server logging out");
        log.debug("IMAP >> {} OK LOGOUT completed", tag);
        ctx.writeAndFlush(tag + " OK LOGOUT completed\r\n").addListener(ChannelFutureListener.CLOSE);
    }

    // ================================================================
    // Not authenticated
    // ================================================================

    private void handleLogin(ChannelHandlerContext ctx, ImapCommand command) {
        String tag = command.getTag();
        if (session.getState() != ImapState.NOT_AUTHENTICATED) {
            respond(ctx, tag + " BAD Already authenticated");
            return;
        }
        List<String> args = command.getArguments();
        if (args.size() < 2) {
            respond(ctx, tag + " BAD LOGIN requires username and password");
            return;
        }
        completeAuthentication(ctx, tag, args.get(0), args.get(1), "LOGIN");
    }

    private void handleAuthenticate(ChannelHandlerContext ctx, ImapCommand command) {
        String tag = command.getTag();
        if (session.getState() != ImapState.NOT_AUTHENTICATED) {
            respond(ctx, tag + " BAD Already authenticated");
            return;
        }
        List<String> args = command.getArguments();
        if (args.isEmpty()) {
            respond(ctx, tag + " BAD Missing authentication mechanism");
            return;
        }
        if (!"PLAIN".equalsIgnoreCase(args.get(0))) {
            respond(ctx, tag + " NO Unsupported authentication mechanism");
            return;
        }

        if (args.size() > 1) {
            // SASL-IR: "=" is an empty initial response
            finishAuthenticatePlain(ctx, tag, "=".equals(args.get(1)) ? "" : args.get(1));
        } else {
            session.setPendingAuthTag(tag);
            respond(ctx, "+ ");
        }
    }

    static String loggableLine(ImapCommand command, String line) {
        String name = command.getName();
        if ("LOGIN".equals(name)) {
            return command.getTag() + " LOGIN ****";
        }
        if ("AUTHENTICATE".equals(name)) {
            List<String> args = command.getArguments();
            return args.size() > 1
                    ? command.getTag() + " AUTHENTICATE " + args.get(0) + " ****"
                    : line;
        }
        return line;
    }

    private void handleAuthenticateContinuation(ChannelHandlerContext ctx, String line) {
        String tag = session.getPendingAuthTag();
        session.setPendingAuthTag(null);

        String response = line.trim();
        if ("*".equals(response)) {
            respond(ctx, tag + " BAD Authentication cancelled");
            return;
        }
        finishAuthenticatePlain(ctx, tag, response);
    }

    private void finishAuthenticatePlain(ChannelHandlerContext ctx, String tag, String base64Credentials) {
        String[] credentials = CryptoUtil.decodeAuthPlain(base64Credentials);
        if (credentials == null) {
            respond(ctx, tag + " BAD Invalid PLAIN response");
            return;
        }
        completeAuthentication(ctx, tag, credentials[0], credentials[1], "AUTHENTICATE");
    }

    private void completeAuthentication(ChannelHandlerContext ctx, String tag, String username, String password,
                                        String commandName) {
        AuthenticationResult result = authenticator.authenticate(username, password, session.getClientIp(), MailProtocol.IMAP);
        if (!result.isAuthenticated()) {
            log.warn("IMAP {} failed for {} from {}: {}", commandName, username, session.getClientIp(), result.status());
            respond(ctx, tag + " NO Authentication failed");
            return;
        }

        String userId = result.userId();
        if (!connectionRegistry.tryAddConnection(userId, properties.getImap().getMaxConnectionsPerUser())) {
            log.warn("IMAP connection limit reached for {} from {}", username, session.getClientIp());
            respond(ctx, tag + " NO [LIMIT] Too many connections");
            return;
        }

        session.setUsername(result.user().getEmail());
        session.setUserId(userId);
        session.setState(ImapState.AUTHENTICATED);
        log.info("IMAP user authenticated: {} from {}", session.getUsername(), session.getClientIp());
        respond(ctx, tag + " OK " + commandName + " completed");
    }

    // ================================================================
    // Authenticated
    // ================================================================

    private void handleEnable(ChannelHandlerContext ctx, ImapCommand command) {
        String tag = command.getTag();
        if (!requireAuth(ctx, tag)) {
            return;
        }
        if (command.getArguments().isEmpty()) {
            respond(ctx, tag + " BAD Missing capability");
            return;
        }

        List<String> enabled = new ArrayList<>();
        for (String argument : command.getArguments()) {
            String capability = argument.toUpperCase(Locale.ROOT);
            if (ENABLEABLE.contains(capability) && session.getEnabledCapabilities().add(capability)) {
                enabled.add(capability);
            }
        }
        respond(ctx, "* ENABLED" + (enabled.isEmpty() ? "" : " " + String.join(" ", enabled)));
        respond(ctx, tag + " OK ENABLE completed");
    }

    private void handleSelect(ChannelHandlerContext ctx, ImapCommand command, boolean readOnly) {
        String tag = command.getTag();
        String commandName = readOnly ? "EXAMINE" : "SELECT";
        if (!requireAuth(ctx, tag)) {
            return;
        }
        if (command.getArguments().isEmpty()) {
            respond(ctx, tag + " BAD Missing mailbox name");
            return;
        }

        // A failed SELECT leaves no mailbox selected
        if (session.getState() == ImapState.SELECTED) {
            session.closeMailbox();
        }
        String mailboxName = command.getArguments().get(0);
        if (!INBOX.equalsIgnoreCase(mailboxName)) {
            respond(ctx, tag + " NO Mailbox does not exist");
            return;
        }

        session.selectMailbox(INBOX, readOnly, loadInbox());

        respond(ctx, "* FLAGS (" + ImapFlags.PERMANENT + ")");
        respond(ctx, "* OK [PERMANENTFLAGS (" + (readOnly ? "" : ImapFlags.PERMANENT) + ")] Permanent flags");
        respond(ctx, "* " + session.getMessages().size() + " EXISTS");
        respond(ctx, "* OK [UIDVALIDITY " + session.getUidValidity() + "] UIDs valid");
        respond(ctx, "* OK [UIDNEXT " + session.getUidNext() + "] Predicted next UID");
        respond(ctx, tag + " OK [" + (readOnly ? "READ-ONLY" : "READ-WRITE") + "] " + commandName + " completed");
    }

    private void handleList(ChannelHandlerContext ctx, ImapCommand command) {
        String tag = command.getTag();
        if (!requireAuth(ctx, tag)) {
            return;
        }
        List<String> args = command.getArguments();
        if (args.size() < 2) {
            respond(ctx, tag + " BAD LIST requires reference and mailbox pattern");
            return;
        }

        String pattern = args.get(0) + args.get(1);
        if (args.get(1).isEmpty()) {
            // Hierarchy delimiter query
            respond(ctx, "* LIST (\\Noselect) \"/\" \"\"");
        } else if (matchesMailboxPattern(pattern, INBOX)) {
            respond(ctx, "* LIST (\\HasNoChildren) \"/\" \"" + INBOX + "\"");
        }
        respond(ctx, tag + " OK LIST completed");
    }

    private void handleStatus(ChannelHandlerContext ctx, ImapCommand command) {
        String tag = command.getTag();
        if (!requireAuth(ctx, tag)) {
            return;
        }
        String raw = command.getRawArguments();
        int open = raw.indexOf('(');
        int close = raw.lastIndexOf(')');
        if (command.getArguments().isEmpty() || open < 0 || close < open) {
            respond(ctx, tag + " BAD STATUS requires mailbox and status items");
            return;
        }
        if (!INBOX.equalsIgnoreCase(command.getArguments().get(0))) {
            respond(ctx, tag + " NO Mailbox does not exist");
            return;
        }

        List<ImapMessage> messages = loadInbox();
        long uidNext = messages.stream().mapToLong(ImapMessage::getUid).max().orElse(0L) + 1;
        List<String> items = new ArrayList<>();
        for (String item : raw.substring(open + 1, close).trim().toUpperCase(Locale.ROOT).split("\\s+")) {
            switch (item) {
                case "MESSAGES" -> items.add("MESSAGES " + messages.size());
                case "UNSEEN" -> items.add("UNSEEN " + messages.stream().filter(m -> !m.hasFlag(ImapFlags.SEEN)).count());
                case "UIDNEXT" -> items.add("UIDNEXT " + uidNext);
                case "UIDVALIDITY" -> items.add("UIDVALIDITY " + session.getUidValidity());
                default -> log.debug("IMAP STATUS item ignored: {}", item);
            }
        }
        respond(ctx, "* STATUS \"" + INBOX + "\" (" + String.join(" ", items) + ")");
        respond(ctx, tag + " OK STATUS completed");
    }

    // ================================================================
    // Selected
    // ================================================================

    private void handleFetch(ChannelHandlerContext ctx, ImapCommand command, boolean uidMode) {
        String tag = command.getTag();
        if (!requireSelected(ctx, tag)) {
            return;
        }
        String[] parts = command.getRawArguments().split("\\s+", 2);
        if (parts.length < 2 || parts[1].isBlank()) {
            respond(ctx, tag + " BAD Missing fetch data items");
            return;
        }
        List<ImapMessage> targets = resolveOrReject(ctx, tag, parts[0], uidMode);
        if (targets == null) {
            return;
        }
        List<String> items = parseFetchItems(parts[1]);

        boolean failed = false;
        for (ImapMessage message : targets) {
            try {
                ctx.write(buildFetchResponse(message, items, uidMode));
                log.debug("IMAP >> * {} FETCH (...) uid={}", message.getSequenceNumber(), message.getUid());
            } catch (MessageAccessException e) {
                log.warn("IMAP FETCH of {} failed for {}: {}", message.getEmailId(), session.getUsername(), e.getMessage());
                failed = true;
            }
        }
        ctx.flush();
        respond(ctx, tag + (failed ? " NO Some messages could not be fetched" : " OK FETCH completed"));
    }

    private String buildFetchResponse(ImapMessage message, List<String> items, boolean uidMode) {
        List<String> out = new ArrayList<>();
        String rendered = null;
        boolean setSeen = false;

        if (uidMode || items.contains("UID")) {
            out.add("UID " + message.getUid());
        }
        for (String item : items) {
            switch (item) {
                case "UID" -> { }
                case "FLAGS" -> out.add("FLAGS (" + ImapFlags.toImapString(message.getFlags()) + ")");
                case "INTERNALDATE" -> out.add("INTERNALDATE \"" + formatInternalDate(message) + "\"");
                case "RFC822.SIZE" -> out.add("RFC822.SIZE " + message.getSizeBytes());
                case "ENVELOPE" -> out.add("ENVELOPE NIL");
                case "BODY[]", "BODY.PEEK[]", "RFC822" -> {
                    if (rendered == null) {
                        rendered = mailboxService.renderMessage(message.getEmailId(), session.getUserId());
                    }
                    out.add(("RFC822".equals(item) ? "RFC822" : "BODY[]") + " " + literal(rendered));
                    setSeen |= !item.contains("PEEK");
                }
                case "BODY[HEADER]", "BODY.PEEK[HEADER]", "RFC822.HEADER" -> {
                    String headers = mailboxService.renderHeaders(message.getEmailId(), session.getUserId()) + "\r\n\r\n";
                    out.add(("RFC822.HEADER".equals(item) ? "RFC822.HEADER" : "BODY[HEADER]") + " " + literal(headers));
                    setSeen |= "BODY[HEADER]".equals(item);
                }
                case "BODY[TEXT]", "BODY.PEEK[TEXT]" -> {
                    if (rendered == null) {
                        rendered = mailboxService.renderMessage(message.getEmailId(), session.getUserId());
                    }
                    int headerEnd = rendered.indexOf("\r\n\r\n");
                    out.add("BODY[TEXT] " + literal(headerEnd < 0 ? "" : rendered.substring(headerEnd + 4)));
                    setSeen |= "BODY[TEXT]".equals(item);
                }
                default -> log.debug("IMAP FETCH item ignored: {}", item);
            }
        }

        if (setSeen && !session.isReadOnly() && !message.hasFlag(ImapFlags.SEEN)) {
            mailboxService.markSeen(message.getEmailId(), session.getUserId());
            message.setFlags(message.getFlags() | ImapFlags.SEEN);
            if (!items.contains("FLAGS")) {
                out.add("FLAGS (" + ImapFlags.toImapString(message.getFlags()) + ")");
            }
        }
        return "* " + message.getSequenceNumber() + " FETCH (" + String.join(" ", out) + ")\r\n";
    }

    private void handleStore(ChannelHandlerContext ctx, ImapCommand command, boolean uidMode) {
        String tag = command.getTag();
        if (!requireSelected(ctx, tag)) {
            return;
        }
        if (session.isReadOnly()) {
            respond(ctx, tag + " NO Mailbox is read-only");
            return;
        }

        // STORE <sequence set> (+|-)FLAGS[.SILENT] (flags)
        String[] parts = command.getRawArguments().split("\\s+", 3);
        if (parts.length < 3) {
            respond(ctx, tag + " BAD Syntax error in STORE arguments");
            return;
        }
        String action = parts[1].toUpperCase(Locale.ROOT);
        boolean silent = action.endsWith(".SILENT");
        String operation = silent ? action.substring(0, action.length() - ".SILENT".length()) : action;
        if (!operation.equals("FLAGS") && !operation.equals("+FLAGS") && !operation.equals("-FLAGS")) {
            respond(ctx, tag + " BAD Unknown STORE action: " + parts[1]);
            return;
        }
        List<ImapMessage> targets = resolveOrReject(ctx, tag, parts[0], uidMode);
        if (targets == null) {
            return;
        }
        int requested = ImapFlags.parse(parts[2]) & ~ImapFlags.RECENT;

        boolean limitReached = false;
        for (ImapMessage message : targets) {
            int current = message.getFlags();
            int updated = switch (operation) {
                case "+FLAGS" -> current | requested;
                case "-FLAGS" -> current & ~requested;
                default -> (current & ImapFlags.RECENT) | requested;
            };

            if (ImapFlags.has(updated, ImapFlags.DELETED)) {
                if (!session.markDeleted(message.getUid())) {
                    limitReached = true;
                    continue;
                }
            } else {
                session.unmarkDeleted(message.getUid());
            }

            mailboxService.updateFlags(message.getEmailId(), session.getUserId(), updated);
            message.setFlags(updated);

            if (!silent) {
                respond(ctx, "* " + message.getSequenceNumber() + " FETCH ("
                        + (uidMode ? "UID " + message.getUid() + " " : "")
                        + "FLAGS (" + ImapFlags.toImapString(updated) + "))");
            }
        }

        if (limitReached) {
            respond(ctx, tag + " NO [LIMIT] Too many messages marked for deletion");
        } else {
            respond(ctx, tag + " OK STORE completed");
        }
    }

    private void handleSearch(ChannelHandlerContext ctx, ImapCommand command, boolean uidMode) {
        String tag = command.getTag();
        if (!requireSelected(ctx, tag)) {
            return;
        }

        List<String> criteria = command.getArguments().stream()
                .map(c -> c.toUpperCase(Locale.ROOT))
                .collect(Collectors.toList());
        if (criteria.size() >= 2 && "CHARSET".equals(criteria.get(0))) {
            criteria = criteria.subList(2, criteria.size());
        }
        for (String criterion : criteria) {
            if (!isSupportedSearchKey(criterion)) {
                respond(ctx, tag + " BAD Unsupported search criteria: " + criterion);
                return;
            }
        }
        boolean includeDeleted = criteria.contains("DELETED");

        List<String> matches = new ArrayList<>();
        for (ImapMessage message : session.getMessages()) {
            if (!includeDeleted && session.isPendingDeletion(message.getUid())) {
                continue;
            }
            if (criteria.stream().allMatch(c -> matchesSearchKey(message, c))) {
                matches.add(String.valueOf(uidMode ? message.getUid() : message.getSequenceNumber()));
            }
        }
        respond(ctx, "* SEARCH" + (matches.isEmpty() ? "" : " " + String.join(" ", matches)));
        respond(ctx, tag + " OK SEARCH completed");
    }

    private void handleExpunge(ChannelHandlerContext ctx, ImapCommand command, boolean uidMode) {
        String tag = command.getTag();
        if (!requireSelected(ctx, tag)) {
            return;
        }
        if (session.isReadOnly()) {
            respond(ctx, tag + " NO Mailbox is read-only");
            return;
        }

        Set<Long> restrictTo = null;
        if (uidMode) {
            List<ImapMessage> targets = resolveOrReject(ctx, tag, command.getRawArguments(), true);
            if (targets == null) {
                return;
            }
            restrictTo = targets.stream().map(ImapMessage::getUid).collect(Collectors.toSet());
        }

        for (int sequence : expungePending(restrictTo)) {
            respond(ctx, "* " + sequence + " EXPUNGE");
        }
        respond(ctx, tag + " OK EXPUNGE completed");
    }

    private void handleClose(ChannelHandlerContext ctx, String tag) {
        if (!requireSelected(ctx, tag)) {
            return;
        }
        // CLOSE: expunge without EXPUNGE responses, then close mailbox
        if (!session.isReadOnly()) {
            expungePending(null);
        }
        session.closeMailbox();
        respond(ctx, tag + " OK CLOSE completed");
    }

    private void handleUnselect(ChannelHandlerContext ctx, String tag) {
        if (!requireSelected(ctx, tag)) {
            return;
        }
        session.closeMailbox();
        respond(ctx, tag + " OK UNSELECT completed");
    }

    private void handleUid(ChannelHandlerContext ctx, ImapCommand command, boolean uidMode) {
        String tag = command.getTag();
        if (uidMode) {
            respond(ctx, tag + " BAD Invalid UID command");
            return;
        }
        ImapCommand subCommand;
        try {
            subCommand = command.subCommand();
        } catch (ImapParseException e) {
            respond(ctx, tag + " BAD " + e.getMessage());
            return;
        }
        switch (subCommand.getName()) {
            case "FETCH", "STORE", "SEARCH", "EXPUNGE" -> dispatch(ctx, subCommand, true);
            default -> respond(ctx, tag + " BAD Invalid UID command: " + subCommand.getName());
        }
    }

    // ================================================================
    // Helper methods
    // ================================================================

    private boolean requireAuth(ChannelHandlerContext ctx, String tag) {
        if (!session.isAuthenticated()) {
            respond(ctx, tag + " NO Not authenticated");
            return false;
        }
        return true;
    }

    private boolean requireSelected(ChannelHandlerContext ctx, String tag) {
        if (!session.isAuthenticated()) {
            respond(ctx, tag + " BAD Not authenticated");
            return false;
        }
        if (session.getState() != ImapState.SELECTED) {
            respond(ctx, tag + " BAD No mailbox selected");
            return false;
        }
        return true;
    }

    private List<ImapMessage> loadInbox() {
        List<MailboxEntry> entries = mailboxService.loadMessages(
                session.getUserId(), properties.getImap().getMaxMessagesPerSession());
        return entries.stream()
                .map(entry -> ImapMessage.builder()
                        .uid(ImapMessage.uidFor(entry.getEmailId()))
                        .emailId(entry.getEmailId())
                        .sizeBytes(entry.getSizeBytes())
                        .messageId(entry.getMessageId())
                        .flags(entry.getFlags())
                        .internalDate(entry.getReceivedAt())
                        .build())
                .collect(Collectors.toList());
    }

    /**
     * Delete messages pending expunge through the store and drop them from the view
     *
     * @param restrictTo only expunge these UIDs (UID EXPUNGE), or null for all
     * @return expunged sequence numbers, highest first
     */
    private List<Integer> expungePending(Set<Long> restrictTo) {
        Set<Long> uids = new LinkedHashSet<>(session.getDeletedUids());
        if (restrictTo != null) {
            uids.retainAll(restrictTo);
        }
        if (uids.isEmpty()) {
            return List.of();
        }
        List<String> emailIds = session.getMessages().stream()
                .filter(m -> uids.contains(m.getUid()))
                .map(ImapMessage::getEmailId)
                .collect(Collectors.toList());
        mailboxService.applyDeletions(emailIds);
        log.info("IMAP expunged {} messages for {}", emailIds.size(), session.getUsername());
        return session.removeMessages(uids);
    }

    private List<ImapMessage> resolveOrReject(ChannelHandlerContext ctx, String tag, String sequenceSet, boolean uidMode) {
        try {
            return resolveSequenceSet(sequenceSet, uidMode);
        } catch (ImapParseException e) {
            respond(ctx, tag + " BAD Invalid sequence set");
            return null;
        }
    }

    /**
     * n, n:m, * and comma lists in sequence or UID numbers. Unknown numbers are skipped.
     */
    List<ImapMessage> resolveSequenceSet(String sequenceSet, boolean uidMode) throws ImapParseException {
        if (sequenceSet == null || sequenceSet.isBlank()) {
            throw new ImapParseException("Invalid sequence set");
        }
        Map<Integer, ImapMessage> result = new TreeMap<>();
        List<ImapMessage> messages = session.getMessages();

        for (String part : sequenceSet.trim().split(",", -1)) {
            String[] range = part.split(":", -1);
            if (range.length > 2) {
                throw new ImapParseException("Invalid sequence set");
            }
            long start = parseSequenceNumber(range[0], uidMode);
            long end = range.length == 2 ? parseSequenceNumber(range[1], uidMode) : start;
            if (start > end) {
                long tmp = start;
                start = end;
                end = tmp;
            }
            for (ImapMessage message : messages) {
                long value = uidMode ? message.getUid() : message.getSequenceNumber();
                if (value >= start && value <= end) {
                    result.put(message.getSequenceNumber(), message);
                }
            }
        }
        return new ArrayList<>(result.values());
    }

    private long parseSequenceNumber(String s, boolean uidMode) throws ImapParseException {
        if ("*".equals(s)) {
            return uidMode ? session.getMaxUid() : session.getMessages().size();
        }
        try {
            long number = Long.parseLong(s);
            if (number <= 0) {
                throw new ImapParseException("Invalid sequence set");
            }
            return number;
        } catch (NumberFormatException e) {
            throw new ImapParseException("Invalid sequence set");
        }
    }

    /**
     * "(FLAGS BODY.PEEK[HEADER])" into upper-cased item names. ALL and FAST are expanded.
     */
    static List<String> parseFetchItems(String raw) {
        String items = raw.trim();
        if (items.startsWith("(") && items.endsWith(")")) {
            items = items.substring(1, items.length() - 1);
        }
        List<String> result = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int depth = 0;
        for (char c : items.toCharArray()) {
            if (c == '[' || c == '(') {
                depth++;
            } else if ((c == ']' || c == ')') && depth > 0) {
                depth--;
            }
            if (c == ' ' && depth == 0) {
                if (current.length() > 0) {
                    result.add(current.toString().toUpperCase(Locale.ROOT));
                    current.setLength(0);
                }
            } else {
                current.append(c);
            }
        }
        if (current.length() > 0) {
            result.add(current.toString().toUpperCase(Locale.ROOT));
        }

        List<String> expanded = new ArrayList<>();
        for (String item : result) {
            switch (item) {
                case "ALL" -> expanded.addAll(List.of("FLAGS", "INTERNALDATE", "RFC822.SIZE", "ENVELOPE"));
                case "FAST" -> expanded.addAll(List.of("FLAGS", "INTERNALDATE", "RFC822.SIZE"));
                default -> expanded.add(item);
            }
        }
        return expanded;
    }

    private static boolean isSupportedSearchKey(String key) {
        return switch (key) {
            case "ALL", "SEEN", "UNSEEN", "DELETED", "UNDELETED", "FLAGGED", "UNFLAGGED", "ANSWERED", "UNANSWERED" -> true;
            default -> false;
        };
    }

    private boolean matchesSearchKey(ImapMessage message, String key) {
        boolean deleted = session.isPendingDeletion(message.getUid());
        return switch (key) {
            case "SEEN" -> message.hasFlag(ImapFlags.SEEN);
            case "UNSEEN" -> !message.hasFlag(ImapFlags.SEEN);
            case "DELETED" -> deleted;
            case "UNDELETED" -> !deleted;
            case "FLAGGED" -> message.hasFlag(ImapFlags.FLAGGED);
            case "UNFLAGGED" -> !message.hasFlag(ImapFlags.FLAGGED);
            case "ANSWERED" -> message.hasFlag(ImapFlags.ANSWERED);
            case "UNANSWERED" -> !message.hasFlag(ImapFlags.ANSWERED);
            default -> true;
        };
    }

    /**
     * LIST pattern match: * matches anything, % anything but the delimiter
     */
    static boolean matchesMailboxPattern(String pattern, String mailbox) {
        StringBuilder regex = new StringBuilder();
        for (char c : pattern.toCharArray()) {
            switch (c) {
                case '*' -> regex.append(".*");
                case '%' -> regex.append("[^/]*");
                default -> regex.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return Pattern.compile(regex.toString(), Pattern.CASE_INSENSITIVE).matcher(mailbox).matches();
    }

    private static String literal(String content) {
        return "{" + content.getBytes(StandardCharsets.UTF_8).length + "}\r\n" + content;
    }

    private static String formatInternalDate(ImapMessage message) {
        return message.getInternalDate() != null ? INTERNAL_DATE.format(message.getInternalDate()) : "01-Jan-1970 00:00:00 +0000";
    }

    private void respond(ChannelHandlerContext ctx, String response) {
        log.debug("IMAP >> {}", response);
        ctx.writeAndFlush(response + "\r\n");
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt instanceof IdleStateEvent) {
            log.info("IMAP session timed out: {} ({})", session.getClientIp(), session.getUsername());
            session.setState(ImapState.LOGOUT);
            ctx.writeAndFlush("* BYE Session timed out\r\n").addListener(ChannelFutureListener.CLOSE);
            return;
        }
        super.userEventTriggered(ctx, evt);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        String ip = session.getClientIp();
        String msg = cause.getMessage();
        if (cause instanceof javax.net.ssl.SSLHandshakeException
                || cause.getCause() instanceof javax.net.ssl.SSLHandshakeException) {
            log.warn("IMAP TLS handshake failed from {}: {}", ip, msg);
        } else if (cause instanceof IOException) {
            log.debug("IMAP connection reset from {}: {}", ip, msg);
        } else {
            log.error("IMAP error from {}: {}", ip, msg, cause);
        }
        ctx.close();
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        if (session.isAuthenticated()) {
            connectionRegistry.removeConnection(session.getUserId());
        }
        log.info("IMAP connection closed: {} ({})", session.getClientIp(), session.getConnectionId());
        super.channelInactive(ctx);
    }
}
