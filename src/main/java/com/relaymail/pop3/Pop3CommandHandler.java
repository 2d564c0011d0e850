package com.relaymail.pop3;

import com.relaymail.config.RelayMailProperties;
import com.relaymail.domain.MailboxEntry;
import com.relaymail.protocol.ConnectionRegistry;
import com.relaymail.service.AuthenticationResult;
import com.relaymail.service.MailProtocol;
import com.relaymail.service.MailboxMessageService;
import com.relaymail.service.ProtocolAuthenticator;
import io.micrometer.core.instrument.MeterRegistry;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.timeout.IdleStateEvent;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Netty-based POP3 command handler (RFC 1939), one instance per connection
 *
 * - AUTHORIZATION: USER, PASS, CAPA, QUIT
 * - TRANSACTION: STAT, LIST, RETR, DELE, NOOP, RSET, UIDL, TOP, CAPA, QUIT
 *
 * Deletions are committed only by QUIT from TRANSACTION.
 */
@Slf4j
public class Pop3CommandHandler extends SimpleChannelInboundHandler<String> {

    private final Pop3Session session = new Pop3Session();
    private final RelayMailProperties properties;
    private final ProtocolAuthenticator authenticator;
    private final MailboxMessageService mailboxService;
    private final ConnectionRegistry connectionRegistry;
    private final MeterRegistry meterRegistry;

    public Pop3CommandHandler(RelayMailProperties properties,
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

    Pop3Session getSession() {
        return session;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) {
        if (ctx.channel().remoteAddress() instanceof InetSocketAddress remoteAddr && remoteAddr.getAddress() != null) {
            session.setClientIp(remoteAddr.getAddress().getHostAddress());
        }
        meterRegistry.counter("relaymail.pop3.connections").increment();
        log.info("POP3 connection from: {} ({})", session.getClientIp(), session.getConnectionId());
        respond(ctx, "+OK " + properties.getServerName() + " POP3 server ready");
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, String msg) {
        session.touch();
        if (session.getState() == Pop3State.UPDATE) {
            return;
        }

        String line = msg.trim();
        int space = line.indexOf(' ');
        String command = (space < 0 ? line : line.substring(0, space)).toUpperCase(Locale.ROOT);
        String args = space < 0 ? "" : line.substring(space + 1).trim();
        log.debug("POP3 << {}", "PASS".equals(command) ? "PASS ****" : line);

        try {
            switch (command) {
                case "USER" -> handleUser(ctx, args);
                case "PASS" -> handlePass(ctx, args);
                case "CAPA" -> handleCapa(ctx);
                case "QUIT" -> handleQuit(ctx);
                case "STAT" -> { if (requireTransaction(ctx)) handleStat(ctx); }
                case "LIST" -> { if (requireTransaction(ctx)) handleList(ctx, args); }
                case "RETR" -> { if (requireTransaction(ctx)) handleRetr(ctx, args); }
                case "DELE" -> { if (requireTransaction(ctx)) handleDele(ctx, args); }
                case "NOOP" -> { if (requireTransaction(ctx)) respond(ctx, "+OK"); }
                case "RSET" -> { if (requireTransaction(ctx)) handleRset(ctx); }
                case "UIDL" -> { if (requireTransaction(ctx)) handleUidl(ctx, args); }
                case "TOP" -> { if (requireTransaction(ctx)) handleTop(ctx, args); }
                default -> respond(ctx, "-ERR Unknown command");
            }
        } catch (RuntimeException e) {
            log.error("POP3 command {} failed for {}", command, session.getUsername(), e);
            respond(ctx, "-ERR Internal server error");
        }
    }

    // ================================================================
    // AUTHORIZATION
    // ================================================================

    private void handleUser(ChannelHandlerContext ctx, String args) {
        if (session.getState() != Pop3State.AUTHORIZATION) {
            respond(ctx, "-ERR Already authenticated");
            return;
        }
        if (args.isEmpty()) {
            respond(ctx, "-ERR Missing username");
            return;
        }
        session.setPendingUsername(args);
        respond(ctx, "+OK User accepted");
    }

    private void handlePass(ChannelHandlerContext ctx, String args) {
        if (session.getState() != Pop3State.AUTHORIZATION) {
            respond(ctx, "-ERR Already authenticated");
            return;
        }
        String username = session.getPendingUsername();
        if (username == null) {
            respond(ctx, "-ERR USER required first");
            return;
        }
        session.setPendingUsername(null);

        AuthenticationResult result = authenticator.authenticate(username, args, session.getClientIp(), MailProtocol.POP3);
        if (!result.isAuthenticated()) {
            log.warn("POP3 login failed for {} from {}: {}", username, session.getClientIp(), result.status());
            respond(ctx, "-ERR Authentication failed");
            return;
        }

        String userId = result.userId();
        if (!connectionRegistry.tryAddConnection(userId, properties.getPop3().getMaxConnectionsPerUser())) {
            log.warn("POP3 connection limit reached for {} from {}", username, session.getClientIp());
            respond(ctx, "-ERR [IN-USE] Too many connections");
            return;
        }

        List<MailboxEntry> entries;
        try {
            entries = mailboxService.loadMessages(userId, properties.getPop3().getMaxMessagesPerSession());
        } catch (RuntimeException e) {
            // The session stays in AUTHORIZATION, so it must not keep the slot
            connectionRegistry.removeConnection(userId);
            throw e;
        }
        session.setUsername(result.user().getEmail());
        session.setUserId(userId);
        List<Pop3Message> messages = new ArrayList<>();
        for (MailboxEntry entry : entries) {
            messages.add(new Pop3Message(messages.size() + 1, entry.getEmailId(), entry.getSizeBytes()));
        }
        session.setMessages(messages);
        session.setState(Pop3State.TRANSACTION);

        log.info("POP3 user authenticated: {} from {}", session.getUsername(), session.getClientIp());
        respond(ctx, "+OK Logged in, " + messages.size() + " messages");
    }

    private void handleCapa(ChannelHandlerContext ctx) {
        respond(ctx, "+OK Capability list follows");
        respond(ctx, "USER");
        respond(ctx, "UIDL");
        respond(ctx, "TOP");
        respond(ctx, "PIPELINING");
        respond(ctx, ".");
    }

    private void handleQuit(ChannelHandlerContext ctx) {
        String reply = "+OK Goodbye";
        if (session.getState() == Pop3State.TRANSACTION) {
            session.setState(Pop3State.UPDATE);
            List<String> deleted = session.getDeletedEmailIds();
            if (!deleted.isEmpty()) {
                try {
                    mailboxService.applyDeletions(deleted);
                    log.info("POP3 deleted {} messages for {}", deleted.size(), session.getUsername());
                } catch (RuntimeException e) {
                    log.error("POP3 failed to delete messages for {}", session.getUsername(), e);
                    reply = "-ERR Some deleted messages not removed";
                }
            }
        } else {
            session.setState(Pop3State.UPDATE);
        }
        log.debug("POP3 >> {}", reply);
        ctx.writeAndFlush(reply + "\r\n").addListener(ChannelFutureListener.CLOSE);
    }

    // ================================================================
    // TRANSACTION
    // ================================================================

    private void handleStat(ChannelHandlerContext ctx) {
        List<Pop3Message> active = session.getActiveMessages();
        respond(ctx, "+OK " + active.size() + " " + totalSize(active));
    }

    private void handleList(ChannelHandlerContext ctx, String args) {
        if (!args.isEmpty()) {
            Pop3Message message = findMessage(ctx, args);
            if (message != null) {
                respond(ctx, "+OK " + message.getNumber() + " " + message.getSizeBytes());
            }
            return;
        }
        List<Pop3Message> active = session.getActiveMessages();
        StringBuilder out = new StringBuilder("+OK " + active.size() + " messages (" + totalSize(active) + " octets)\r\n");
        for (Pop3Message message : active) {
            out.append(message.getNumber()).append(' ').append(message.getSizeBytes()).append("\r\n");
        }
        out.append(".");
        respond(ctx, out.toString());
    }

    private void handleRetr(ChannelHandlerContext ctx, String args) {
        Pop3Message message = findMessage(ctx, args);
        if (message == null) {
            return;
        }
        String content = mailboxService.renderMessage(message.getEmailId(), session.getUserId());
        int octets = content.getBytes(StandardCharsets.UTF_8).length;
        log.debug("POP3 >> +OK {} octets (message {})", octets, message.getNumber());
        ctx.writeAndFlush("+OK " + octets + " octets\r\n" + dotStuff(content) + ".\r\n");
    }

    private void handleDele(ChannelHandlerContext ctx, String args) {
        Integer number = parseNumber(args);
        if (number == null || session.getMessage(number) == null) {
            respond(ctx, "-ERR No such message");
            return;
        }
        if (session.isDeleted(number)) {
            respond(ctx, "-ERR Message already deleted");
            return;
        }
        if (!session.markDeleted(number)) {
            respond(ctx, "-ERR Too many deleted messages");
            return;
        }
        respond(ctx, "+OK Message " + number + " deleted");
    }

    private void handleRset(ChannelHandlerContext ctx) {
        session.resetDeletions();
        List<Pop3Message> active = session.getActiveMessages();
        respond(ctx, "+OK Maildrop has " + active.size() + " messages (" + totalSize(active) + " octets)");
    }

    private void handleUidl(ChannelHandlerContext ctx, String args) {
        if (!args.isEmpty()) {
            Pop3Message message = findMessage(ctx, args);
            if (message != null) {
                respond(ctx, "+OK " + message.getNumber() + " " + message.getEmailId());
            }
            return;
        }
        StringBuilder out = new StringBuilder("+OK\r\n");
        for (Pop3Message message : session.getActiveMessages()) {
            out.append(message.getNumber()).append(' ').append(message.getEmailId()).append("\r\n");
        }
        out.append(".");
        respond(ctx, out.toString());
    }

    private void handleTop(ChannelHandlerContext ctx, String args) {
        String[] parts = args.split("\\s+");
        Integer lines = parts.length == 2 ? parseCount(parts[1]) : null;
        if (lines == null) {
            respond(ctx, "-ERR Usage: TOP msg lines");
            return;
        }
        Pop3Message message = findMessage(ctx, parts[0]);
        if (message == null) {
            return;
        }
        String top = mailboxService.renderTop(message.getEmailId(), session.getUserId(), lines);
        log.debug("POP3 >> +OK Top of message {} follows", message.getNumber());
        ctx.writeAndFlush("+OK Top of message follows\r\n" + dotStuff(top) + ".\r\n");
    }

    // ================================================================
    // Helper methods
    // ================================================================

    private boolean requireTransaction(ChannelHandlerContext ctx) {
        if (session.getState() != Pop3State.TRANSACTION) {
            respond(ctx, "-ERR Not authenticated");
            return false;
        }
        return true;
    }

    /**
     * Looks up a message that is not marked deleted, answering -ERR otherwise
     */
    private Pop3Message findMessage(ChannelHandlerContext ctx, String arg) {
        Integer number = parseNumber(arg);
        Pop3Message message = number != null ? session.getMessage(number) : null;
        if (message == null) {
            respond(ctx, "-ERR No such message");
            return null;
        }
        if (session.isDeleted(number)) {
            respond(ctx, "-ERR Message already deleted");
            return null;
        }
        return message;
    }

    private static Integer parseNumber(String arg) {
        Integer number = parseCount(arg);
        return number != null && number > 0 ? number : null;
    }

    private static Integer parseCount(String arg) {
        try {
            int value = Integer.parseInt(arg.trim());
            return value >= 0 ? value : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static long totalSize(List<Pop3Message> messages) {
        return messages.stream().mapToLong(Pop3Message::getSizeBytes).sum();
    }

    /**
     * Byte-stuff lines starting with "." and end with CRLF, ready for the terminating "."
     */
    static String dotStuff(String content) {
        String normalized = content.replace("\r\n", "\n").replace("\n", "\r\n");
        if (normalized.endsWith("\r\n")) {
            normalized = normalized.substring(0, normalized.length() - 2);
        }
        StringBuilder out = new StringBuilder(normalized.length() + 16);
        for (String line : normalized.split("\r\n", -1)) {
            if (line.startsWith(".")) {
                out.append('.');
            }
            out.append(line).append("\r\n");
        }
        return out.toString();
    }

    private void respond(ChannelHandlerContext ctx, String response) {
        log.debug("POP3 >> {}", response);
        ctx.writeAndFlush(response + "\r\n");
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt instanceof IdleStateEvent) {
            // Timeout is not QUIT: pending deletions are dropped
            log.info("POP3 session timed out: {} ({})", session.getClientIp(), session.getUsername());
            session.setState(Pop3State.UPDATE);
            ctx.writeAndFlush("-ERR Session timed out\r\n").addListener(ChannelFutureListener.CLOSE);
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
            log.warn("POP3 TLS handshake failed from {}: {}", ip, msg);
        } else if (cause instanceof IOException) {
            log.debug("POP3 connection reset from {}: {}", ip, msg);
        } else {
            log.error("POP3 error from {}: {}", ip, msg, cause);
        }
        ctx.close();
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        if (session.isAuthenticated()) {
            connectionRegistry.removeConnection(session.getUserId());
        }
        if (session.getState() == Pop3State.TRANSACTION && !session.getDeletedNumbers().isEmpty()) {
            log.info("POP3 connection dropped without QUIT, {} deletions discarded for {}",
                    session.getDeletedNumbers().size(), session.getUsername());
        }
        log.info("POP3 connection closed: {} ({})", session.getClientIp(), session.getConnectionId());
        super.channelInactive(ctx);
    }
}
