package com.relaymail.pop3;

import com.relaymail.config.RelayMailProperties;
import com.relaymail.domain.MailboxEntry;
import com.relaymail.domain.User;
import com.relaymail.protocol.ConnectionRegistry;
import com.relaymail.service.AuthenticationResult;
import com.relaymail.service.MailProtocol;
import com.relaymail.service.MailboxMessageService;
import com.relaymail.service.ProtocolAuthenticator;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.timeout.IdleStateEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * POP3 command handler tests over an EmbeddedChannel
 */
@ExtendWith(MockitoExtension.class)
class Pop3CommandHandlerTest {

    private static final String USER_ID = "user-1";
    private static final String EMAIL = "user@example.com";

    @Mock
    private ProtocolAuthenticator authenticator;

    @Mock
    private MailboxMessageService mailboxService;

    private RelayMailProperties properties;
    private ConnectionRegistry connectionRegistry;
    private Pop3CommandHandler handler;
    private EmbeddedChannel channel;

    @BeforeEach
    void setUp() {
        properties = new RelayMailProperties();
        properties.setServerName("mail.example.com");
        connectionRegistry = new ConnectionRegistry("POP3");
        handler = new Pop3CommandHandler(properties, authenticator, mailboxService, connectionRegistry,
                new SimpleMeterRegistry());
        channel = new EmbeddedChannel(handler);
    }

    private String readAll() {
        StringBuilder out = new StringBuilder();
        Object msg;
        while ((msg = channel.readOutbound()) != null) {
            out.append(msg);
        }
        return out.toString();
    }

    private String send(String line) {
        channel.writeInbound(line);
        return readAll();
    }

    private void login() {
        User user = User.builder().id(USER_ID).email(EMAIL).build();
        when(authenticator.authenticate(EMAIL, "secret", "unknown", MailProtocol.POP3))
                .thenReturn(AuthenticationResult.success(user, "key-1"));
        when(mailboxService.loadMessages(USER_ID, 1000)).thenReturn(List.of(
                MailboxEntry.builder().emailId("email-a").sizeBytes(100).build(),
                MailboxEntry.builder().emailId("email-b").sizeBytes(250).build()));
        readAll();
        send("USER " + EMAIL);
        assertThat(send("PASS secret")).isEqualTo("+OK Logged in, 2 messages\r\n");
    }

    @Test
    @DisplayName("Greeting on connect")
    void testChannelActive_Greeting() {
        assertThat(readAll()).isEqualTo("+OK mail.example.com POP3 server ready\r\n");
    }

    @Test
    @DisplayName("USER / PASS success moves to TRANSACTION")
    void testLogin_Success() {
        login();

        assertThat(handler.getSession().getState()).isEqualTo(Pop3State.TRANSACTION);
        assertThat(connectionRegistry.getConnectionCount(USER_ID)).isEqualTo(1);
    }

    @Test
    @DisplayName("Wrong secret is a generic failure")
    void testLogin_Failure() {
        when(authenticator.authenticate(EMAIL, "wrong", "unknown", MailProtocol.POP3))
                .thenReturn(AuthenticationResult.notFound());
        readAll();

        assertThat(send("USER " + EMAIL)).isEqualTo("+OK User accepted\r\n");
        assertThat(send("PASS wrong")).isEqualTo("-ERR Authentication failed\r\n");
        assertThat(handler.getSession().getState()).isEqualTo(Pop3State.AUTHORIZATION);
    }

    @Test
    @DisplayName("Store failure during login releases the connection slot")
    void testLogin_LoadFailureReleasesSlot() {
        User user = User.builder().id(USER_ID).email(EMAIL).build();
        when(authenticator.authenticate(EMAIL, "secret", "unknown", MailProtocol.POP3))
                .thenReturn(AuthenticationResult.success(user, "key-1"));
        when(mailboxService.loadMessages(USER_ID, 1000))
                .thenThrow(new IllegalStateException("store down"))
                .thenReturn(List.of());
        readAll();

        send("USER " + EMAIL);
        assertThat(send("PASS secret")).isEqualTo("-ERR Internal server error\r\n");
        assertThat(handler.getSession().getState()).isEqualTo(Pop3State.AUTHORIZATION);
        assertThat(handler.getSession().isAuthenticated()).isFalse();
        assertThat(connectionRegistry.getConnectionCount(USER_ID)).isZero();

        send("USER " + EMAIL);
        assertThat(send("PASS secret")).isEqualTo("+OK Logged in, 0 messages\r\n");
        assertThat(connectionRegistry.getConnectionCount(USER_ID)).isEqualTo(1);

        channel.close();
        assertThat(connectionRegistry.getConnectionCount(USER_ID)).isZero();
    }

    @Test
    @DisplayName("Transaction commands before login")
    void testStat_NotAuthenticated() {
        readAll();

        assertThat(send("STAT")).isEqualTo("-ERR Not authenticated\r\n");
    }

    @Test
    @DisplayName("USER after login")
    void testUser_AlreadyAuthenticated() {
        login();

        assertThat(send("USER other@example.com")).isEqualTo("-ERR Already authenticated\r\n");
    }

    @Test
    @DisplayName("STAT and LIST skip messages marked deleted")
    void testStatAndList() {
        login();

        assertThat(send("STAT")).isEqualTo("+OK 2 350\r\n");
        assertThat(send("DELE 1")).isEqualTo("+OK Message 1 deleted\r\n");
        assertThat(send("STAT")).isEqualTo("+OK 1 250\r\n");
        assertThat(send("LIST")).isEqualTo("+OK 1 messages (250 octets)\r\n2 250\r\n.\r\n");
        assertThat(send("LIST 2")).isEqualTo("+OK 2 250\r\n");
        assertThat(send("LIST 9")).isEqualTo("-ERR No such message\r\n");
    }

    @Test
    @DisplayName("DELE twice and DELE of an unknown message")
    void testDele_Errors() {
        login();
        send("DELE 2");

        assertThat(send("DELE 2")).isEqualTo("-ERR Message already deleted\r\n");
        assertThat(send("DELE 3")).isEqualTo("-ERR No such message\r\n");
        assertThat(send("DELE x")).isEqualTo("-ERR No such message\r\n");
    }

    @Test
    @DisplayName("RETR byte-stuffs lines starting with a dot")
    void testRetr_DotStuffing() {
        login();
        String message = "Subject: dots\r\n\r\n.hidden\r\nnormal\r\n";
        when(mailboxService.renderMessage("email-a", USER_ID)).thenReturn(message);

        String response = send("RETR 1");

        assertThat(response).isEqualTo("+OK " + message.getBytes(StandardCharsets.UTF_8).length + " octets\r\n"
                + "Subject: dots\r\n\r\n..hidden\r\nnormal\r\n.\r\n");
    }

    @Test
    @DisplayName("TOP returns headers and the first lines")
    void testTop() {
        login();
        when(mailboxService.renderTop("email-b", USER_ID, 1)).thenReturn("Subject: hi\r\n\r\nline1");

        assertThat(send("TOP 2 1")).isEqualTo("+OK Top of message follows\r\nSubject: hi\r\n\r\nline1\r\n.\r\n");
        assertThat(send("TOP 2")).isEqualTo("-ERR Usage: TOP msg lines\r\n");
    }

    @Test
    @DisplayName("UIDL uses the email id")
    void testUidl() {
        login();

        assertThat(send("UIDL")).isEqualTo("+OK\r\n1 email-a\r\n2 email-b\r\n.\r\n");
        assertThat(send("UIDL 2")).isEqualTo("+OK 2 email-b\r\n");
    }

    @Test
    @DisplayName("RSET clears deletion marks")
    void testRset() {
        login();
        send("DELE 1");

        assertThat(send("RSET")).isEqualTo("+OK Maildrop has 2 messages (350 octets)\r\n");
        assertThat(handler.getSession().getDeletedNumbers()).isEmpty();
    }

    @Test
    @DisplayName("QUIT commits deletions and closes")
    void testQuit_CommitsDeletions() {
        login();
        send("DELE 2");

        assertThat(send("QUIT")).isEqualTo("+OK Goodbye\r\n");
        verify(mailboxService).applyDeletions(List.of("email-b"));
        assertThat(channel.isOpen()).isFalse();
        assertThat(connectionRegistry.getConnectionCount(USER_ID)).isZero();
    }

    @Test
    @DisplayName("Disconnect without QUIT commits nothing")
    void testDisconnect_NoCommit() {
        login();
        send("DELE 1");

        channel.close();

        verify(mailboxService, never()).applyDeletions(any());
        assertThat(connectionRegistry.getConnectionCount(USER_ID)).isZero();
    }

    @Test
    @DisplayName("Idle timeout commits nothing")
    void testIdleTimeout_NoCommit() {
        login();
        send("DELE 1");

        channel.pipeline().fireUserEventTriggered(IdleStateEvent.ALL_IDLE_STATE_EVENT);

        assertThat(readAll()).isEqualTo("-ERR Session timed out\r\n");
        assertThat(channel.isOpen()).isFalse();
        verify(mailboxService, never()).applyDeletions(any());
    }

    @Test
    @DisplayName("CAPA lists capabilities")
    void testCapa() {
        readAll();

        assertThat(send("CAPA")).isEqualTo("+OK Capability list follows\r\nUSER\r\nUIDL\r\nTOP\r\nPIPELINING\r\n.\r\n");
    }

    @Test
    @DisplayName("Unknown command and internal failure")
    void testErrors() {
        login();
        when(mailboxService.renderMessage("email-a", USER_ID)).thenThrow(new IllegalStateException("store down"));

        assertThat(send("XTND")).isEqualTo("-ERR Unknown command\r\n");
        assertThat(send("RETR 1")).isEqualTo("-ERR Internal server error\r\n");
        assertThat(channel.isOpen()).isTrue();
    }

    @Test
    @DisplayName("Byte-stuffing terminates the last line")
    void testDotStuff() {
        assertThat(Pop3CommandHandler.dotStuff(".a\n.b")).isEqualTo("..a\r\n..b\r\n");
    }
}
