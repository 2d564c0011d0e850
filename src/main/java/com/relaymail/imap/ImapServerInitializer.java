package com.relaymail.imap;

import com.relaymail.config.RelayMailProperties;
import com.relaymail.protocol.ConnectionRegistry;
import com.relaymail.service.MailboxMessageService;
import com.relaymail.service.ProtocolAuthenticator;
import io.micrometer.core.instrument.MeterRegistry;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.socket.SocketChannel;
import io.netty.handler.codec.DelimiterBasedFrameDecoder;
import io.netty.handler.codec.Delimiters;
import io.netty.handler.codec.string.StringDecoder;
import io.netty.handler.codec.string.StringEncoder;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslHandler;
import io.netty.handler.timeout.IdleStateHandler;
import io.netty.util.concurrent.EventExecutorGroup;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeUnit;

/**
 * IMAP Netty channel initializer
 */
@Slf4j
@RequiredArgsConstructor
public class ImapServerInitializer extends ChannelInitializer<SocketChannel> {

    private final RelayMailProperties properties;
    private final ProtocolAuthenticator authenticator;
    private final MailboxMessageService mailboxService;
    private final ConnectionRegistry connectionRegistry;
    private final MeterRegistry meterRegistry;
    private final EventExecutorGroup handlerGroup;
    private final SslContext sslContext;
    private final boolean implicitSsl;

    @Override
    protected void initChannel(SocketChannel ch) {
        ChannelPipeline pipeline = ch.pipeline();

        // Implicit SSL (port 993)
        if (implicitSsl && sslContext != null) {
            SslHandler sslHandler = sslContext.newHandler(ch.alloc());
            pipeline.addLast("ssl", sslHandler);
            InetSocketAddress remoteAddr = ch.remoteAddress();
            String remoteIp = remoteAddr != null ? remoteAddr.getAddress().getHostAddress() : "unknown";
            sslHandler.handshakeFuture().addListener(future -> {
                if (future.isSuccess()) {
                    log.info("IMAPS TLS handshake completed for {}", remoteIp);
                } else {
                    log.warn("IMAPS TLS handshake failed for {}: {}", remoteIp, future.cause().getMessage());
                }
            });
        }

        pipeline.addLast("idleState", new IdleStateHandler(
                0, 0, properties.getImap().getTimeout(), TimeUnit.MILLISECONDS));

        pipeline.addLast("framer", new DelimiterBasedFrameDecoder(
                properties.getImap().getMaxLineLength(), Delimiters.lineDelimiter()));
        pipeline.addLast("decoder", new StringDecoder(StandardCharsets.UTF_8));
        pipeline.addLast("encoder", new StringEncoder(StandardCharsets.UTF_8));

        // Store and BCrypt calls block, keep them off the I/O threads
        pipeline.addLast(handlerGroup, "handler", new ImapCommandHandler(
                properties, authenticator, mailboxService, connectionRegistry, meterRegistry));
    }
}
