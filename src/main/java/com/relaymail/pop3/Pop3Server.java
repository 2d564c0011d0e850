package com.relaymail.pop3;

import com.relaymail.config.RelayMailProperties;
import com.relaymail.protocol.ConnectionRegistry;
import com.relaymail.service.MailboxMessageService;
import com.relaymail.service.ProtocolAuthenticator;
import io.micrometer.core.instrument.MeterRegistry;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.ssl.SslContext;
import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.EventExecutorGroup;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Netty-based POP3 server (RFC 1939)
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "relaymail.pop3.enabled", havingValue = "true", matchIfMissing = true)
public class Pop3Server {

    private final RelayMailProperties properties;
    private final ProtocolAuthenticator authenticator;
    private final MailboxMessageService mailboxService;
    private final SslContext sslContext;
    private final MeterRegistry meterRegistry;
    private final ConnectionRegistry connectionRegistry = new ConnectionRegistry("POP3");

    public Pop3Server(RelayMailProperties properties,
                      ProtocolAuthenticator authenticator,
                      MailboxMessageService mailboxService,
                      @Autowired(required = false) @Nullable SslContext sslContext,
                      MeterRegistry meterRegistry) {
        this.properties = properties;
        this.authenticator = authenticator;
        this.mailboxService = mailboxService;
        this.sslContext = sslContext;
        this.meterRegistry = meterRegistry;
    }

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private EventExecutorGroup handlerGroup;
    private Channel serverChannel;
    private Channel sslServerChannel;

    @PostConstruct
    public void start() {
        Mono.fromRunnable(this::startServer)
                .subscribeOn(Schedulers.boundedElastic())
                .subscribe();
    }

    private void startServer() {
        RelayMailProperties.Pop3 pop3 = properties.getPop3();
        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup();
        handlerGroup = new DefaultEventExecutorGroup(pop3.getHandlerThreads());

        try {
            serverChannel = bind(pop3.getPort(), false);
            log.info("=== POP3 Server started on port {} ===", pop3.getPort());

            if (sslContext != null) {
                sslServerChannel = bind(pop3.getSslPort(), true);
                log.info("=== POP3S Server started on port {} (implicit SSL) ===", pop3.getSslPort());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("POP3 Server start interrupted", e);
        }
    }

    private Channel bind(int port, boolean implicitSsl) throws InterruptedException {
        ServerBootstrap bootstrap = new ServerBootstrap();
        bootstrap.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .childHandler(new Pop3ServerInitializer(properties, authenticator, mailboxService,
                        connectionRegistry, meterRegistry, handlerGroup, sslContext, implicitSsl))
                .option(ChannelOption.SO_BACKLOG, 128)
                .childOption(ChannelOption.SO_KEEPALIVE, true)
                .childOption(ChannelOption.TCP_NODELAY, true);
        return bootstrap.bind(port).sync().channel();
    }

    @PreDestroy
    public void stop() {
        log.info("Shutting down POP3 Server...");
        if (sslServerChannel != null) {
            sslServerChannel.close();
        }
        if (serverChannel != null) {
            serverChannel.close();
        }
        if (bossGroup != null) {
            bossGroup.shutdownGracefully();
        }
        if (workerGroup != null) {
            workerGroup.shutdownGracefully();
        }
        if (handlerGroup != null) {
            handlerGroup.shutdownGracefully();
        }
    }
}
