package com.relaymail.config;

import io.netty.handler.ssl.ClientAuth;
import io.netty.handler.ssl.OpenSsl;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.ssl.SslProvider;
import io.netty.handler.ssl.SupportedCipherSuiteFilter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;

import javax.net.ssl.KeyManagerFactory;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.security.GeneralSecurityException;
import java.security.KeyStore;

/**
 * Server certificate for IMAPS / POP3S listeners
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class NettyConfig {

    private static final String CLASSPATH_PREFIX = "classpath:";

    private final RelayMailProperties properties;

    @Bean
    @ConditionalOnProperty(name = "relaymail.tls.enabled", havingValue = "true")
    public SslContext sslContext() {
        RelayMailProperties.Tls tls = properties.getTls();
        try {
            KeyStore keyStore = loadKeyStore(tls);

            KeyManagerFactory kmf = KeyManagerFactory.getInstance(KeyManagerFactory.getDefaultAlgorithm());
            kmf.init(keyStore, tls.getKeyPassword().toCharArray());

            SslProvider provider = OpenSsl.isAvailable() ? SslProvider.OPENSSL : SslProvider.JDK;
            SslContext ctx = SslContextBuilder.forServer(kmf)
                    .sslProvider(provider)
                    .protocols("TLSv1.2", "TLSv1.3")
                    .ciphers(null, SupportedCipherSuiteFilter.INSTANCE)
                    .clientAuth(ClientAuth.NONE)
                    .build();
            log.info("TLS context ready (keystore: {}, provider: {})", tls.getKeystorePath(), provider);
            return ctx;
        } catch (IOException | GeneralSecurityException e) {
            log.error("Failed to initialize TLS context from {}: {}", tls.getKeystorePath(), e.getMessage());
            throw new IllegalStateException("TLS context initialization failed", e);
        }
    }

    private KeyStore loadKeyStore(RelayMailProperties.Tls tls) throws IOException, GeneralSecurityException {
        KeyStore keyStore = KeyStore.getInstance(tls.getKeystoreType());
        String path = tls.getKeystorePath();
        char[] password = tls.getKeystorePassword().toCharArray();

        if (path.startsWith(CLASSPATH_PREFIX)) {
            try (InputStream is = new ClassPathResource(path.substring(CLASSPATH_PREFIX.length())).getInputStream()) {
                keyStore.load(is, password);
            }
        } else {
            try (InputStream is = new FileInputStream(path)) {
                keyStore.load(is, password);
            }
        }
        return keyStore;
    }
}
