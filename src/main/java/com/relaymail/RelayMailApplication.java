package com.relaymail;

import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * RelayMail mail platform core
 *
 * - Netty-based IMAP4rev2 and POP3 protocol servers
 * - API-key authentication with rate limiting
 * - Inbound ingestion and open-relay prevention
 * - Outbound SMTP delivery with MX resolution and retry
 * - MyBatis + SQLite persistence
 */
@SpringBootApplication
@MapperScan("com.relaymail.mapper")
@EnableConfigurationProperties
@EnableScheduling
public class RelayMailApplication {

    public static void main(String[] args) {
        SpringApplication.run(RelayMailApplication.class, args);
    }
}
