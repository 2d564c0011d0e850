package com.relaymail.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OutboundAttachment {

    private String id;
    private String outboundEmailId;
    private String fileName;
    private String contentType;
    private long sizeBytes;
    private byte[] content;
}
