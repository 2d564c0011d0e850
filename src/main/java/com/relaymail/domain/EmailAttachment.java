package com.relaymail.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EmailAttachment {

    private String id;
    private String emailId;
    private String fileName;
    private String contentType;
    private long sizeBytes;
    private byte[] content;
}
