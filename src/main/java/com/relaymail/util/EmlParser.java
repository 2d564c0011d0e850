package com.relaymail.util;

import jakarta.activation.DataHandler;
import jakarta.mail.BodyPart;
import jakarta.mail.MessagingException;
import jakarta.mail.Multipart;
import jakarta.mail.Part;
import jakarta.mail.Session;
import jakarta.mail.internet.ContentType;
import jakarta.mail.internet.MimeBodyPart;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.internet.MimeMultipart;
import jakarta.mail.internet.MimePart;
import jakarta.mail.internet.ParseException;
import jakarta.mail.util.ByteArrayDataSource;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.UUID;

/**
 * EML parsing and building utilities based on Jakarta Mail
 */
@Slf4j
public final class EmlParser {

    public static final String NO_SUBJECT = "(No Subject)";

    private static final Session SESSION;

    private static final Map<String, String> EXTENSIONS = Map.ofEntries(
            Map.entry("image/jpeg", ".jpg"),
            Map.entry("image/png", ".png"),
            Map.entry("image/gif", ".gif"),
            Map.entry("image/webp", ".webp"),
            Map.entry("image/svg+xml", ".svg"),
            Map.entry("application/pdf", ".pdf"),
            Map.entry("application/zip", ".zip"),
            Map.entry("application/x-zip-compressed", ".zip"),
            Map.entry("application/msword", ".doc"),
            Map.entry("application/vnd.openxmlformats-officedocument.wordprocessingml.document", ".docx"),
            Map.entry("application/vnd.ms-excel", ".xls"),
            Map.entry("application/vnd.openxmlformats-officedocument.spreadsheetml.sheet", ".xlsx"),
            Map.entry("application/vnd.ms-powerpoint", ".ppt"),
            Map.entry("application/vnd.openxmlformats-officedocument.presentationml.presentation", ".pptx"),
            Map.entry("text/plain", ".txt"),
            Map.entry("text/html", ".html"),
            Map.entry("text/csv", ".csv"),
            Map.entry("application/json", ".json"),
            Map.entry("application/xml", ".xml"),
            Map.entry("text/xml", ".xml"));

    static {
        Properties props = new Properties();
        props.setProperty("mail.mime.charset", "UTF-8");
        props.setProperty("mail.mime.decodetext.strict", "false");
        SESSION = Session.getInstance(props);
    }

    private EmlParser() {}

    /**
     * Parse a MimeMessage from bytes
     */
    public static MimeMessage parse(byte[] emlData) throws MessagingException, IOException {
        try (InputStream is = new ByteArrayInputStream(emlData)) {
            return new MimeMessage(SESSION, is);
        }
    }

    /**
     * Serialize a MimeMessage to bytes
     */
    public static byte[] toBytes(MimeMessage message) throws MessagingException, IOException {
        ByteArrayOutputStream outputStream = new ByteArrayOutputStream();
        message.writeTo(outputStream);
        return outputStream.toByteArray();
    }

    /**
     * New message that keeps the given Message-ID when saved instead of generating one
     */
    public static MimeMessage newMessage(Session session, String messageId) {
        return new MimeMessage(session) {
            @Override
            protected void updateMessageID() throws MessagingException {
                if (messageId == null || messageId.isBlank()) {
                    super.updateMessageID();
                } else {
                    setHeader("Message-ID", messageId);
                }
            }
        };
    }

    /**
     * Message-ID header, or a generated {@code <uuid@domain>} when absent
     */
    public static String extractMessageId(MimeMessage message, String domain) throws MessagingException {
        String messageId = message.getMessageID();
        if (messageId == null || messageId.isBlank()) {
            messageId = "<" + UUID.randomUUID() + "@" + domain + ">";
        }
        return messageId.trim();
    }

    public static String extractSubject(MimeMessage message) throws MessagingException {
        String subject = message.getSubject();
        return subject != null ? subject : NO_SUBJECT;
    }

    /**
     * First value of a header, unfolded, or null
     */
    public static String header(MimeMessage message, String name) throws MessagingException {
        String value = message.getHeader(name, " ");
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.replaceAll("\\s+", " ").trim();
    }

    /**
     * Depth-first search for the first inline part of the given type (text/plain, text/html)
     */
    public static String findTextBody(Part part, String mimeType) throws MessagingException, IOException {
        if (isAttachment(part)) {
            return null;
        }
        if (part.isMimeType(mimeType)) {
            Object content = part.getContent();
            return content instanceof String text ? text : null;
        }
        if (part.isMimeType("multipart/*")) {
            Multipart multipart = (Multipart) part.getContent();
            for (int i = 0; i < multipart.getCount(); i++) {
                String text = findTextBody(multipart.getBodyPart(i), mimeType);
                if (text != null) {
                    return text;
                }
            }
        }
        return null;
    }

    /**
     * Leaf parts that are attachments: disposition attachment, or any part carrying a filename
     */
    public static List<Part> findAttachments(Part part) throws MessagingException, IOException {
        List<Part> attachments = new ArrayList<>();
        collectAttachments(part, attachments);
        return attachments;
    }

    private static void collectAttachments(Part part, List<Part> attachments) throws MessagingException, IOException {
        if (part.isMimeType("multipart/*")) {
            Multipart multipart = (Multipart) part.getContent();
            for (int i = 0; i < multipart.getCount(); i++) {
                BodyPart child = multipart.getBodyPart(i);
                collectAttachments(child, attachments);
            }
        } else if (isAttachment(part)) {
            attachments.add(part);
        }
    }

    private static boolean isAttachment(Part part) throws MessagingException {
        return Part.ATTACHMENT.equalsIgnoreCase(part.getDisposition()) || part.getFileName() != null;
    }

    /**
     * Base MIME type without parameters, lower-cased
     */
    public static String baseType(String contentType) {
        if (contentType == null) {
            return "application/octet-stream";
        }
        try {
            return new ContentType(contentType).getBaseType().toLowerCase(Locale.ROOT);
        } catch (ParseException e) {
            log.debug("Unparseable content type '{}': {}", contentType, e.getMessage());
            return "application/octet-stream";
        }
    }

    /**
     * Name for an attachment that arrived without one, e.g. attachment.pdf
     */
    public static String fileNameFor(String mimeType) {
        return "attachment" + EXTENSIONS.getOrDefault(baseType(mimeType), "");
    }

    /**
     * Attachment part with base64 transfer encoding
     */
    public static MimeBodyPart attachmentPart(String fileName, String contentType, byte[] content)
            throws MessagingException {
        MimeBodyPart part = new MimeBodyPart();
        part.setDataHandler(new DataHandler(new ByteArrayDataSource(content != null ? content : new byte[0], baseType(contentType))));
        part.setFileName(fileName);
        part.setDisposition(Part.ATTACHMENT);
        part.setHeader("Content-Transfer-Encoding", "base64");
        return part;
    }

    /**
     * Set text and/or HTML body (multipart/alternative when both) and wrap it in
     * multipart/mixed when there are attachments
     */
    public static void setBody(MimeMessage message, String text, String html, List<MimeBodyPart> attachments)
            throws MessagingException {
        if (attachments == null || attachments.isEmpty()) {
            setTextContent(message, text, html);
            return;
        }

        MimeBodyPart body = new MimeBodyPart();
        setTextContent(body, text, html);
        MimeMultipart mixed = new MimeMultipart("mixed");
        mixed.addBodyPart(body);
        for (MimeBodyPart attachment : attachments) {
            mixed.addBodyPart(attachment);
        }
        message.setContent(mixed);
    }

    private static void setTextContent(MimePart target, String text, String html) throws MessagingException {
        boolean hasText = text != null && !text.isEmpty();
        boolean hasHtml = html != null && !html.isEmpty();

        if (hasText && hasHtml) {
            MimeBodyPart textPart = new MimeBodyPart();
            textPart.setText(text, "UTF-8");
            MimeBodyPart htmlPart = new MimeBodyPart();
            htmlPart.setText(html, "UTF-8", "html");
            MimeMultipart alternative = new MimeMultipart("alternative");
            alternative.addBodyPart(textPart);
            alternative.addBodyPart(htmlPart);
            target.setContent(alternative);
        } else if (hasHtml) {
            target.setText(html, "UTF-8", "html");
        } else {
            target.setText(hasText ? text : "", "UTF-8");
        }
    }

    public static Session getSession() {
        return SESSION;
    }
}
