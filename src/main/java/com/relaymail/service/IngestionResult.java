package com.relaymail.service;

/**
 * Outcome of {@link MessageIngestionService#ingest}. The SMTP listener maps it to a reply code.
 */
public record IngestionResult(Status status, String emailId, String detail) {

    public enum Status {
        ACCEPTED,
        MESSAGE_TOO_LARGE,
        ATTACHMENT_TOO_LARGE,
        TRANSACTION_FAILED
    }

    public static IngestionResult accepted(String emailId) {
        return new IngestionResult(Status.ACCEPTED, emailId, null);
    }

    public static IngestionResult messageTooLarge() {
        return new IngestionResult(Status.MESSAGE_TOO_LARGE, null, "Message too large");
    }

    public static IngestionResult attachmentTooLarge(String fileName) {
        return new IngestionResult(Status.ATTACHMENT_TOO_LARGE, null, "Attachment '" + fileName + "' too large");
    }

    public static IngestionResult transactionFailed() {
        return new IngestionResult(Status.TRANSACTION_FAILED, null, "Transaction failed");
    }

    public boolean isAccepted() {
        return status == Status.ACCEPTED;
    }
}
