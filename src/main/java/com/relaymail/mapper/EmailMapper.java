package com.relaymail.mapper;

import com.relaymail.domain.Email;
import com.relaymail.domain.EmailAttachment;
import com.relaymail.domain.EmailRecipient;
import com.relaymail.domain.MailboxEntry;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

@Mapper
public interface EmailMapper {

    void insert(Email email);

    void insertRecipient(EmailRecipient recipient);

    void insertAttachment(EmailAttachment attachment);

    Email findByMessageId(@Param("messageId") String messageId);

    /**
     * Email visible to the user as recipient or sender, null otherwise
     */
    Email findByIdForUser(@Param("id") String id, @Param("userId") String userId);

    /**
     * Mailbox listing for the user, oldest first, with the user's flags
     */
    List<MailboxEntry> findMailboxEntries(@Param("userId") String userId, @Param("limit") int limit);

    List<EmailRecipient> findRecipients(@Param("emailId") String emailId);

    List<EmailAttachment> findAttachments(@Param("emailId") String emailId);

    int updateRecipientFlags(@Param("emailId") String emailId,
                             @Param("userId") String userId,
                             @Param("flags") int flags,
                             @Param("read") boolean read);

    /**
     * Set \\Seen for the user's copy, keeping the other flags
     */
    int markSeen(@Param("emailId") String emailId, @Param("userId") String userId);

    int deleteRecipients(@Param("emailId") String emailId);

    int deleteAttachments(@Param("emailId") String emailId);

    int deleteById(@Param("id") String id);
}
