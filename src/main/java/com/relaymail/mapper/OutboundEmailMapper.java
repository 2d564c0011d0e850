package com.relaymail.mapper;

import com.relaymail.domain.DeliveryLog;
import com.relaymail.domain.OutboundAttachment;
import com.relaymail.domain.OutboundEmail;
import com.relaymail.domain.OutboundRecipient;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.Instant;
import java.util.List;

@Mapper
public interface OutboundEmailMapper {

    /**
     * Queued emails whose retry time (if any) has passed, oldest first
     */
    List<OutboundEmail> findDueForDelivery(@Param("now") Instant now, @Param("limit") int limit);

    List<OutboundRecipient> findRecipients(@Param("outboundEmailId") String outboundEmailId);

    List<OutboundAttachment> findAttachments(@Param("outboundEmailId") String outboundEmailId);

    int update(OutboundEmail email);

    int updateRecipient(OutboundRecipient recipient);

    /**
     * Return emails left in SENDING by an interrupted run to the queue
     */
    int requeueInterrupted();

    void insertDeliveryLog(DeliveryLog log);
}
