package com.chatintel.group.source;

import com.chatintel.group.exception.ChatSourceException;
import com.chatintel.group.exception.ContactLookupException;
import com.chatintel.group.model.ChatSummary;
import com.chatintel.group.model.ContactInfo;
import com.chatintel.group.model.GroupSnapshot;
import com.chatintel.group.model.MediaPayload;
import com.chatintel.group.model.RawMessage;

import java.util.List;
import java.util.Optional;

/**
 * Read-only view of the chat account the pipeline scrapes.
 * Connection lifecycle and authentication belong to the implementation.
 * Every method may throw {@link ChatSourceException}.
 */
public interface ChatSource {

    /** Every chat of the account, groups and one-to-one alike. */
    List<ChatSummary> listChats();

    GroupSnapshot fetchGroup(String chatId);

    /** Newest messages of a chat, at most {@code limit}, in source order. */
    List<RawMessage> fetchRecentMessages(String chatId, int limit);

    /**
     * @throws ContactLookupException when the contact is unknown to the source
     */
    ContactInfo resolveContact(String contactId);

    Optional<MediaPayload> downloadMedia(String messageId);

    ConnectionState connectionState();
}
