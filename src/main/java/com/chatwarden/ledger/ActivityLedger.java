package com.chatwarden.ledger;

import com.chatwarden.policy.ContentCategory;

/**
 * Append-only record of content events with trailing-window counting.
 * All methods throw {@link com.chatwarden.support.TransientStoreException} when
 * the backing store is unavailable.
 */
public interface ActivityLedger {

    /**
     * Appends an event stamped "now" and, in the same atomic step, counts the events
     * of the same (identity, chat, category) with timestamp &gt;= now - windowSeconds.
     * A non-null fingerprint narrows the count to events carrying the same fingerprint.
     * Not safe to blindly retry: a retry after an ambiguous failure may count twice.
     */
    long recordAndCount(long identityId, long chatId, ContentCategory category,
                        int windowSeconds, String fingerprint);

    /**
     * Deletes events strictly older than now - retentionSeconds.
     *
     * @return number of events removed
     */
    long prune(long retentionSeconds);

    /**
     * Forgets every event of an identity in a chat.
     */
    void clear(long identityId, long chatId);
}
