package com.kickstack.realtime.relay.store;

import com.kickstack.realtime.common.model.ChangeRecord;

import java.util.Collection;
import java.util.List;

/**
 * Read-only view of the append-only change table written by database triggers.
 * Implementations may be queried concurrently by the poller and any number of backfills.
 * Failures surface as Spring {@link org.springframework.dao.DataAccessException}s.
 */
public interface ChangeStore {

    /**
     * Records with id greater than {@code afterId} whose table is in {@code tables},
     * ascending by id, at most {@code limit} of them.
     */
    List<ChangeRecord> fetchSince(long afterId, Collection<String> tables, int limit);

    /**
     * Highest id currently in the store, 0 when empty
     */
    long currentMaxId();
}
