package com.kickstack.realtime.relay.subscription;

import com.kickstack.realtime.common.model.ChangeRecord;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Per-connection delivery state.
 * Mutated only while holding the {@link SubscriptionRegistry} lock, except
 * for the outbox, which is drained by one sender at a time without it.
 */
public class Subscription {

    @Getter
    private final SubscriberConnection connection;

    @Getter
    private final long connectedAt;

    private final Set<String> tables = new LinkedHashSet<>();

    /**
     * Tables added after connect only receive ids above their floor
     */
    private final Map<String, Long> tableFloors = new HashMap<>();

    /**
     * Highest id sent, or the requested resume point if nothing was sent yet
     */
    @Getter
    private long cursor;

    /**
     * Highest id handed to a sender; at or above the cursor
     */
    private long claimed;

    /**
     * Claimed records waiting to be written, in id order
     */
    private final Queue<ChangeRecord> outbox = new ConcurrentLinkedQueue<>();

    private final AtomicBoolean draining = new AtomicBoolean();

    /**
     * While true the poller leaves this connection to its backfill
     */
    @Getter
    private boolean backfillPending = true;

    Subscription(SubscriberConnection connection, Collection<String> tables, long sinceId) {
        this.connection = connection;
        this.connectedAt = System.currentTimeMillis();
        this.tables.addAll(tables);
        this.cursor = sinceId;
        this.claimed = sinceId;
    }

    public String getId() {
        return connection.getId();
    }

    public List<String> getTables() {
        return new ArrayList<>(tables);
    }

    /**
     * True if a record with this id from this table has been neither sent
     * nor handed to a sender, and should be
     */
    public boolean wants(String table, long id) {
        if (!tables.contains(table) || id <= Math.max(cursor, claimed)) {
            return false;
        }
        Long floor = tableFloors.get(table);
        return floor == null || id > floor;
    }

    /**
     * Cursors only move forward
     */
    public void advanceCursor(long id) {
        if (id > cursor) {
            cursor = id;
        }
    }

    /**
     * Reserve an id for sending so no other path picks it up
     */
    public void claim(long id) {
        if (id > claimed) {
            claimed = id;
        }
    }

    public void completeBackfill() {
        this.backfillPending = false;
    }

    boolean addTable(String table, long floor) {
        if (!tables.add(table)) {
            return false;
        }
        tableFloors.put(table, floor);
        return true;
    }

    boolean removeTable(String table) {
        tableFloors.remove(table);
        return tables.remove(table);
    }

    public void enqueue(ChangeRecord record) {
        outbox.add(record);
    }

    public ChangeRecord nextQueued() {
        return outbox.poll();
    }

    public boolean hasQueued() {
        return !outbox.isEmpty();
    }

    public void clearQueued() {
        outbox.clear();
    }

    /**
     * @return true if the caller became the only thread draining the outbox
     */
    public boolean startDraining() {
        return draining.compareAndSet(false, true);
    }

    public void stopDraining() {
        draining.set(false);
    }
}
