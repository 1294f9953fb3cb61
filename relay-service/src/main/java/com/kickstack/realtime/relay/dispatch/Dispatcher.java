package com.kickstack.realtime.relay.dispatch;

import com.kickstack.realtime.common.model.ChangeRecord;
import com.kickstack.realtime.common.protocol.RelayMessage;
import com.kickstack.realtime.relay.subscription.SubscriberConnection;
import com.kickstack.realtime.relay.subscription.Subscription;
import com.kickstack.realtime.relay.subscription.SubscriptionRegistry;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Executor;

/**
 * Fans change records out to interested connections and advances their cursors.
 *
 * Deciding who gets a record happens under the registry lock: the record's id
 * is claimed on the subscription so no other path can pick it up again. The
 * socket write happens outside the lock, and the cursor moves only after it
 * succeeded. Live records go through a per-connection outbox drained on the
 * delivery executor, so a stalled subscriber holds up nobody but itself.
 */
@Slf4j
@Component
public class Dispatcher {

    private final SubscriptionRegistry registry;
    private final Executor deliveryExecutor;

    public Dispatcher(SubscriptionRegistry registry,
                      @Qualifier("deliveryExecutor") Executor deliveryExecutor) {
        this.registry = registry;
        this.deliveryExecutor = deliveryExecutor;
    }

    /**
     * Queue a batch and start sending it.
     *
     * @return number of messages queued
     */
    public int dispatch(List<ChangeRecord> batch) {
        DispatchPlan plan = registry.atomically(() -> enqueue(batch));
        flush(plan.getTargets());
        return plan.getQueued();
    }

    /**
     * Claim every record of an ascending batch for each matching connection
     * and put it in that connection's outbox. Runs under the registry lock so
     * callers can pair it with a watermark update; nothing is written yet.
     */
    public DispatchPlan enqueue(List<ChangeRecord> batch) {
        return registry.atomically(() -> {
            Set<Subscription> targets = new LinkedHashSet<>();
            int queued = 0;
            for (ChangeRecord record : batch) {
                for (Subscription subscription : registry.matching(record.getTable(), record.getId())) {
                    if (claim(subscription, record)) {
                        subscription.enqueue(record);
                        targets.add(subscription);
                        queued++;
                    }
                }
            }
            if (queued > 0) {
                log.debug("Queued {} records as {} messages for {} connections", batch.size(), queued, targets.size());
            }
            return new DispatchPlan(targets, queued);
        });
    }

    /**
     * Start draining outboxes. Must be called without holding the registry lock.
     */
    public void flush(Collection<Subscription> targets) {
        for (Subscription subscription : targets) {
            scheduleDrain(subscription);
        }
    }

    /**
     * Send one record to one connection on the calling thread, if it still wants it.
     * A failed send unregisters and closes the connection; it never throws.
     * Must be called without holding the registry lock.
     *
     * @return true if the record was sent and the cursor advanced
     */
    public boolean deliver(Subscription subscription, ChangeRecord record) {
        boolean claimed = registry.atomically(() -> claim(subscription, record));
        return claimed && send(subscription, record);
    }

    private boolean claim(Subscription subscription, ChangeRecord record) {
        if (!registry.isRegistered(subscription)
                || !subscription.wants(record.getTable(), record.getId())) {
            return false;
        }
        if (!subscription.getConnection().isOpen()) {
            log.debug("Connection {} not writable, leaving cursor at {}",
                    subscription.getId(), subscription.getCursor());
            return false;
        }
        subscription.claim(record.getId());
        return true;
    }

    private boolean send(Subscription subscription, ChangeRecord record) {
        SubscriberConnection connection = subscription.getConnection();
        try {
            connection.send(RelayMessage.change(record));
        } catch (Exception e) {
            log.warn("Failed to send change {} to connection {}, dropping subscriber",
                    record.getId(), connection.getId(), e);
            drop(subscription);
            return false;
        }

        registry.atomically(() -> {
            if (registry.isRegistered(subscription)) {
                subscription.advanceCursor(record.getId());
            }
            return null;
        });
        return true;
    }

    private void drop(Subscription subscription) {
        subscription.clearQueued();
        registry.atomically(() -> {
            if (registry.isRegistered(subscription)) {
                registry.unregister(subscription.getId());
            }
            return null;
        });
        subscription.getConnection().close(SubscriberConnection.CloseReason.SERVER_ERROR);
    }

    private void scheduleDrain(Subscription subscription) {
        deliveryExecutor.execute(() -> drain(subscription));
    }

    private void drain(Subscription subscription) {
        if (!subscription.startDraining()) {
            // The current drainer picks up whatever was just queued
            return;
        }
        try {
            ChangeRecord record;
            while ((record = subscription.nextQueued()) != null) {
                if (!registry.isRegistered(subscription)) {
                    subscription.clearQueued();
                    break;
                }
                if (!send(subscription, record)) {
                    break;
                }
            }
        } finally {
            subscription.stopDraining();
        }

        // Records queued after the last poll but before the flag was released
        if (subscription.hasQueued() && registry.isRegistered(subscription)) {
            scheduleDrain(subscription);
        }
    }

    /**
     * Connections a batch was queued for, and how many messages in total
     */
    @Value
    public static class DispatchPlan {
        Set<Subscription> targets;
        int queued;
    }
}
