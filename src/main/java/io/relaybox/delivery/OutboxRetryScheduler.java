/*
 * Copyright 2022 Neil Madden.
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may not use this file except
 * in compliance with the License. You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software distributed under the License
 * is distributed on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express
 * or implied. See the License for the specific language governing permissions and limitations under
 * the License.
 *
 */

package io.relaybox.delivery;

import static java.util.Objects.requireNonNull;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives delivery of queued {@link OutboxEntry outbox entries}.
 *
 * <p>Two independent timers run here. The retry loop only runs between {@link #start()} and {@link #stop()}; each
 * tick attempts every pending recipient whose presence is known to be online, then either reschedules itself with
 * the next (longer) backoff delay or, when the outbox has drained, resets the backoff and goes idle. A tick that
 * finds the transport disconnected is skipped and rescheduled without advancing the backoff. The expiry sweep runs
 * once when started and then at a fixed interval, marking expired messages and deleting their entries.
 *
 * <p>Independently of both timers, {@link #resendTo(String)} pushes everything queued for a single peer as soon as
 * that peer comes online.
 */
public final class OutboxRetryScheduler {
    private static final Logger logger = LoggerFactory.getLogger(OutboxRetryScheduler.class);

    public enum State {
        /** No retry tick is scheduled. */
        IDLE,
        /** A retry tick is waiting for its backoff delay to elapse. */
        SCHEDULED,
        /** A retry pass is in progress. */
        RUNNING
    }

    private final MessageStore store;
    private final Transport transport;
    private final PresenceTracker presence;
    private final MessageStatusUpdater statusUpdater;
    private final Scheduler scheduler;
    private final Clock clock;
    private final DeliveryConfig config;

    private State state = State.IDLE;
    private boolean started = false;
    private int backoffIndex = 0;
    private Scheduler.Cancellable retryTimer;
    private Scheduler.Cancellable sweepTimer;

    OutboxRetryScheduler(MessageStore store, Transport transport, PresenceTracker presence,
            MessageStatusUpdater statusUpdater, Scheduler scheduler, Clock clock, DeliveryConfig config) {
        this.store = requireNonNull(store, "store");
        this.transport = requireNonNull(transport, "transport");
        this.presence = requireNonNull(presence, "presence");
        this.statusUpdater = requireNonNull(statusUpdater, "statusUpdater");
        this.scheduler = requireNonNull(scheduler, "scheduler");
        this.clock = requireNonNull(clock, "clock");
        this.config = requireNonNull(config, "config");
    }

    /**
     * Starts the retry loop with the backoff reset. Has no effect if the loop is already started.
     */
    public synchronized void start() {
        if (started) {
            logger.debug("Retry loop already started");
            return;
        }
        started = true;
        backoffIndex = 0;
        logger.info("Starting outbox retry loop");
        if (state == State.IDLE) {
            scheduleNextTick();
        }
    }

    /**
     * Stops the retry loop. A pending tick is cancelled; a pass that is already running finishes its sends but does
     * not reschedule.
     */
    public synchronized void stop() {
        if (!started) {
            return;
        }
        started = false;
        if (retryTimer != null) {
            retryTimer.cancel();
            retryTimer = null;
        }
        if (state == State.SCHEDULED) {
            state = State.IDLE;
        }
        logger.info("Stopped outbox retry loop");
    }

    public synchronized boolean isStarted() {
        return started;
    }

    public synchronized State getState() {
        return state;
    }

    public synchronized int getBackoffIndex() {
        return backoffIndex;
    }

    /**
     * The delay the next scheduled tick waits for, given the current backoff index.
     */
    public synchronized Duration getNextDelay() {
        var steps = config.getBackoff();
        return steps.get(Math.min(backoffIndex, steps.size() - 1));
    }

    /**
     * Persists a new entry and wakes the retry loop if it is started but idle.
     */
    void enqueue(OutboxEntry entry) {
        store.saveOutboxEntry(entry);
        logger.debug("Queued message {} for {} recipient(s)", entry.getId(), entry.getPendingRecipients().size());
        synchronized (this) {
            if (started && state == State.IDLE) {
                backoffIndex = 0;
                scheduleNextTick();
            }
        }
    }

    private void scheduleNextTick() {
        assert Thread.holdsLock(this);
        var delay = getNextDelay();
        logger.debug("Next outbox retry in {}", delay);
        state = State.SCHEDULED;
        retryTimer = scheduler.schedule(this::tick, delay);
    }

    void tick() {
        synchronized (this) {
            if (state == State.RUNNING) {
                logger.debug("Retry pass already in progress, skipping tick");
                return;
            }
            retryTimer = null;
            if (!started) {
                state = State.IDLE;
                return;
            }
            state = State.RUNNING;
        }

        boolean connected;
        boolean remaining;
        try {
            connected = transport.isConnected();
            remaining = connected ? retryPass() : true;
        } catch (RuntimeException e) {
            logger.error("Outbox retry pass failed", e);
            connected = true;
            remaining = true;
        }

        synchronized (this) {
            state = State.IDLE;
            if (!started) {
                return;
            }
            if (!connected) {
                logger.debug("Transport not connected, skipping retry");
                scheduleNextTick();
            } else if (remaining) {
                backoffIndex++;
                scheduleNextTick();
            } else {
                logger.debug("Outbox drained, retry loop idle");
                backoffIndex = 0;
            }
        }
    }

    /**
     * One pass over the whole outbox.
     *
     * @return whether any entry is still pending afterwards.
     */
    private boolean retryPass() {
        var pending = store.getPendingOutbox();
        if (pending.isEmpty()) {
            return false;
        }
        logger.debug("Retrying {} queued message(s)", pending.size());
        var now = clock.instant();
        int sent = 0, skipped = 0, failed = 0;
        for (var entry : pending) {
            if (entry.isExpired(now)) {
                expire(entry);
                continue;
            }
            for (var recipient : entry.getPendingRecipients()) {
                if (!presence.isOnline(recipient)) {
                    skipped++;
                    continue;
                }
                if (attemptSend(entry, recipient)) {
                    sent++;
                } else {
                    failed++;
                }
            }
        }
        logger.debug("Retry pass complete: {} sent, {} skipped as offline, {} failed", sent, skipped, failed);
        return !store.getPendingOutbox().isEmpty();
    }

    /**
     * Sends every entry queued for the peer right away, ignoring the backoff timer.
     *
     * @return the number of entries sent.
     */
    public int resendTo(String identity) {
        if (!transport.isConnected()) {
            logger.debug("Transport not connected, cannot resend to {}", identity);
            return 0;
        }
        var entries = store.getOutboxForRecipient(identity);
        var now = clock.instant();
        int sent = 0;
        for (var entry : entries) {
            if (entry.isExpired(now)) {
                expire(entry);
            } else if (attemptSend(entry, identity)) {
                sent++;
            }
        }
        logger.info("Resent {} of {} queued message(s) to {}", sent, entries.size(), identity);
        return sent;
    }

    /**
     * Sends the entry to all of its pending recipients that are online.
     *
     * @throws MessageExpiredException if the entry has expired; it is then removed.
     */
    int resend(OutboxEntry entry) {
        if (entry.isExpired(clock.instant())) {
            expire(entry);
            throw new MessageExpiredException(entry.getId());
        }
        if (!transport.isConnected()) {
            return 0;
        }
        int sent = 0;
        for (var recipient : entry.getPendingRecipients()) {
            if (presence.isOnline(recipient) && attemptSend(entry, recipient)) {
                sent++;
            }
        }
        return sent;
    }

    public boolean hasPendingFor(String identity) {
        try {
            return !store.getOutboxForRecipient(identity).isEmpty();
        } catch (StorageException e) {
            logger.warn("Unable to read outbox for {}", identity, e);
            return false;
        }
    }

    private boolean attemptSend(OutboxEntry entry, String recipient) {
        try {
            transport.send(recipient, entry.getPayload(), entry.getId());
        } catch (IOException | RuntimeException e) {
            logger.warn("Failed to send message {} to {}: {}", entry.getId(), recipient, e.toString());
            return false;
        }
        statusUpdater.advance(entry.getId(), DeliveryStatus.SENT);
        return true;
    }

    private void expire(OutboxEntry entry) {
        logger.info("Message {} expired undelivered", entry.getId());
        statusUpdater.advance(entry.getId(), DeliveryStatus.EXPIRED);
        try {
            store.deleteOutboxEntry(entry.getId());
        } catch (OutboxEntryNotFoundException e) {
            logger.debug("Expired entry {} already removed", entry.getId());
        }
    }

    /**
     * Starts the expiry sweep: one sweep now, then one per sweep interval. Calling this again has no effect.
     */
    public void startSweep() {
        synchronized (this) {
            if (sweepTimer != null) {
                return;
            }
            var interval = config.getSweepInterval();
            sweepTimer = scheduler.scheduleAtFixedRate(this::sweep, interval, interval);
        }
        sweep();
    }

    public synchronized void stopSweep() {
        if (sweepTimer != null) {
            sweepTimer.cancel();
            sweepTimer = null;
        }
    }

    /**
     * Marks every expired entry's message as expired and deletes the entries. Safe to run repeatedly and alongside
     * the retry loop.
     *
     * @return the number of entries deleted.
     */
    public int sweep() {
        try {
            var now = clock.instant();
            for (var entry : store.getExpiredOutbox(now)) {
                statusUpdater.advance(entry.getId(), DeliveryStatus.EXPIRED);
            }
            var purged = store.purgeExpiredOutbox(now);
            if (purged > 0) {
                logger.info("Purged {} expired outbox entries", purged);
            }
            return purged;
        } catch (StorageException e) {
            logger.error("Outbox sweep failed", e);
            return 0;
        }
    }
}
