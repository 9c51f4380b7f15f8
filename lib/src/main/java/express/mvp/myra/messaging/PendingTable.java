package express.mvp.myra.messaging;

import express.mvp.myra.messaging.engine.SlotHandle;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Outstanding operations of one session, correlated with their futures.
 *
 * <ul>
 *   <li><b>Sends</b> are keyed by a continuation token handed to the engine with the message.
 *       Tokens are never reused, so a completion for an unknown token is stale and ignored.
 *   <li><b>Releases</b> are keyed by the engine's {@link SlotHandle}, compared by reference.
 *       The {@link SlotKey} of a resent message can repeat, the handle cannot.
 *   <li><b>Requests</b> are keyed by identity alone, since a reply keeps the identity but gets a
 *       new serial.
 * </ul>
 *
 * <p>Every key has at most one live entry. Entries are inserted before the engine call is posted
 * and removed exactly once.
 *
 * <h2>Thread Safety</h2>
 *
 * <p>All maps are guarded by a single mutex, exposed through {@link #lock()} so that the session
 * can make compound decisions atomically.
 */
final class PendingTable {

    /** A registered slot release. */
    record PendingRelease(
            SlotHandle slot,
            CompletableFuture<Optional<SlotKey>> future,
            MessageEnvelope envelope) {

        SlotKey key() {
            return slot.key();
        }
    }

    private final Object lock = new Object();

    private final Map<Long, MessageEnvelope> sends = new HashMap<>();

    private final Map<SlotHandle, PendingRelease> releases = new IdentityHashMap<>();

    private final Map<Identity, RequestTimeout> requests = new HashMap<>();

    private long nextToken = 1;

    Object lock() {
        return lock;
    }

    // ─── Sends ──────────────────────────────────────────────────────────────────

    /**
     * Registers a send and returns its continuation token.
     *
     * @param envelope the envelope being sent
     * @return a token never handed out before
     */
    long registerSend(MessageEnvelope envelope) {
        synchronized (lock) {
            long token = nextToken++;
            sends.put(token, envelope);
            return token;
        }
    }

    /**
     * Removes and returns the envelope registered under {@code token}.
     *
     * @param token the continuation token
     * @return the envelope, or null if the token is unknown or already completed
     */
    MessageEnvelope completeSend(long token) {
        synchronized (lock) {
            return sends.remove(token);
        }
    }

    // ─── Releases ───────────────────────────────────────────────────────────────

    /**
     * Registers the slot of a received envelope.
     *
     * @param slot the engine's slot handle
     * @param envelope the envelope holding the slot
     * @return the registration, or null if the handle is already registered
     */
    PendingRelease registerRelease(SlotHandle slot, MessageEnvelope envelope) {
        synchronized (lock) {
            if (releases.containsKey(slot)) {
                return null;
            }
            PendingRelease pending = new PendingRelease(slot, new CompletableFuture<>(), envelope);
            releases.put(slot, pending);
            return pending;
        }
    }

    /**
     * Returns the release registered for {@code slot}, registering one if absent.
     *
     * @param slot the engine's slot handle
     * @param envelope the envelope holding the slot
     * @return the registration
     */
    PendingRelease releaseFor(SlotHandle slot, MessageEnvelope envelope) {
        synchronized (lock) {
            return releases.computeIfAbsent(
                    slot, s -> new PendingRelease(s, new CompletableFuture<>(), envelope));
        }
    }

    /**
     * Removes the release registered for {@code slot}.
     *
     * @param slot the engine's slot handle
     * @return the registration, or null
     */
    PendingRelease completeRelease(SlotHandle slot) {
        synchronized (lock) {
            return releases.remove(slot);
        }
    }

    /**
     * Returns a copy of every registered release.
     *
     * @return snapshot of pending releases
     */
    List<PendingRelease> releases() {
        synchronized (lock) {
            return new ArrayList<>(releases.values());
        }
    }

    // ─── Requests ───────────────────────────────────────────────────────────────

    /**
     * Registers a request.
     *
     * @param identity identity of the request envelope
     * @param timeout the request's timeout
     * @return false if a request with this identity is already pending
     */
    boolean registerRequest(Identity identity, RequestTimeout timeout) {
        synchronized (lock) {
            return requests.putIfAbsent(identity, timeout) == null;
        }
    }

    /**
     * Removes and returns the request waiting for {@code identity}.
     *
     * @param identity identity of a received envelope
     * @return the request, or null
     */
    RequestTimeout takeRequest(Identity identity) {
        synchronized (lock) {
            return requests.remove(identity);
        }
    }

    /**
     * Removes the request only if it is still the one registered for its identity.
     *
     * @param identity the identity
     * @param timeout the expected registration
     * @return true if removed
     */
    boolean removeRequest(Identity identity, RequestTimeout timeout) {
        synchronized (lock) {
            return requests.remove(identity, timeout);
        }
    }

    /**
     * Removes and returns every pending request.
     *
     * @return the requests
     */
    List<RequestTimeout> drainRequests() {
        synchronized (lock) {
            List<RequestTimeout> drained = new ArrayList<>(requests.values());
            requests.clear();
            return drained;
        }
    }

    // ─── Diagnostics ────────────────────────────────────────────────────────────

    int pendingSends() {
        synchronized (lock) {
            return sends.size();
        }
    }

    int pendingReleases() {
        synchronized (lock) {
            return releases.size();
        }
    }

    int pendingRequests() {
        synchronized (lock) {
            return requests.size();
        }
    }
}
