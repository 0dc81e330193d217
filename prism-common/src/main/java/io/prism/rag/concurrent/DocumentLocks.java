package io.prism.rag.concurrent;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Mutual exclusion per document id.
 *
 * <p>A lock exists only while some thread holds or waits for it: the last {@link #unlock} of a
 * document removes its entry, so the registry stays as small as the set of documents being
 * written at the moment. Locks are reentrant.</p>
 *
 * <pre>
 * locks.lock(documentId);
 * try {
 *     ...
 * } finally {
 *     locks.unlock(documentId);
 * }
 * </pre>
 */
public class DocumentLocks {

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();

    public void lock(String documentId) {
        Entry entry = entries.compute(documentId, (id, current) -> {
            Entry held = current != null ? current : new Entry();
            held.users++;
            return held;
        });
        entry.lock.lock();
    }

    /**
     * @throws IllegalMonitorStateException if the calling thread does not hold the lock
     */
    public void unlock(String documentId) {
        Entry entry = entries.get(documentId);
        if (entry == null || !entry.lock.isHeldByCurrentThread()) {
            throw new IllegalMonitorStateException("Lock for document " + documentId + " is not held");
        }
        entry.lock.unlock();
        entries.computeIfPresent(documentId, (id, current) -> --current.users == 0 ? null : current);
    }

    /** Number of documents currently locked or waited on. */
    public int size() {
        return entries.size();
    }

    // users is only read and written inside compute calls on the entry's own key.
    private static final class Entry {
        private final ReentrantLock lock = new ReentrantLock();
        private int users;
    }
}
