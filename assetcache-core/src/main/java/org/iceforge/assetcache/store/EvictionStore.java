package org.iceforge.assetcache.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Byte-budgeted LRU store.
 * <p>
 * A hash map gives each key a direct reference to its node in a doubly-linked list, so lookup,
 * recency update, insertion and eviction are all O(1) pointer rewrites. The list head holds the
 * least recently used entry and the tail the most recently used one.
 * <p>
 * Payloads are treated as immutable snapshots. Every {@link #get(String)} returns the result of the
 * copier supplied at construction so callers can never alias the stored value.
 *
 * @param <V> payload type
 */
public class EvictionStore<V> {
    private static final Logger logger = LoggerFactory.getLogger(EvictionStore.class);

    private static final class Node<V> {
        final String key;
        V payload;
        long sizeBytes;
        long accessCount;
        Node<V> prev;
        Node<V> next;

        Node(String key, V payload, long sizeBytes) {
            this.key = key;
            this.payload = payload;
            this.sizeBytes = sizeBytes;
            this.accessCount = 1;
        }
    }

    private final Map<String, Node<V>> index = new HashMap<>();
    private final UnaryOperator<V> copier;
    private final long maxSizeBytes;

    private Node<V> head;
    private Node<V> tail;
    private long currentSizeBytes;
    private long evictionCount;

    public EvictionStore(long maxSizeBytes, UnaryOperator<V> copier) {
        if (maxSizeBytes <= 0) {
            throw new IllegalArgumentException("maxSizeBytes must be positive: " + maxSizeBytes);
        }
        this.maxSizeBytes = maxSizeBytes;
        this.copier = Objects.requireNonNull(copier, "copier");
        logger.info("Eviction store initialized with max capacity: {} bytes", maxSizeBytes);
    }

    public synchronized Optional<V> get(String key) {
        Node<V> node = index.get(Objects.requireNonNull(key, "key"));
        if (node == null) {
            return Optional.empty();
        }
        node.accessCount++;
        moveToTail(node);
        return Optional.of(copier.apply(node.payload));
    }

    /**
     * Stores {@code payload} under {@code key}.
     *
     * @return {@code false} if the payload is larger than the whole budget; the store is left untouched
     */
    public synchronized boolean set(String key, V payload, long sizeBytes) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(payload, "payload");
        if (sizeBytes < 0 || sizeBytes > maxSizeBytes) {
            logger.debug("Not caching {}: {} bytes exceeds budget of {}", key, sizeBytes, maxSizeBytes);
            return false;
        }

        Node<V> node = index.get(key);
        if (node != null) {
            // Detach first so growth of this entry never evicts the entry itself.
            unlink(node);
            currentSizeBytes -= node.sizeBytes;
            node.payload = payload;
            node.sizeBytes = sizeBytes;
            node.accessCount = 1;
        } else {
            node = new Node<>(key, payload, sizeBytes);
            index.put(key, node);
        }

        while (currentSizeBytes + sizeBytes > maxSizeBytes && head != null) {
            evictHead();
        }

        linkAtTail(node);
        currentSizeBytes += sizeBytes;
        return true;
    }

    public synchronized Optional<String> evictOne() {
        if (head == null) {
            return Optional.empty();
        }
        return Optional.of(evictHead());
    }

    public synchronized boolean remove(String key) {
        Node<V> node = index.remove(Objects.requireNonNull(key, "key"));
        if (node == null) {
            return false;
        }
        unlink(node);
        currentSizeBytes -= node.sizeBytes;
        return true;
    }

    public synchronized void clear() {
        index.clear();
        head = null;
        tail = null;
        currentSizeBytes = 0;
        logger.info("Eviction store cleared");
    }

    /** Membership test that does not change recency. */
    public synchronized boolean contains(String key) {
        return index.containsKey(key);
    }

    public synchronized int size() {
        return index.size();
    }

    public synchronized long currentSizeBytes() {
        return currentSizeBytes;
    }

    public long maxSizeBytes() {
        return maxSizeBytes;
    }

    public synchronized long evictionCount() {
        return evictionCount;
    }

    public synchronized long accessCount(String key) {
        Node<V> node = index.get(key);
        return node == null ? 0 : node.accessCount;
    }

    /** Keys from least to most recently used. */
    public synchronized List<String> keys() {
        List<String> out = new ArrayList<>(index.size());
        for (Node<V> n = head; n != null; n = n.next) {
            out.add(n.key);
        }
        return out;
    }

    /**
     * Walks the list in both directions and cross-checks it against the index and the size total.
     *
     * @throws IllegalStateException on the first inconsistency found
     */
    synchronized void verifyIntegrity() {
        long total = 0;
        int forward = 0;
        Node<V> prev = null;
        for (Node<V> n = head; n != null; n = n.next) {
            if (n.prev != prev) throw new IllegalStateException("broken back link at " + n.key);
            if (index.get(n.key) != n) throw new IllegalStateException("list node not indexed: " + n.key);
            if (++forward > index.size()) throw new IllegalStateException("cycle or duplicate in list");
            total += n.sizeBytes;
            prev = n;
        }
        if (prev != tail) throw new IllegalStateException("tail does not terminate the list");
        if (forward != index.size()) throw new IllegalStateException("index has " + index.size() + " keys, list has " + forward);
        if (total != currentSizeBytes) throw new IllegalStateException("size total " + total + " != " + currentSizeBytes);
        if (currentSizeBytes > maxSizeBytes) throw new IllegalStateException("over budget: " + currentSizeBytes);
    }

    private String evictHead() {
        Node<V> victim = head;
        unlink(victim);
        index.remove(victim.key);
        currentSizeBytes -= victim.sizeBytes;
        evictionCount++;
        logger.debug("Evicted {} ({} bytes)", victim.key, victim.sizeBytes);
        return victim.key;
    }

    private void moveToTail(Node<V> node) {
        if (node == tail) {
            return;
        }
        unlink(node);
        linkAtTail(node);
    }

    private void linkAtTail(Node<V> node) {
        node.prev = tail;
        node.next = null;
        if (tail != null) {
            tail.next = node;
        } else {
            head = node;
        }
        tail = node;
    }

    private void unlink(Node<V> node) {
        if (node.prev != null) {
            node.prev.next = node.next;
        } else {
            head = node.next;
        }
        if (node.next != null) {
            node.next.prev = node.prev;
        } else {
            tail = node.prev;
        }
        node.prev = null;
        node.next = null;
    }
}
