package com.logsentinel.core.delivery;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Broadcasts {@link FeedUpdate}s to live subscribers and keeps the most
 * recent ones for late joiners.
 *
 * <p>
 * Subscribers are called on the publishing thread and must return quickly. A
 * subscriber that throws is logged and stays registered.
 * </p>
 *
 * @since 1.0.0
 */
public class LiveFeed {

    private static final Logger LOG = LoggerFactory.getLogger(LiveFeed.class);

    public static final int DEFAULT_CAPACITY = 100;

    private final List<Consumer<FeedUpdate>> subscribers = new CopyOnWriteArrayList<>();
    private final Deque<FeedUpdate> recent = new ArrayDeque<>();
    private final int capacity;

    public LiveFeed() {
        this(DEFAULT_CAPACITY);
    }

    public LiveFeed(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0, got: " + capacity);
        }
        this.capacity = capacity;
    }

    /**
     * @param subscriber callback for every future update
     * @return handle that removes the subscription when closed
     */
    public AutoCloseable subscribe(Consumer<FeedUpdate> subscriber) {
        Objects.requireNonNull(subscriber, "subscriber must not be null");
        subscribers.add(subscriber);
        return () -> subscribers.remove(subscriber);
    }

    public void publish(FeedUpdate update) {
        Objects.requireNonNull(update, "update must not be null");
        synchronized (recent) {
            recent.addLast(update);
            while (recent.size() > capacity) {
                recent.removeFirst();
            }
        }
        for (Consumer<FeedUpdate> subscriber : subscribers) {
            try {
                subscriber.accept(update);
            } catch (RuntimeException e) {
                LOG.warn("Feed subscriber failed on {}: {}", update, e.toString());
            }
        }
    }

    /**
     * @param limit maximum number of updates
     * @return newest first
     */
    public List<FeedUpdate> recent(int limit) {
        List<FeedUpdate> out = new ArrayList<>();
        synchronized (recent) {
            Iterator<FeedUpdate> it = recent.descendingIterator();
            while (it.hasNext() && out.size() < limit) {
                out.add(it.next());
            }
        }
        return out;
    }

    public int subscriberCount() {
        return subscribers.size();
    }
}
