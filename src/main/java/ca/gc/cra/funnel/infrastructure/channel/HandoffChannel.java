package ca.gc.cra.funnel.infrastructure.channel;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.LongAdder;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Many-producer, single-consumer FIFO with close-then-drain termination.
 *
 * <p>{@link #put(Object)} never blocks: producers take the read side of a gate with {@code tryLock}, so a
 * producer racing {@link #close()} simply drops its item. {@link #close()} takes the write side, which
 * guarantees every accepted item is queued ahead of the end-of-stream sentinel. Items are dropped, and
 * counted, once {@code capacity} items are waiting.</p>
 *
 * <p>{@link #drain()} hands out a single-pass sequence that blocks while empty and ends after the
 * sentinel. Each item is delivered exactly once; order is FIFO per producer thread.</p>
 *
 * @param <T> item type
 * @since FUNNEL 0.1
 */
public final class HandoffChannel<T> {
  private static final Object END = new Object();

  private final BlockingQueue<Object> queue = new LinkedBlockingQueue<>();
  private final ReentrantReadWriteLock gate = new ReentrantReadWriteLock();
  private final AtomicInteger depth = new AtomicInteger();
  private final AtomicBoolean drained = new AtomicBoolean();
  private final LongAdder dropped = new LongAdder();
  private final int capacity;
  private volatile boolean closed;

  /**
   * Creates a channel holding at most {@code capacity} undelivered items.
   *
   * @param capacity maximum number of waiting items; must be positive
   */
  public HandoffChannel(int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be positive");
    }
    this.capacity = capacity;
  }

  /**
   * Offers an item. Dropped silently when the channel is closed, closing, or full.
   *
   * @param item item to enqueue; {@code null} is ignored
   * @return {@code true} when the item was accepted
   */
  public boolean put(T item) {
    if (item == null) {
      return false;
    }
    if (closed || !gate.readLock().tryLock()) {
      dropped.increment();
      return false;
    }
    try {
      if (closed) {
        dropped.increment();
        return false;
      }
      if (depth.incrementAndGet() > capacity) {
        depth.decrementAndGet();
        dropped.increment();
        return false;
      }
      queue.add(item);
      return true;
    } finally {
      gate.readLock().unlock();
    }
  }

  /** Stops accepting items and appends the end-of-stream marker. Idempotent. */
  public void close() {
    gate.writeLock().lock();
    try {
      if (closed) {
        return;
      }
      closed = true;
      queue.add(END);
    } finally {
      gate.writeLock().unlock();
    }
  }

  public boolean isClosed() {
    return closed;
  }

  /**
   * Number of items dropped because the channel was closed or full.
   *
   * @return drop count since creation
   */
  public long droppedCount() {
    return dropped.sum();
  }

  /**
   * Returns the consumer's view of the channel. May be called once.
   *
   * @return single-pass blocking sequence of items
   * @throws IllegalStateException if a consumer already claimed the channel
   */
  public Iterable<T> drain() {
    if (!drained.compareAndSet(false, true)) {
      throw new IllegalStateException("Channel already has a consumer");
    }
    Iterator<T> iterator = new DrainIterator();
    return () -> iterator;
  }

  private final class DrainIterator implements Iterator<T> {
    private Object next;
    private boolean finished;

    @Override
    public boolean hasNext() {
      if (finished) {
        return false;
      }
      if (next == null) {
        try {
          next = queue.take();
        } catch (InterruptedException ex) {
          // The consumer is never interrupted by the session; treat interruption as end of stream.
          Thread.currentThread().interrupt();
          finished = true;
          return false;
        }
        if (next == END) {
          next = null;
          finished = true;
          return false;
        }
        depth.decrementAndGet();
      }
      return true;
    }

    @Override
    @SuppressWarnings("unchecked")
    public T next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      T item = (T) next;
      next = null;
      return item;
    }
  }
}
