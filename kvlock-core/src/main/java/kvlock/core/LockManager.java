/*
 * Copyright 2021 Andre Gebers
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
 */
package kvlock.core;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

import kvlock.common.KvlockException;
import kvlock.common.TransactionAbortedException;
import kvlock.common.TransactionTerminatedException;
import kvlock.common.TransactionTimedOutException;
import kvlock.core.graph.WaitForGraph;
import kvlock.core.graph.WaitNode;
import kvlock.core.util.HumanReadable;

/**
 * Hands out exclusive per key transactions to threads.
 * <p>
 * Lock records are created on first use and evicted in the background once they are idle and not held.
 * A transaction that is held longer than the max lock duration gets released forcibly, and a deadlock
 * between waiting threads gets broken by aborting one of the transactions involved. Both forced
 * terminations are reported through {@link LockTransaction#outcome()} of the terminated transaction
 * and to the registered termination listeners.
 * <p>
 * Acquisition is not fair, any waiting thread may get the lock once it is released. A thread that
 * already holds a key gets {@code true} when it starts a transaction on the key again, holds are not
 * counted and a single {@link #endTransaction(Object)} releases the key.
 *
 * @param <K> key type, requires proper {@code equals} and {@code hashCode}
 */
public class LockManager<K> implements AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(LockManager.class);

  // caps the deadline so that nanoTime arithmetic can't overflow
  private static final long MAX_TIMEOUT_NANOS = TimeUnit.DAYS.toNanos(365);

  private final LockManagerConfig config;

  private final ConcurrentMap<K, LockRecord<K>> locks = new ConcurrentHashMap<>();

  private final WaitForGraph<WaitNode<K>> waitForGraph = new WaitForGraph<>();

  private final ScheduledThreadPoolExecutor guardScheduler;

  private final EvictionSweeper<K> evictionSweeper;

  private final DeadlockResolver<K> deadlockResolver;

  private final AtomicLong sequence = new AtomicLong();

  private final AtomicBoolean closed = new AtomicBoolean();

  private final List<Consumer<LockTransaction<K>>> terminationListeners = new ArrayList<>();

  public LockManager() {
    this(LockManagerConfig.defaults());
  }

  public LockManager(LockManagerConfig config) {
    super();
    if(config == null) {
      throw new KvlockException("config is null");
    }
    this.config = config;
    this.guardScheduler = new ScheduledThreadPoolExecutor(1, new ThreadFactoryBuilder()
        .setNameFormat("kvlock-guard-%d")
        .setDaemon(true)
        .build());
    this.guardScheduler.setRemoveOnCancelPolicy(true);
    this.evictionSweeper = new EvictionSweeper<>(locks, config.getExpirationTime(), config.getEvictionInterval());
    this.deadlockResolver = new DeadlockResolver<>(this,
        config.getResolutionStrategy(),
        config.getDeadlockDetectionInterval());
    log.debug("lock manager config '{}'", config);
    evictionSweeper.start();
    deadlockResolver.start();
  }

  public LockManagerConfig getConfig() {
    return config;
  }

  /**
   * Start a transaction on the key, waiting up to the configured acquisition timeout.
   * @return {@code true} if the calling thread holds the key now
   */
  public boolean tryStartTransaction(K key) {
    return tryBeginTransaction(key) != null;
  }

  /**
   * Start a transaction on the key, waiting up to the timeout. Never throws on contention.
   * @return {@code true} if the calling thread holds the key now
   */
  public boolean tryStartTransaction(K key, long timeout, TimeUnit unit) {
    return tryBeginTransaction(key, timeout, unit) != null;
  }

  public LockTransaction<K> tryBeginTransaction(K key) {
    return tryBeginTransaction(key, config.getAcquisitionTimeout().toNanos(), TimeUnit.NANOSECONDS);
  }

  /**
   * Start a transaction on the key, waiting up to the timeout.
   * <p>
   * If the key is held by another thread the calling thread is recorded as waiting for it. The wait
   * stays recorded after a timeout until the thread acquires the key, calls {@link #releaseAll()} or the
   * key gets evicted.
   * @return the transaction or {@code null} if the key could not be acquired in time or the thread was
   *         interrupted
   * @throws KvlockException if the lock manager is closed
   */
  public LockTransaction<K> tryBeginTransaction(K key, long timeout, TimeUnit unit) {
    checkKey(key);
    checkOpen();
    long ownerId = Thread.currentThread().getId();
    long timeoutNs = Math.min(Math.max(0, unit.toNanos(timeout)), MAX_TIMEOUT_NANOS);
    long deadlineNs = System.nanoTime() + timeoutNs;
    for(;;) {
      LockRecord<K> record = locks.computeIfAbsent(key, k -> new LockRecord<>(k, waitForGraph));
      LockRecord.Acquisition<K> acquisition = record.tryAcquire(
          ownerId,
          deadlineNs,
          sequence::incrementAndGet,
          tx -> armGuard(record, tx));
      switch(acquisition.status()) {
      case ACQUIRED:
        log.debug("started '{}'", acquisition.transaction());
        return acquisition.transaction();
      case ALREADY_HELD:
        log.debug("key '{}' already held by current thread", key);
        return acquisition.transaction();
      case RETIRED:
        // evicted concurrently, retry on a fresh record
        locks.remove(key, record);
        continue;
      case INTERRUPTED:
        log.debug("interrupted while waiting for key '{}'", key);
        return null;
      case TIMEOUT:
      default:
        log.debug("failed to acquire key '{}' within '{}'", key,
            HumanReadable.formatDuration(Duration.ofNanos(timeoutNs)));
        return null;
      }
    }
  }

  /**
   * End the calling thread's transaction on the key. No-op if the calling thread does not hold the key.
   */
  public void endTransaction(K key) {
    checkKey(key);
    LockRecord<K> record = locks.get(key);
    LockTransaction<K> tx = (record != null)?record.release(Thread.currentThread().getId()):null;
    if(tx == null) {
      log.debug("end transaction, key '{}' not held by current thread, ignore", key);
      return;
    }
    tx.conclude(TransactionState.ENDED, null);
    log.debug("ended '{}'", tx);
  }

  /**
   * End all transactions of the calling thread and forget the keys it is recorded waiting for.
   * @return the keys that were released
   */
  public Set<K> releaseAll() {
    Set<K> held = heldKeys();
    held.forEach(this::endTransaction);
    forgetWaits();
    return held;
  }

  /**
   * Forget the keys the calling thread is recorded waiting for, after it gave up on them. Keys it
   * holds stay held.
   */
  public void forgetWaits() {
    waitForGraph.removeOutgoingEdges(WaitNode.owner(Thread.currentThread().getId()));
  }

  /**
   * @return the keys currently held by the calling thread
   */
  public Set<K> heldKeys() {
    long ownerId = Thread.currentThread().getId();
    return locks.values()
        .stream()
        .filter(record -> record.isHeldBy(ownerId))
        .map(LockRecord::getKey)
        .collect(Collectors.toSet());
  }

  public boolean isLocked(K key) {
    LockRecord<K> record = locks.get(key);
    return (record != null) && record.isLocked();
  }

  /**
   * @return the active transaction on the key, of any thread, or {@code null}
   */
  public LockTransaction<K> currentTransaction(K key) {
    LockRecord<K> record = locks.get(key);
    return (record != null)?record.currentTransaction():null;
  }

  /**
   * @return the number of lock records in the lock table, held or not
   */
  public int lockCount() {
    return locks.size();
  }

  public WaitForGraph<WaitNode<K>> waitForGraph() {
    return waitForGraph;
  }

  private Future<?> armGuard(LockRecord<K> record, LockTransaction<K> tx) {
    try {
      return guardScheduler.schedule(() -> expire(record, tx),
          config.getMaxLockDuration().toNanos(),
          TimeUnit.NANOSECONDS);
    } catch(RejectedExecutionException e) {
      log.debug("guard not armed for '{}', lock manager closed", tx);
      return null;
    }
  }

  private void expire(LockRecord<K> record, LockTransaction<K> tx) {
    String msg = String.format("transaction on key '%s' exceeded max lock duration of '%s'",
        tx.getKey(),
        HumanReadable.formatDuration(config.getMaxLockDuration()));
    if(terminate(record, tx, TransactionState.TIMED_OUT, new TransactionTimedOutException(msg, tx.getKey()))) {
      log.warn(msg);
    }
  }

  /**
   * Abort the transaction if it still holds its key.
   * @return {@code true} if the transaction was aborted
   */
  boolean abort(LockTransaction<K> tx) {
    LockRecord<K> record = locks.get(tx.getKey());
    if(record == null) {
      return false;
    }
    String msg = String.format("transaction on key '%s' aborted to resolve a deadlock", tx.getKey());
    return terminate(record, tx, TransactionState.ABORTED, new TransactionAbortedException(msg, tx.getKey()));
  }

  private boolean terminate(LockRecord<K> record,
      LockTransaction<K> tx,
      TransactionState state,
      TransactionTerminatedException e) {
    if(!record.forceRelease(tx)) {
      return false;
    }
    tx.conclude(state, e);
    getCopyOfTerminationListeners().forEach(l -> {
      try {
        l.accept(tx);
      } catch(Exception listenerException) {
        log.warn("exception on termination listener '{}', '{}'", l, tx, listenerException);
      }
    });
    return true;
  }

  /**
   * Run deadlock detection now instead of waiting for the next interval.
   * @return the aborted transaction or {@code null}
   */
  public LockTransaction<K> resolveDeadlock() {
    return deadlockResolver.resolve();
  }

  /**
   * Run the eviction now instead of waiting for the next interval.
   * @return the number of evicted lock records
   */
  public int evictIdle() {
    return evictionSweeper.evictIdle();
  }

  /**
   * Register a listener that is called with every transaction the lock manager terminates, on the
   * thread that terminated it.
   */
  public synchronized void registerTerminationListener(Consumer<LockTransaction<K>> listener) {
    terminationListeners.add(listener);
  }

  public synchronized void unregisterTerminationListener(Consumer<LockTransaction<K>> listener) {
    terminationListeners.remove(listener);
  }

  private synchronized List<Consumer<LockTransaction<K>>> getCopyOfTerminationListeners() {
    return new ArrayList<>(terminationListeners);
  }

  public void registerEvictionListener(Consumer<List<K>> listener) {
    evictionSweeper.registerEvictionListener(listener);
  }

  public void unregisterEvictionListener(Consumer<List<K>> listener) {
    evictionSweeper.unregisterEvictionListener(listener);
  }

  public boolean isClosed() {
    return closed.get();
  }

  private void checkOpen() {
    if(closed.get()) {
      throw new KvlockException("lock manager closed");
    }
  }

  private void checkKey(K key) {
    if(key == null) {
      throw new KvlockException("key is null");
    }
  }

  /**
   * Stops the background sweeps and cancels all max duration timers. Locks that are still held stay
   * held until their owners end them.
   */
  @Override
  public void close() {
    if(!closed.compareAndSet(false, true)) {
      return;
    }
    evictionSweeper.stop();
    deadlockResolver.stop();
    try {
      guardScheduler.shutdownNow();
    } catch(Exception e) {
      log.warn("failed to shutdown max lock duration timers", e);
    }
    long held = locks.values().stream().filter(LockRecord::isLocked).count();
    if(held > 0) {
      log.info("closed, '{}' lock(s) still held", held);
    } else {
      log.debug("closed");
    }
  }

  @Override
  public String toString() {
    return "LockManager, '" + locks.size() + "' lock(s), " + waitForGraph;
  }

  Map<K, LockRecord<K>> lockTable() {
    return locks;
  }

}
