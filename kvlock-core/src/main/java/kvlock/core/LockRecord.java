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

import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.function.LongSupplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import kvlock.core.graph.WaitForGraph;
import kvlock.core.graph.WaitNode;

/**
 * Per key lock state. The record is its own monitor; the exclusive lock is the owner field guarded by
 * it, so a thread other than the owner (max duration guard, deadlock resolver) can release it.
 * <p>
 * Wait-for graph updates for this key happen while holding the record monitor. The graph is never
 * locked first, so there is a single lock order: record, then graph.
 */
class LockRecord<K> {

  private static final Logger log = LoggerFactory.getLogger(LockRecord.class);

  enum Status {
    ACQUIRED,
    ALREADY_HELD,
    TIMEOUT,
    INTERRUPTED,
    // evicted from the lock table, the caller has to fetch a fresh record
    RETIRED;
  }

  static class Acquisition<K> {

    private final Status status;

    private final LockTransaction<K> transaction;

    private Acquisition(Status status, LockTransaction<K> transaction) {
      this.status = status;
      this.transaction = transaction;
    }

    Status status() {
      return status;
    }

    LockTransaction<K> transaction() {
      return transaction;
    }

  }

  private final K key;

  private final WaitNode<K> keyNode;

  private final WaitForGraph<WaitNode<K>> waitForGraph;

  private boolean locked;

  private long ownerId;

  private boolean retired;

  private long lastAccessedNanos;

  private long acquiredAtNanos;

  private LockTransaction<K> transaction;

  private Future<?> guard;

  LockRecord(K key, WaitForGraph<WaitNode<K>> waitForGraph) {
    super();
    this.key = key;
    this.keyNode = WaitNode.resource(key);
    this.waitForGraph = waitForGraph;
    this.lastAccessedNanos = System.nanoTime();
  }

  K getKey() {
    return key;
  }

  /**
   * Blocks until the lock is granted, the deadline passes, the thread gets interrupted or the record
   * retires.
   * @param armGuard called with the new transaction once the lock is granted, returns the guard timer
   *        or {@code null}
   */
  synchronized Acquisition<K> tryAcquire(long owner,
      long deadlineNanos,
      LongSupplier sequence,
      Function<LockTransaction<K>, Future<?>> armGuard) {
    if(retired) {
      return new Acquisition<>(Status.RETIRED, null);
    }
    if(locked && (ownerId == owner)) {
      return new Acquisition<>(Status.ALREADY_HELD, transaction);
    }
    WaitNode<K> ownerNode = WaitNode.owner(owner);
    boolean waiting = false;
    while(locked) {
      long remainingNanos = deadlineNanos - System.nanoTime();
      if(remainingNanos <= 0) {
        waitForGraph.addEdge(ownerNode, keyNode);
        return new Acquisition<>(Status.TIMEOUT, null);
      }
      if(!waiting) {
        waitForGraph.addEdge(ownerNode, keyNode);
        waiting = true;
      }
      try {
        TimeUnit.NANOSECONDS.timedWait(this, remainingNanos);
      } catch(InterruptedException e) {
        Thread.currentThread().interrupt();
        return new Acquisition<>(Status.INTERRUPTED, null);
      }
      if(retired) {
        return new Acquisition<>(Status.RETIRED, null);
      }
    }
    long now = System.nanoTime();
    locked = true;
    ownerId = owner;
    acquiredAtNanos = now;
    lastAccessedNanos = now;
    transaction = new LockTransaction<>(key, owner, now, sequence.getAsLong());
    waitForGraph.removeEdge(ownerNode, keyNode);
    waitForGraph.addEdge(keyNode, ownerNode);
    guard = armGuard.apply(transaction);
    log.trace("acquired '{}'", transaction);
    return new Acquisition<>(Status.ACQUIRED, transaction);
  }

  /**
   * Release on behalf of the owner.
   * @return the concluded transaction or {@code null} if the owner does not hold the lock
   */
  synchronized LockTransaction<K> release(long owner) {
    if(!locked || (ownerId != owner)) {
      return null;
    }
    return clear();
  }

  /**
   * Release on behalf of the lock manager, only if the expected transaction still holds the lock.
   */
  synchronized boolean forceRelease(LockTransaction<K> expected) {
    if(!locked || (transaction != expected)) {
      return false;
    }
    clear();
    return true;
  }

  private LockTransaction<K> clear() {
    LockTransaction<K> tx = transaction;
    waitForGraph.removeEdge(keyNode, WaitNode.owner(ownerId));
    if(guard != null) {
      guard.cancel(false);
      guard = null;
    }
    locked = false;
    ownerId = 0;
    transaction = null;
    lastAccessedNanos = System.nanoTime();
    notifyAll();
    log.trace("released '{}'", tx);
    return tx;
  }

  /**
   * Retire the record if nobody holds it and it has not been accessed for longer than the expiration.
   * A retired record is never handed out again.
   */
  synchronized boolean retireIfIdle(long nowNanos, long expirationNanos) {
    if(locked || retired) {
      return false;
    }
    if((nowNanos - lastAccessedNanos) > expirationNanos) {
      retired = true;
      // drops wait edges of callers that gave up on this key
      waitForGraph.removeVertex(keyNode);
      notifyAll();
      return true;
    }
    return false;
  }

  synchronized boolean isLocked() {
    return locked;
  }

  synchronized boolean isHeldBy(long owner) {
    return locked && (ownerId == owner);
  }

  synchronized boolean isRetired() {
    return retired;
  }

  synchronized LockTransaction<K> currentTransaction() {
    return transaction;
  }

  synchronized long getLastAccessedNanos() {
    return lastAccessedNanos;
  }

  synchronized long getAcquiredAtNanos() {
    return acquiredAtNanos;
  }

  @Override
  public String toString() {
    return "lock:" + key;
  }

}
