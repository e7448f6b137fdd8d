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

import java.util.concurrent.CompletableFuture;

import kvlock.common.KvlockException;
import kvlock.common.TransactionTerminatedException;

/**
 * Exclusive access of one owner (thread) to one key, from acquisition to release.
 * <p>
 * The outcome is written exactly once, by whoever concludes the transaction: the owner calling
 * {@link LockManager#endTransaction(Object)} completes it normally with {@link TransactionState#ENDED},
 * the max duration guard and the deadlock resolver complete it exceptionally with a
 * {@link TransactionTerminatedException}.
 */
public class LockTransaction<K> {

  private final K key;

  private final long ownerId;

  private final long acquiredAtNanos;

  private final long acquiredAtMillis;

  private final long sequence;

  private final CompletableFuture<TransactionState> outcome = new CompletableFuture<>();

  private volatile TransactionState state = TransactionState.ACTIVE;

  private volatile TransactionTerminatedException termination;

  LockTransaction(K key, long ownerId, long acquiredAtNanos, long sequence) {
    super();
    this.key = key;
    this.ownerId = ownerId;
    this.acquiredAtNanos = acquiredAtNanos;
    this.acquiredAtMillis = System.currentTimeMillis();
    this.sequence = sequence;
  }

  public K getKey() {
    return key;
  }

  public long getOwnerId() {
    return ownerId;
  }

  /**
   * @return {@link System#nanoTime()} at acquisition, only comparable within the same JVM
   */
  public long getAcquiredAtNanos() {
    return acquiredAtNanos;
  }

  public long getAcquiredAtMillis() {
    return acquiredAtMillis;
  }

  /**
   * @return the acquisition order within the lock manager
   */
  public long getSequence() {
    return sequence;
  }

  public TransactionState state() {
    return state;
  }

  public boolean isActive() {
    return TransactionState.ACTIVE.equals(state);
  }

  /**
   * @return the exception that terminated this transaction or {@code null} if it is active or was
   *         ended by its owner
   */
  public TransactionTerminatedException termination() {
    return termination;
  }

  /**
   * A future that completes when the transaction concludes. It completes normally with
   * {@link TransactionState#ENDED} or exceptionally with a {@link TransactionTerminatedException}.
   */
  public CompletableFuture<TransactionState> outcome() {
    return outcome.copy();
  }

  /**
   * Throws if the transaction is no longer active.
   * @throws TransactionTerminatedException if the lock manager terminated the transaction
   * @throws KvlockException if the transaction was ended by its owner
   */
  public void checkActive() {
    TransactionState s = state;
    if(TransactionState.ACTIVE.equals(s)) {
      return;
    } else if(termination != null) {
      throw termination;
    } else {
      throw new KvlockException(String.format("transaction on key '%s' already ended", key));
    }
  }

  boolean conclude(TransactionState newState, TransactionTerminatedException e) {
    synchronized(this) {
      if(!TransactionState.ACTIVE.equals(state)) {
        return false;
      }
      this.termination = e;
      this.state = newState;
    }
    // complete outside the monitor, dependent stages run on the completing thread
    if(e != null) {
      outcome.completeExceptionally(e);
    } else {
      outcome.complete(newState);
    }
    return true;
  }

  @Override
  public String toString() {
    return "tx:" + sequence + "(key '" + key + "', owner '" + ownerId + "', " + state + ")";
  }

}
