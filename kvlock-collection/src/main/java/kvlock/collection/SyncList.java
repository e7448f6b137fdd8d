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
package kvlock.collection;

import java.util.AbstractList;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.ListIterator;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import kvlock.common.LockAcquisitionException;
import kvlock.common.TransactionTerminatedException;
import kvlock.core.LockManager;
import kvlock.core.LockTransaction;

/**
 * List that locks an index before it reads or modifies the element at that index. Locks are held per
 * thread until the thread calls {@link #close()}, which releases all indexes it acquired.
 * <p>
 * If the lock manager terminates the transaction on an index (max lock duration exceeded or deadlock
 * victim), every further access of the thread to that index throws the
 * {@link TransactionTerminatedException} until the thread calls {@link #close()}.
 * <p>
 * Appending, searching and iterating do not lock indexes. Iterators work on a snapshot and are
 * read-only.
 */
public class SyncList<T> extends AbstractList<T> implements AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(SyncList.class);

  private final List<T> list = new ArrayList<>();

  private final LockManager<Integer> lockManager;

  // thread id -> transactions on the indexes acquired by that thread
  private final Map<Long, Map<Integer, LockTransaction<Integer>>> transactionLocks = new HashMap<>();

  public SyncList(LockManager<Integer> lockManager) {
    super();
    this.lockManager = lockManager;
  }

  public LockManager<Integer> getLockManager() {
    return lockManager;
  }

  private void acquireLock(int index) {
    long ownerId = Thread.currentThread().getId();
    LockTransaction<Integer> held;
    synchronized(transactionLocks) {
      Map<Integer, LockTransaction<Integer>> indexes = transactionLocks.get(ownerId);
      held = (indexes != null)?indexes.get(index):null;
    }
    if(held != null) {
      if(held.isActive()) {
        return;
      }
      TransactionTerminatedException termination = held.termination();
      if(termination != null) {
        throw termination;
      }
      // ended directly on the lock manager, acquire again
    }
    LockTransaction<Integer> tx = lockManager.tryBeginTransaction(index);
    if(tx == null) {
      throw new LockAcquisitionException("could not acquire lock on index " + index);
    }
    synchronized(transactionLocks) {
      transactionLocks.computeIfAbsent(ownerId, id -> new HashMap<>()).put(index, tx);
    }
  }

  @Override
  public T get(int index) {
    acquireLock(index);
    synchronized(list) {
      return list.get(index);
    }
  }

  @Override
  public T set(int index, T element) {
    acquireLock(index);
    synchronized(list) {
      return list.set(index, element);
    }
  }

  @Override
  public boolean add(T element) {
    synchronized(list) {
      return list.add(element);
    }
  }

  @Override
  public void add(int index, T element) {
    acquireLock(index);
    synchronized(list) {
      list.add(index, element);
    }
  }

  @Override
  public T remove(int index) {
    acquireLock(index);
    synchronized(list) {
      return list.remove(index);
    }
  }

  @Override
  public boolean remove(Object o) {
    int index = indexOf(o);
    if(index == -1) {
      return false;
    }
    acquireLock(index);
    synchronized(list) {
      return list.remove(o);
    }
  }

  @Override
  public int size() {
    synchronized(list) {
      return list.size();
    }
  }

  @Override
  public boolean contains(Object o) {
    synchronized(list) {
      return list.contains(o);
    }
  }

  @Override
  public int indexOf(Object o) {
    synchronized(list) {
      return list.indexOf(o);
    }
  }

  @Override
  public int lastIndexOf(Object o) {
    synchronized(list) {
      return list.lastIndexOf(o);
    }
  }

  @Override
  public boolean addAll(Collection<? extends T> c) {
    synchronized(list) {
      return list.addAll(c);
    }
  }

  @Override
  public Object[] toArray() {
    synchronized(list) {
      return list.toArray();
    }
  }

  private List<T> snapshot() {
    synchronized(list) {
      return Collections.unmodifiableList(new ArrayList<>(list));
    }
  }

  @Override
  public Iterator<T> iterator() {
    return snapshot().iterator();
  }

  @Override
  public ListIterator<T> listIterator(int index) {
    return snapshot().listIterator(index);
  }

  /**
   * Remove all elements and release the indexes the calling thread holds.
   */
  @Override
  public void clear() {
    synchronized(list) {
      list.clear();
    }
    close();
  }

  /**
   * @return the indexes currently held by any thread, terminated transactions are left out
   */
  public Set<Integer> acquiredLocks() {
    synchronized(transactionLocks) {
      Set<Integer> acquired = new TreeSet<>();
      transactionLocks.values().forEach(indexes -> indexes.forEach((index, tx) -> {
        if(tx.isActive()) {
          acquired.add(index);
        }
      }));
      return acquired;
    }
  }

  /**
   * Release all indexes acquired by the calling thread and forget the indexes it failed to acquire.
   */
  @Override
  public void close() {
    Map<Integer, LockTransaction<Integer>> indexes;
    synchronized(transactionLocks) {
      indexes = transactionLocks.remove(Thread.currentThread().getId());
    }
    if(indexes != null) {
      indexes.keySet().forEach(lockManager::endTransaction);
      log.debug("released '{}' index lock(s)", indexes.size());
    }
    // a failed acquisition leaves the thread recorded as waiting
    lockManager.forgetWaits();
  }

}
