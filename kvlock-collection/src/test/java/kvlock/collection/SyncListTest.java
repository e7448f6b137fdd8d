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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import kvlock.common.LockAcquisitionException;
import kvlock.common.TransactionTimedOutException;
import kvlock.core.LockManager;
import kvlock.core.LockManagerConfig;
import kvlock.core.LockTransaction;
import kvlock.core.graph.WaitNode;

public class SyncListTest {

  private LockManager<Integer> lockManager;

  private SyncList<String> list;

  private ExecutorService other;

  @BeforeEach
  public void setup() {
    lockManager = new LockManager<>(LockManagerConfig.builder()
        .setAcquisitionTimeout(Duration.ofMillis(100))
        .build());
    list = new SyncList<>(lockManager);
    list.addAll(List.of("a", "b", "c"));
    other = Executors.newSingleThreadExecutor();
  }

  @AfterEach
  public void teardown() {
    other.shutdownNow();
    lockManager.close();
  }

  private <T> T onOtherThread(Callable<T> c) throws Exception {
    return other.submit(c).get(10, TimeUnit.SECONDS);
  }

  @Test
  public void indexLockedUntilClose() throws Exception {
    assertEquals("a", list.get(0));
    assertEquals(Set.of(0), list.acquiredLocks());
    assertTrue(lockManager.isLocked(0));
    ExecutionException e = assertThrows(ExecutionException.class, () -> onOtherThread(() -> list.get(0)));
    assertInstanceOf(LockAcquisitionException.class, e.getCause());
    // other indexes are free
    assertEquals("b", onOtherThread(() -> list.set(1, "B")));
    assertEquals(Set.of(0, 1), list.acquiredLocks());
    list.close();
    assertEquals(Set.of(1), list.acquiredLocks());
    assertEquals("a", onOtherThread(() -> list.get(0)));
    onOtherThread(() -> {
      list.close();
      return null;
    });
    assertTrue(list.acquiredLocks().isEmpty());
    assertFalse(lockManager.isLocked(0));
    assertFalse(lockManager.isLocked(1));
  }

  @Test
  public void closeForgetsFailedAcquisitions() throws Exception {
    assertEquals("a", list.get(0));
    assertEquals("b", onOtherThread(() -> list.get(1)));
    assertThrows(LockAcquisitionException.class, () -> list.get(1));
    long ownerId = Thread.currentThread().getId();
    assertTrue(lockManager.waitForGraph().containsEdge(WaitNode.owner(ownerId), WaitNode.resource(1)));
    list.close();
    assertFalse(lockManager.waitForGraph().containsVertex(WaitNode.owner(ownerId)));
    // holding index 0 again while the other thread waits for it is no deadlock
    assertEquals("a", list.get(0));
    ExecutionException e = assertThrows(ExecutionException.class, () -> onOtherThread(() -> list.get(0)));
    assertInstanceOf(LockAcquisitionException.class, e.getCause());
    assertFalse(lockManager.waitForGraph().hasCycle());
    assertNull(lockManager.resolveDeadlock());
    assertEquals(Set.of(0, 1), list.acquiredLocks());
    list.close();
    onOtherThread(() -> {
      list.close();
      return null;
    });
    assertEquals(0, lockManager.waitForGraph().vertexCount());
  }

  @Test
  public void terminatedIndexThrowsUntilClose() throws Exception {
    LockManagerConfig config = LockManagerConfig.builder()
        .setAcquisitionTimeout(Duration.ofMillis(100))
        .setMaxLockDuration(Duration.ofMillis(300))
        .build();
    try(LockManager<Integer> shortLocks = new LockManager<>(config)) {
      SyncList<Integer> counters = new SyncList<>(shortLocks);
      counters.add(0);
      assertEquals(0, (int)counters.get(0));
      LockTransaction<Integer> tx = shortLocks.currentTransaction(0);
      ExecutionException e = assertThrows(ExecutionException.class, () -> tx.outcome().get(10, TimeUnit.SECONDS));
      assertInstanceOf(TransactionTimedOutException.class, e.getCause());
      assertFalse(shortLocks.isLocked(0));
      assertTrue(counters.acquiredLocks().isEmpty());
      // another thread writes between the read and the write of this thread
      assertEquals(0, (int)onOtherThread(() -> {
        try(SyncList<Integer> other = counters) {
          return other.set(0, 5);
        }
      }));
      assertThrows(TransactionTimedOutException.class, () -> counters.set(0, 1));
      assertThrows(TransactionTimedOutException.class, () -> counters.get(0));
      assertEquals(5, (int)counters.toArray()[0]);
      counters.close();
      assertEquals(5, (int)counters.get(0));
      counters.close();
    }
  }

  @Test
  public void unlockedOperations() throws Exception {
    assertEquals("b", list.get(1));
    // appending and searching never wait for index locks
    assertTrue(onOtherThread(() -> list.add("d")));
    assertEquals(4, (int)onOtherThread(list::size));
    assertTrue(onOtherThread(() -> list.contains("b")));
    assertEquals(1, (int)onOtherThread(() -> list.indexOf("b")));
    assertEquals(List.of("a", "b", "c", "d"), List.copyOf(list));
    list.close();
  }

  @Test
  public void removeLocksIndex() throws Exception {
    assertTrue(list.remove("b"));
    assertEquals(Set.of(1), list.acquiredLocks());
    assertFalse(list.remove("x"));
    assertEquals("c", list.remove(1));
    list.add(0, "z");
    assertEquals(Set.of(0, 1), list.acquiredLocks());
    assertEquals(List.of("z", "a"), List.copyOf(list));
    list.close();
  }

  @Test
  public void snapshotIterator() {
    Iterator<String> it = list.iterator();
    list.add("d");
    assertEquals("a", it.next());
    assertThrows(UnsupportedOperationException.class, it::remove);
    int count = 0;
    for(String s : list) {
      assertNotNull(s);
      count++;
    }
    assertEquals(4, count);
    assertTrue(list.acquiredLocks().isEmpty());
  }

  @Test
  public void clearReleasesLocks() {
    list.get(0);
    list.get(2);
    assertEquals(Set.of(0, 2), list.acquiredLocks());
    list.clear();
    assertEquals(0, list.size());
    assertTrue(list.acquiredLocks().isEmpty());
    assertFalse(lockManager.isLocked(2));
  }

  @Test
  public void outOfBounds() {
    assertThrows(IndexOutOfBoundsException.class, () -> list.get(5));
    // the index is locked before the bounds check
    assertEquals(Set.of(5), list.acquiredLocks());
    list.close();
  }

  @Test
  public void concurrentWriters() throws Exception {
    final int threads = 4;
    final int rounds = 200;
    SyncList<Integer> counters = new SyncList<>(lockManager);
    counters.add(0);
    ExecutorService pool = Executors.newFixedThreadPool(threads);
    try {
      List<Future<Object>> futures = pool.invokeAll(Collections.nCopies(threads, () -> {
        for(int i=0;i<rounds;i++) {
          for(;;) {
            try(SyncList<Integer> tx = counters) {
              tx.set(0, tx.get(0) + 1);
              break;
            } catch(LockAcquisitionException e) {
              // retry
            }
          }
        }
        return null;
      }));
      for(Future<Object> f : futures) {
        f.get(60, TimeUnit.SECONDS);
      }
    } finally {
      pool.shutdownNow();
    }
    assertEquals(threads * rounds, (int)counters.get(0));
    counters.close();
  }

}
