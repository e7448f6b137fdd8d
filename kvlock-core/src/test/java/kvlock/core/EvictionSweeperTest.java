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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assertions.fail;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

import kvlock.core.graph.WaitNode;

public class EvictionSweeperTest {

  private static final long TIMEOUT_NANOS = TimeUnit.SECONDS.toNanos(10);

  private boolean isTimeout(long startNs) {
    return (System.nanoTime() - startNs) >= TIMEOUT_NANOS;
  }

  @Test
  public void heldLocksSurviveEviction() throws Exception {
    LockManagerConfig config = LockManagerConfig.builder()
        .setExpirationTime(Duration.ofMillis(100))
        .setEvictionInterval(Duration.ofMillis(50))
        .setDeadlockDetectionInterval(Duration.ofHours(1))
        .build();
    CompletableFuture<List<String>> evicted = new CompletableFuture<>();
    try(LockManager<String> lm = new LockManager<>(config); OwnerThread b = new OwnerThread("owner-b")) {
      lm.registerEvictionListener(evicted::complete);
      assertTrue(lm.tryStartTransaction("held"));
      assertTrue(lm.tryStartTransaction("idle"));
      lm.endTransaction("idle");
      assertEquals(2, lm.lockCount());
      long startNs = System.nanoTime();
      while(lm.lockCount() > 1) {
        if(isTimeout(startNs)) {
          fail("timeout reached, idle lock should have been evicted by now");
        }
        Thread.sleep(20);
      }
      assertEquals(List.of("idle"), evicted.get(5, TimeUnit.SECONDS));
      // several more eviction runs
      Thread.sleep(500);
      assertEquals(1, lm.lockCount());
      assertTrue(lm.isLocked("held"));
      assertFalse(b.call(() -> lm.tryStartTransaction("held", 0, TimeUnit.MILLISECONDS)));
      // evicted key gets a fresh record
      assertTrue(b.call(() -> lm.tryStartTransaction("idle", 0, TimeUnit.MILLISECONDS)));
      assertEquals(2, lm.lockCount());
      lm.endTransaction("held");
    }
  }

  @Test
  public void evictIdleNow() throws Exception {
    LockManagerConfig config = LockManagerConfig.builder()
        .setExpirationTime(Duration.ofMillis(50))
        .setEvictionInterval(Duration.ofHours(1))
        .setDeadlockDetectionInterval(Duration.ofHours(1))
        .build();
    try(LockManager<String> lm = new LockManager<>(config)) {
      assertTrue(lm.tryStartTransaction("k1"));
      lm.endTransaction("k1");
      assertTrue(lm.tryStartTransaction("k2"));
      // not idle long enough
      assertEquals(0, lm.evictIdle());
      LockRecord<String> record = lm.lockTable().get("k1");
      Thread.sleep(100);
      assertEquals(1, lm.evictIdle());
      assertTrue(record.isRetired());
      assertFalse(lm.lockTable().containsKey("k1"));
      assertFalse(lm.isLocked("k1"));
      assertTrue(lm.isLocked("k2"));
      assertEquals(1, lm.lockCount());
    }
  }

  @Test
  public void evictionDropsStaleWaits() throws Exception {
    LockManagerConfig config = LockManagerConfig.builder()
        .setExpirationTime(Duration.ofMillis(50))
        .setEvictionInterval(Duration.ofHours(1))
        .setDeadlockDetectionInterval(Duration.ofHours(1))
        .build();
    try(LockManager<String> lm = new LockManager<>(config); OwnerThread b = new OwnerThread("owner-b")) {
      assertTrue(lm.tryStartTransaction("k1"));
      assertFalse(b.call(() -> lm.tryStartTransaction("k1", 0, TimeUnit.MILLISECONDS)));
      long ownerB = b.call(() -> Thread.currentThread().getId());
      assertTrue(lm.waitForGraph().containsEdge(WaitNode.owner(ownerB), WaitNode.resource("k1")));
      lm.endTransaction("k1");
      Thread.sleep(100);
      assertEquals(1, lm.evictIdle());
      assertEquals(0, lm.waitForGraph().vertexCount());
    }
  }

  @Test
  public void exclusionWhileEvicting() throws Exception {
    // records expire almost immediately and get evicted all the time while threads use them
    LockManagerConfig config = LockManagerConfig.builder()
        .setExpirationTime(Duration.ofNanos(1))
        .setEvictionInterval(Duration.ofMillis(1))
        .setDeadlockDetectionInterval(Duration.ofHours(1))
        .build();
    final int threads = 8;
    final String[] keys = {"a", "b"};
    AtomicInteger[] inside = {new AtomicInteger(), new AtomicInteger()};
    AtomicBoolean violated = new AtomicBoolean();
    AtomicInteger evictions = new AtomicInteger();
    ExecutorService pool = Executors.newFixedThreadPool(threads);
    try(LockManager<String> lm = new LockManager<>(config)) {
      lm.registerEvictionListener(l -> evictions.addAndGet(l.size()));
      List<Future<?>> futures = new ArrayList<>();
      for(int t=0;t<threads;t++) {
        final int offset = t;
        futures.add(pool.submit(() -> {
          for(int i=0;i<1000;i++) {
            int k = (i + offset) % keys.length;
            if(lm.tryStartTransaction(keys[k], 5, TimeUnit.SECONDS)) {
              try {
                if(inside[k].incrementAndGet() != 1) {
                  violated.set(true);
                }
                inside[k].decrementAndGet();
              } finally {
                lm.endTransaction(keys[k]);
              }
            }
            if((i % 100) == 0) {
              Thread.sleep(2);
            }
          }
          return null;
        }));
      }
      for(Future<?> f : futures) {
        f.get(60, TimeUnit.SECONDS);
      }
      assertFalse(violated.get());
      assertTrue(evictions.get() > 0);
    } finally {
      pool.shutdownNow();
    }
  }

}
