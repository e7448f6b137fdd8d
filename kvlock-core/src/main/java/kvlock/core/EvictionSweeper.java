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
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import kvlock.core.util.HumanReadable;

/**
 * Removes lock records that are not held and have not been accessed within the expiration time.
 * Held records are never removed.
 */
class EvictionSweeper<K> {

  private static final Logger log = LoggerFactory.getLogger(EvictionSweeper.class);

  private final ConcurrentMap<K, LockRecord<K>> locks;

  private final Duration expirationTime;

  private final Duration interval;

  private Thread evictionThread;

  private final AtomicBoolean stop = new AtomicBoolean();

  private final List<Consumer<List<K>>> listeners = new ArrayList<>();

  EvictionSweeper(ConcurrentMap<K, LockRecord<K>> locks, Duration expirationTime, Duration interval) {
    super();
    this.locks = locks;
    this.expirationTime = expirationTime;
    this.interval = interval;
  }

  synchronized void start() {
    if(evictionThread == null) {
      evictionThread = setupEvictionThread();
      evictionThread.setDaemon(true);
      evictionThread.start();
    }
  }

  synchronized void stop() {
    if(evictionThread != null) {
      stop.set(true);
      listeners.clear();
      evictionThread.interrupt();
    }
  }

  private Thread setupEvictionThread() {
    Runnable r = () -> {
      log.info("started, expiration time '{}', check interval '{}'",
          HumanReadable.formatDuration(expirationTime),
          HumanReadable.formatDuration(interval));
      try {
        while(!stop.get()) {
          try {
            Thread.sleep(interval.toMillis());
          } catch(InterruptedException e) {
            log.debug("interrupted, exiting...");
            break;
          }
          try {
            evictIdle();
          } catch(Throwable t) {
            log.error("failed in eviction thread", t);
          }
        }
      } finally {
        log.info("stopped");
      }
    };
    return new Thread(r, "kvlock-eviction");
  }

  /**
   * @return the number of evicted lock records
   */
  int evictIdle() {
    long startNs = System.nanoTime();
    long expirationNs = expirationTime.toNanos();
    List<K> evicted = new ArrayList<>();
    for(Map.Entry<K, LockRecord<K>> entry : locks.entrySet()) {
      LockRecord<K> record = entry.getValue();
      if(record.retireIfIdle(System.nanoTime(), expirationNs)) {
        locks.remove(entry.getKey(), record);
        evicted.add(entry.getKey());
      }
    }
    if(!evicted.isEmpty()) {
      getCopyOfListeners().forEach(l -> {
        try {
          l.accept(evicted);
        } catch(Exception e) {
          log.warn("exception on eviction listener '{}', '{}'", l, evicted, e);
        }
      });
    }
    if(log.isDebugEnabled()) {
      log.debug("evicted '{}' idle lock(s) in '{}', '{}' lock(s) left",
          evicted.size(),
          HumanReadable.formatDuration(Duration.ofNanos(System.nanoTime() - startNs)),
          locks.size());
    }
    return evicted.size();
  }

  synchronized void registerEvictionListener(Consumer<List<K>> listener) {
    listeners.add(listener);
  }

  synchronized void unregisterEvictionListener(Consumer<List<K>> listener) {
    listeners.remove(listener);
  }

  private synchronized List<Consumer<List<K>>> getCopyOfListeners() {
    return new ArrayList<>(listeners);
  }

}
