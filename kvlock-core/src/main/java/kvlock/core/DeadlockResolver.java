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
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import kvlock.core.graph.WaitNode;
import kvlock.core.util.HumanReadable;

/**
 * Periodically searches the wait-for graph for a cycle and aborts one transaction of the cycle,
 * picked by the {@link ResolutionStrategy}. At most one victim per run, remaining deadlocks are
 * resolved on the next runs.
 */
class DeadlockResolver<K> {

  private static final Logger log = LoggerFactory.getLogger(DeadlockResolver.class);

  private final LockManager<K> lockManager;

  private final ResolutionStrategy strategy;

  private final Duration interval;

  private Thread t;

  private final AtomicBoolean stop = new AtomicBoolean();

  DeadlockResolver(LockManager<K> lockManager, ResolutionStrategy strategy, Duration interval) {
    super();
    this.lockManager = lockManager;
    this.strategy = strategy;
    this.interval = interval;
  }

  synchronized void start() {
    if(t != null) {
      return;
    }
    Runnable r = () -> {
      log.info("started, strategy '{}', check interval '{}'", strategy, HumanReadable.formatDuration(interval));
      try {
        while(!stop.get()) {
          try {
            Thread.sleep(interval.toMillis());
          } catch(InterruptedException e) {
            break;
          }
          try {
            resolve();
          } catch(Throwable t) {
            log.error("exception in deadlock resolver", t);
          }
        }
      } finally {
        log.info("stopped");
      }
    };
    t = new Thread(r, "kvlock-deadlock-resolver");
    t.setDaemon(true);
    t.start();
  }

  synchronized void stop() {
    stop.set(true);
    if(t != null) {
      t.interrupt();
    }
  }

  /**
   * Run deadlock detection once.
   * @return the aborted transaction or {@code null} if there was no deadlock
   */
  LockTransaction<K> resolve() {
    List<WaitNode<K>> cycle = lockManager.waitForGraph().cycleNodes();
    if(cycle == null) {
      return null;
    }
    List<LockTransaction<K>> candidates = new ArrayList<>();
    for(WaitNode<K> node : cycle) {
      if(node.isResource()) {
        LockTransaction<K> tx = lockManager.currentTransaction(node.getKey());
        if(tx != null) {
          candidates.add(tx);
        }
      }
    }
    LockTransaction<K> victim = strategy.selectVictim(candidates);
    if(victim == null) {
      // holders released in the meantime
      log.debug("cycle '{}' without lock holder, ignore", cycle);
      return null;
    }
    log.warn("deadlock detected '{}', aborting '{}' ({})", cycle, victim, strategy);
    return lockManager.abort(victim)?victim:null;
  }

}
