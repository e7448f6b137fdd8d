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

import java.util.Collection;
import java.util.Comparator;

/**
 * Picks the transaction to abort when a deadlock has been detected.
 */
public enum ResolutionStrategy {

  /** abort the transaction that acquired its lock first */
  TERMINATE_OLDEST,

  /** abort the transaction that acquired its lock last */
  TERMINATE_NEWEST;

  private static final Comparator<LockTransaction<?>> BY_ACQUISITION =
      Comparator.<LockTransaction<?>>comparingLong(LockTransaction::getAcquiredAtNanos)
      .thenComparingLong(LockTransaction::getSequence);

  public <K> LockTransaction<K> selectVictim(Collection<LockTransaction<K>> candidates) {
    if(candidates.isEmpty()) {
      return null;
    }
    LockTransaction<K> victim = null;
    for(LockTransaction<K> tx : candidates) {
      if(victim == null) {
        victim = tx;
      } else {
        int c = BY_ACQUISITION.compare(tx, victim);
        if((TERMINATE_OLDEST.equals(this) && (c < 0)) || (TERMINATE_NEWEST.equals(this) && (c > 0))) {
          victim = tx;
        }
      }
    }
    return victim;
  }

}
