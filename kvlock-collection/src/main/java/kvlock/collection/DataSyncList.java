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

import java.util.Set;

import kvlock.core.LockManager;
import kvlock.core.LockManagerConfig;

/**
 * Owns a {@link SyncList} and its lock manager. Threads work on the list through
 * {@link #transaction()} and release their index locks by closing it:
 * <pre>
 * try(SyncList&lt;String&gt; tx = dataSyncList.transaction()) {
 *   tx.set(0, "value");
 * }
 * </pre>
 */
public class DataSyncList<T> implements AutoCloseable {

  private final LockManager<Integer> lockManager;

  private final SyncList<T> list;

  public DataSyncList() {
    this(LockManagerConfig.defaults());
  }

  public DataSyncList(LockManagerConfig config) {
    super();
    this.lockManager = new LockManager<>(config);
    this.list = new SyncList<>(lockManager);
  }

  public SyncList<T> transaction() {
    return list;
  }

  public Set<Integer> acquiredLocks() {
    return list.acquiredLocks();
  }

  @Override
  public void close() {
    lockManager.close();
  }

}
