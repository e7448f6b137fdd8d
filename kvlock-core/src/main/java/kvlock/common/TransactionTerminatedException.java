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
package kvlock.common;

/**
 * A transaction was ended by the lock manager instead of its owner.
 * Delivered through the outcome of the terminated transaction, never thrown on a background thread.
 */
public abstract class TransactionTerminatedException extends KvlockException {

  private static final long serialVersionUID = 6218395528407751270L;

  private final transient Object key;

  protected TransactionTerminatedException(String message, Object key) {
    super(message);
    this.key = key;
  }

  /**
   * @return the key whose transaction was terminated
   */
  public Object getKey() {
    return key;
  }

}
