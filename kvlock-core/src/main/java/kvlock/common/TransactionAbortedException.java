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
 * The transaction was chosen as deadlock victim and aborted to break a wait cycle.
 */
public class TransactionAbortedException extends TransactionTerminatedException {

  private static final long serialVersionUID = -2635004745612395386L;

  public TransactionAbortedException(String message, Object key) {
    super(message, key);
  }

}
