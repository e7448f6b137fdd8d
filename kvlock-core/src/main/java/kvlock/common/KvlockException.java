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
 * Base of all exceptions raised by the lock manager and its consumers.
 */
public class KvlockException extends RuntimeException {

  private static final long serialVersionUID = 3906260371542318517L;

  public KvlockException() {
    super();
  }

  public KvlockException(String message, Throwable cause, boolean enableSuppression, boolean writableStackTrace) {
    super(message, cause, enableSuppression, writableStackTrace);
  }

  public KvlockException(String message, Throwable cause) {
    super(message, cause);
  }

  public KvlockException(String message) {
    super(message);
  }

  public KvlockException(Throwable cause) {
    super(cause);
  }

}
