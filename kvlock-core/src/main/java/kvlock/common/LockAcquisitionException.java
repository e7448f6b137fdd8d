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
 * Raised when a lock could not be acquired within the acquisition timeout by code that can't
 * proceed without it.
 */
public class LockAcquisitionException extends KvlockException {

  private static final long serialVersionUID = -4431086537120924672L;

  public LockAcquisitionException(String message, Throwable cause) {
    super(message, cause);
  }

  public LockAcquisitionException(String message) {
    super(message);
  }

}
