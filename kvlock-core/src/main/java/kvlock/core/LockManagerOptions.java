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
import java.util.concurrent.TimeUnit;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;

import kvlock.common.KvlockException;
import kvlock.core.util.HumanReadable;

/**
 * Lock manager settings as command line options, for applications that let their users tune the
 * lock manager. Options that are not given keep the defaults of {@link LockManagerConfig}.
 */
public class LockManagerOptions {

  @Parameter(names="--lock-expiration-time", description="evict unheld locks after no access within this"
      + " duration. Unit can be specified ms, s, m, h, d, defaults to seconds.")
  public String expirationTime;

  @Parameter(names="--lock-acquisition-timeout", description="default time to wait for a lock."
      + " Unit can be specified ms, s, m, h, d, defaults to seconds.")
  public String acquisitionTimeout;

  @Parameter(names="--lock-max-duration", description="release locks forcibly that are held longer than this."
      + " Unit can be specified ms, s, m, h, d, defaults to seconds.")
  public String maxLockDuration;

  @Parameter(names="--lock-eviction-interval", description="how often to check for idle locks."
      + " Unit can be specified ms, s, m, h, d, defaults to seconds.")
  public String evictionInterval;

  @Parameter(names="--lock-deadlock-detection-interval", description="how often to check for deadlocks."
      + " Unit can be specified ms, s, m, h, d, defaults to seconds.")
  public String deadlockDetectionInterval;

  @Parameter(names="--lock-resolution-strategy", description="deadlock victim selection, options:"
      + " TERMINATE_OLDEST, TERMINATE_NEWEST")
  public ResolutionStrategy resolutionStrategy;

  /**
   * Parse the lock manager options from the arguments, other arguments are ignored.
   */
  public static LockManagerOptions parse(String... args) {
    LockManagerOptions options = new LockManagerOptions();
    try {
      JCommander.newBuilder()
      .addObject(options)
      .acceptUnknownOptions(true)
      .build()
      .parse(args);
    } catch(ParameterException e) {
      throw new KvlockException("failed to parse lock manager options", e);
    }
    return options;
  }

  public LockManagerConfig toConfig() {
    LockManagerConfig.Builder b = LockManagerConfig.builder();
    Duration d = durationOrNull(expirationTime);
    if(d != null) {
      b.setExpirationTime(d);
    }
    d = durationOrNull(acquisitionTimeout);
    if(d != null) {
      b.setAcquisitionTimeout(d);
    }
    d = durationOrNull(maxLockDuration);
    if(d != null) {
      b.setMaxLockDuration(d);
    }
    d = durationOrNull(evictionInterval);
    if(d != null) {
      b.setEvictionInterval(d);
    }
    d = durationOrNull(deadlockDetectionInterval);
    if(d != null) {
      b.setDeadlockDetectionInterval(d);
    }
    if(resolutionStrategy != null) {
      b.setResolutionStrategy(resolutionStrategy);
    }
    return b.build();
  }

  // blank means not set
  private static Duration durationOrNull(String duration) {
    return HumanReadable.parseDurationOrNull(duration, TimeUnit.SECONDS);
  }

}
