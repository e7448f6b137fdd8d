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

import com.google.common.base.MoreObjects;

import kvlock.common.KvlockException;

/**
 * Immutable settings of a {@link LockManager}. Use {@link #builder()} to change any of the defaults.
 */
public class LockManagerConfig {

  public static final Duration DEFAULT_EXPIRATION_TIME = Duration.ofMinutes(5);

  public static final Duration DEFAULT_ACQUISITION_TIMEOUT = Duration.ofSeconds(30);

  public static final Duration DEFAULT_MAX_LOCK_DURATION = Duration.ofMinutes(1);

  public static final Duration DEFAULT_EVICTION_INTERVAL = Duration.ofMinutes(1);

  public static final Duration DEFAULT_DEADLOCK_DETECTION_INTERVAL = Duration.ofSeconds(10);

  public static final ResolutionStrategy DEFAULT_RESOLUTION_STRATEGY = ResolutionStrategy.TERMINATE_OLDEST;

  private static final LockManagerConfig DEFAULTS = builder().build();

  private final Duration expirationTime;

  private final Duration acquisitionTimeout;

  private final Duration maxLockDuration;

  private final Duration evictionInterval;

  private final Duration deadlockDetectionInterval;

  private final ResolutionStrategy resolutionStrategy;

  private LockManagerConfig(Builder b) {
    this.expirationTime = b.expirationTime;
    this.acquisitionTimeout = b.acquisitionTimeout;
    this.maxLockDuration = b.maxLockDuration;
    this.evictionInterval = b.evictionInterval;
    this.deadlockDetectionInterval = b.deadlockDetectionInterval;
    this.resolutionStrategy = b.resolutionStrategy;
  }

  public static LockManagerConfig defaults() {
    return DEFAULTS;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Idle time after which an unheld lock record gets evicted.
   */
  public Duration getExpirationTime() {
    return expirationTime;
  }

  /**
   * Timeout of {@link LockManager#tryStartTransaction(Object)}.
   */
  public Duration getAcquisitionTimeout() {
    return acquisitionTimeout;
  }

  /**
   * Maximum time a transaction may hold its lock before it gets released forcibly.
   */
  public Duration getMaxLockDuration() {
    return maxLockDuration;
  }

  public Duration getEvictionInterval() {
    return evictionInterval;
  }

  public Duration getDeadlockDetectionInterval() {
    return deadlockDetectionInterval;
  }

  public ResolutionStrategy getResolutionStrategy() {
    return resolutionStrategy;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("expirationTime", expirationTime)
        .add("acquisitionTimeout", acquisitionTimeout)
        .add("maxLockDuration", maxLockDuration)
        .add("evictionInterval", evictionInterval)
        .add("deadlockDetectionInterval", deadlockDetectionInterval)
        .add("resolutionStrategy", resolutionStrategy)
        .toString();
  }

  public static class Builder {

    private Duration expirationTime = DEFAULT_EXPIRATION_TIME;

    private Duration acquisitionTimeout = DEFAULT_ACQUISITION_TIMEOUT;

    private Duration maxLockDuration = DEFAULT_MAX_LOCK_DURATION;

    private Duration evictionInterval = DEFAULT_EVICTION_INTERVAL;

    private Duration deadlockDetectionInterval = DEFAULT_DEADLOCK_DETECTION_INTERVAL;

    private ResolutionStrategy resolutionStrategy = DEFAULT_RESOLUTION_STRATEGY;

    private Builder() {
      super();
    }

    private static Duration checkPositive(String name, Duration d) {
      if((d == null) || d.isNegative() || d.isZero()) {
        throw new KvlockException(String.format("invalid %s, '%s'", name, d));
      }
      return d;
    }

    public Builder setExpirationTime(Duration expirationTime) {
      this.expirationTime = checkPositive("expirationTime", expirationTime);
      return this;
    }

    /**
     * Set the default acquisition timeout, zero means fail immediately if the lock is held.
     */
    public Builder setAcquisitionTimeout(Duration acquisitionTimeout) {
      if((acquisitionTimeout == null) || acquisitionTimeout.isNegative()) {
        throw new KvlockException("invalid acquisitionTimeout, " + acquisitionTimeout);
      }
      this.acquisitionTimeout = acquisitionTimeout;
      return this;
    }

    public Builder setMaxLockDuration(Duration maxLockDuration) {
      this.maxLockDuration = checkPositive("maxLockDuration", maxLockDuration);
      return this;
    }

    public Builder setEvictionInterval(Duration evictionInterval) {
      this.evictionInterval = checkPositive("evictionInterval", evictionInterval);
      return this;
    }

    public Builder setDeadlockDetectionInterval(Duration deadlockDetectionInterval) {
      this.deadlockDetectionInterval = checkPositive("deadlockDetectionInterval", deadlockDetectionInterval);
      return this;
    }

    public Builder setResolutionStrategy(ResolutionStrategy resolutionStrategy) {
      if(resolutionStrategy == null) {
        throw new KvlockException("resolutionStrategy is null");
      }
      this.resolutionStrategy = resolutionStrategy;
      return this;
    }

    public LockManagerConfig build() {
      return new LockManagerConfig(this);
    }

  }

}
