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
package kvlock.core.util;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import org.apache.commons.lang3.StringUtils;

import kvlock.common.KvlockException;

public class HumanReadable {

  private HumanReadable() {
  }

  public static Duration parseDurationOrNull(String s, TimeUnit defaultTimeUnit) {
    if(StringUtils.isBlank(s)) {
      return null;
    }
    return parseDuration(s, defaultTimeUnit);
  }

  /**
   * Parse a duration with an optional unit suffix. Suffixes are: ms, s, m, h, d.
   * A value without suffix is interpreted in the default time unit.
   */
  public static Duration parseDuration(String s, TimeUnit defaultTimeUnit) {
    if(StringUtils.isBlank(s)) {
      throw new KvlockException("failed to parse duration, blank");
    }
    String trimmed = StringUtils.trim(s);
    int end = StringUtils.indexOfAnyBut(trimmed, "0123456789");
    String digits = end==-1?trimmed:trimmed.substring(0, end);
    String suffix = end==-1?"":trimmed.substring(end).trim();
    if(digits.isEmpty()) {
      throw new KvlockException("failed to parse duration " + s);
    }
    long value;
    try {
      value = Long.parseLong(digits);
    } catch(NumberFormatException e) {
      throw new KvlockException("failed to parse duration " + s, e);
    }
    TimeUnit unit = unitOf(suffix, defaultTimeUnit, s);
    try {
      return Duration.of(value, unit.toChronoUnit());
    } catch(ArithmeticException e) {
      throw new KvlockException("duration out of range " + s, e);
    }
  }

  private static TimeUnit unitOf(String suffix, TimeUnit defaultTimeUnit, String s) {
    if(suffix.isEmpty()) {
      return defaultTimeUnit;
    } else if(StringUtils.equalsIgnoreCase(suffix, "ms")) {
      return TimeUnit.MILLISECONDS;
    } else if(StringUtils.equalsIgnoreCase(suffix, "s")) {
      return TimeUnit.SECONDS;
    } else if(StringUtils.equalsIgnoreCase(suffix, "m")) {
      return TimeUnit.MINUTES;
    } else if(StringUtils.equalsIgnoreCase(suffix, "h")) {
      return TimeUnit.HOURS;
    } else if(StringUtils.equalsIgnoreCase(suffix, "d")) {
      return TimeUnit.DAYS;
    } else {
      throw new KvlockException(String.format("failed to parse duration '%s', unknown unit '%s'", s, suffix));
    }
  }

  public static String formatDuration(Duration duration) {
    long ms = duration.toMillis();
    if((ms < 1000) && (ms > 0)) {
      return ms + " millisecond" + (ms==1?"":"s");
    }
    long seconds = duration.getSeconds();
    if(seconds == 0) {
      return "now";
    }
    List<String> parts = new ArrayList<>();
    addPart(parts, "day", seconds / 86400);
    addPart(parts, "hour", (seconds / 3600) % 24);
    addPart(parts, "minute", (seconds / 60) % 60);
    addPart(parts, "second", seconds % 60);
    if(parts.size() == 1) {
      return parts.get(0);
    }
    return String.join(", ", parts.subList(0, parts.size() - 1)) + " and " + parts.get(parts.size() - 1);
  }

  private static void addPart(List<String> parts, String name, long value) {
    if(value != 0) {
      parts.add(value + " " + name + (value==1?"":"s"));
    }
  }

}
