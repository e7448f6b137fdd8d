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

import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;

import java.util.List;

import org.junit.jupiter.api.Test;

public class ResolutionStrategyTest {

  @Test
  public void selectVictim() {
    LockTransaction<String> t1 = new LockTransaction<>("k1", 1, 100, 1);
    LockTransaction<String> t2 = new LockTransaction<>("k2", 2, 200, 2);
    LockTransaction<String> t3 = new LockTransaction<>("k3", 3, 300, 3);
    List<LockTransaction<String>> candidates = List.of(t2, t3, t1);
    assertSame(t1, ResolutionStrategy.TERMINATE_OLDEST.selectVictim(candidates));
    assertSame(t3, ResolutionStrategy.TERMINATE_NEWEST.selectVictim(candidates));
    assertNull(ResolutionStrategy.TERMINATE_OLDEST.selectVictim(List.<LockTransaction<String>>of()));
  }

  @Test
  public void sequenceBreaksTies() {
    LockTransaction<String> t1 = new LockTransaction<>("k1", 1, 100, 7);
    LockTransaction<String> t2 = new LockTransaction<>("k2", 2, 100, 8);
    assertSame(t1, ResolutionStrategy.TERMINATE_OLDEST.selectVictim(List.of(t2, t1)));
    assertSame(t2, ResolutionStrategy.TERMINATE_NEWEST.selectVictim(List.of(t1, t2)));
  }

}
