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
package kvlock.core.graph;

/**
 * Vertex of the wait-for graph, either a resource (a lock key) or an owner (a thread).
 * An edge pointing from an owner to a resource is a wait, an edge from a resource to an owner a hold.
 */
public class WaitNode<K> {

  private final K key;

  private final Long ownerId;

  private WaitNode(K key, Long ownerId) {
    super();
    this.key = key;
    this.ownerId = ownerId;
  }

  public static <K> WaitNode<K> resource(K key) {
    if(key == null) {
      throw new IllegalArgumentException("key is null");
    }
    return new WaitNode<>(key, null);
  }

  public static <K> WaitNode<K> owner(long ownerId) {
    return new WaitNode<>(null, ownerId);
  }

  public boolean isResource() {
    return key != null;
  }

  public boolean isOwner() {
    return ownerId != null;
  }

  public K getKey() {
    return key;
  }

  public Long getOwnerId() {
    return ownerId;
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = 1;
    result = prime * result + ((key == null) ? 0 : key.hashCode());
    result = prime * result + ((ownerId == null) ? 0 : ownerId.hashCode());
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null)
      return false;
    if (getClass() != obj.getClass())
      return false;
    WaitNode<?> other = (WaitNode<?>) obj;
    if (key == null) {
      if (other.key != null)
        return false;
    } else if (!key.equals(other.key))
      return false;
    if (ownerId == null) {
      if (other.ownerId != null)
        return false;
    } else if (!ownerId.equals(other.ownerId))
      return false;
    return true;
  }

  @Override
  public String toString() {
    if(key != null) {
      return "key:"+key;
    } else {
      return "owner:"+ownerId;
    }
  }

}
