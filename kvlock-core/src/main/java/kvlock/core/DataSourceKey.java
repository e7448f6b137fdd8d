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

import org.apache.commons.lang3.Validate;

/**
 * Composite lock key, a key scoped by the data source it belongs to.
 */
public class DataSourceKey<K> {

  private final String dataSource;

  private final K key;

  public DataSourceKey(String dataSource, K key) {
    super();
    this.dataSource = Validate.notBlank(dataSource, "dataSource is blank");
    this.key = Validate.notNull(key, "key is null");
  }

  public static <K> DataSourceKey<K> of(String dataSource, K key) {
    return new DataSourceKey<>(dataSource, key);
  }

  public String getDataSource() {
    return dataSource;
  }

  public K getKey() {
    return key;
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = 1;
    result = prime * result + dataSource.hashCode();
    result = prime * result + key.hashCode();
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
    DataSourceKey<?> other = (DataSourceKey<?>) obj;
    return dataSource.equals(other.dataSource) && key.equals(other.key);
  }

  @Override
  public String toString() {
    return dataSource + "/" + key;
  }

}
