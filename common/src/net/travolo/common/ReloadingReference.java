/*
 * Copyright Travolo
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package net.travolo.common;

import java.util.concurrent.Callable;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

import com.google.common.base.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Encapsulates a reference to something that is created the first time it is needed. Instead
 * of providing an initial value, a {@link Callable} that can create the thing is given.
 * The value is kept until {@link #clear()} is called, after which the next {@link #get()} loads it again.
 * Loading and clearing are serialized by one lock, so a clear never interleaves with a load in progress,
 * and readers never observe a partially constructed value.
 */
public final class ReloadingReference<V> {

  private static final Logger log = LoggerFactory.getLogger(ReloadingReference.class);

  private volatile V value;
  private final Callable<V> retriever;
  private final Lock lock;
  private int loads;

  public ReloadingReference(Callable<V> retriever) {
    Preconditions.checkNotNull(retriever);
    this.retriever = retriever;
    lock = new ReentrantLock();
  }

  /**
   * @return object that is returned by the provided {@link Callable}. If not yet created, it will block and
   *  wait for creation. If already created, it will return the existing value.
   * @throws IllegalStateException if the {@link Callable} fails or returns {@code null}; nothing is cached then,
   *  so a later call tries again
   */
  public V get() {
    V theValue = value;
    if (theValue != null) {
      return theValue;
    }
    lock.lock();
    try {
      if (value == null) {
        V loaded;
        try {
          loaded = retriever.call();
        } catch (Exception e) {
          throw new IllegalStateException(e);
        }
        Preconditions.checkState(loaded != null, "Retriever returned null");
        loads++;
        log.debug("Loaded value (load #{})", loads);
        value = loaded;
      }
      return value;
    } finally {
      lock.unlock();
    }
  }

  /**
   * @return object that is returned by the provided {@link Callable}, if it has already been created
   *  previously, or {@code null} otherwise
   */
  public V maybeGet() {
    return value;
  }

  /**
   * Clears the reference, requiring a load on next access. Waits for any load in progress to finish.
   */
  public void clear() {
    lock.lock();
    try {
      value = null;
    } finally {
      lock.unlock();
    }
  }

  /**
   * @return how many times the value has been loaded so far
   */
  public int getLoadCount() {
    lock.lock();
    try {
      return loads;
    } finally {
      lock.unlock();
    }
  }

}
