/*
 * Copyright 2016 Midokura SARL
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.openstack.neutron.util;

import java.util.ArrayDeque;
import java.util.Deque;

import javax.annotation.Nonnull;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A process-wide accessor whose value can be temporarily replaced.
 *
 * Code that would otherwise call a static entry point (spawn a worker, look
 * up a registry, build a notifier) asks the accessor for the current
 * implementation instead. Tests replace the implementation with
 * {@link #substitute(Object)} and put the previous one back by closing the
 * returned {@link Restorer}. Substitutions nest and must be restored in
 * reverse order.
 *
 * The current value is kept in a volatile field, so threads spawned by the
 * code under test observe the substitute as soon as it is installed.
 */
public final class Substitutable<T> {

    private static final Logger log =
        LoggerFactory.getLogger(Substitutable.class);

    private final String name;
    private final T defaultValue;
    private final Deque<T> previous = new ArrayDeque<>();
    private volatile T current;

    public Substitutable(@Nonnull String name, @Nonnull T defaultValue) {
        this.name = Preconditions.checkNotNull(name);
        this.defaultValue = Preconditions.checkNotNull(defaultValue);
        this.current = defaultValue;
    }

    public String getName() {
        return name;
    }

    public T get() {
        return current;
    }

    public T getDefault() {
        return defaultValue;
    }

    public synchronized boolean isSubstituted() {
        return !previous.isEmpty();
    }

    /**
     * Installs {@code value} until the returned restorer is closed.
     */
    public synchronized Restorer substitute(@Nonnull T value) {
        Preconditions.checkNotNull(value, "Cannot substitute %s with null",
                                   name);
        final T replaced = current;
        previous.push(replaced);
        current = value;
        log.debug("Substituted {} with {}", name, value);
        return new Restorer(value);
    }

    private synchronized void restore(T installed) {
        if (current != installed) {
            throw new IllegalStateException(
                "Substitutions of " + name + " restored out of order: " +
                installed + " is not the current value " + current);
        }
        current = previous.pop();
        log.debug("Restored {} to {}", name, current);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("name", name)
            .add("current", current)
            .toString();
    }

    /**
     * Puts back the value that was current before a substitution. Closing
     * it more than once has no further effect.
     */
    public final class Restorer implements AutoCloseable {

        private final T installed;
        private boolean restored = false;

        private Restorer(T installed) {
            this.installed = installed;
        }

        public T getInstalled() {
            return installed;
        }

        @Override
        public void close() {
            synchronized (Substitutable.this) {
                if (restored) {
                    return;
                }
                restore(installed);
                restored = true;
            }
        }
    }
}
