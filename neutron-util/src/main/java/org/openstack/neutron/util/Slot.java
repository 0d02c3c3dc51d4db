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

import java.util.function.Supplier;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A named holder for the single process-wide instance of some resource.
 *
 * At most one value occupies the slot. The value is set once, either
 * explicitly or by {@link #getOrCreate(Supplier)}, and dropped only by
 * {@link #clear()}.
 */
public final class Slot<T> {

    private static final Logger log = LoggerFactory.getLogger(Slot.class);

    private final String name;
    private volatile T value;

    public Slot(@Nonnull String name) {
        this.name = Preconditions.checkNotNull(name);
    }

    public String getName() {
        return name;
    }

    @Nullable
    public T get() {
        return value;
    }

    public boolean isEmpty() {
        return value == null;
    }

    /**
     * Occupies the slot.
     *
     * @throws IllegalStateException if the slot already holds a value
     */
    public synchronized void set(@Nonnull T newValue) {
        Preconditions.checkNotNull(newValue);
        if (value != null) {
            throw new IllegalStateException(
                "Slot " + name + " already holds " + value);
        }
        value = newValue;
        log.debug("Slot {} now holds {}", name, newValue);
    }

    /**
     * Returns the current value, creating it with {@code factory} if the
     * slot is empty.
     */
    public synchronized T getOrCreate(@Nonnull Supplier<? extends T> factory) {
        if (value == null) {
            T created = factory.get();
            Preconditions.checkState(created != null,
                                     "Factory for slot %s returned null",
                                     name);
            value = created;
            log.debug("Slot {} created {}", name, created);
        }
        return value;
    }

    /**
     * Empties the slot and returns what it held, or null.
     */
    @Nullable
    public synchronized T clear() {
        T old = value;
        value = null;
        if (old != null) {
            log.debug("Slot {} cleared", name);
        }
        return old;
    }

    /**
     * @throws IllegalStateException if the slot is occupied
     */
    public void checkEmpty() {
        T held = value;
        if (held != null) {
            throw new IllegalStateException(
                "Slot " + name + " is expected to be empty but holds " + held);
        }
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("name", name)
            .add("value", value)
            .toString();
    }
}
