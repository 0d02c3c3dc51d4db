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

import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicLong;

import com.google.common.base.MoreObjects;

/**
 * Identifies the flow of execution that code is running in.
 *
 * Every thread starts in the {@link #root()} context. Work handed to a
 * spawned worker runs in a child context created by {@link #spawn()}, so
 * code can tell whether it is running in the flow that started it or in a
 * worker derived from it, whatever the worker's threading model is.
 */
public final class ExecutionContext {

    public enum Kind { ROOT, SPAWNED }

    private static final AtomicLong ids = new AtomicLong(0);

    private static final ExecutionContext ROOT =
        new ExecutionContext(ids.getAndIncrement(), Kind.ROOT, null);

    private static final ThreadLocal<ExecutionContext> current =
        new ThreadLocal<>();

    private final long id;
    private final Kind kind;
    private final ExecutionContext parent;

    private ExecutionContext(long id, Kind kind, ExecutionContext parent) {
        this.id = id;
        this.kind = kind;
        this.parent = parent;
    }

    public static ExecutionContext root() {
        return ROOT;
    }

    public static ExecutionContext current() {
        ExecutionContext ctx = current.get();
        return ctx == null ? ROOT : ctx;
    }

    public long id() {
        return id;
    }

    public Kind kind() {
        return kind;
    }

    public ExecutionContext parent() {
        return parent;
    }

    /**
     * Creates a child context for work that leaves this flow.
     */
    public ExecutionContext spawn() {
        return new ExecutionContext(ids.getAndIncrement(), Kind.SPAWNED, this);
    }

    /**
     * Runs {@code work} on the calling thread with this context current,
     * restoring the previous one afterwards.
     */
    public <V> V call(Callable<V> work) throws Exception {
        ExecutionContext saved = current.get();
        current.set(this);
        try {
            return work.call();
        } finally {
            if (saved == null) {
                current.remove();
            } else {
                current.set(saved);
            }
        }
    }

    public void run(Runnable work) {
        ExecutionContext saved = current.get();
        current.set(this);
        try {
            work.run();
        } finally {
            if (saved == null) {
                current.remove();
            } else {
                current.set(saved);
            }
        }
    }

    /**
     * Wraps {@code work} so that it runs in this context on whichever
     * thread eventually calls it.
     */
    public <V> Callable<V> bind(final Callable<V> work) {
        return () -> call(work);
    }

    public Runnable bind(final Runnable work) {
        return () -> run(work);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("id", id)
            .add("kind", kind)
            .toString();
    }
}
