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
package org.openstack.neutron.tests;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import com.google.common.util.concurrent.ExecutionError;
import com.google.common.util.concurrent.SimpleTimeLimiter;
import com.google.common.util.concurrent.TimeLimiter;
import com.google.common.util.concurrent.UncheckedExecutionException;

import org.openstack.neutron.util.ExecutionContext;
import org.openstack.neutron.util.eventloop.NeutronThreadFactory;

/**
 * Bounds the time a block of test code may take.
 *
 * The block runs on a worker thread, in the execution context of the
 * caller. When the deadline passes the worker is interrupted and the caller
 * gets a {@link TimeoutFailure}; a block that ignores interruption keeps
 * running on its own daemon thread.
 */
public final class CooperativeTimeoutGuard {

    public static final long DEFAULT_TIMEOUT_SECONDS = 5;

    @FunctionalInterface
    public interface Block {
        void run() throws Exception;
    }

    public static <T> T withTimeout(long seconds, Callable<T> body)
            throws Exception {
        return withTimeout(seconds, TimeUnit.SECONDS, body);
    }

    public static void withTimeout(long seconds, Block body) throws Exception {
        withTimeout(seconds, TimeUnit.SECONDS, body);
    }

    public static void withTimeout(long timeout, TimeUnit unit,
                                   final Block body) throws Exception {
        withTimeout(timeout, unit, () -> {
            body.run();
            return null;
        });
    }

    /**
     * @return what {@code body} returned
     * @throws TimeoutFailure if {@code body} did not complete in time
     */
    public static <T> T withTimeout(long timeout, TimeUnit unit,
                                    Callable<T> body) throws Exception {
        ExecutorService executor = Executors.newSingleThreadExecutor(
            new NeutronThreadFactory("timeout-guard"));
        TimeLimiter limiter = SimpleTimeLimiter.create(executor);
        try {
            return limiter.callWithTimeout(
                ExecutionContext.current().bind(body), timeout, unit);
        } catch (TimeoutException e) {
            throw new TimeoutFailure(e);
        } catch (ExecutionException | UncheckedExecutionException
                 | ExecutionError e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception) {
                throw (Exception) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw e;
        } finally {
            executor.shutdownNow();
        }
    }

    private CooperativeTimeoutGuard() {
    }
}
