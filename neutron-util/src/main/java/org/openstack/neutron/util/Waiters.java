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
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This class contains some utils to wait for a condition to hold.
 */
public class Waiters {

    protected final static Logger log = LoggerFactory
            .getLogger(Waiters.class);

    public static void waitFor(String what, Callable<Boolean> condition)
            throws Exception {
        waitFor(what, TimeUnit.SECONDS.toMillis(10), 50, condition);
    }

    /**
     * Polls {@code condition} every {@code between} milliseconds for at most
     * {@code total} milliseconds.
     *
     * @throws AssertionError if the condition never held
     */
    public static void waitFor(String what, long total, long between,
                               Callable<Boolean> condition)
            throws Exception {
        long start = System.currentTimeMillis();
        while (!condition.call()) {
            long passed = System.currentTimeMillis() - start;
            if (passed >= total) {
                throw new AssertionError(String.format(
                    "The wait for: \"%s\" didn't complete successfully " +
                    "(waited %d ms)", what, passed));
            }
            log.trace("Still waiting for \"{}\"", what);
            Thread.sleep(Math.min(between, total - passed));
        }
    }

    private Waiters() {
    }
}
