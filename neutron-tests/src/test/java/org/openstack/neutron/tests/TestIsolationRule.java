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

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

import org.junit.AssumptionViolatedException;
import org.junit.Test;
import org.junit.runners.model.MultipleFailureException;
import org.junit.runners.model.Statement;

import org.openstack.neutron.util.ExecutionContext;
import org.openstack.neutron.util.SystemExit;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.Assert.fail;

public class TestIsolationRule {

    private final IsolationRule rule = new IsolationRule();
    private final List<String> ran = new ArrayList<>();

    private static Statement statement(final Callable<Void> body) {
        return new Statement() {
            @Override
            public void evaluate() throws Throwable {
                body.call();
            }
        };
    }

    private TestContext contextWithExitCheck() {
        TestContext context = new TestContext("isolated");
        context.addOnException(new SystemExitHandler());
        context.addCleanup(() -> ran.add("cleanup"));
        return context;
    }

    @Test
    public void testPassingBodyRunsCleanups() throws Throwable {
        TestContext context = contextWithExitCheck();
        rule.run(statement(() -> {
            ran.add("body");
            return null;
        }), context);

        assertThat(ran, contains("body", "cleanup"));
    }

    @Test
    public void testContextIsOnlyAvailableDuringTheTest() throws Throwable {
        final TestContext context = new TestContext("isolated");
        rule.run(statement(() -> {
            assertThat(rule.getContext(), sameInstance(context));
            return null;
        }), context);
        try {
            rule.getContext();
            fail("No test should be running");
        } catch (IllegalStateException expected) {
        }
    }

    @Test
    public void testExitInTheTestBecomesAFailure() throws Throwable {
        TestContext context = contextWithExitCheck();
        try {
            rule.run(statement(() -> {
                throw new SystemExit(0);
            }), context);
            fail("Test failure expected");
        } catch (AssertionError e) {
            assertThat(e.getMessage(), is("Test invoked exit with code 0"));
            assertThat(e.getCause(), instanceOf(SystemExit.class));
        }
        assertThat(ran, contains("cleanup"));
    }

    @Test
    public void testExitFromSpawnedContextPropagates() throws Throwable {
        TestContext context = contextWithExitCheck();
        final SystemExit exit = ExecutionContext.root().spawn()
            .call(() -> new SystemExit(3));
        try {
            rule.run(statement(() -> {
                throw exit;
            }), context);
            fail("SystemExit expected");
        } catch (SystemExit e) {
            assertThat(e, sameInstance(exit));
        }
        assertThat(ran, contains("cleanup"));
        assertThat(context.isForcedFailure(), is(false));
    }

    @Test
    public void testCleanupFailuresAreReportedAfterThePrimary()
            throws Throwable {
        TestContext context = new TestContext("isolated");
        final IllegalStateException cleanupFailure =
            new IllegalStateException("cleanup");
        context.addCleanup(() -> {
            throw cleanupFailure;
        });
        final AssertionError primary = new AssertionError("body");
        try {
            rule.run(statement(() -> {
                throw primary;
            }), context);
            fail("MultipleFailureException expected");
        } catch (MultipleFailureException e) {
            assertThat(e.getFailures(), hasSize(2));
            assertThat(e.getFailures().get(0), sameInstance(primary));
            assertThat(e.getFailures().get(1), sameInstance(cleanupFailure));
        }
    }

    @Test
    public void testCleanupFailureFailsAPassingTest() throws Throwable {
        TestContext context = new TestContext("isolated");
        final IllegalStateException cleanupFailure =
            new IllegalStateException("cleanup");
        context.addCleanup(() -> {
            throw cleanupFailure;
        });
        try {
            rule.run(statement(() -> null), context);
            fail("Cleanup failure expected");
        } catch (IllegalStateException e) {
            assertThat(e, sameInstance(cleanupFailure));
        }
    }

    @Test
    public void testAssumptionFailureSkipsHandlers() throws Throwable {
        TestContext context = new TestContext("isolated");
        context.addOnException((failure, ctx) -> ran.add("handler"));
        context.addCleanup(() -> ran.add("cleanup"));
        try {
            rule.run(statement(() -> {
                throw new AssumptionViolatedException("skip");
            }), context);
            fail("AssumptionViolatedException expected");
        } catch (AssumptionViolatedException expected) {
        }
        assertThat(ran, contains("cleanup"));
    }

    @Test
    public void testForcedFailureReplacesTheRaisedOne() throws Throwable {
        TestContext context = new TestContext("isolated");
        final AssertionError forced = new AssertionError("forced");
        context.addOnException((failure, ctx) -> ctx.forceFailure(forced));
        try {
            rule.run(statement(() -> {
                throw new IllegalArgumentException("raised");
            }), context);
            fail("Forced failure expected");
        } catch (AssertionError e) {
            assertThat(e, sameInstance(forced));
        }
    }

    @Test
    public void testBrokenHandlerDoesNotHideTheTestFailure()
            throws Throwable {
        TestContext context = new TestContext("isolated");
        context.addOnException((failure, ctx) -> {
            throw new AssertionError("debugger broke");
        });
        context.addOnException((failure, ctx) -> ran.add("handler"));
        context.addCleanup(() -> ran.add("cleanup"));
        final IllegalArgumentException primary =
            new IllegalArgumentException("body");
        try {
            rule.run(statement(() -> {
                throw primary;
            }), context);
            fail("Test failure expected");
        } catch (IllegalArgumentException e) {
            assertThat(e, sameInstance(primary));
        }
        assertThat(ran, contains("handler", "cleanup"));
    }
}
