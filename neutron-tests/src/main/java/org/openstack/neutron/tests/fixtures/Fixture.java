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
package org.openstack.neutron.tests.fixtures;

import com.google.common.base.Preconditions;

import org.openstack.neutron.tests.CleanupStack;
import org.openstack.neutron.util.Substitutable;

/**
 * A reusable piece of test setup that registers its own teardown.
 *
 * A fixture is set up once, against the cleanup stack of the test using it.
 * If {@link #doSetUp()} fails, only the cleanups registered before the
 * failure run.
 */
public abstract class Fixture {

    private CleanupStack cleanups;

    public final void setUp(CleanupStack testCleanups) throws Exception {
        Preconditions.checkState(cleanups == null,
                                 "Fixture %s is already set up", this);
        cleanups = Preconditions.checkNotNull(testCleanups);
        doSetUp();
    }

    protected abstract void doSetUp() throws Exception;

    protected void addCleanup(CleanupStack.Cleanup cleanup) {
        Preconditions.checkState(cleanups != null,
                                 "Fixture %s is not set up", this);
        cleanups.register(cleanup);
    }

    protected <F extends Fixture> F useFixture(F fixture) throws Exception {
        fixture.setUp(cleanups);
        return fixture;
    }

    /**
     * Installs {@code value} in {@code target} until the test is torn down.
     */
    protected <T> T substitute(Substitutable<T> target, T value)
            throws Exception {
        return useFixture(new SubstitutionFixture<>(target, value)).getValue();
    }
}
