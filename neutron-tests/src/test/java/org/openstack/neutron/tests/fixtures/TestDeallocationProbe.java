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

import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.mockito.Mockito.mock;

public class TestDeallocationProbe {

    private static DeallocationProbe probeGarbage() {
        return DeallocationProbe.of(new Object());
    }

    @Test
    public void testUnreachableObjectIsCollected() throws Exception {
        DeallocationProbe probe = probeGarbage();
        probe.verify();
        assertThat(probe.isDeallocated(), is(true));
    }

    @Test(expected = DeallocationLeakError.class)
    public void testReachableObjectLeaks() throws Exception {
        Object held = new Object();
        DeallocationProbe.of(held).verify();
        held.hashCode();
    }

    @Test
    public void testMocksAreExempt() throws Exception {
        Runnable held = mock(Runnable.class);
        DeallocationProbe.of(held).verify();
        held.hashCode();
    }
}
