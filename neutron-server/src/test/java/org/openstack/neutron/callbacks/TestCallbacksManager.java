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
package org.openstack.neutron.callbacks;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.junit.Before;
import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.fail;

public class TestCallbacksManager {

    private CallbacksManager manager;
    private List<String> received;

    @Before
    public void setUp() {
        manager = new CallbacksManager();
        received = new ArrayList<>();
    }

    private Callback recorder(final String name) {
        return (resource, event, trigger, kwargs) ->
            received.add(name + ":" + resource + ":" + event);
    }

    private static Map<String, Object> noArgs() {
        return Collections.emptyMap();
    }

    @Test
    public void testSubscribeIsIdempotent() {
        Callback callback = recorder("a");
        manager.subscribe(callback, Resources.PORT, Events.AFTER_CREATE);
        manager.subscribe(callback, Resources.PORT, Events.AFTER_CREATE);
        assertThat(manager.getSubscribers(Resources.PORT, Events.AFTER_CREATE),
                   hasSize(1));
    }

    @Test
    public void testNotifyReachesSubscribersInOrder() {
        manager.subscribe(recorder("a"), Resources.PORT, Events.AFTER_CREATE);
        manager.subscribe(recorder("b"), Resources.PORT, Events.AFTER_CREATE);
        manager.subscribe(recorder("c"), Resources.ROUTER, Events.AFTER_CREATE);

        manager.notify(Resources.PORT, Events.AFTER_CREATE, this, noArgs());

        assertThat(received, contains("a:port:after_create",
                                      "b:port:after_create"));
    }

    @Test
    public void testUnsubscribeVariants() {
        Callback a = recorder("a");
        manager.subscribe(a, Resources.PORT, Events.AFTER_CREATE);
        manager.subscribe(a, Resources.PORT, Events.AFTER_DELETE);
        manager.subscribe(a, Resources.NETWORK, Events.AFTER_DELETE);

        manager.unsubscribe(a, Resources.PORT, Events.AFTER_CREATE);
        assertThat(manager.getSubscribers(Resources.PORT, Events.AFTER_CREATE),
                   is(empty()));

        manager.unsubscribeByResource(a, Resources.PORT);
        assertThat(manager.getSubscribers(Resources.PORT, Events.AFTER_DELETE),
                   is(empty()));
        assertThat(manager.isEmpty(), is(false));

        manager.unsubscribeAll(a);
        assertThat(manager.isEmpty(), is(true));
    }

    @Test
    public void testUnsubscribeUnknownCallbackIsHarmless() {
        manager.unsubscribe(recorder("a"), Resources.PORT, Events.AFTER_CREATE);
        assertThat(manager.isEmpty(), is(true));
    }

    @Test
    public void testFailureInBeforeEventTriggersAbort() {
        manager.subscribe((resource, event, trigger, kwargs) -> {
            throw new IllegalStateException("boom");
        }, Resources.ROUTER, Events.BEFORE_DELETE);
        manager.subscribe(recorder("a"), Resources.ROUTER, Events.ABORT_DELETE);

        try {
            manager.notify(Resources.ROUTER, Events.BEFORE_DELETE, this,
                           noArgs());
            fail("CallbackFailure expected");
        } catch (CallbackFailure e) {
            assertThat(e.getErrors(), hasSize(1));
        }
        assertThat(received, contains("a:router:abort_delete"));
    }

    @Test
    public void testClear() {
        manager.subscribe(recorder("a"), Resources.PORT, Events.AFTER_CREATE);
        manager.clear();
        assertThat(manager.isEmpty(), is(true));
    }
}
