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

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.junit.After;
import org.junit.Test;

import org.openstack.neutron.config.ConfigOpts;
import org.openstack.neutron.rpc.Notifier;
import org.openstack.neutron.rpc.NotifierFactory;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;

public class TestFakeNotifier {

    @After
    public void tearDown() {
        FakeNotifier.reset();
    }

    @Test
    public void testNotificationsAreRecorded() {
        Notifier notifier = FakeNotifier.FACTORY.create(null, "network",
                                                         null);
        Map<String, Object> payload = new HashMap<>();
        payload.put("id", "net-1");
        payload.put("description", null);

        notifier.prepare("network.host1").info("network.create.end", payload);
        payload.put("id", "changed");

        List<FakeNotifier.Notification> sent = FakeNotifier.getNotifications();
        assertThat(sent, hasSize(1));
        assertThat(sent.get(0).getPublisherId(), is("network.host1"));
        assertThat(sent.get(0).getPriority(), is(Notifier.INFO));
        assertThat(sent.get(0).getEventType(), is("network.create.end"));
        assertThat(sent.get(0).getPayload().get("id"), is((Object) "net-1"));
    }

    @Test
    public void testPreparedNotifierStaysFake() {
        Notifier notifier = new FakeNotifier("a").prepare("b");
        assertThat(notifier, instanceOf(FakeNotifier.class));
    }

    @Test
    public void testDriverByClassName() {
        ConfigOpts conf = new ConfigOpts("neutron");
        conf.setOverride(NotifierFactory.NOTIFICATION_DRIVER,
                         ImmutableList.of(FakeNotifier.Driver.class.getName()));
        Notifier notifier =
            NotifierFactory.CONFIGURED_DRIVERS.create(null, "port", conf);

        notifier.error("port.delete.end", ImmutableMap.of("id", "p"));

        assertThat(FakeNotifier.getNotifications(), hasSize(1));
        assertThat(FakeNotifier.getNotifications().get(0).getPriority(),
                   is(Notifier.ERROR));
    }

    @Test
    public void testReset() {
        new FakeNotifier("a").audit("x", null);
        FakeNotifier.reset();
        assertThat(FakeNotifier.getNotifications(), hasSize(0));
    }
}
