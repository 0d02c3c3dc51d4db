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

import org.openstack.neutron.config.ConfigOpts;

/**
 * Sets the messaging options for a test and puts back what was there
 * before.
 */
public class MessagingConfFixture extends Fixture {

    public static final String TRANSPORT_DRIVER = "rpc_backend";
    public static final String RESPONSE_TIMEOUT = "rpc_response_timeout";

    private final ConfigOpts conf;
    private String transportDriver;
    private Integer responseTimeout;

    public MessagingConfFixture(ConfigOpts conf) {
        this.conf = conf;
    }

    public void setTransportDriver(String transportDriver) {
        this.transportDriver = transportDriver;
    }

    public void setResponseTimeout(int responseTimeout) {
        this.responseTimeout = responseTimeout;
    }

    public String getTransportDriver() {
        return transportDriver;
    }

    public Integer getResponseTimeout() {
        return responseTimeout;
    }

    @Override
    protected void doSetUp() {
        if (transportDriver != null) {
            override(TRANSPORT_DRIVER, transportDriver);
        }
        if (responseTimeout != null) {
            override(RESPONSE_TIMEOUT, responseTimeout);
        }
    }

    private void override(final String key, Object value) {
        if (conf.hasOverride(key, null)) {
            final Object previous = conf.get(key);
            addCleanup(() -> conf.setOverride(key, previous));
        } else {
            addCleanup(() -> conf.clearOverride(key, null));
        }
        conf.setOverride(key, value);
    }
}
