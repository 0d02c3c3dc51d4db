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
package org.openstack.neutron.rpc;

import org.openstack.neutron.config.ConfigGroup;
import org.openstack.neutron.config.ConfigInt;
import org.openstack.neutron.config.ConfigString;

@ConfigGroup
public interface RpcConfig {

    String FAKE_DRIVER = "fake";

    @ConfigString(key = "rpc_backend", defaultValue = "rabbit")
    String getTransportDriver();

    /**
     * Seconds to wait for a response from a call; 0 means do not wait.
     */
    @ConfigInt(key = "rpc_response_timeout", defaultValue = 60)
    int getResponseTimeout();

    @ConfigString(key = "control_exchange", defaultValue = "neutron")
    String getControlExchange();
}
