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

public final class Resources {

    public static final String AGENT = "agent";
    public static final String FLOATING_IP = "floating_ip";
    public static final String NETWORK = "network";
    public static final String PORT = "port";
    public static final String PROCESS = "process";
    public static final String ROUTER = "router";
    public static final String ROUTER_GATEWAY = "router_gateway";
    public static final String ROUTER_INTERFACE = "router_interface";
    public static final String SUBNET = "subnet";
    public static final String SUBNET_POOL = "subnetpool";

    private Resources() {
    }
}
