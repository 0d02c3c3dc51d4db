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
package org.openstack.neutron.policy;

import com.google.common.collect.ImmutableMap;

import org.openstack.neutron.common.NeutronException;

public class PolicyNotAuthorized extends NeutronException {

    private static final long serialVersionUID = 1L;

    public PolicyNotAuthorized(String action) {
        super("{action} is disallowed by policy",
              ImmutableMap.of("action", action));
    }
}
