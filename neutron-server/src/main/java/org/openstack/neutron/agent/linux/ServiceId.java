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
package org.openstack.neutron.agent.linux;

import java.util.Objects;

public final class ServiceId {

    private final String uuid;
    private final String service;

    public ServiceId(String uuid, String service) {
        this.uuid = uuid;
        this.service = service;
    }

    public String getUuid() {
        return uuid;
    }

    public String getService() {
        return service;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ServiceId)) return false;
        ServiceId that = (ServiceId) o;
        return Objects.equals(uuid, that.uuid)
               && Objects.equals(service, that.service);
    }

    @Override
    public int hashCode() {
        return Objects.hash(uuid, service);
    }

    @Override
    public String toString() {
        return service == null ? uuid : service + " for " + uuid;
    }
}
