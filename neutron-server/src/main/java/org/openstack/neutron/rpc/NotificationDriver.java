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

import java.util.Map;

/**
 * Delivers notifications somewhere. Drivers named by class in the
 * {@code notification_driver} option need a public no-argument constructor.
 */
public interface NotificationDriver {

    void notify(String publisherId, String eventType, String priority,
                Map<String, Object> payload);
}
