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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes every notification to the log.
 */
public class LogNotificationDriver implements NotificationDriver {

    private static final Logger log =
        LoggerFactory.getLogger("org.openstack.neutron.notification");

    @Override
    public void notify(String publisherId, String eventType, String priority,
                       Map<String, Object> payload) {
        log.info("{} {} {}: {}", priority, publisherId, eventType, payload);
    }
}
