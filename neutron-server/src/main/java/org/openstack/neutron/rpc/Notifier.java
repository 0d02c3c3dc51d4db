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

import java.util.List;
import java.util.Map;

import com.google.common.collect.ImmutableList;

/**
 * Sends notifications on behalf of a publisher through a set of drivers.
 */
public class Notifier {

    public static final String AUDIT = "AUDIT";
    public static final String DEBUG = "DEBUG";
    public static final String INFO = "INFO";
    public static final String WARN = "WARN";
    public static final String ERROR = "ERROR";
    public static final String CRITICAL = "CRITICAL";

    private final String publisherId;
    private final ImmutableList<NotificationDriver> drivers;

    public Notifier(String publisherId, List<NotificationDriver> drivers) {
        this.publisherId = publisherId;
        this.drivers = ImmutableList.copyOf(drivers);
    }

    public String getPublisherId() {
        return publisherId;
    }

    public List<NotificationDriver> getDrivers() {
        return drivers;
    }

    /**
     * Returns a notifier publishing through the same drivers under another
     * publisher id.
     */
    public Notifier prepare(String newPublisherId) {
        return new Notifier(newPublisherId, drivers);
    }

    public void audit(String eventType, Map<String, Object> payload) {
        send(AUDIT, eventType, payload);
    }

    public void debug(String eventType, Map<String, Object> payload) {
        send(DEBUG, eventType, payload);
    }

    public void info(String eventType, Map<String, Object> payload) {
        send(INFO, eventType, payload);
    }

    public void warn(String eventType, Map<String, Object> payload) {
        send(WARN, eventType, payload);
    }

    public void error(String eventType, Map<String, Object> payload) {
        send(ERROR, eventType, payload);
    }

    public void critical(String eventType, Map<String, Object> payload) {
        send(CRITICAL, eventType, payload);
    }

    protected void send(String priority, String eventType,
                        Map<String, Object> payload) {
        for (NotificationDriver driver : drivers) {
            driver.notify(publisherId, eventType, priority, payload);
        }
    }
}
