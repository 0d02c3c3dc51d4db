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

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.openstack.neutron.config.ConfigOpts;

/**
 * Builds the {@link Notifier} used by {@link Rpc}.
 */
public interface NotifierFactory {

    String NOTIFICATION_DRIVER = "notification_driver";

    Notifier create(Transport transport, String publisherId, ConfigOpts conf);

    /**
     * Resolves the drivers listed in {@value #NOTIFICATION_DRIVER}:
     * {@code log}, {@code noop}, or the name of a {@link NotificationDriver}
     * class.
     */
    NotifierFactory CONFIGURED_DRIVERS = new NotifierFactory() {

        private final Logger log = LoggerFactory.getLogger(Notifier.class);

        @Override
        public Notifier create(Transport transport, String publisherId,
                               ConfigOpts conf) {
            List<NotificationDriver> drivers = new ArrayList<>();
            for (String name : conf.getList(NOTIFICATION_DRIVER)) {
                if (name.equals("noop")) {
                    continue;
                }
                if (name.equals("log")) {
                    drivers.add(new LogNotificationDriver());
                    continue;
                }
                try {
                    drivers.add(Class.forName(name)
                                    .asSubclass(NotificationDriver.class)
                                    .getDeclaredConstructor()
                                    .newInstance());
                } catch (ReflectiveOperationException | ClassCastException e) {
                    throw new IllegalArgumentException(
                        "Cannot load notification driver " + name, e);
                }
            }
            log.debug("Notifier for {} uses drivers {}", publisherId, drivers);
            return new Notifier(publisherId, drivers);
        }

        @Override
        public String toString() {
            return "configured-drivers";
        }
    };
}
