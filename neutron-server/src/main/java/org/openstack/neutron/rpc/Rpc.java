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
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import com.google.common.collect.ImmutableList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.openstack.neutron.config.ConfigOpts;
import org.openstack.neutron.util.Substitutable;

/**
 * Process-wide messaging state: the transport and the notifier.
 */
public final class Rpc {

    private static final Logger log = LoggerFactory.getLogger(Rpc.class);

    public static final ImmutableList<String> ALLOWED_EXMODS =
        ImmutableList.of("org.openstack.neutron.common",
                         "org.openstack.neutron.callbacks");

    public static final Substitutable<NotifierFactory> NOTIFIER_FACTORY =
        new Substitutable<>("notifier-factory",
                            NotifierFactory.CONFIGURED_DRIVERS);

    private static final List<String> extraExmods =
        new CopyOnWriteArrayList<>();

    private static volatile Transport transport;
    private static volatile Notifier notifier;

    public static synchronized void init(ConfigOpts conf) {
        RpcConfig config = conf.getConfig(RpcConfig.class);
        transport = new Transport(config.getTransportDriver(),
                                  config.getResponseTimeout(),
                                  getAllowedExmods());
        notifier = NOTIFIER_FACTORY.get().create(transport, null, conf);
        log.debug("RPC initialized with {}", transport);
    }

    /**
     * @throws IllegalStateException if {@link #init(ConfigOpts)} was not
     *         called
     */
    public static synchronized void cleanup() {
        if (transport == null || notifier == null) {
            throw new IllegalStateException("RPC is not initialized");
        }
        transport.cleanup();
        transport = null;
        notifier = null;
    }

    public static boolean isInitialized() {
        return transport != null;
    }

    public static void addExtraExmods(String... exmods) {
        extraExmods.addAll(Arrays.asList(exmods));
    }

    public static void clearExtraExmods() {
        extraExmods.clear();
    }

    public static List<String> getAllowedExmods() {
        List<String> exmods = new ArrayList<>(ALLOWED_EXMODS);
        exmods.addAll(extraExmods);
        return exmods;
    }

    public static Transport getTransport() {
        Transport current = transport;
        if (current == null) {
            throw new IllegalStateException("RPC is not initialized");
        }
        return current;
    }

    public static Notifier getNotifier(String service, String host) {
        Notifier current = notifier;
        if (current == null) {
            throw new IllegalStateException("RPC is not initialized");
        }
        String publisherId = host == null ? service : service + "." + host;
        return current.prepare(publisherId);
    }

    public static Connection createConnection() {
        return new Connection(getTransport());
    }

    private Rpc() {
    }
}
