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

import com.google.common.collect.ImmutableList;

import org.openstack.neutron.util.Substitutable;

/**
 * Groups the servers a component consumes with, started together.
 */
public class Connection {

    /**
     * Starts the servers of a connection.
     */
    public interface ConsumerStarter {
        List<RpcServer> consumeInThreads(Connection connection);
    }

    public static final ConsumerStarter START_SERVERS = new ConsumerStarter() {
        @Override
        public List<RpcServer> consumeInThreads(Connection connection) {
            for (RpcServer server : connection.servers) {
                server.startAsync().awaitRunning();
            }
            return ImmutableList.copyOf(connection.servers);
        }

        @Override
        public String toString() {
            return "start-servers";
        }
    };

    public static final Substitutable<ConsumerStarter> CONSUME_IN_THREADS =
        new Substitutable<>("consume-in-threads", START_SERVERS);

    private final Transport transport;
    private final List<RpcServer> servers = new ArrayList<>();

    Connection(Transport transport) {
        this.transport = transport;
    }

    public RpcServer createConsumer(String topic, List<Object> endpoints) {
        RpcServer server = new RpcServer(transport, topic, endpoints);
        servers.add(server);
        return server;
    }

    public List<RpcServer> consumeInThreads() {
        return CONSUME_IN_THREADS.get().consumeInThreads(this);
    }

    public void close() {
        for (RpcServer server : servers) {
            server.stopAsync().awaitTerminated();
        }
    }
}
