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
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Callbacks interested in resource updates pushed over RPC, by resource
 * type.
 */
public final class ConsumerRegistry {

    /**
     * Handles pushed resources.
     */
    public interface ResourceCallback {
        void handle(String resourceType, List<Object> resources,
                    String eventType);
    }

    private static final Map<String, List<ResourceCallback>> callbacks =
        new ConcurrentHashMap<>();

    public static void subscribe(ResourceCallback callback,
                                 String resourceType) {
        callbacks.computeIfAbsent(resourceType,
                                  t -> new CopyOnWriteArrayList<>())
                 .add(callback);
    }

    public static void unsubscribe(ResourceCallback callback,
                                   String resourceType) {
        List<ResourceCallback> current = callbacks.get(resourceType);
        if (current != null) {
            current.remove(callback);
        }
    }

    public static void push(String resourceType, List<Object> resources,
                            String eventType) {
        List<ResourceCallback> current = callbacks.get(resourceType);
        if (current == null) {
            return;
        }
        for (ResourceCallback callback : current) {
            callback.handle(resourceType, resources, eventType);
        }
    }

    public static List<ResourceCallback> getCallbacks(String resourceType) {
        List<ResourceCallback> current = callbacks.get(resourceType);
        return current == null ? new ArrayList<>() : new ArrayList<>(current);
    }

    public static void clear() {
        callbacks.clear();
    }

    private ConsumerRegistry() {
    }
}
