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

import java.util.Collections;
import java.util.Map;

import org.openstack.neutron.util.Substitutable;

/**
 * Process-wide entry point to the callbacks machinery. Every call resolves
 * the manager through {@link #CALLBACK_MANAGER}.
 */
public final class Registry {

    public static final Substitutable<CallbacksManager> CALLBACK_MANAGER =
        new Substitutable<>("callback-manager", new CallbacksManager());

    public static CallbacksManager getCallbackManager() {
        return CALLBACK_MANAGER.get();
    }

    public static void subscribe(Callback callback, String resource,
                                 String event) {
        getCallbackManager().subscribe(callback, resource, event);
    }

    public static void unsubscribe(Callback callback, String resource,
                                   String event) {
        getCallbackManager().unsubscribe(callback, resource, event);
    }

    public static void unsubscribeByResource(Callback callback,
                                             String resource) {
        getCallbackManager().unsubscribeByResource(callback, resource);
    }

    public static void unsubscribeAll(Callback callback) {
        getCallbackManager().unsubscribeAll(callback);
    }

    public static void notify(String resource, String event, Object trigger) {
        notify(resource, event, trigger,
               Collections.<String, Object>emptyMap());
    }

    public static void notify(String resource, String event, Object trigger,
                              Map<String, Object> kwargs) {
        getCallbackManager().notify(resource, event, trigger, kwargs);
    }

    public static void clear() {
        getCallbackManager().clear();
    }

    private Registry() {
    }
}
