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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import javax.annotation.Nonnull;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dispatches resource events to the callbacks subscribed to them.
 *
 * Subscriptions are kept per resource and event, in subscription order;
 * subscribing the same callback twice to the same pair has no effect.
 */
public class CallbacksManager {

    private static final Logger log =
        LoggerFactory.getLogger(CallbacksManager.class);

    private final Map<String, Map<String, List<Callback>>> callbacks =
        new LinkedHashMap<>();

    public synchronized void subscribe(@Nonnull Callback callback,
                                       @Nonnull String resource,
                                       @Nonnull String event) {
        Preconditions.checkNotNull(callback);
        log.debug("Subscribe: {} {} {}", callback, resource, event);
        List<Callback> subscribers = callbacks
            .computeIfAbsent(resource, r -> new LinkedHashMap<>())
            .computeIfAbsent(event, e -> new ArrayList<>());
        if (!subscribers.contains(callback)) {
            subscribers.add(callback);
        }
    }

    public synchronized void unsubscribe(Callback callback, String resource,
                                         String event) {
        Map<String, List<Callback>> byEvent = callbacks.get(resource);
        if (byEvent == null || byEvent.get(event) == null
            || !byEvent.get(event).remove(callback)) {
            log.debug("Callback {} not found for {} {}",
                      callback, resource, event);
        }
    }

    public synchronized void unsubscribeByResource(Callback callback,
                                                   String resource) {
        Map<String, List<Callback>> byEvent = callbacks.get(resource);
        if (byEvent != null) {
            for (List<Callback> subscribers : byEvent.values()) {
                subscribers.remove(callback);
            }
        }
    }

    public synchronized void unsubscribeAll(Callback callback) {
        for (Map<String, List<Callback>> byEvent : callbacks.values()) {
            for (List<Callback> subscribers : byEvent.values()) {
                subscribers.remove(callback);
            }
        }
    }

    /**
     * Returns the callbacks subscribed to {@code event} on {@code resource}.
     */
    public synchronized List<Callback> getSubscribers(String resource,
                                                      String event) {
        Map<String, List<Callback>> byEvent = callbacks.get(resource);
        if (byEvent == null || byEvent.get(event) == null) {
            return Collections.emptyList();
        }
        return ImmutableList.copyOf(byEvent.get(event));
    }

    public synchronized boolean isEmpty() {
        for (Map<String, List<Callback>> byEvent : callbacks.values()) {
            for (List<Callback> subscribers : byEvent.values()) {
                if (!subscribers.isEmpty()) {
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * Notifies every subscriber. If any of them fails while handling a
     * {@code before_*} event, the corresponding {@code abort_*} event is
     * dispatched and a {@link CallbackFailure} is raised.
     */
    public void notify(String resource, String event, Object trigger,
                       Map<String, Object> kwargs) {
        List<CallbackFailure.NotificationError> errors =
            notifyLoop(resource, event, trigger, kwargs);
        if (!errors.isEmpty()) {
            if (event.startsWith(Events.BEFORE)) {
                String abortEvent =
                    Events.ABORT + event.substring(Events.BEFORE.length());
                notifyLoop(resource, abortEvent, trigger, kwargs);
            }
            throw new CallbackFailure(errors);
        }
    }

    public synchronized void clear() {
        callbacks.clear();
    }

    private List<CallbackFailure.NotificationError> notifyLoop(
            String resource, String event, Object trigger,
            Map<String, Object> kwargs) {
        List<Callback> subscribers = getSubscribers(resource, event);
        log.debug("Notify callbacks for {}, {}", resource, event);
        List<CallbackFailure.NotificationError> errors = new ArrayList<>();
        for (Callback callback : subscribers) {
            try {
                log.trace("Calling callback {}", callback);
                callback.notify(resource, event, trigger, kwargs);
            } catch (Exception e) {
                log.error("Error during notification for {} {}, {}",
                          callback, resource, event, e);
                errors.add(new CallbackFailure.NotificationError(callback, e));
            }
        }
        return errors;
    }
}
