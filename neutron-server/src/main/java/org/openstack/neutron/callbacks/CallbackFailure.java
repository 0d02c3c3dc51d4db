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

import java.util.List;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.openstack.neutron.common.NeutronException;

/**
 * Raised when callbacks subscribed to a {@code before_*} event fail, after
 * the matching {@code abort_*} event was dispatched.
 */
public class CallbackFailure extends NeutronException {

    private static final long serialVersionUID = 1L;

    private final ImmutableList<NotificationError> errors;

    public CallbackFailure(List<NotificationError> errors) {
        super("Callback failure: {errors}",
              ImmutableMap.of("errors", errors));
        this.errors = ImmutableList.copyOf(errors);
    }

    public List<NotificationError> getErrors() {
        return errors;
    }

    /**
     * One callback that raised while handling an event.
     */
    public static class NotificationError {

        private final Callback callback;
        private final Exception error;

        public NotificationError(Callback callback, Exception error) {
            this.callback = callback;
            this.error = error;
        }

        public Callback getCallback() {
            return callback;
        }

        public Exception getError() {
            return error;
        }

        @Override
        public String toString() {
            return "Callback " + callback + " failed with \"" + error + "\"";
        }
    }
}
