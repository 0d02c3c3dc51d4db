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

public final class Events {

    public static final String BEFORE_CREATE = "before_create";
    public static final String BEFORE_READ = "before_read";
    public static final String BEFORE_UPDATE = "before_update";
    public static final String BEFORE_DELETE = "before_delete";

    public static final String PRECOMMIT_CREATE = "precommit_create";
    public static final String PRECOMMIT_UPDATE = "precommit_update";
    public static final String PRECOMMIT_DELETE = "precommit_delete";

    public static final String AFTER_CREATE = "after_create";
    public static final String AFTER_READ = "after_read";
    public static final String AFTER_UPDATE = "after_update";
    public static final String AFTER_DELETE = "after_delete";

    public static final String ABORT_CREATE = "abort_create";
    public static final String ABORT_READ = "abort_read";
    public static final String ABORT_UPDATE = "abort_update";
    public static final String ABORT_DELETE = "abort_delete";

    public static final String ABORT = "abort_";
    public static final String BEFORE = "before_";

    private Events() {
    }
}
