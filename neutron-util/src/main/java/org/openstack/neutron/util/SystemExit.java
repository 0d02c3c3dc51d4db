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
package org.openstack.neutron.util;

/**
 * Signals an unconditional request to terminate the current process.
 *
 * It is an {@link Error} so that ordinary {@code catch (Exception e)} blocks
 * do not intercept it on its way up to whoever owns the process. It
 * remembers the execution context that requested the exit.
 */
public class SystemExit extends Error {

    private static final long serialVersionUID = 1L;

    private final int code;
    private final transient ExecutionContext origin;

    public SystemExit(int code) {
        super("exit(" + code + ")");
        this.code = code;
        this.origin = ExecutionContext.current();
    }

    public int getCode() {
        return code;
    }

    public ExecutionContext getOrigin() {
        return origin;
    }
}
