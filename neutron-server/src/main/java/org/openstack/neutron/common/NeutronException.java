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
package org.openstack.neutron.common;

import java.util.Collections;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.openstack.neutron.util.Substitutable;

/**
 * Base class of the exceptions raised by Neutron components.
 *
 * Messages are templates with named <code>{placeholders}</code> filled from
 * the keyword arguments given to the constructor. A template that cannot be
 * filled is logged and used verbatim, unless {@link #FATAL_EXCEPTIONS}
 * holds true, in which case the problem is raised as an
 * {@link IllegalArgumentException}.
 */
public class NeutronException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private static final Logger log =
        LoggerFactory.getLogger(NeutronException.class);

    private static final Pattern PLACEHOLDER =
        Pattern.compile("\\{([A-Za-z_][A-Za-z0-9_]*)\\}");

    public static final Substitutable<Boolean> FATAL_EXCEPTIONS =
        new Substitutable<>("use-fatal-exceptions", Boolean.FALSE);

    private final Map<String, ?> kwargs;

    public NeutronException(String template) {
        this(template, Collections.<String, Object>emptyMap(), null);
    }

    public NeutronException(String template, Map<String, ?> kwargs) {
        this(template, kwargs, null);
    }

    public NeutronException(String template, Map<String, ?> kwargs,
                            Throwable cause) {
        super(format(template, kwargs), cause);
        this.kwargs = kwargs;
    }

    public Map<String, ?> getKwargs() {
        return kwargs;
    }

    static String format(String template, Map<String, ?> kwargs) {
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuffer sb = new StringBuffer();
        while (matcher.find()) {
            String name = matcher.group(1);
            if (!kwargs.containsKey(name)) {
                if (FATAL_EXCEPTIONS.get()) {
                    throw new IllegalArgumentException(
                        "Missing argument '" + name + "' for message: " +
                        template);
                }
                log.error("Exception in string format operation, " +
                          "missing '{}' for: {}", name, template);
                return template;
            }
            matcher.appendReplacement(
                sb, Matcher.quoteReplacement(String.valueOf(kwargs.get(name))));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }
}
