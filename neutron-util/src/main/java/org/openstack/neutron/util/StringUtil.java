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

import java.util.Locale;

import com.google.common.collect.ImmutableSet;

/**
 * Helper class for String operations. Only static methods should exist.
 */
public class StringUtil {

    public final static String EMPTY_STRING = "";

    public final static ImmutableSet<String> TRUE_STRINGS =
        ImmutableSet.of("1", "t", "true", "on", "y", "yes");

    public final static ImmutableSet<String> FALSE_STRINGS =
        ImmutableSet.of("0", "f", "false", "off", "n", "no");

    /**
     * Interprets a string as a boolean.
     *
     * The recognised values are those of {@link #TRUE_STRINGS} and
     * {@link #FALSE_STRINGS}, case-insensitively and ignoring surrounding
     * whitespace. Anything else, including null, yields {@code defaultValue}
     * unless {@code strict} is set, in which case it is rejected.
     *
     * @throws IllegalArgumentException in strict mode, for unrecognised
     *         values
     */
    public static boolean boolFromString(String value, boolean strict,
                                         boolean defaultValue) {
        String lowered = value == null
                         ? EMPTY_STRING
                         : value.trim().toLowerCase(Locale.ROOT);
        if (TRUE_STRINGS.contains(lowered)) {
            return true;
        }
        if (FALSE_STRINGS.contains(lowered)) {
            return false;
        }
        if (strict) {
            throw new IllegalArgumentException(
                "Unrecognized value '" + value + "', acceptable values are: "
                + TRUE_STRINGS + " " + FALSE_STRINGS);
        }
        return defaultValue;
    }

    /**
     * Checks whether the string is null or empty.
     */
    public static boolean isNullOrEmpty(String str) {
        return (str == null || str.equals(""));
    }

    private StringUtil() {
    }
}
