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

import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

public class TestStringUtil {

    @Test
    public void testBoolFromString() throws Exception {
        for (String value : new String[]{"1", "t", "True", " yes ", "ON"}) {
            assertThat(value, StringUtil.boolFromString(value, true, false),
                       is(true));
        }
        for (String value : new String[]{"0", "f", "FALSE", "no", "off"}) {
            assertThat(value, StringUtil.boolFromString(value, true, true),
                       is(false));
        }
        assertThat(StringUtil.boolFromString(null, false, true), is(true));
        assertThat(StringUtil.boolFromString("maybe", false, false),
                   is(false));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testStrictRejectsUnknownValues() throws Exception {
        StringUtil.boolFromString("maybe", true, false);
    }

    @Test
    public void testIsNullOrEmpty() throws Exception {
        assertThat(StringUtil.isNullOrEmpty(null), is(true));
        assertThat(StringUtil.isNullOrEmpty(""), is(true));
        assertThat(StringUtil.isNullOrEmpty("x"), is(false));
    }
}
