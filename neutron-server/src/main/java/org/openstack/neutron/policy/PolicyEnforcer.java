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
package org.openstack.neutron.policy;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableMap;

/**
 * Evaluates policy rules against the roles of a caller.
 *
 * A rule is a list of alternatives separated by {@code or}; each
 * alternative is {@code role:<name>}, {@code rule:<other rule>}, {@code @}
 * (always) or {@code !} (never). An empty rule always passes. Actions
 * without a rule fall back to the {@value #DEFAULT_RULE} rule, and pass if
 * there is none.
 */
public class PolicyEnforcer {

    public static final String DEFAULT_RULE = "default";

    private static final Splitter OR =
        Splitter.on(" or ").trimResults().omitEmptyStrings();

    private final ImmutableMap<String, String> rules;

    public PolicyEnforcer(Map<String, String> rules) {
        this.rules = ImmutableMap.copyOf(rules);
    }

    public Map<String, String> getRules() {
        return rules;
    }

    public boolean check(Set<String> roles, String action) {
        String rule = rules.get(action);
        if (rule == null) {
            rule = rules.get(DEFAULT_RULE);
        }
        return rule == null || evaluate(rule, roles, new HashSet<String>());
    }

    private boolean evaluate(String rule, Set<String> roles,
                             Set<String> visiting) {
        if (rule.trim().isEmpty()) {
            return true;
        }
        for (String alternative : OR.split(rule)) {
            if (alternative.equals("@")) {
                return true;
            }
            if (alternative.equals("!")) {
                continue;
            }
            if (alternative.startsWith("role:")
                && roles.contains(alternative.substring(5))) {
                return true;
            }
            if (alternative.startsWith("rule:")) {
                String name = alternative.substring(5);
                String referenced = rules.get(name);
                if (referenced != null && visiting.add(name)
                    && evaluate(referenced, roles, visiting)) {
                    return true;
                }
            }
        }
        return false;
    }
}
