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

import java.io.File;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import org.apache.commons.configuration.ConfigurationException;
import org.apache.commons.configuration.PropertiesConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.openstack.neutron.config.ConfigOpts;

/**
 * Process-wide authorization policy.
 */
public final class Policy {

    private static final Logger log = LoggerFactory.getLogger(Policy.class);

    public static final String POLICY_FILE = "policy_file";

    private static volatile PolicyEnforcer enforcer;

    /**
     * Loads the rules named by the {@value #POLICY_FILE} option, unless the
     * policy is already initialized. A missing file yields an empty policy.
     */
    public static synchronized void init(ConfigOpts conf) {
        if (enforcer != null) {
            return;
        }
        Map<String, String> rules = new LinkedHashMap<>();
        String policyFile = conf.getString(POLICY_FILE);
        if (policyFile != null && new File(policyFile).isFile()) {
            rules.putAll(loadRules(policyFile));
        }
        enforcer = new PolicyEnforcer(rules);
        log.debug("Policy initialized with {} rules", rules.size());
    }

    public static synchronized void reset() {
        enforcer = null;
    }

    public static boolean isInitialized() {
        return enforcer != null;
    }

    public static PolicyEnforcer getEnforcer() {
        PolicyEnforcer current = enforcer;
        if (current == null) {
            throw new PolicyNotInitializedException();
        }
        return current;
    }

    public static boolean check(Set<String> roles, String action) {
        return getEnforcer().check(roles, action);
    }

    /**
     * @throws PolicyNotAuthorized if the roles do not satisfy the rule of
     *         {@code action}
     */
    public static void enforce(Set<String> roles, String action) {
        if (!check(roles, action)) {
            throw new PolicyNotAuthorized(action);
        }
    }

    private static Map<String, String> loadRules(String policyFile) {
        try {
            PropertiesConfiguration properties = new PropertiesConfiguration();
            properties.setDelimiterParsingDisabled(true);
            properties.load(policyFile);
            Map<String, String> rules = new LinkedHashMap<>();
            Iterator<String> keys = properties.getKeys();
            while (keys.hasNext()) {
                String key = keys.next();
                rules.put(key, properties.getString(key, ""));
            }
            return rules;
        } catch (ConfigurationException e) {
            throw new IllegalArgumentException(
                "Cannot load policy file " + policyFile, e);
        }
    }

    private Policy() {
    }
}
