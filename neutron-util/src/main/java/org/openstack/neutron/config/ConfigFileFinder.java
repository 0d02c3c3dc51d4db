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
package org.openstack.neutron.config;

import java.io.File;
import java.util.ArrayList;
import java.util.List;

/**
 * Locates the configuration files to load when none are named explicitly.
 */
public interface ConfigFileFinder {

    List<String> findConfigFiles(String project);

    /**
     * Looks for {@code <project>.conf} in the user's and the system-wide
     * configuration directories, in that order.
     */
    ConfigFileFinder STANDARD_LOCATIONS = new ConfigFileFinder() {
        @Override
        public List<String> findConfigFiles(String project) {
            String fileName = project + ".conf";
            String[] dirs = {
                System.getProperty("user.home") + "/." + project,
                System.getProperty("user.home"),
                "/etc/" + project,
                "/etc"
            };
            List<String> found = new ArrayList<>();
            for (String dir : dirs) {
                File candidate = new File(dir, fileName);
                if (candidate.isFile()) {
                    found.add(candidate.getAbsolutePath());
                }
            }
            return found;
        }

        @Override
        public String toString() {
            return "standard-locations";
        }
    };
}
