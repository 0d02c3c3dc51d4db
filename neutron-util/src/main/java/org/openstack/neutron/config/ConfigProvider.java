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

import java.lang.reflect.InvocationHandler;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;

/**
 * Builds a config object when given an annotated interface. Sample usage:
 * <blockquote><pre>
 *   &#064;ConfigGroup("agent")
 *   public interface AgentConfig {
 *
 *      &#064;ConfigInt(key = "check_child_processes_interval",
 *                 defaultValue = 60)
 *      int getCheckInterval();
 *   }
 *
 *   AgentConfig config = ConfigOpts.CONF.getConfig(AgentConfig.class);
 * </pre></blockquote>
 *
 * The facade reads through to the provider on every call, so it always
 * reflects the overrides in place at that moment.
 */
@SuppressWarnings("JavaDoc")
public abstract class ConfigProvider {

    public abstract String getValue(String group, String key,
                                    String defaultValue);

    public abstract boolean getValue(String group, String key,
                                     boolean defaultValue);

    public abstract int getValue(String group, String key, int defaultValue);

    public abstract long getValue(String group, String key, long defaultValue);

    public <Config> Config getConfig(Class<Config> configInterface) {
        return getConfig(configInterface, this);
    }

    @SuppressWarnings("unchecked")
    public static <Config> Config getConfig(
            Class<Config> configInterface, final ConfigProvider provider) {

        InvocationHandler handler = new InvocationHandler() {
            @Override
            public Object invoke(Object proxy, Method method, Object[] args)
                throws Throwable {
                if (method.getDeclaringClass() == Object.class) {
                    return handleObjectMethod(proxy, method, args,
                                              configInterface);
                }
                return handleInvocation(method, provider);
            }
        };

        return (Config) Proxy.newProxyInstance(
            configInterface.getClassLoader(),
            new Class<?>[]{configInterface}, handler);
    }

    private static Object handleObjectMethod(Object proxy, Method method,
                                             Object[] args,
                                             Class<?> configInterface) {
        switch (method.getName()) {
            case "equals":
                return proxy == args[0];
            case "hashCode":
                return System.identityHashCode(proxy);
            default:
                return configInterface.getSimpleName() + "@proxy";
        }
    }

    private static Object handleInvocation(Method method,
                                           ConfigProvider provider) {

        ConfigInt intConfigAnn = method.getAnnotation(ConfigInt.class);
        if (intConfigAnn != null) {
            return provider.getValue(findDeclaredGroupName(method),
                                     intConfigAnn.key(),
                                     intConfigAnn.defaultValue());
        }

        ConfigLong longConfigAnn = method.getAnnotation(ConfigLong.class);
        if (longConfigAnn != null) {
            return provider.getValue(findDeclaredGroupName(method),
                                     longConfigAnn.key(),
                                     longConfigAnn.defaultValue());
        }

        ConfigBool boolConfigAnn = method.getAnnotation(ConfigBool.class);
        if (boolConfigAnn != null) {
            return provider.getValue(findDeclaredGroupName(method),
                                     boolConfigAnn.key(),
                                     boolConfigAnn.defaultValue());
        }

        ConfigString strConfigAnn = method.getAnnotation(ConfigString.class);
        if (strConfigAnn != null) {
            return provider.getValue(findDeclaredGroupName(method),
                                     strConfigAnn.key(),
                                     strConfigAnn.defaultValue());
        }

        throw new IllegalArgumentException(
            "Method " + method.toGenericString() + " is being used as a " +
            "config entry accessor but is not annotated with one of the " +
            "@ConfigInt, @ConfigLong, @ConfigString, @ConfigBool " +
            "annotations.");
    }

    private static String findDeclaredGroupName(Method method) {
        ConfigGroup configGroup = method.getAnnotation(ConfigGroup.class);
        if (configGroup == null) {
            configGroup =
                method.getDeclaringClass().getAnnotation(ConfigGroup.class);
        }
        return configGroup == null ? ConfigOpts.DEFAULT_GROUP
                                   : configGroup.value();
    }
}
