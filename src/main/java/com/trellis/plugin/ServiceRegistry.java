package com.trellis.plugin;

import com.trellis.util.LogUtil;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Services exposed by plugins, keyed by {@code <plugin>:<service>}. Written during registration,
 * read freely afterwards.
 */
public class ServiceRegistry {
    private static final Logger logger = LoggerFactory.getLogger(ServiceRegistry.class);

    private final Map<String, Object> services = Collections.synchronizedMap(new LinkedHashMap<>());

    /**
     * Builds the qualified key of a service.
     *
     * @param pluginName  the owning plugin
     * @param serviceName the service name
     * @return the qualified key
     */
    public static String qualify(String pluginName, String serviceName) {
        return pluginName + ":" + serviceName;
    }

    /**
     * Stores a service under its qualified key.
     *
     * @param pluginName  the owning plugin
     * @param serviceName the service name
     * @param service     the service
     */
    public void register(String pluginName, String serviceName, Object service) {
        if (serviceName == null || serviceName.isEmpty()) {
            throw new IllegalArgumentException("Service name must not be empty");
        }
        String key = qualify(pluginName, serviceName);
        if (services.put(key, service) != null) {
            logger.warn(LogUtil.warn("Service " + key + " was replaced"));
        }
    }

    /**
     * Gets a service by its exact key.
     *
     * @param key the qualified key
     * @return the service or null
     */
    public Object get(String key) {
        return services.get(key);
    }

    public boolean contains(String key) {
        return services.containsKey(key);
    }

    /**
     * Gets a snapshot of all services.
     *
     * @return the services in registration order
     */
    public Map<String, Object> snapshot() {
        synchronized (services) {
            return Collections.unmodifiableMap(new LinkedHashMap<>(services));
        }
    }
}
