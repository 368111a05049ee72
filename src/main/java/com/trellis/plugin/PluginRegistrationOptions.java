package com.trellis.plugin;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Options for a single plugin registration: a path prefix applied to the plugin's routes and
 * scoped middleware, and configuration overriding the plugin's defaults.
 */
public class PluginRegistrationOptions {
    private String prefix;
    private final Map<String, Object> config = new LinkedHashMap<>();

    public static PluginRegistrationOptions create() {
        return new PluginRegistrationOptions();
    }

    public PluginRegistrationOptions prefix(String prefix) {
        this.prefix = prefix;
        return this;
    }

    public PluginRegistrationOptions config(String key, Object value) {
        config.put(key, value);
        return this;
    }

    public PluginRegistrationOptions config(Map<String, Object> values) {
        config.putAll(values);
        return this;
    }

    public String getPrefix() {
        return prefix;
    }

    public Map<String, Object> getConfig() {
        return Collections.unmodifiableMap(config);
    }
}
