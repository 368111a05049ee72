package com.trellis.plugin;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fluent builder for plugins defined by lambdas instead of a class.
 *
 * <pre>
 * Plugin plugin = Plugin.builder("greeter", "1.0.0")
 *     .dependencies("base")
 *     .onRegister(ctx -&gt; ctx.addRoute("GET", "/hello", c -&gt; c.text("hi")))
 *     .build();
 * </pre>
 */
public class PluginBuilder {
    private String name;
    private String version;
    private String description;
    private String author;
    private final List<String> dependencies = new ArrayList<>();
    private final List<String> tags = new ArrayList<>();
    private final Map<String, Object> config = new LinkedHashMap<>();
    private PluginHook registerFn;
    private PluginHook beforeRegister;
    private PluginHook afterRegister;
    private PluginHook beforeStart;
    private PluginHook afterStart;
    private PluginHook beforeStop;
    private PluginHook afterStop;

    public PluginBuilder name(String name) {
        this.name = name;
        return this;
    }

    public PluginBuilder version(String version) {
        this.version = version;
        return this;
    }

    public PluginBuilder description(String description) {
        this.description = description;
        return this;
    }

    public PluginBuilder author(String author) {
        this.author = author;
        return this;
    }

    public PluginBuilder dependencies(String... names) {
        this.dependencies.addAll(Arrays.asList(names));
        return this;
    }

    public PluginBuilder tags(String... values) {
        this.tags.addAll(Arrays.asList(values));
        return this;
    }

    /**
     * Adds a default configuration value.
     *
     * @param key   the key
     * @param value the value
     * @return this builder
     */
    public PluginBuilder config(String key, Object value) {
        this.config.put(key, value);
        return this;
    }

    public PluginBuilder config(Map<String, Object> values) {
        this.config.putAll(values);
        return this;
    }

    public PluginBuilder onRegister(PluginHook fn) {
        this.registerFn = fn;
        return this;
    }

    public PluginBuilder beforeRegister(PluginHook hook) {
        this.beforeRegister = hook;
        return this;
    }

    public PluginBuilder afterRegister(PluginHook hook) {
        this.afterRegister = hook;
        return this;
    }

    public PluginBuilder beforeStart(PluginHook hook) {
        this.beforeStart = hook;
        return this;
    }

    public PluginBuilder afterStart(PluginHook hook) {
        this.afterStart = hook;
        return this;
    }

    public PluginBuilder beforeStop(PluginHook hook) {
        this.beforeStop = hook;
        return this;
    }

    public PluginBuilder afterStop(PluginHook hook) {
        this.afterStop = hook;
        return this;
    }

    /**
     * Builds the plugin.
     *
     * @return the plugin
     * @throws IllegalStateException if the name, the version or the register function is missing
     */
    public Plugin build() {
        if (name == null || name.isEmpty()) {
            throw new IllegalStateException("Plugin name is required");
        }
        if (version == null || version.isEmpty()) {
            throw new IllegalStateException("Plugin version is required");
        }
        if (registerFn == null) {
            throw new IllegalStateException("Plugin register function is required");
        }
        PluginMetadata metadata = new PluginMetadata(name, version, description, author,
                dependencies, tags);
        return new BuiltPlugin(metadata, Collections.unmodifiableMap(new LinkedHashMap<>(config)),
                this);
    }

    private static final class BuiltPlugin implements Plugin {
        private final PluginMetadata metadata;
        private final Map<String, Object> config;
        private final PluginHook registerFn;
        private final PluginHook beforeRegister;
        private final PluginHook afterRegister;
        private final PluginHook beforeStart;
        private final PluginHook afterStart;
        private final PluginHook beforeStop;
        private final PluginHook afterStop;

        private BuiltPlugin(PluginMetadata metadata, Map<String, Object> config, PluginBuilder b) {
            this.metadata = metadata;
            this.config = config;
            this.registerFn = b.registerFn;
            this.beforeRegister = b.beforeRegister;
            this.afterRegister = b.afterRegister;
            this.beforeStart = b.beforeStart;
            this.afterStart = b.afterStart;
            this.beforeStop = b.beforeStop;
            this.afterStop = b.afterStop;
        }

        @Override
        public PluginMetadata getMetadata() {
            return metadata;
        }

        @Override
        public Map<String, Object> getDefaultConfig() {
            return config;
        }

        @Override
        public void register(PluginContext context) throws Exception {
            registerFn.run(context);
        }

        @Override
        public void beforeRegister(PluginContext context) throws Exception {
            run(beforeRegister, context);
        }

        @Override
        public void afterRegister(PluginContext context) throws Exception {
            run(afterRegister, context);
        }

        @Override
        public void beforeStart(PluginContext context) throws Exception {
            run(beforeStart, context);
        }

        @Override
        public void afterStart(PluginContext context) throws Exception {
            run(afterStart, context);
        }

        @Override
        public void beforeStop(PluginContext context) throws Exception {
            run(beforeStop, context);
        }

        @Override
        public void afterStop(PluginContext context) throws Exception {
            run(afterStop, context);
        }

        private static void run(PluginHook hook, PluginContext context) throws Exception {
            if (hook != null) {
                hook.run(context);
            }
        }

        @Override
        public String toString() {
            return "Plugin{" + metadata + "}";
        }
    }
}
