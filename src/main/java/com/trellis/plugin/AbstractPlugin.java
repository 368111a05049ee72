package com.trellis.plugin;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Abstract base class for plugins that provides common functionality.
 */
public abstract class AbstractPlugin implements Plugin {
    protected final Logger logger = LoggerFactory.getLogger(getClass());
    private final PluginMetadata metadata;

    /**
     * Creates a new plugin with the specified name, version and dependencies.
     *
     * @param name         the plugin name
     * @param version      the plugin version
     * @param dependencies names of plugins that must be registered first
     */
    protected AbstractPlugin(String name, String version, String... dependencies) {
        this(PluginMetadata.of(name, version).withDependencies(dependencies));
    }

    protected AbstractPlugin(PluginMetadata metadata) {
        this.metadata = metadata;
    }

    @Override
    public PluginMetadata getMetadata() {
        return metadata;
    }

    @Override
    public void beforeStart(PluginContext context) throws Exception {
        logger.debug("Plugin {} v{} starting", metadata.getName(), metadata.getVersion());
    }

    @Override
    public void beforeStop(PluginContext context) throws Exception {
        logger.debug("Plugin {} v{} stopping", metadata.getName(), metadata.getVersion());
    }
}
