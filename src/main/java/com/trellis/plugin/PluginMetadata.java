package com.trellis.plugin;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Descriptive data of a plugin. The name is the plugin's unique identifier within a manager;
 * dependencies name plugins that must already be registered.
 */
public final class PluginMetadata {
    private final String name;
    private final String version;
    private final String description;
    private final String author;
    private final List<String> dependencies;
    private final List<String> tags;

    public PluginMetadata(String name, String version, String description, String author,
            List<String> dependencies, List<String> tags) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Plugin name is required");
        }
        if (version == null || version.isEmpty()) {
            throw new IllegalArgumentException("Plugin version is required");
        }
        this.name = name;
        this.version = version;
        this.description = description;
        this.author = author;
        this.dependencies = dependencies == null ? Collections.emptyList()
                : Collections.unmodifiableList(List.copyOf(dependencies));
        this.tags = tags == null ? Collections.emptyList()
                : Collections.unmodifiableList(List.copyOf(tags));
    }

    /**
     * Creates metadata with only a name and a version.
     *
     * @param name    the plugin name
     * @param version the plugin version
     * @return the metadata
     */
    public static PluginMetadata of(String name, String version) {
        return new PluginMetadata(name, version, null, null, null, null);
    }

    public PluginMetadata withDescription(String newDescription) {
        return new PluginMetadata(name, version, newDescription, author, dependencies, tags);
    }

    public PluginMetadata withAuthor(String newAuthor) {
        return new PluginMetadata(name, version, description, newAuthor, dependencies, tags);
    }

    public PluginMetadata withDependencies(String... names) {
        return new PluginMetadata(name, version, description, author, Arrays.asList(names), tags);
    }

    public PluginMetadata withTags(String... newTags) {
        return new PluginMetadata(name, version, description, author, dependencies,
                Arrays.asList(newTags));
    }

    public String getName() {
        return name;
    }

    public String getVersion() {
        return version;
    }

    public String getDescription() {
        return description;
    }

    public String getAuthor() {
        return author;
    }

    public List<String> getDependencies() {
        return dependencies;
    }

    public List<String> getTags() {
        return tags;
    }

    @Override
    public String toString() {
        return name + "@" + version;
    }
}
