package com.trellis.plugin;

/** Lifecycle state of a plugin within a {@link PluginManager}. */
public enum PluginState {
    UNREGISTERED,
    REGISTERING,
    REGISTERED,
    STARTING,
    STARTED,
    STOPPING,
    STOPPED;

    /**
     * Checks whether a plugin in this state counts as registered for dependency resolution.
     *
     * @return true for REGISTERED and every later state
     */
    public boolean isRegistered() {
        return compareTo(REGISTERED) >= 0;
    }
}
