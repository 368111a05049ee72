package com.trellis.plugin;

/** Thrown when a start or stop hook fails. The rest of the sequence is not run. */
public class LifecycleHookException extends PluginException {
    private final String hook;

    public LifecycleHookException(String pluginName, String hook, Throwable cause) {
        super(pluginName, "Plugin '" + pluginName + "' failed in " + hook + ": " + cause.getMessage(),
                cause);
        this.hook = hook;
    }

    /**
     * Gets the name of the failing hook.
     *
     * @return e.g. {@code beforeStart}
     */
    public String getHook() {
        return hook;
    }
}
