package com.trellis.plugin.error;

import com.trellis.middleware.CommonMiddleware;
import com.trellis.plugin.AbstractPlugin;
import com.trellis.plugin.PluginContext;

/**
 * Plugin that adds global exception handling to the application.
 * Exceptions thrown by later middleware or handlers become consistent JSON error responses.
 *
 * <p>Configuration: {@code dev} (boolean) includes the exception class and message in the body.
 * When absent, the application's dev flag is used.
 */
public class ErrorHandlerPlugin extends AbstractPlugin {
    public static final String NAME = "error-handler";

    public ErrorHandlerPlugin() {
        super(NAME, "1.0.0");
    }

    @Override
    public void register(PluginContext context) {
        boolean dev = isDev(context);
        logger.info("Registering error handler (dev details {})", dev ? "on" : "off");
        context.addMiddleware(CommonMiddleware.errorHandler(dev));
    }

    private static boolean isDev(PluginContext context) {
        Object configured = context.getConfig().get("dev");
        if (configured != null) {
            return Boolean.parseBoolean(configured.toString());
        }
        return context.getServer() != null && context.getServer().getConfig().isDev();
    }
}
