package fr.lapetina.dispatch.infrastructure.config;

/**
 * Listener interface for configuration changes.
 */
@FunctionalInterface
public interface ConfigChangeListener {

    /**
     * Called after a configuration was loaded.
     *
     * @param oldConfig the previous configuration, null on the initial load
     * @param newConfig the configuration now in effect
     */
    void onConfigChanged(DispatchConfig oldConfig, DispatchConfig newConfig);
}
