package io.fuzzdeck.core.settings;

import io.fuzzdeck.api.reverse.FacadeServerParams;
import io.fuzzdeck.api.settings.SettingsStore;

import java.util.Optional;

/**
 * Typed access to the saved reverse-server bridge address and secret.
 */
public class BridgeSettings {

    public static final String BRIDGE_ADDR = "yak-bridge-addr";
    public static final String BRIDGE_SECRET = "yak-bridge-secret";

    private final SettingsStore store;

    public BridgeSettings(SettingsStore store) {
        this.store = store;
    }

    public Optional<String> address() {
        return store.get(BRIDGE_ADDR).filter(s -> !s.isBlank());
    }

    public Optional<String> secret() {
        return store.get(BRIDGE_SECRET).filter(s -> !s.isBlank());
    }

    /**
     * Remember a bridge that accepted a connection.
     */
    public void save(String address, String secret) {
        store.set(BRIDGE_ADDR, address);
        store.set(BRIDGE_SECRET, secret);
    }

    /**
     * Route {@code params} through the saved bridge, if one is saved.
     */
    public FacadeServerParams applyTo(FacadeServerParams params) {
        return address()
                .map(addr -> params.withBridge(addr, secret().orElse("")))
                .orElse(params);
    }
}
