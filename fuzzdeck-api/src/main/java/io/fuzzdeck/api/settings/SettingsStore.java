package io.fuzzdeck.api.settings;

import java.util.Optional;

/**
 * Persisted key/value settings shared by the console pages.
 */
public interface SettingsStore {

    Optional<String> get(String key);

    void set(String key, String value);
}
