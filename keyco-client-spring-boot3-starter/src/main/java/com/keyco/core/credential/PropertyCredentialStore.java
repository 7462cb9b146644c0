package com.keyco.core.credential;

import com.keyco.config.KeycoClientProperties;
import com.keyco.core.spi.CredentialStore;

import java.util.Optional;

/**
 * 读取 keyco.client.api-key
 */
public class PropertyCredentialStore implements CredentialStore {

    private final KeycoClientProperties props;

    public PropertyCredentialStore(KeycoClientProperties props) {
        this.props = props;
    }

    @Override
    public Optional<String> get() {
        String key = props.getApiKey();
        return key == null || key.isBlank() ? Optional.empty() : Optional.of(key.trim());
    }
}
