package com.mooncell.router.core.error;

import lombok.Getter;

@Getter
public class ProviderConfigException extends RuntimeException {

    private final ProviderConfigError error;

    public ProviderConfigException(ProviderConfigError error, String message) {
        super(message);
        this.error = error;
    }

    public ProviderConfigException(ProviderConfigError error, String message, Throwable cause) {
        super(message, cause);
        this.error = error;
    }
}
