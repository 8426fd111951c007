package com.mooncell.router.core.error;

import lombok.Getter;

@Getter
public class ModelResolutionException extends RuntimeException {

    private final ResolutionError error;

    public ModelResolutionException(ResolutionError error, String message) {
        super(message);
        this.error = error;
    }
}
