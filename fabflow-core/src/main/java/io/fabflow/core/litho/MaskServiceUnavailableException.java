package io.fabflow.core.litho;

import java.io.Serial;

/// Thrown when the mask extraction service cannot produce a mask file.
public class MaskServiceUnavailableException extends Exception {

    @Serial private static final long serialVersionUID = 6480318893617406113L;

    public MaskServiceUnavailableException(String message) {
        super(message);
    }

    public MaskServiceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
