package org.neuralchilli.marshal.service;

import org.neuralchilli.marshal.domain.ErrorCategory;

/**
 * A pipeline template or run request cannot be used as given.
 */
public class ConfigurationException extends OrchestrationException {

    public ConfigurationException(String message) {
        super(ErrorCategory.CONFIGURATION, message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(ErrorCategory.CONFIGURATION, message, cause);
    }
}
