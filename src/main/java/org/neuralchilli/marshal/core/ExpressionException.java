package org.neuralchilli.marshal.core;

import org.neuralchilli.marshal.service.ConfigurationException;

/**
 * Exception thrown when a step parameter expression cannot be evaluated.
 */
public class ExpressionException extends ConfigurationException {

    public ExpressionException(String message) {
        super(message);
    }

    public ExpressionException(String message, Throwable cause) {
        super(message, cause);
    }
}
