package org.gamma.imgbatch.config;

public class ConfigurationException extends BatchAbortException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
