package org.gamma.imgbatch.config;

/**
 * Fatal, pre-run failure of a batch job. Raised before any image is processed.
 */
public class BatchAbortException extends Exception {

    public BatchAbortException(String message) {
        super(message);
    }

    public BatchAbortException(String message, Throwable cause) {
        super(message, cause);
    }
}
