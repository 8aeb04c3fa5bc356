package org.dma.gbdt4j.exception;

/**
 * Base class of the errors raised while growing, querying or boosting trees.
 */
public class GBDTException extends RuntimeException {
    public GBDTException() {
        super();
    }

    public GBDTException(String msg) {
        super(msg);
    }

    public GBDTException(Throwable cause) {
        super(cause);
    }

    public GBDTException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
