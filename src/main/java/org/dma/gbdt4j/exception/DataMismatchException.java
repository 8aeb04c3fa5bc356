package org.dma.gbdt4j.exception;

/**
 * Raised when the data handed to a tree disagrees with its metadata,
 * e.g. a feature matrix whose dimensionality differs from the feature info,
 * an empty instance range or a prediction vector that is too short.
 */
public class DataMismatchException extends GBDTException {
    public DataMismatchException() {
        super();
    }

    public DataMismatchException(String msg) {
        super(msg);
    }

    public DataMismatchException(Throwable cause) {
        super(cause);
    }

    public DataMismatchException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
