package org.dma.gbdt4j.exception;

/**
 * Raised when a training parameter is out of its legal range.
 */
public class InvalidParamException extends GBDTException {
    public InvalidParamException() {
        super();
    }

    public InvalidParamException(String msg) {
        super(msg);
    }

    public InvalidParamException(Throwable cause) {
        super(cause);
    }

    public InvalidParamException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
