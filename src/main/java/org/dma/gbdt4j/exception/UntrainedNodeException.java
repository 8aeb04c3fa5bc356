package org.dma.gbdt4j.exception;

public class UntrainedNodeException extends GBDTException {
    public UntrainedNodeException() {
        super();
    }

    public UntrainedNodeException(String msg) {
        super(msg);
    }

    public UntrainedNodeException(Throwable cause) {
        super(cause);
    }

    public UntrainedNodeException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
