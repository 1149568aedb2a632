package com.questrail.cbf.subarray.internal.model;

/**
 * A model document could not be read.
 */
public final class ModelDocumentException extends RuntimeException
{
    public ModelDocumentException(String message) {
        super(message);
    }

    public ModelDocumentException(String message, Throwable cause) {
        super(message, cause);
    }
}
