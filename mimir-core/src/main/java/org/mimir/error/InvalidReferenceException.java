package org.mimir.error;

public class InvalidReferenceException extends ResolutionException {

    public InvalidReferenceException(String message) {
        super(null, message);
    }
}
