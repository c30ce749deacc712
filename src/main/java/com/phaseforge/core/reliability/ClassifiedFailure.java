package com.phaseforge.core.reliability;

/**
 * Implemented by exceptions that already know which {@link ErrorKind} they represent.
 */
public interface ClassifiedFailure {

    ErrorKind errorKind();
}
