package org.dependencytrack.cvss.vector;

/**
 * Base of all failures to turn a string into a valid CVSS vector.
 */
public abstract class InvalidVectorException extends Exception {

    InvalidVectorException(final String message) {
        super(message);
    }

}
