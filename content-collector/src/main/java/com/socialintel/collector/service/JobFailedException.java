package com.socialintel.collector.service;

/**
 * Unrecoverable condition inside a running job; the job ends FAILED.
 */
class JobFailedException extends RuntimeException {

    JobFailedException(String message) {
        super(message);
    }

    JobFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
