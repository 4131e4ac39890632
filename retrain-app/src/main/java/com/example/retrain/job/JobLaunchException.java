package com.example.retrain.job;

/**
 * The training process could not be started or supervised. Unlike a non-zero exit, this is a
 * fault of the host, not of the job.
 */
public class JobLaunchException extends RuntimeException {

    public JobLaunchException(String message, Throwable cause) {
        super(message, cause);
    }
}
