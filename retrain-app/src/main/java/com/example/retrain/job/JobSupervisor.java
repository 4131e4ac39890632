package com.example.retrain.job;

/**
 * Runs the external training job to completion.
 */
public interface JobSupervisor {

    /**
     * Blocks until the job terminates. No timeout is applied.
     *
     * @return exit status and captured standard error
     * @throws JobLaunchException if the job could not be started or the wait was interrupted
     */
    JobResult runTrainingJob();
}
