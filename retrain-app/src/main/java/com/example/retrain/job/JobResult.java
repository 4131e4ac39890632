package com.example.retrain.job;

/**
 * @param exitCode process exit status, 0 means success
 * @param stderr   everything the job wrote to standard error
 */
public record JobResult(int exitCode, String stderr) {

    public boolean succeeded() {
        return exitCode == 0;
    }
}
