package com.example.retrain.job;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

/**
 * {@link JobSupervisor} that launches a command line as a child process.
 *
 * <p>
 * Standard output is discarded; standard error is read to the end and returned with the exit
 * status. Reading stderr before {@link Process#waitFor()} keeps a chatty job from blocking on a
 * full pipe.
 * </p>
 */
@Slf4j
public class ProcessJobSupervisor implements JobSupervisor {

    private final List<String> command;
    private final Path workingDir;

    public ProcessJobSupervisor(List<String> command, Path workingDir) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("training job command must not be empty");
        }
        this.command = List.copyOf(command);
        this.workingDir = workingDir;
    }

    @Override
    public JobResult runTrainingJob() {
        ProcessBuilder pb = new ProcessBuilder(command)
                .directory(workingDir.toFile())
                .redirectOutput(ProcessBuilder.Redirect.DISCARD);

        log.info("Launching training job: {} (cwd={})", command, workingDir.toAbsolutePath());
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new JobLaunchException("Cannot start training job " + command, e);
        }

        try (InputStream err = process.getErrorStream()) {
            String stderr = new String(err.readAllBytes(), StandardCharsets.UTF_8);
            int exit = process.waitFor();
            log.info("Training job exited with status {}", exit);
            return new JobResult(exit, stderr);
        } catch (IOException e) {
            process.destroyForcibly();
            throw new JobLaunchException("Lost training job stderr for " + command, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new JobLaunchException("Interrupted while waiting for training job", e);
        }
    }

    public List<String> command() {
        return command;
    }
}
