package com.example.retrain;

import com.example.retrain.ml.TrainingJob;
import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.jar.JarFile;

/**
 * Command line that runs the bundled {@link TrainingJob} in a child JVM.
 *
 * <p>
 * From an exploded class path the job class is started directly. Inside a repackaged Spring Boot
 * jar the application classes live under {@value #BOOT_CLASSES}, out of reach of the plain
 * application class loader, so the job is started through Boot's {@code PropertiesLauncher} with
 * {@code loader.main} naming the job class.
 * </p>
 *
 * <p>Dataset and registry paths are made absolute, so the job reads the same files the engine
 * fingerprints and scores whatever its working directory is.</p>
 */
@Slf4j
final class TrainingJobCommand {

    static final String BOOT_LAUNCHER = "org.springframework.boot.loader.launch.PropertiesLauncher";
    static final String BOOT_CLASSES = "BOOT-INF/classes/";

    private TrainingJobCommand() {}

    static List<String> build(Path java, String classPath, Path dataset, Path registryDir, String modelName) {
        List<String> cmd = new ArrayList<>();
        cmd.add(java.toString());
        cmd.add("-cp");
        cmd.add(classPath);
        if (isBootArchive(classPath)) {
            cmd.add("-Dloader.main=" + TrainingJob.class.getName());
            cmd.add(BOOT_LAUNCHER);
        } else {
            cmd.add(TrainingJob.class.getName());
        }
        cmd.add("--dataset=" + dataset.toAbsolutePath());
        cmd.add("--registry=" + registryDir.toAbsolutePath());
        cmd.add("--model-name=" + modelName);
        return List.copyOf(cmd);
    }

    /** A single jar carrying the job class under {@value #BOOT_CLASSES}. */
    static boolean isBootArchive(String classPath) {
        if (classPath == null || classPath.isBlank() || classPath.contains(File.pathSeparator)) {
            return false;
        }
        Path jar = Path.of(classPath);
        if (!jar.getFileName().toString().endsWith(".jar") || !Files.isRegularFile(jar)) {
            return false;
        }
        String entry = BOOT_CLASSES + TrainingJob.class.getName().replace('.', '/') + ".class";
        try (JarFile jf = new JarFile(jar.toFile())) {
            return jf.getEntry(entry) != null;
        } catch (IOException e) {
            log.warn("Cannot inspect {} for a Boot layout, launching the job class directly: {}", jar, e.toString());
            return false;
        }
    }
}
