package com.example.retrain;

import com.example.retrain.ml.TrainingJob;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.jar.JarOutputStream;
import java.util.zip.ZipEntry;

import static org.junit.jupiter.api.Assertions.*;

class TrainingJobCommandTest {

    @TempDir
    Path dir;

    private final Path java = Path.of("/opt/jdk/bin/java");

    private Path jarWith(String name, String... entries) throws Exception {
        Path jar = dir.resolve(name);
        try (OutputStream out = Files.newOutputStream(jar); JarOutputStream jos = new JarOutputStream(out)) {
            for (String e : entries) {
                jos.putNextEntry(new ZipEntry(e));
                jos.write(new byte[]{(byte) 0xCA, (byte) 0xFE});
                jos.closeEntry();
            }
        }
        return jar;
    }

    private List<String> build(String classPath) {
        return TrainingJobCommand.build(java, classPath, Path.of("data/processed/cleaned.csv"), Path.of("models"),
                "HousingModel");
    }

    @Test
    void explodedClassPathRunsJobClassDirectly() {
        String cp = dir.resolve("classes") + File.pathSeparator + dir.resolve("lib/commons-math3.jar");

        List<String> cmd = build(cp);

        assertEquals(List.of(java.toString(), "-cp", cp, TrainingJob.class.getName()), cmd.subList(0, 4));
        assertFalse(cmd.contains(TrainingJobCommand.BOOT_LAUNCHER));
    }

    @Test
    void repackagedBootJarGoesThroughPropertiesLauncher() throws Exception {
        Path jar = jarWith("retrain-app.jar",
                "BOOT-INF/classes/com/example/retrain/ml/TrainingJob.class",
                "BOOT-INF/lib/commons-math3-3.6.1.jar");

        List<String> cmd = build(jar.toString());

        assertEquals(List.of(java.toString(), "-cp", jar.toString(),
                "-Dloader.main=com.example.retrain.ml.TrainingJob",
                "org.springframework.boot.loader.launch.PropertiesLauncher"), cmd.subList(0, 5));
        assertFalse(cmd.contains(TrainingJob.class.getName()));
    }

    @Test
    void plainJarRunsJobClassDirectly() throws Exception {
        Path jar = jarWith("retrain-app-plain.jar", "com/example/retrain/ml/TrainingJob.class");

        assertEquals(TrainingJob.class.getName(), build(jar.toString()).get(3));
    }

    @Test
    void unreadableJarFallsBackToDirectLaunch() throws Exception {
        Path notAJar = Files.writeString(dir.resolve("broken.jar"), "not a zip");

        assertFalse(TrainingJobCommand.isBootArchive(notAJar.toString()));
    }

    @Test
    void pathsAreAbsolute() {
        List<String> cmd = build(dir.resolve("classes").toString());

        assertTrue(cmd.contains("--dataset=" + Path.of("data/processed/cleaned.csv").toAbsolutePath()), cmd.toString());
        assertTrue(cmd.contains("--registry=" + Path.of("models").toAbsolutePath()), cmd.toString());
        assertEquals("--model-name=HousingModel", cmd.get(cmd.size() - 1));
    }
}
