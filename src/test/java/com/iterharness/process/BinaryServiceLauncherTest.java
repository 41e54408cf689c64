package com.iterharness.process;

import com.iterharness.core.error.ErrorKind;
import com.iterharness.core.error.HarnessException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisabledOnOs(OS.WINDOWS)
class BinaryServiceLauncherTest {

    @TempDir
    Path dir;

    private Path executable(Path path) throws Exception {
        Files.createDirectories(path.getParent());
        Files.writeString(path, "#!/bin/sh\n");
        assertTrue(path.toFile().setExecutable(true));
        return path;
    }

    @Test
    void configuredBinaryWins() throws Exception {
        Path configured = executable(dir.resolve("custom/iter-service"));
        executable(dir.resolve("path/iter-service"));
        var launcher = new BinaryServiceLauncher(configured.toString(), dir, dir.resolve("path").toString());

        assertEquals(configured.toAbsolutePath(), launcher.resolveBinary());
    }

    @Test
    void fallsBackToPath() throws Exception {
        Path onPath = executable(dir.resolve("path/iter-service"));
        var launcher = new BinaryServiceLauncher("", dir, dir.resolve("path").toString());

        assertEquals(onPath.toAbsolutePath(), launcher.resolveBinary());
    }

    @Test
    void fallsBackToTestsBinInAParentDirectory() throws Exception {
        Path bundled = executable(dir.resolve("tests/bin/iter-service"));
        Path workingDir = Files.createDirectories(dir.resolve("module/sub"));
        var launcher = new BinaryServiceLauncher(null, workingDir, null);

        assertEquals(bundled.toAbsolutePath(), launcher.resolveBinary());
    }

    @Test
    void commandServesWithConfig() throws Exception {
        Path binary = executable(dir.resolve("bin/iter-service"));
        var launcher = new BinaryServiceLauncher(binary.toString(), dir, null);

        assertEquals(List.of(binary.toAbsolutePath().toString(), "serve", "--config", "/tmp/c.toml"),
                launcher.command(Path.of("/tmp/c.toml")));
    }

    @Test
    void missingBinaryIsSetupFatal() {
        var launcher = new BinaryServiceLauncher(dir.resolve("nope").toString(), dir, dir.toString());
        var ex = assertThrows(HarnessException.class, launcher::resolveBinary);
        assertEquals(ErrorKind.SETUP_FATAL, ex.kind());
    }
}
