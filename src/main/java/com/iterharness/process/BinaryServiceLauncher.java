package com.iterharness.process;

import com.iterharness.core.error.ErrorKind;
import com.iterharness.core.error.HarnessException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Launches the {@code iter-service} binary as {@code <binary> serve --config <path>}.
 *
 * <p>Resolution order: the configured path, {@code iter-service} on {@code PATH}, then
 * {@code tests/bin/iter-service} under the working directory and its parents.
 */
public class BinaryServiceLauncher implements ServiceLauncher {

    private static final Logger log = LoggerFactory.getLogger(BinaryServiceLauncher.class);

    static final String BINARY_NAME = "iter-service";

    private final String configuredBinary;
    private final Path workingDir;
    private final String pathEnv;

    public BinaryServiceLauncher(String configuredBinary) {
        this(configuredBinary, Path.of("").toAbsolutePath(), System.getenv("PATH"));
    }

    BinaryServiceLauncher(String configuredBinary, Path workingDir, String pathEnv) {
        this.configuredBinary = configuredBinary;
        this.workingDir = workingDir;
        this.pathEnv = pathEnv;
    }

    @Override
    public List<String> command(Path configPath) {
        Path binary = resolveBinary();
        return List.of(binary.toString(), "serve", "--config", configPath.toString());
    }

    /**
     * @throws HarnessException SETUP_FATAL if no executable is found
     */
    Path resolveBinary() {
        var candidates = new ArrayList<Path>();
        if (configuredBinary != null && !configuredBinary.isBlank()) {
            candidates.add(Path.of(configuredBinary));
        }
        if (pathEnv != null) {
            for (String dir : pathEnv.split(File.pathSeparator)) {
                if (!dir.isBlank()) candidates.add(Path.of(dir, BINARY_NAME));
            }
        }
        for (Path dir = workingDir; dir != null; dir = dir.getParent()) {
            candidates.add(dir.resolve("tests").resolve("bin").resolve(BINARY_NAME));
        }
        for (Path candidate : candidates) {
            if (Files.isRegularFile(candidate) && Files.isExecutable(candidate)) {
                log.debug("Using service binary {}", candidate);
                return candidate.toAbsolutePath();
            }
        }
        throw new HarnessException(ErrorKind.SETUP_FATAL, BINARY_NAME + " binary not found (searched "
                + candidates.size() + " locations)");
    }
}
