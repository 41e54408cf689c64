package com.iterharness.process;

import com.iterharness.core.error.ErrorKind;
import com.iterharness.core.error.HarnessException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Renders the TOML configuration file the service reads at startup.
 *
 * <p>One template is used for every environment: loopback binding on the allocated port,
 * storage under the environment's private data directory, API and MCP enabled, logging
 * to stdout (captured in {@code service.log}) and a short index debounce so tests do not
 * wait on the file watcher.
 */
public class ServiceConfigWriter {

    private static final Logger log = LoggerFactory.getLogger(ServiceConfigWriter.class);

    static final int DEBOUNCE_MS = 100;
    static final int SHUTDOWN_TIMEOUT_SECONDS = 5;

    private final String logLevel;
    private final Path extraSectionFile;

    /**
     * @param logLevel         service log level
     * @param extraSectionFile optional file appended verbatim (e.g. an {@code [llm]} section);
     *                         null or absent means nothing is appended
     */
    public ServiceConfigWriter(String logLevel, Path extraSectionFile) {
        this.logLevel = logLevel;
        this.extraSectionFile = extraSectionFile;
    }

    public String render(int port, Path dataDir) {
        String data = escape(dataDir.toAbsolutePath().toString());
        return """
                [service]
                host = "127.0.0.1"
                port = %d
                data_dir = "%s"
                pid_file = "%s/iter-service.pid"
                shutdown_timeout_seconds = %d

                [api]
                enabled = true
                api_key = ""

                [mcp]
                enabled = true

                [logging]
                level = "%s"
                format = "text"
                output = ["stdout"]

                [index]
                debounce_ms = %d
                watch_enabled = true
                """.formatted(port, data, data, SHUTDOWN_TIMEOUT_SECONDS, logLevel, DEBOUNCE_MS)
                + extraSection();
    }

    /**
     * Writes the rendered config to {@code configPath}.
     *
     * @throws HarnessException SETUP_FATAL if the file cannot be written
     */
    public Path write(Path configPath, int port, Path dataDir) {
        try {
            Files.createDirectories(configPath.getParent());
            Files.writeString(configPath, render(port, dataDir), StandardCharsets.UTF_8);
            log.debug("Wrote service config {} (port {})", configPath, port);
            return configPath;
        } catch (IOException e) {
            throw new HarnessException(ErrorKind.SETUP_FATAL, "Failed to write config " + configPath, e);
        }
    }

    private String extraSection() {
        if (extraSectionFile == null || !Files.isRegularFile(extraSectionFile)) {
            return "";
        }
        try {
            String content = Files.readString(extraSectionFile, StandardCharsets.UTF_8);
            return content.isBlank() ? "" : "\n" + content;
        } catch (IOException e) {
            log.warn("Could not read extra config section {}: {}", extraSectionFile, e.getMessage());
            return "";
        }
    }

    static String escape(String value) {
        return value.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
