package com.iterharness.process;

import java.nio.file.Path;
import java.util.Map;

/**
 * Everything needed to run the service as a local child process.
 *
 * @param baseUrl     loopback URL the service will listen on
 * @param port        port written into the config
 * @param configPath  where the generated config is written
 * @param dataDir     private storage directory of the environment
 * @param logFile     file receiving the child's stdout and stderr
 * @param environment extra environment variables for the child
 */
public record ProcessSpec(
    String baseUrl,
    int port,
    Path configPath,
    Path dataDir,
    Path logFile,
    Map<String, String> environment
) {}
