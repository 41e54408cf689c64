package com.iterharness.process;

import java.nio.file.Path;
import java.util.List;

/**
 * Produces the command line that starts the service with a given config file.
 * Implementations: {@link BinaryServiceLauncher} (the iter-service binary).
 */
@FunctionalInterface
public interface ServiceLauncher {

    List<String> command(Path configPath);
}
