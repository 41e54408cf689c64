package com.iterharness.container;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.core.DefaultDockerClientConfig;
import com.github.dockerjava.core.DockerClientImpl;
import com.github.dockerjava.zerodep.ZerodepDockerHttpClient;

import java.time.Duration;

/**
 * Creates Docker clients on the zerodep transport, which speaks to the Unix socket without
 * extra native libraries.
 */
public final class DockerClients {

    public static final String DEFAULT_UNIX_SOCKET = "unix:///var/run/docker.sock";

    private DockerClients() {}

    /**
     * @param dockerHost {@code DOCKER_HOST} value, or null for the local socket
     */
    public static DockerClient create(String dockerHost) {
        var config = DefaultDockerClientConfig.createDefaultConfigBuilder()
                .withDockerHost(dockerHost != null && !dockerHost.isBlank() ? dockerHost : DEFAULT_UNIX_SOCKET)
                .build();
        var httpClient = new ZerodepDockerHttpClient.Builder()
                .dockerHost(config.getDockerHost())
                .sslConfig(config.getSSLConfig())
                .connectionTimeout(Duration.ofSeconds(10))
                .responseTimeout(Duration.ofMinutes(5))
                .build();
        return DockerClientImpl.getInstance(config, httpClient);
    }
}
