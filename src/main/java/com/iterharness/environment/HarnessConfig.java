package com.iterharness.environment;

import com.github.dockerjava.api.DockerClient;
import com.iterharness.container.DockerClients;
import com.iterharness.core.health.HealthProbe;
import com.iterharness.core.port.PortAllocator;
import com.iterharness.process.BinaryServiceLauncher;
import com.iterharness.process.ServiceLauncher;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;

@Configuration
public class HarnessConfig {

    @Bean
    public PortAllocator portAllocator(HarnessProperties properties) {
        return new PortAllocator(properties.getBasePort());
    }

    @Bean
    public HealthProbe healthProbe(HarnessProperties properties) {
        return new HealthProbe(properties.getTimeouts().getProbe());
    }

    @Bean
    public ServiceLauncher serviceLauncher(HarnessProperties properties) {
        return new BinaryServiceLauncher(properties.getLocal().getBinary());
    }

    /**
     * Only created when a containerized environment is requested.
     */
    @Bean
    @Lazy
    public DockerClient dockerClient() {
        return DockerClients.create(System.getenv("DOCKER_HOST"));
    }

    @Bean
    public TestSetup testSetup(HarnessProperties properties, PortAllocator portAllocator,
                               HealthProbe healthProbe, ServiceLauncher serviceLauncher,
                               ObjectProvider<DockerClient> dockerClient) {
        return new TestSetup(properties, portAllocator, healthProbe, serviceLauncher,
                dockerClient::getObject, System.getenv());
    }
}
