package com.company.trainingruns.config;

import com.company.trainingruns.infrastructure.Ec2HostLivenessClient;
import com.company.trainingruns.infrastructure.HostLivenessClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.ec2.Ec2Client;

/**
 * EC2 client for the host liveness fallback. Absent unless explicitly enabled,
 * in which case the orphaned run detector is not created either.
 */
@Configuration
@ConditionalOnProperty(
        value = "training-runs.infrastructure.enabled",
        havingValue = "true"
)
public class InfrastructureClientConfig {

    @Bean(destroyMethod = "close")
    public Ec2Client ec2Client(TrainingRunProperties properties) {
        TrainingRunProperties.Infrastructure infrastructure = properties.getInfrastructure();
        return Ec2Client.builder()
                .region(Region.of(infrastructure.getRegion()))
                .overrideConfiguration(ClientOverrideConfiguration.builder()
                        .apiCallTimeout(infrastructure.getApiTimeout())
                        .build())
                .build();
    }

    @Bean
    public HostLivenessClient hostLivenessClient(Ec2Client ec2Client) {
        return new Ec2HostLivenessClient(ec2Client);
    }
}
