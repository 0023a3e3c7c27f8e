package com.company.trainingruns.infrastructure;

import com.company.trainingruns.domain.enums.HostState;
import com.company.trainingruns.exception.ExternalServiceException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.ec2.Ec2Client;
import software.amazon.awssdk.services.ec2.model.DescribeInstancesRequest;
import software.amazon.awssdk.services.ec2.model.DescribeInstancesResponse;
import software.amazon.awssdk.services.ec2.model.Ec2Exception;
import software.amazon.awssdk.services.ec2.model.Instance;
import software.amazon.awssdk.services.ec2.model.InstanceStateName;

import java.util.Optional;

/**
 * EC2 instance liveness. Registered as a bean by {@code InfrastructureClientConfig}
 * only when the infrastructure check is enabled.
 */
@Slf4j
@RequiredArgsConstructor
public class Ec2HostLivenessClient implements HostLivenessClient {

    static final String SERVICE = "ec2";
    private static final String INSTANCE_NOT_FOUND = "InvalidInstanceID.NotFound";
    private static final String MALFORMED_INSTANCE_ID = "InvalidInstanceID.Malformed";

    private final Ec2Client ec2Client;

    @Override
    public HostState describeHost(String hostId) {
        try {
            DescribeInstancesResponse response = ec2Client.describeInstances(
                    DescribeInstancesRequest.builder().instanceIds(hostId).build());

            Optional<Instance> instance = response.reservations().stream()
                    .flatMap(r -> r.instances().stream())
                    .findFirst();

            if (instance.isEmpty()) {
                return HostState.NOT_FOUND;
            }
            return toHostState(instance.get().state().name());

        } catch (Ec2Exception e) {
            String code = e.awsErrorDetails() != null ? e.awsErrorDetails().errorCode() : null;
            if (INSTANCE_NOT_FOUND.equals(code) || MALFORMED_INSTANCE_ID.equals(code)) {
                log.debug("Instance {} not known to EC2 ({})", hostId, code);
                return HostState.NOT_FOUND;
            }
            throw new ExternalServiceException(SERVICE, "describe-instances for " + hostId + " failed", e);
        } catch (SdkException e) {
            throw new ExternalServiceException(SERVICE, "describe-instances for " + hostId + " failed", e);
        }
    }

    static HostState toHostState(InstanceStateName state) {
        if (state == null) {
            return HostState.UNKNOWN;
        }
        switch (state) {
            case PENDING:
                return HostState.PENDING;
            case RUNNING:
                return HostState.RUNNING;
            case STOPPING:
                return HostState.STOPPING;
            case STOPPED:
                return HostState.STOPPED;
            case SHUTTING_DOWN:
                return HostState.SHUTTING_DOWN;
            case TERMINATED:
                return HostState.TERMINATED;
            default:
                return HostState.UNKNOWN;
        }
    }
}
