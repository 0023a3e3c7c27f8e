package com.company.trainingruns.infrastructure;

import com.company.trainingruns.domain.enums.HostState;
import com.company.trainingruns.exception.ExternalServiceException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.awscore.exception.AwsErrorDetails;
import software.amazon.awssdk.services.ec2.Ec2Client;
import software.amazon.awssdk.services.ec2.model.DescribeInstancesRequest;
import software.amazon.awssdk.services.ec2.model.DescribeInstancesResponse;
import software.amazon.awssdk.services.ec2.model.Ec2Exception;
import software.amazon.awssdk.services.ec2.model.Instance;
import software.amazon.awssdk.services.ec2.model.InstanceState;
import software.amazon.awssdk.services.ec2.model.InstanceStateName;
import software.amazon.awssdk.services.ec2.model.Reservation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class Ec2HostLivenessClientTest {

    @Mock
    private Ec2Client ec2Client;

    @Test
    void describeHost_shouldMapInstanceState() {
        when(ec2Client.describeInstances(any(DescribeInstancesRequest.class)))
                .thenReturn(DescribeInstancesResponse.builder()
                        .reservations(Reservation.builder()
                                .instances(Instance.builder()
                                        .instanceId("i-1")
                                        .state(InstanceState.builder().name(InstanceStateName.TERMINATED).build())
                                        .build())
                                .build())
                        .build());

        assertThat(new Ec2HostLivenessClient(ec2Client).describeHost("i-1")).isEqualTo(HostState.TERMINATED);
    }

    @Test
    void describeHost_noReservations_shouldBeNotFound() {
        when(ec2Client.describeInstances(any(DescribeInstancesRequest.class)))
                .thenReturn(DescribeInstancesResponse.builder().build());

        assertThat(new Ec2HostLivenessClient(ec2Client).describeHost("i-1")).isEqualTo(HostState.NOT_FOUND);
    }

    @Test
    void describeHost_unknownInstanceId_shouldBeNotFound() {
        when(ec2Client.describeInstances(any(DescribeInstancesRequest.class)))
                .thenThrow(ec2Error("InvalidInstanceID.NotFound"));

        assertThat(new Ec2HostLivenessClient(ec2Client).describeHost("i-1")).isEqualTo(HostState.NOT_FOUND);
    }

    @Test
    void describeHost_otherApiError_shouldBeExternalServiceFailure() {
        when(ec2Client.describeInstances(any(DescribeInstancesRequest.class)))
                .thenThrow(ec2Error("RequestLimitExceeded"));

        assertThatThrownBy(() -> new Ec2HostLivenessClient(ec2Client).describeHost("i-1"))
                .isInstanceOf(ExternalServiceException.class);
    }

    private static Ec2Exception ec2Error(String code) {
        return (Ec2Exception) Ec2Exception.builder()
                .awsErrorDetails(AwsErrorDetails.builder().errorCode(code).build())
                .message(code)
                .build();
    }
}
