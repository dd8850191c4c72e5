package tech.regionguard.failover.routing;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import software.amazon.awssdk.services.route53.Route53Client;
import software.amazon.awssdk.services.route53.model.Change;
import software.amazon.awssdk.services.route53.model.ChangeInfo;
import software.amazon.awssdk.services.route53.model.ChangeResourceRecordSetsRequest;
import software.amazon.awssdk.services.route53.model.ChangeResourceRecordSetsResponse;
import software.amazon.awssdk.services.route53.model.ChangeStatus;
import software.amazon.awssdk.services.route53.model.GetChangeRequest;
import software.amazon.awssdk.services.route53.model.GetChangeResponse;
import software.amazon.awssdk.services.route53.model.GetHealthCheckStatusRequest;
import software.amazon.awssdk.services.route53.model.GetHealthCheckStatusResponse;
import software.amazon.awssdk.services.route53.model.HealthCheckObservation;
import software.amazon.awssdk.services.route53.model.ListResourceRecordSetsRequest;
import software.amazon.awssdk.services.route53.model.ListResourceRecordSetsResponse;
import software.amazon.awssdk.services.route53.model.RRType;
import software.amazon.awssdk.services.route53.model.ResourceRecord;
import software.amazon.awssdk.services.route53.model.ResourceRecordSet;
import software.amazon.awssdk.services.route53.model.ResourceRecordSetFailover;
import software.amazon.awssdk.services.route53.model.Route53Exception;
import software.amazon.awssdk.services.route53.model.StatusReport;
import tech.regionguard.failover.model.RegionId;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class Route53FailoverRoutingStrategyTest {

    private static final String ZONE = "Z0123456789";
    private static final String RECORD = "api.example.com";
    private static final String PRIMARY_TARGET = "api-us-east-1.example.com";
    private static final String SECONDARY_TARGET = "api-us-west-2.example.com";

    private Route53Client route53;
    private Route53FailoverRoutingStrategy strategy;

    @BeforeEach
    void setUp() {
        route53 = mock(Route53Client.class);
        strategy = new Route53FailoverRoutingStrategy(route53, ZONE, RECORD + ".", 60, Map.of(
            RegionId.PRIMARY, new Route53FailoverRoutingStrategy.RegionRecord(PRIMARY_TARGET, "hc-primary"),
            RegionId.SECONDARY, new Route53FailoverRoutingStrategy.RegionRecord(SECONDARY_TARGET, "hc-secondary")),
            Duration.ofMillis(1));
    }

    @Test
    void shouldReadActiveRegionFromPrimaryRecord() throws Exception {
        primaryRecordPointsTo(PRIMARY_TARGET + ".");

        assertEquals(RegionId.PRIMARY, strategy.activeRegion().orElseThrow());
    }

    @Test
    void shouldSwapFailoverRecordsAndWaitForSync() throws Exception {
        // Given
        primaryRecordPointsTo(PRIMARY_TARGET);
        when(route53.changeResourceRecordSets(any(ChangeResourceRecordSetsRequest.class)))
            .thenReturn(ChangeResourceRecordSetsResponse.builder()
                .changeInfo(ChangeInfo.builder().id("/change/C1").status(ChangeStatus.PENDING).build())
                .build());
        when(route53.getChange(any(GetChangeRequest.class)))
            .thenReturn(change(ChangeStatus.PENDING), change(ChangeStatus.INSYNC));

        // When
        strategy.setActiveRegion(RegionId.SECONDARY);

        // Then
        ArgumentCaptor<ChangeResourceRecordSetsRequest> captor =
            ArgumentCaptor.forClass(ChangeResourceRecordSetsRequest.class);
        verify(route53).changeResourceRecordSets(captor.capture());
        List<Change> changes = captor.getValue().changeBatch().changes();
        assertEquals(2, changes.size());

        ResourceRecordSet primarySet = changes.get(0).resourceRecordSet();
        assertEquals(ResourceRecordSetFailover.PRIMARY, primarySet.failover());
        assertEquals(SECONDARY_TARGET, primarySet.resourceRecords().get(0).value());
        assertEquals("hc-secondary", primarySet.healthCheckId());

        ResourceRecordSet secondarySet = changes.get(1).resourceRecordSet();
        assertEquals(ResourceRecordSetFailover.SECONDARY, secondarySet.failover());
        assertEquals(PRIMARY_TARGET, secondarySet.resourceRecords().get(0).value());

        verify(route53, times(2)).getChange(any(GetChangeRequest.class));
        assertEquals("set-active:SECONDARY", strategy.getStatus().lastOperation());
    }

    @Test
    void shouldSkipChangeWhenAlreadyRouted() throws Exception {
        primaryRecordPointsTo(SECONDARY_TARGET);

        strategy.setActiveRegion(RegionId.SECONDARY);

        verify(route53, never()).changeResourceRecordSets(any(ChangeResourceRecordSetsRequest.class));
    }

    @Test
    void shouldWrapRoute53Failures() {
        // Given
        primaryRecordPointsTo(PRIMARY_TARGET);
        when(route53.changeResourceRecordSets(any(ChangeResourceRecordSetsRequest.class)))
            .thenThrow((Route53Exception) Route53Exception.builder().message("Throttling").build());

        // When
        RoutingException thrown = assertThrows(RoutingException.class,
            () -> strategy.setActiveRegion(RegionId.SECONDARY));

        // Then
        assertTrue(thrown.getMessage().contains("Throttling"));
        assertEquals("Throttling", strategy.getStatus().lastError());
    }

    @Test
    void shouldRejectUnconfiguredRegion() {
        assertThrows(RoutingException.class, () -> strategy.setActiveRegion(RegionId.of("EU")));
    }

    @Test
    void shouldReportHealthCheckFromCheckerQuorum() throws Exception {
        when(route53.getHealthCheckStatus(any(GetHealthCheckStatusRequest.class)))
            .thenReturn(GetHealthCheckStatusResponse.builder()
                .healthCheckObservations(
                    observation("Success: HTTP Status Code 200"),
                    observation("Failure: Connection timed out"),
                    observation("Failure: Connection timed out"))
                .build());

        assertTrue(strategy.healthCheckStatus(RegionId.PRIMARY));
    }

    @Test
    void shouldReportUnhealthyWithoutObservations() throws Exception {
        when(route53.getHealthCheckStatus(any(GetHealthCheckStatusRequest.class)))
            .thenReturn(GetHealthCheckStatusResponse.builder().healthCheckObservations(List.of()).build());

        assertFalse(strategy.healthCheckStatus(RegionId.SECONDARY));
    }

    private void primaryRecordPointsTo(String target) {
        when(route53.listResourceRecordSets(any(ListResourceRecordSetsRequest.class)))
            .thenReturn(ListResourceRecordSetsResponse.builder()
                .resourceRecordSets(
                    ResourceRecordSet.builder()
                        .name(RECORD + ".")
                        .type(RRType.CNAME)
                        .setIdentifier("primary")
                        .failover(ResourceRecordSetFailover.PRIMARY)
                        .resourceRecords(ResourceRecord.builder().value(target).build())
                        .build(),
                    ResourceRecordSet.builder()
                        .name(RECORD + ".")
                        .type(RRType.CNAME)
                        .setIdentifier("secondary")
                        .failover(ResourceRecordSetFailover.SECONDARY)
                        .resourceRecords(ResourceRecord.builder().value("other.example.com").build())
                        .build())
                .build());
    }

    private static GetChangeResponse change(ChangeStatus status) {
        return GetChangeResponse.builder()
            .changeInfo(ChangeInfo.builder().id("/change/C1").status(status).build())
            .build();
    }

    private static HealthCheckObservation observation(String status) {
        return HealthCheckObservation.builder()
            .region("us-east-1")
            .statusReport(StatusReport.builder().status(status).build())
            .build();
    }
}
