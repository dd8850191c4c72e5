package tech.regionguard.failover.routing;

import org.jboss.logging.Logger;
import software.amazon.awssdk.services.route53.Route53Client;
import software.amazon.awssdk.services.route53.model.Change;
import software.amazon.awssdk.services.route53.model.ChangeAction;
import software.amazon.awssdk.services.route53.model.ChangeBatch;
import software.amazon.awssdk.services.route53.model.ChangeResourceRecordSetsRequest;
import software.amazon.awssdk.services.route53.model.ChangeStatus;
import software.amazon.awssdk.services.route53.model.GetChangeRequest;
import software.amazon.awssdk.services.route53.model.GetHealthCheckStatusRequest;
import software.amazon.awssdk.services.route53.model.HealthCheckObservation;
import software.amazon.awssdk.services.route53.model.ListResourceRecordSetsRequest;
import software.amazon.awssdk.services.route53.model.RRType;
import software.amazon.awssdk.services.route53.model.ResourceRecord;
import software.amazon.awssdk.services.route53.model.ResourceRecordSet;
import software.amazon.awssdk.services.route53.model.ResourceRecordSetFailover;
import software.amazon.awssdk.services.route53.model.Route53Exception;
import tech.regionguard.failover.model.RegionId;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Route 53 failover routing.
 *
 * The deployment publishes a CNAME failover record pair (set identifiers "primary" and
 * "secondary"). Making a region active UPSERTs the pair so that region's target is the
 * PRIMARY record, carrying that region's health check, and the other region's target is
 * the SECONDARY record. The call returns once Route 53 reports the change INSYNC.
 */
public class Route53FailoverRoutingStrategy implements TrafficRoutingStrategy {

    private static final Logger LOG = Logger.getLogger(Route53FailoverRoutingStrategy.class);

    static final String PRIMARY_SET_ID = "primary";
    static final String SECONDARY_SET_ID = "secondary";

    private final Route53Client route53;
    private final String hostedZoneId;
    private final String recordName;
    private final long ttlSeconds;
    private final Map<RegionId, RegionRecord> records;
    private final Duration syncPollInterval;

    private volatile String lastOperation = "none";
    private volatile String lastError = null;

    /**
     * Failover record data for one region.
     */
    public record RegionRecord(String target, String healthCheckId) {
    }

    public Route53FailoverRoutingStrategy(Route53Client route53, String hostedZoneId, String recordName,
                                          long ttlSeconds, Map<RegionId, RegionRecord> records,
                                          Duration syncPollInterval) {
        this.route53 = route53;
        this.hostedZoneId = hostedZoneId;
        this.recordName = normalize(recordName);
        this.ttlSeconds = ttlSeconds;
        this.records = Map.copyOf(records);
        this.syncPollInterval = syncPollInterval;
    }

    @Override
    public void setActiveRegion(RegionId regionId) throws RoutingException {
        RegionRecord active = recordFor(regionId);
        RegionRecord standby = records.entrySet().stream()
            .filter(e -> !e.getKey().equals(regionId))
            .map(Map.Entry::getValue)
            .findFirst()
            .orElseThrow(() -> new RoutingException("No standby region record configured besides " + regionId));

        lastOperation = "set-active:" + regionId;
        lastError = null;

        if (activeRegion().filter(regionId::equals).isPresent()) {
            LOG.infof("Route 53 record %s already routes to %s", recordName, regionId);
            return;
        }

        ChangeResourceRecordSetsRequest request = ChangeResourceRecordSetsRequest.builder()
            .hostedZoneId(hostedZoneId)
            .changeBatch(ChangeBatch.builder()
                .comment("RegionGuard cutover to " + regionId)
                .changes(
                    upsert(PRIMARY_SET_ID, ResourceRecordSetFailover.PRIMARY, active),
                    upsert(SECONDARY_SET_ID, ResourceRecordSetFailover.SECONDARY, standby))
                .build())
            .build();

        try {
            String changeId = route53.changeResourceRecordSets(request).changeInfo().id();
            LOG.infof("Route 53 change %s submitted: %s -> %s", changeId, recordName, active.target());
            waitForSync(changeId);
            LOG.infof("Route 53 change %s is INSYNC, traffic now routed to %s", changeId, regionId);
        } catch (Route53Exception e) {
            lastError = e.getMessage();
            throw new RoutingException("Failed to update failover records for " + recordName + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            lastError = "Interrupted while waiting for INSYNC";
            throw new RoutingException("Interrupted while waiting for Route 53 change to propagate", e);
        }
    }

    @Override
    public boolean healthCheckStatus(RegionId regionId) throws RoutingException {
        String healthCheckId = recordFor(regionId).healthCheckId();
        if (healthCheckId == null) {
            throw new RoutingException("No Route 53 health check configured for region " + regionId);
        }

        try {
            List<HealthCheckObservation> observations = route53.getHealthCheckStatus(
                    GetHealthCheckStatusRequest.builder().healthCheckId(healthCheckId).build())
                .healthCheckObservations();
            if (observations.isEmpty()) {
                return false;
            }
            long healthy = observations.stream()
                .filter(o -> o.statusReport() != null && o.statusReport().status() != null)
                .filter(o -> o.statusReport().status().startsWith("Success"))
                .count();
            // Route 53 reports a check healthy when more than 18% of its checkers succeed
            return healthy * 100 > observations.size() * 18L;
        } catch (Route53Exception e) {
            throw new RoutingException("Failed to read health check " + healthCheckId + ": " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<RegionId> activeRegion() throws RoutingException {
        try {
            List<ResourceRecordSet> sets = route53.listResourceRecordSets(ListResourceRecordSetsRequest.builder()
                    .hostedZoneId(hostedZoneId)
                    .startRecordName(recordName)
                    .startRecordType(RRType.CNAME)
                    .maxItems("10")
                    .build())
                .resourceRecordSets();

            Optional<String> primaryTarget = sets.stream()
                .filter(s -> normalize(s.name()).equals(recordName))
                .filter(s -> s.failover() == ResourceRecordSetFailover.PRIMARY)
                .flatMap(s -> s.resourceRecords().stream())
                .map(ResourceRecord::value)
                .findFirst();

            return primaryTarget.flatMap(target -> records.entrySet().stream()
                .filter(e -> e.getValue().target().equalsIgnoreCase(normalize(target)))
                .map(Map.Entry::getKey)
                .findFirst());
        } catch (Route53Exception e) {
            throw new RoutingException("Failed to read failover records for " + recordName + ": " + e.getMessage(), e);
        }
    }

    @Override
    public RoutingStatus getStatus() {
        String active;
        try {
            active = activeRegion().map(RegionId::value).orElse("unknown");
        } catch (RoutingException e) {
            active = "unknown";
        }
        return new RoutingStatus("route53", active,
            "zone=" + hostedZoneId + ", record=" + recordName, lastOperation, lastError);
    }

    private Change upsert(String setIdentifier, ResourceRecordSetFailover role, RegionRecord record) {
        ResourceRecordSet.Builder set = ResourceRecordSet.builder()
            .name(recordName)
            .type(RRType.CNAME)
            .setIdentifier(setIdentifier)
            .failover(role)
            .ttl(ttlSeconds)
            .resourceRecords(ResourceRecord.builder().value(record.target()).build());
        if (record.healthCheckId() != null) {
            set.healthCheckId(record.healthCheckId());
        }
        return Change.builder().action(ChangeAction.UPSERT).resourceRecordSet(set.build()).build();
    }

    private void waitForSync(String changeId) throws InterruptedException {
        GetChangeRequest request = GetChangeRequest.builder().id(changeId).build();
        while (route53.getChange(request).changeInfo().status() != ChangeStatus.INSYNC) {
            Thread.sleep(syncPollInterval.toMillis());
        }
    }

    private RegionRecord recordFor(RegionId regionId) throws RoutingException {
        RegionRecord record = records.get(regionId);
        if (record == null) {
            throw new RoutingException("No Route 53 failover record configured for region " + regionId);
        }
        return record;
    }

    private static String normalize(String name) {
        return name.endsWith(".") ? name.substring(0, name.length() - 1) : name;
    }
}
