package tech.regionguard.failover.replication;

import org.jboss.logging.Logger;
import software.amazon.awssdk.services.rds.RdsClient;
import software.amazon.awssdk.services.rds.model.DescribeGlobalClustersRequest;
import software.amazon.awssdk.services.rds.model.FailoverGlobalClusterRequest;
import software.amazon.awssdk.services.rds.model.FailoverState;
import software.amazon.awssdk.services.rds.model.GlobalCluster;
import software.amazon.awssdk.services.rds.model.GlobalClusterMember;
import software.amazon.awssdk.services.rds.model.RdsException;
import software.amazon.awssdk.services.rds.model.SwitchoverGlobalClusterRequest;
import tech.regionguard.failover.model.RegionId;

import java.time.Duration;
import java.util.Map;

/**
 * Aurora global database. Promotion moves the writer to the target region's member cluster:
 * a switchover when both regions are reachable, a failover (accepting the already bounded
 * data loss) otherwise. The call returns once the target cluster is the writer.
 */
public class AuroraGlobalClusterStore implements ReplicatedStore {

    private static final Logger LOG = Logger.getLogger(AuroraGlobalClusterStore.class);

    private final String storeId;
    private final String globalClusterId;
    private final Map<RegionId, String> memberClusterArns;
    private final Map<RegionId, RdsClient> clients;
    private final Duration pollInterval;

    public AuroraGlobalClusterStore(String storeId, String globalClusterId, Map<RegionId, String> memberClusterArns,
                                    Map<RegionId, RdsClient> clients, Duration pollInterval) {
        this.storeId = storeId;
        this.globalClusterId = globalClusterId;
        this.memberClusterArns = Map.copyOf(memberClusterArns);
        this.clients = Map.copyOf(clients);
        this.pollInterval = pollInterval;
    }

    @Override
    public String storeId() {
        return storeId;
    }

    @Override
    public void promoteToWritable(RegionId target, boolean planned) throws StorePromotionException {
        String targetArn = memberClusterArns.get(target);
        RdsClient client = clients.get(target);
        if (targetArn == null || client == null) {
            throw new StorePromotionException("No Aurora member cluster configured for region " + target);
        }

        try {
            GlobalCluster cluster = describe(client);
            if (isWriter(cluster, targetArn)) {
                LOG.infof("Aurora global cluster %s already writes in %s", globalClusterId, target);
                return;
            }

            FailoverState inProgress = cluster.failoverState();
            if (inProgress != null && inProgress.status() != null && targetArn.equals(inProgress.toDbClusterArn())) {
                LOG.infof("Aurora global cluster %s already moving writer to %s (%s)",
                    globalClusterId, target, inProgress.statusAsString());
            } else if (planned) {
                LOG.infof("Switching over Aurora global cluster %s to %s", globalClusterId, targetArn);
                client.switchoverGlobalCluster(SwitchoverGlobalClusterRequest.builder()
                    .globalClusterIdentifier(globalClusterId)
                    .targetDbClusterIdentifier(targetArn)
                    .build());
            } else {
                LOG.warnf("Failing over Aurora global cluster %s to %s with data loss allowed", globalClusterId, targetArn);
                client.failoverGlobalCluster(FailoverGlobalClusterRequest.builder()
                    .globalClusterIdentifier(globalClusterId)
                    .targetDbClusterIdentifier(targetArn)
                    .allowDataLoss(true)
                    .build());
            }

            while (!isWriter(describe(client), targetArn)) {
                Thread.sleep(pollInterval.toMillis());
            }
            LOG.infof("Aurora global cluster %s now writes in %s", globalClusterId, target);

        } catch (RdsException e) {
            throw new StorePromotionException("Failed to promote Aurora global cluster " + globalClusterId
                + " to " + target + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StorePromotionException("Interrupted while waiting for " + globalClusterId
                + " writer to move to " + target, e);
        }
    }

    private GlobalCluster describe(RdsClient client) throws StorePromotionException {
        return client.describeGlobalClusters(DescribeGlobalClustersRequest.builder()
                .globalClusterIdentifier(globalClusterId)
                .build())
            .globalClusters()
            .stream()
            .findFirst()
            .orElseThrow(() -> new StorePromotionException("Aurora global cluster " + globalClusterId + " not found"));
    }

    private static boolean isWriter(GlobalCluster cluster, String clusterArn) {
        for (GlobalClusterMember member : cluster.globalClusterMembers()) {
            if (clusterArn.equals(member.dbClusterArn())) {
                return Boolean.TRUE.equals(member.isWriter());
            }
        }
        return false;
    }
}
