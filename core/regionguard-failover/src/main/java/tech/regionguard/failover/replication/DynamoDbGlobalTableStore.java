package tech.regionguard.failover.replication;

import org.jboss.logging.Logger;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.DescribeTableRequest;
import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;
import software.amazon.awssdk.services.dynamodb.model.ReplicaDescription;
import software.amazon.awssdk.services.dynamodb.model.ReplicaStatus;
import software.amazon.awssdk.services.dynamodb.model.TableDescription;
import software.amazon.awssdk.services.dynamodb.model.TableStatus;
import tech.regionguard.failover.model.RegionId;

import java.util.Map;

/**
 * DynamoDB global table. Every replica accepts writes, so promotion verifies that the
 * table and its replica in the target region are ACTIVE.
 */
public class DynamoDbGlobalTableStore implements ReplicatedStore {

    private static final Logger LOG = Logger.getLogger(DynamoDbGlobalTableStore.class);

    private final String storeId;
    private final String tableName;
    private final Map<RegionId, String> awsRegions;
    private final Map<RegionId, DynamoDbClient> clients;

    public DynamoDbGlobalTableStore(String storeId, String tableName, Map<RegionId, String> awsRegions,
                                    Map<RegionId, DynamoDbClient> clients) {
        this.storeId = storeId;
        this.tableName = tableName;
        this.awsRegions = Map.copyOf(awsRegions);
        this.clients = Map.copyOf(clients);
    }

    @Override
    public String storeId() {
        return storeId;
    }

    @Override
    public void promoteToWritable(RegionId target, boolean planned) throws StorePromotionException {
        DynamoDbClient client = clients.get(target);
        String awsRegion = awsRegions.get(target);
        if (client == null || awsRegion == null) {
            throw new StorePromotionException("No DynamoDB client configured for region " + target);
        }

        TableDescription table;
        try {
            table = client.describeTable(DescribeTableRequest.builder().tableName(tableName).build()).table();
        } catch (DynamoDbException e) {
            throw new StorePromotionException("Failed to describe table " + tableName + " in " + awsRegion
                + ": " + e.getMessage(), e);
        }

        if (table.tableStatus() != TableStatus.ACTIVE) {
            throw new StorePromotionException("Table " + tableName + " in " + awsRegion
                + " is " + table.tableStatusAsString() + ", not ACTIVE");
        }

        // Replicas list the other regions; the region we asked is the table itself
        for (ReplicaDescription replica : table.replicas()) {
            if (awsRegion.equals(replica.regionName()) && replica.replicaStatus() != ReplicaStatus.ACTIVE) {
                throw new StorePromotionException("Replica of " + tableName + " in " + awsRegion
                    + " is " + replica.replicaStatusAsString());
            }
        }

        LOG.infof("Global table %s is writable in %s (%s)", tableName, target, awsRegion);
    }
}
