package tech.regionguard.failover.aws;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.awscore.client.builder.AwsClientBuilder;
import software.amazon.awssdk.awscore.client.builder.AwsSyncClientBuilder;
import software.amazon.awssdk.http.urlconnection.UrlConnectionHttpClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.cloudwatch.CloudWatchClient;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.rds.RdsClient;
import software.amazon.awssdk.services.route53.Route53Client;
import software.amazon.awssdk.services.sns.SnsClient;
import software.amazon.awssdk.services.ssm.SsmClient;
import software.amazon.awssdk.utils.SdkAutoCloseable;
import tech.regionguard.failover.config.FailoverConfig;
import tech.regionguard.failover.model.RegionId;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Creates AWS SDK clients per AWS region, configured with the default credentials chain
 * and the optional endpoint override (for LocalStack testing).
 *
 * <p>Clients are created lazily and cached, so backends that are not configured never
 * create one.</p>
 */
@ApplicationScoped
public class AwsClientFactory {

    private static final Logger LOG = Logger.getLogger(AwsClientFactory.class);

    // Route 53 is a global service with its control plane in us-east-1
    private static final String ROUTE53_REGION = "us-east-1";

    @Inject
    FailoverConfig config;

    private final Map<String, SdkAutoCloseable> clients = new ConcurrentHashMap<>();

    /**
     * AWS region name per configured region id.
     */
    public Map<RegionId, String> awsRegions() {
        Map<RegionId, String> result = new LinkedHashMap<>();
        config.regions().forEach((id, settings) -> result.put(RegionId.of(id), settings.awsRegion()));
        return result;
    }

    public Map<RegionId, DynamoDbClient> dynamoDb() {
        return perRegion("dynamodb", DynamoDbClient::builder, DynamoDbClient.class);
    }

    public Map<RegionId, RdsClient> rds() {
        return perRegion("rds", RdsClient::builder, RdsClient.class);
    }

    public Map<RegionId, CloudWatchClient> cloudWatch() {
        return perRegion("cloudwatch", CloudWatchClient::builder, CloudWatchClient.class);
    }

    public Map<RegionId, SsmClient> ssm() {
        return perRegion("ssm", SsmClient::builder, SsmClient.class);
    }

    public SnsClient sns(String awsRegion) {
        return client("sns", awsRegion, SnsClient::builder, SnsClient.class);
    }

    public Route53Client route53() {
        return client("route53", ROUTE53_REGION, Route53Client::builder, Route53Client.class);
    }

    @PreDestroy
    void close() {
        clients.forEach((key, client) -> {
            try {
                client.close();
            } catch (Exception e) {
                LOG.warnf("Error closing AWS client %s: %s", key, e.getMessage());
            }
        });
        clients.clear();
    }

    private <C extends SdkAutoCloseable, B extends AwsClientBuilder<B, C> & AwsSyncClientBuilder<B, C>> Map<RegionId, C> perRegion(
        String service, Supplier<B> builderFactory, Class<C> type) {
        Map<RegionId, C> result = new LinkedHashMap<>();
        awsRegions().forEach((id, awsRegion) -> result.put(id, client(service, awsRegion, builderFactory, type)));
        return result;
    }

    private <C extends SdkAutoCloseable, B extends AwsClientBuilder<B, C> & AwsSyncClientBuilder<B, C>> C client(
        String service, String awsRegion, Supplier<B> builderFactory, Class<C> type) {
        SdkAutoCloseable client = clients.computeIfAbsent(service + "@" + awsRegion, key -> {
            LOG.infof("Creating %s client for region %s", service, awsRegion);
            B builder = builderFactory.get()
                .region(Region.of(awsRegion))
                .credentialsProvider(DefaultCredentialsProvider.create());
            builder.httpClientBuilder(UrlConnectionHttpClient.builder());
            config.aws().endpointOverride().ifPresent(endpoint -> {
                LOG.infof("Using %s endpoint override: %s", service, endpoint);
                builder.endpointOverride(URI.create(endpoint));
            });
            return builder.build();
        });
        return type.cast(client);
    }
}
