package tech.regionguard.failover.alert;

import org.jboss.logging.Logger;
import software.amazon.awssdk.services.sns.SnsClient;
import software.amazon.awssdk.services.sns.model.MessageAttributeValue;
import software.amazon.awssdk.services.sns.model.PublishRequest;

import java.util.Map;

/**
 * Publishes alerts to the SNS alarm topic. WARNING and CRITICAL only; INFO stays in the warning store.
 */
public class SnsAlertSink implements AlertSink {

    private static final Logger LOG = Logger.getLogger(SnsAlertSink.class);
    private static final int MAX_SUBJECT_LENGTH = 100;

    private final SnsClient snsClient;
    private final String topicArn;

    public SnsAlertSink(SnsClient snsClient, String topicArn) {
        this.snsClient = snsClient;
        this.topicArn = topicArn;
    }

    @Override
    public void notify(AlertSeverity severity, String message) {
        if (severity == AlertSeverity.INFO) {
            return;
        }

        String subject = "[RegionGuard " + severity + "] " + message;
        if (subject.length() > MAX_SUBJECT_LENGTH) {
            subject = subject.substring(0, MAX_SUBJECT_LENGTH - 3) + "...";
        }

        PublishRequest request = PublishRequest.builder()
            .topicArn(topicArn)
            .subject(subject)
            .message(message)
            .messageAttributes(Map.of("severity", MessageAttributeValue.builder()
                .dataType("String")
                .stringValue(severity.name())
                .build()))
            .build();

        String messageId = snsClient.publish(request).messageId();
        LOG.debugf("Published %s alert to %s (messageId=%s)", severity, topicArn, messageId);
    }

    @Override
    public String name() {
        return "sns";
    }
}
