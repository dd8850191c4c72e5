package tech.regionguard.failover.fence;

import org.jboss.logging.Logger;
import software.amazon.awssdk.services.ssm.SsmClient;
import software.amazon.awssdk.services.ssm.model.GetParameterRequest;
import software.amazon.awssdk.services.ssm.model.ParameterNotFoundException;
import software.amazon.awssdk.services.ssm.model.ParameterType;
import software.amazon.awssdk.services.ssm.model.PutParameterRequest;

import tech.regionguard.failover.model.RegionId;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Write fence published as an SSM parameter that payment functions check before writing.
 *
 * The flag for a region ({@code <prefix><regionId>}, value "true"/"false") is written to the
 * Parameter Store of every configured region, so it is readable even while the fenced
 * region's own SSM endpoint is unreachable. A change succeeds if at least one region
 * accepted it; failures in individual regions are logged.
 */
public class SsmParameterWriteFence implements WriteFence {

    private static final Logger LOG = Logger.getLogger(SsmParameterWriteFence.class);

    private final Map<RegionId, SsmClient> clients;
    private final String parameterPrefix;

    public SsmParameterWriteFence(Map<RegionId, SsmClient> clients, String parameterPrefix) {
        this.clients = Map.copyOf(clients);
        this.parameterPrefix = parameterPrefix;
    }

    @Override
    public void fence(RegionId regionId) throws WriteFenceException {
        write(regionId, true);
    }

    @Override
    public void lift(RegionId regionId) throws WriteFenceException {
        write(regionId, false);
    }

    @Override
    public boolean isFenced(RegionId regionId) throws WriteFenceException {
        String name = parameterName(regionId);
        List<String> errors = new ArrayList<>();
        int answered = 0;

        for (Map.Entry<RegionId, SsmClient> entry : clients.entrySet()) {
            try {
                String value = entry.getValue()
                    .getParameter(GetParameterRequest.builder().name(name).build())
                    .parameter()
                    .value();
                answered++;
                if (Boolean.parseBoolean(value)) {
                    return true;
                }
            } catch (ParameterNotFoundException e) {
                answered++;
            } catch (Exception e) {
                errors.add(entry.getKey() + ": " + e.getMessage());
            }
        }

        if (answered == 0) {
            throw new WriteFenceException("Could not read fence flag " + name + " in any region: " + errors);
        }
        return false;
    }

    @Override
    public String type() {
        return "ssm";
    }

    private void write(RegionId regionId, boolean fenced) throws WriteFenceException {
        String name = parameterName(regionId);
        List<String> errors = new ArrayList<>();
        int written = 0;

        for (Map.Entry<RegionId, SsmClient> entry : clients.entrySet()) {
            try {
                entry.getValue().putParameter(PutParameterRequest.builder()
                    .name(name)
                    .value(Boolean.toString(fenced))
                    .type(ParameterType.STRING)
                    .overwrite(true)
                    .build());
                written++;
            } catch (Exception e) {
                LOG.warnf("Failed to write fence flag %s=%s in %s: %s", name, fenced, entry.getKey(), e.getMessage());
                errors.add(entry.getKey() + ": " + e.getMessage());
            }
        }

        if (written == 0) {
            throw new WriteFenceException("Could not write fence flag " + name + " in any region: " + errors);
        }
        LOG.infof("Write fence %s for %s (%d/%d regions updated)",
            fenced ? "raised" : "lifted", regionId, written, clients.size());
    }

    private String parameterName(RegionId regionId) {
        return parameterPrefix + regionId.value();
    }
}
