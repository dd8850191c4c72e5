package tech.regionguard.lease;

import io.quarkus.redis.datasource.RedisDataSource;
import io.vertx.mutiny.redis.client.Response;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Redis operations on the orchestrator lease.
 *
 * <p>Two keys are used: the lease key holds the instance id with a TTL, and
 * {@code <lease key>:epoch} is a counter incremented on every acquisition. The epoch is the
 * fencing token: renewal and release only succeed for the holder presenting the current
 * epoch, so an instance that was paused past its TTL cannot act on a lease a peer took over
 * in the meantime, even when both run with the same instance id.</p>
 *
 * <p>All checks run as Lua scripts so read and write are atomic.</p>
 */
@ApplicationScoped
public class LeaseManager {

    private static final Logger LOG = Logger.getLogger(LeaseManager.class.getName());

    /**
     * KEYS[1] = lease key, KEYS[2] = epoch key, ARGV[1] = instance id, ARGV[2] = TTL seconds.
     * Returns the new epoch, or 0 if another instance holds the lease.
     */
    static final String ACQUIRE_SCRIPT = """
        local holder = redis.call("get", KEYS[1])
        if holder and holder ~= ARGV[1] then
            return 0
        end
        redis.call("set", KEYS[1], ARGV[1], "EX", ARGV[2])
        return redis.call("incr", KEYS[2])
        """;

    /**
     * KEYS[1] = lease key, KEYS[2] = epoch key, ARGV[1] = instance id, ARGV[2] = epoch, ARGV[3] = TTL seconds.
     * Returns 1 if the TTL was extended, 0 if the lease or epoch moved on.
     */
    static final String RENEW_SCRIPT = """
        if redis.call("get", KEYS[1]) == ARGV[1] and redis.call("get", KEYS[2]) == ARGV[2] then
            return redis.call("expire", KEYS[1], ARGV[3])
        end
        return 0
        """;

    /**
     * KEYS[1] = lease key, KEYS[2] = epoch key, ARGV[1] = instance id, ARGV[2] = epoch.
     * Returns 1 if deleted. The epoch counter is kept so the next holder gets a higher epoch.
     */
    static final String RELEASE_SCRIPT = """
        if redis.call("get", KEYS[1]) == ARGV[1] and redis.call("get", KEYS[2]) == ARGV[2] then
            return redis.call("del", KEYS[1])
        end
        return 0
        """;

    @Inject
    LeaseConfig leaseConfig;

    @Inject
    Instance<RedisDataSource> redisDataSource;

    /**
     * Take the lease if it is free or already ours.
     *
     * @return the new epoch, or 0 if another instance holds the lease
     * @throws LeaseException if Redis cannot be reached
     */
    public long acquire() throws LeaseException {
        Response result = eval("acquire", ACQUIRE_SCRIPT,
            leaseConfig.instanceId(), String.valueOf(leaseConfig.leaseTtlSeconds()));
        long epoch = result == null ? 0 : result.toLong();
        if (epoch > 0) {
            LOG.info("Orchestrator lease acquired by " + leaseConfig.instanceId() + " with epoch " + epoch);
        }
        return epoch;
    }

    /**
     * Extend the TTL if this instance still holds the lease at the given epoch.
     *
     * @return false if the lease expired or was taken over
     * @throws LeaseException if Redis cannot be reached
     */
    public boolean renew(long epoch) throws LeaseException {
        Response result = eval("renew", RENEW_SCRIPT,
            leaseConfig.instanceId(), String.valueOf(epoch), String.valueOf(leaseConfig.leaseTtlSeconds()));
        return isOne(result);
    }

    /**
     * Give the lease up so the peer can take over without waiting for the TTL.
     *
     * @return true if the lease was released by this call
     */
    public boolean release(long epoch) {
        try {
            boolean released = isOne(eval("release", RELEASE_SCRIPT, leaseConfig.instanceId(), String.valueOf(epoch)));
            if (!released) {
                LOG.warning("Orchestrator lease epoch " + epoch + " was no longer held at release");
            }
            return released;
        } catch (LeaseException e) {
            LOG.warning("Could not release orchestrator lease, it expires on its own: " + e.getMessage());
            return false;
        }
    }

    /**
     * @return the instance id holding the lease, "unheld" if free, null if Redis cannot be read
     */
    public String currentHolder() {
        try {
            Response holder = redis().execute("GET", leaseConfig.leaseKey());
            return holder == null ? "unheld" : holder.toString();
        } catch (Exception e) {
            LOG.fine("Could not read orchestrator lease holder: " + e.getMessage());
            return null;
        }
    }

    private Response eval(String operation, String script, String... args) throws LeaseException {
        String[] command = new String[4 + args.length];
        command[0] = script;
        command[1] = "2";
        command[2] = leaseConfig.leaseKey();
        command[3] = leaseConfig.leaseKey() + ":epoch";
        System.arraycopy(args, 0, command, 4, args.length);
        try {
            return redis().execute("EVAL", command);
        } catch (LeaseException e) {
            throw e;
        } catch (Exception e) {
            LOG.log(Level.SEVERE, "Orchestrator lease " + operation + " failed: " + e.getMessage(), e);
            throw new LeaseException("Redis unavailable during lease " + operation, e);
        }
    }

    private RedisDataSource redis() throws LeaseException {
        if (!redisDataSource.isResolvable()) {
            throw new LeaseException("Orchestrator lease enabled but no Redis client is configured", null);
        }
        return redisDataSource.get();
    }

    private static boolean isOne(Response result) {
        return result != null && result.toLong() == 1L;
    }

    /**
     * Raised when the lease store cannot be reached.
     */
    public static class LeaseException extends Exception {
        public LeaseException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
