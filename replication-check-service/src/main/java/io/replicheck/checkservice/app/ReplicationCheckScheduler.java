package io.replicheck.checkservice.app;

import io.replicheck.checkservice.config.ReplicationCheckProperties;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Triggers the replication check at the bound {@code replicheck.schedule} cadence.
 */
@Component
@ConditionalOnProperty(prefix = "replicheck.schedule", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ReplicationCheckScheduler {

    private static final Logger log = LoggerFactory.getLogger(ReplicationCheckScheduler.class);

    private final ReplicationCheckJob job;

    public ReplicationCheckScheduler(ReplicationCheckJob job, ReplicationCheckProperties.Schedule schedule) {
        this.job = Objects.requireNonNull(job, "job");
        Objects.requireNonNull(schedule, "schedule");
        log.info("Replication check scheduled every {} after an initial delay of {}",
            schedule.interval(), schedule.initialDelay());
    }

    @Scheduled(fixedDelayString = "#{@replicationCheckSchedule.interval().toMillis()}",
        initialDelayString = "#{@replicationCheckSchedule.initialDelay().toMillis()}")
    public void tick() {
        job.runOnce();
    }
}
