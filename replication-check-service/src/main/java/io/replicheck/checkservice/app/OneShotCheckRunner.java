package io.replicheck.checkservice.app;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Runs a single check at startup. Combine with {@code replicheck.schedule.enabled=false} to
 * exit once the check has finished.
 */
@Component
@ConditionalOnProperty(prefix = "replicheck", name = "run-once", havingValue = "true")
public class OneShotCheckRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(OneShotCheckRunner.class);

    private final ReplicationCheckJob job;

    public OneShotCheckRunner(ReplicationCheckJob job) {
        this.job = job;
    }

    @Override
    public void run(ApplicationArguments args) {
        log.info("Running a single replication check");
        job.runOnce();
    }
}
