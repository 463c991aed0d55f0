package io.replicheck.checkservice.config;

import io.replicheck.replication.model.Thresholds;
import io.replicheck.replication.runtime.ReplicationCheckSettings;
import jakarta.validation.constraints.NotBlank;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "replicheck")
public class ReplicationCheckProperties {

    private static final Logger log = LoggerFactory.getLogger(ReplicationCheckProperties.class);

    private final Path soaDir;
    private final String cluster;
    private final String checkNamePrefix;
    private final boolean verbose;
    private final int parallelism;
    private final ThresholdSettings thresholds;
    private final Synapse synapse;
    private final Sensu sensu;
    private final Schedule schedule;

    public ReplicationCheckProperties(Path soaDir,
                                      @NotBlank String cluster,
                                      String checkNamePrefix,
                                      Boolean verbose,
                                      Integer parallelism,
                                      ThresholdSettings thresholds,
                                      Synapse synapse,
                                      Sensu sensu,
                                      Schedule schedule) {
        this.soaDir = soaDir != null ? soaDir : Path.of("/nail/etc/services");
        this.cluster = requireNonBlank(cluster, "cluster");
        this.checkNamePrefix = checkNamePrefix == null || checkNamePrefix.isBlank()
            ? ReplicationCheckSettings.DEFAULT_CHECK_NAME_PREFIX
            : checkNamePrefix;
        this.verbose = Boolean.TRUE.equals(verbose);
        this.parallelism = parallelism != null ? parallelism : ReplicationCheckSettings.DEFAULT_PARALLELISM;
        if (this.parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1");
        }
        this.thresholds = thresholds != null ? thresholds : new ThresholdSettings(null, null);
        this.synapse = synapse != null ? synapse : new Synapse(null, null, null);
        this.sensu = sensu != null ? sensu : new Sensu(null, null, null, null, null, null, null, null, null, null);
        this.schedule = schedule != null ? schedule : new Schedule(null, null);
        if (this.thresholds.toThresholds().isInverted()) {
            log.warn("Critical threshold {}% is above warning threshold {}%; the WARNING band is empty "
                    + "and every shortfall at or below {}% reports CRITICAL",
                this.thresholds.crit(), this.thresholds.warn(), this.thresholds.crit());
        }
    }

    public Path getSoaDir() {
        return soaDir;
    }

    public String getCluster() {
        return cluster;
    }

    public String getCheckNamePrefix() {
        return checkNamePrefix;
    }

    public boolean isVerbose() {
        return verbose;
    }

    public int getParallelism() {
        return parallelism;
    }

    public ThresholdSettings getThresholds() {
        return thresholds;
    }

    public Synapse getSynapse() {
        return synapse;
    }

    public Sensu getSensu() {
        return sensu;
    }

    public Schedule getSchedule() {
        return schedule;
    }

    public ReplicationCheckSettings toSettings() {
        return new ReplicationCheckSettings(checkNamePrefix, parallelism, verbose);
    }

    /**
     * Percentages of available/expected backends at or below which WARNING and CRITICAL
     * are reported.
     */
    public static final class ThresholdSettings {
        private final int warn;
        private final int crit;

        public ThresholdSettings(Integer warn, Integer crit) {
            this.warn = warn != null ? warn : Thresholds.DEFAULT_WARN_PERCENT;
            this.crit = crit != null ? crit : Thresholds.DEFAULT_CRIT_PERCENT;
        }

        public int warn() {
            return warn;
        }

        public int crit() {
            return crit;
        }

        public Thresholds toThresholds() {
            return new Thresholds(warn, crit);
        }
    }

    public static final class Synapse {
        private static final String DEFAULT_HOST_PORT = "localhost:3212";

        private final String hostPort;
        private final Duration connectTimeout;
        private final Duration readTimeout;

        public Synapse(String hostPort, Duration connectTimeout, Duration readTimeout) {
            this.hostPort = hostPort == null || hostPort.isBlank() ? DEFAULT_HOST_PORT : hostPort;
            this.connectTimeout = connectTimeout != null ? connectTimeout : Duration.ofSeconds(2);
            this.readTimeout = readTimeout != null ? readTimeout : Duration.ofSeconds(10);
        }

        public String hostPort() {
            return hostPort;
        }

        public Duration connectTimeout() {
            return connectTimeout;
        }

        public Duration readTimeout() {
            return readTimeout;
        }
    }

    public static final class Sensu {
        private static final String DEFAULT_URL = "http://localhost:3031";

        private final boolean enabled;
        private final String url;
        private final String alertAfter;
        private final String checkEvery;
        private final int realertEvery;
        private final List<String> handlers;
        private final String source;
        private final Integer ttl;
        private final Duration connectTimeout;
        private final Duration readTimeout;

        public Sensu(Boolean enabled,
                     String url,
                     String alertAfter,
                     String checkEvery,
                     Integer realertEvery,
                     List<String> handlers,
                     String source,
                     Integer ttl,
                     Duration connectTimeout,
                     Duration readTimeout) {
            this.enabled = enabled == null || enabled;
            this.url = url == null || url.isBlank() ? DEFAULT_URL : stripTrailingSlash(url);
            this.alertAfter = alertAfter == null || alertAfter.isBlank() ? "2m" : alertAfter;
            this.checkEvery = checkEvery == null || checkEvery.isBlank() ? "1m" : checkEvery;
            this.realertEvery = realertEvery != null ? realertEvery : -1;
            this.handlers = handlers == null ? List.of() : List.copyOf(handlers);
            this.source = source == null || source.isBlank() ? null : source;
            this.ttl = ttl;
            this.connectTimeout = connectTimeout != null ? connectTimeout : Duration.ofSeconds(2);
            this.readTimeout = readTimeout != null ? readTimeout : Duration.ofSeconds(5);
        }

        public boolean enabled() {
            return enabled;
        }

        public String url() {
            return url;
        }

        public String alertAfter() {
            return alertAfter;
        }

        public String checkEvery() {
            return checkEvery;
        }

        public int realertEvery() {
            return realertEvery;
        }

        public List<String> handlers() {
            return handlers;
        }

        public String source() {
            return source;
        }

        /**
         * Seconds after which Sensu flags the check as stale, or {@code null} to leave it unset.
         */
        public Integer ttl() {
            return ttl;
        }

        public Duration connectTimeout() {
            return connectTimeout;
        }

        public Duration readTimeout() {
            return readTimeout;
        }

        private static String stripTrailingSlash(String value) {
            return value.endsWith("/") ? value.substring(0, value.length() - 1) : value;
        }
    }

    /**
     * Cadence of the scheduled check. Whether the schedule runs at all is decided by
     * {@code replicheck.schedule.enabled}, read as a condition before binding.
     */
    public static final class Schedule {
        private final Duration interval;
        private final Duration initialDelay;

        public Schedule(Duration interval, Duration initialDelay) {
            this.interval = Objects.requireNonNullElse(interval, Duration.ofMinutes(1));
            this.initialDelay = Objects.requireNonNullElse(initialDelay, Duration.ofSeconds(5));
            if (this.interval.isZero() || this.interval.isNegative()) {
                throw new IllegalArgumentException("schedule interval must be positive");
            }
        }

        public Duration interval() {
            return interval;
        }

        public Duration initialDelay() {
            return initialDelay;
        }
    }

    private static String requireNonBlank(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
        return value;
    }
}
