package io.replicheck.checkservice.config;

import static org.assertj.core.api.Assertions.assertThat;

import io.replicheck.replication.model.NamespaceId;
import io.replicheck.replication.model.Thresholds;
import java.nio.file.Path;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.context.ConfigurationPropertiesAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;

@ExtendWith(OutputCaptureExtension.class)
class ReplicationCheckPropertiesBindingTest {

    private final ApplicationContextRunner contextRunner =
        new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(ConfigurationPropertiesAutoConfiguration.class))
            .withUserConfiguration(Config.class);

    @Test
    void appliesDefaultsWhenOnlyClusterIsSet() {
        contextRunner
            .withPropertyValues("replicheck.cluster=norcal-prod")
            .run(context -> {
                ReplicationCheckProperties properties = context.getBean(ReplicationCheckProperties.class);
                assertThat(properties.getCluster()).isEqualTo("norcal-prod");
                assertThat(properties.getSoaDir()).isEqualTo(Path.of("/nail/etc/services"));
                assertThat(properties.getCheckNamePrefix()).isEqualTo("check_marathon_services_replication");
                assertThat(properties.getParallelism()).isEqualTo(4);
                assertThat(properties.isVerbose()).isFalse();
                assertThat(properties.getThresholds().toThresholds()).isEqualTo(Thresholds.defaults());
                assertThat(properties.getSynapse().hostPort()).isEqualTo("localhost:3212");
                assertThat(properties.getSensu().enabled()).isTrue();
                assertThat(properties.getSensu().url()).isEqualTo("http://localhost:3031");
                assertThat(properties.getSensu().alertAfter()).isEqualTo("2m");
                assertThat(properties.getSensu().checkEvery()).isEqualTo("1m");
                assertThat(properties.getSensu().realertEvery()).isEqualTo(-1);
                assertThat(properties.getSensu().handlers()).isEmpty();
                assertThat(properties.getSensu().ttl()).isNull();
                assertThat(properties.getSchedule().interval()).isEqualTo(Duration.ofMinutes(1));
                assertThat(properties.getSchedule().initialDelay()).isEqualTo(Duration.ofSeconds(5));
            });
    }

    @Test
    void bindsExplicitValues() {
        contextRunner
            .withPropertyValues(
                "replicheck.cluster=pnw-devc",
                "replicheck.soa-dir=/tmp/soa",
                "replicheck.check-name-prefix=replication",
                "replicheck.verbose=true",
                "replicheck.parallelism=8",
                "replicheck.thresholds.warn=80",
                "replicheck.thresholds.crit=50",
                "replicheck.synapse.host-port=synapse.local:4000",
                "replicheck.synapse.read-timeout=3s",
                "replicheck.sensu.enabled=false",
                "replicheck.sensu.url=http://sensu:3031/",
                "replicheck.sensu.handlers=default,pagerduty",
                "replicheck.sensu.ttl=300",
                "replicheck.schedule.interval=PT30S",
                "replicheck.schedule.initial-delay=PT0S")
            .run(context -> {
                ReplicationCheckProperties properties = context.getBean(ReplicationCheckProperties.class);
                assertThat(properties.getSoaDir()).isEqualTo(Path.of("/tmp/soa"));
                assertThat(properties.isVerbose()).isTrue();
                assertThat(properties.getThresholds().toThresholds()).isEqualTo(new Thresholds(80, 50));
                assertThat(properties.getSynapse().hostPort()).isEqualTo("synapse.local:4000");
                assertThat(properties.getSynapse().readTimeout()).isEqualTo(Duration.ofSeconds(3));
                assertThat(properties.getSensu().enabled()).isFalse();
                assertThat(properties.getSensu().url()).isEqualTo("http://sensu:3031");
                assertThat(properties.getSensu().handlers()).containsExactly("default", "pagerduty");
                assertThat(properties.getSensu().ttl()).isEqualTo(300);
                assertThat(properties.getSchedule().interval()).isEqualTo(Duration.ofSeconds(30));
                assertThat(properties.getSchedule().initialDelay()).isZero();
                assertThat(properties.toSettings().parallelism()).isEqualTo(8);
                assertThat(properties.toSettings().checkId(NamespaceId.of("web", "main")))
                    .isEqualTo("replication.web.main");
            });
    }

    @Test
    void invertedThresholdsBindAndLogWarning(CapturedOutput output) {
        contextRunner
            .withPropertyValues(
                "replicheck.cluster=norcal-prod",
                "replicheck.thresholds.warn=50",
                "replicheck.thresholds.crit=90")
            .run(context -> {
                assertThat(context).hasNotFailed();
                Thresholds thresholds = context.getBean(ReplicationCheckProperties.class)
                    .getThresholds().toThresholds();
                assertThat(thresholds.isInverted()).isTrue();
            });

        assertThat(output).contains("WARN").contains("Critical threshold 90% is above warning threshold 50%");
    }

    @Test
    void orderedThresholdsDoNotWarn(CapturedOutput output) {
        contextRunner
            .withPropertyValues(
                "replicheck.cluster=norcal-prod",
                "replicheck.thresholds.warn=75",
                "replicheck.thresholds.crit=50")
            .run(context -> assertThat(context).hasNotFailed());

        assertThat(output).doesNotContain("Critical threshold");
    }

    @Test
    void failsWithoutCluster() {
        contextRunner.run(context -> assertThat(context).hasFailed());
    }

    @Test
    void rejectsNonPositiveParallelism() {
        contextRunner
            .withPropertyValues("replicheck.cluster=norcal-prod", "replicheck.parallelism=0")
            .run(context -> assertThat(context).hasFailed());
    }

    @EnableConfigurationProperties(ReplicationCheckProperties.class)
    private static class Config {}
}
