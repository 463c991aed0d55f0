package io.replicheck.checkservice.config;

import static org.assertj.core.api.Assertions.assertThat;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.replicheck.checkservice.app.OneShotCheckRunner;
import io.replicheck.checkservice.app.ReplicationCheckJob;
import io.replicheck.checkservice.app.ReplicationCheckScheduler;
import io.replicheck.checkservice.infra.sensu.LoggingAlertTransport;
import io.replicheck.checkservice.infra.sensu.SensuAlertTransport;
import io.replicheck.replication.ports.AlertTransportPort;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.context.ConfigurationPropertiesAutoConfiguration;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.autoconfigure.web.client.RestTemplateAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

class ReplicationCheckConfigurationTest {

    private final ApplicationContextRunner contextRunner =
        new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(
                ConfigurationPropertiesAutoConfiguration.class,
                JacksonAutoConfiguration.class,
                RestTemplateAutoConfiguration.class))
            .withUserConfiguration(Config.class, ReplicationCheckConfiguration.class)
            .withPropertyValues("replicheck.cluster=norcal-prod", "replicheck.schedule.initial-delay=PT1H");

    @Test
    void wiresSensuTransportByDefault() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(ReplicationCheckJob.class);
            assertThat(context.getBean(AlertTransportPort.class)).isInstanceOf(SensuAlertTransport.class);
        });
    }

    @Test
    void fallsBackToLoggingTransportWhenSensuIsDisabled() {
        contextRunner
            .withPropertyValues("replicheck.sensu.enabled=false")
            .run(context ->
                assertThat(context.getBean(AlertTransportPort.class)).isInstanceOf(LoggingAlertTransport.class));
    }

    @Test
    void schedulesCheckFromBoundCadence() {
        contextRunner
            .withUserConfiguration(SchedulingConfig.class, ReplicationCheckScheduler.class)
            .withPropertyValues("replicheck.schedule.interval=PT10M")
            .run(context -> {
                assertThat(context).hasNotFailed();
                assertThat(context).hasSingleBean(ReplicationCheckScheduler.class);
                assertThat(context.getBean("replicationCheckSchedule", ReplicationCheckProperties.Schedule.class)
                    .interval()).isEqualTo(Duration.ofMinutes(10));
            });
    }

    @Test
    void skipsSchedulerWhenDisabled() {
        contextRunner
            .withUserConfiguration(SchedulingConfig.class, ReplicationCheckScheduler.class)
            .withPropertyValues("replicheck.schedule.enabled=false")
            .run(context -> assertThat(context).doesNotHaveBean(ReplicationCheckScheduler.class));
    }

    @Test
    void registersOneShotRunnerOnlyWhenRequested() {
        contextRunner
            .withUserConfiguration(OneShotCheckRunner.class)
            .run(context -> assertThat(context).doesNotHaveBean(OneShotCheckRunner.class));
        contextRunner
            .withUserConfiguration(OneShotCheckRunner.class)
            .withPropertyValues("replicheck.run-once=true")
            .run(context -> assertThat(context).hasSingleBean(OneShotCheckRunner.class));
    }

    @Configuration
    @EnableScheduling
    static class SchedulingConfig {}

    @Configuration
    @EnableConfigurationProperties(ReplicationCheckProperties.class)
    static class Config {
        @Bean
        MeterRegistry meterRegistry() {
            return new SimpleMeterRegistry();
        }
    }
}
