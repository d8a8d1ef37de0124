package com.z254.bulwark.governance.starter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.bulwark.governance.admission.AdmissionController;
import com.z254.bulwark.governance.admission.AdmissionStore;
import com.z254.bulwark.governance.admission.InMemoryAdmissionStore;
import com.z254.bulwark.governance.anomaly.AnomalyScorer;
import com.z254.bulwark.governance.anomaly.IncidentResponder;
import com.z254.bulwark.governance.audit.AuditPublisher;
import com.z254.bulwark.governance.audit.AuditSink;
import com.z254.bulwark.governance.audit.LoggingAuditSink;
import com.z254.bulwark.governance.config.BulwarkGovernanceProperties;
import com.z254.bulwark.governance.gateway.GovernanceGateway;
import com.z254.bulwark.governance.health.GovernanceHealthIndicator;
import com.z254.bulwark.governance.observability.GovernanceMetrics;
import com.z254.bulwark.governance.state.StateRecordCodec;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Auto-configuration for BULWARK governance.
 * <p>
 * Provides:
 * <ul>
 *   <li>Admission controller with adaptive limits and per-key circuit breaking</li>
 *   <li>Anomaly scorer with incident response</li>
 *   <li>Governance gateway and its maintenance task</li>
 *   <li>Logging audit sink (replace by declaring an {@link AuditSink} bean)</li>
 *   <li>State record JSON codec</li>
 *   <li>Actuator health indicator</li>
 * </ul>
 */
@AutoConfiguration
@EnableConfigurationProperties(BulwarkGovernanceProperties.class)
@ConditionalOnProperty(prefix = "bulwark.governance", name = "enabled", havingValue = "true", matchIfMissing = true)
public class BulwarkGovernanceAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(BulwarkGovernanceAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public Clock governanceClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public GovernanceMetrics governanceMetrics(ObjectProvider<MeterRegistry> meterRegistry) {
        return new GovernanceMetrics(meterRegistry.getIfAvailable(SimpleMeterRegistry::new));
    }

    @Bean
    @ConditionalOnMissingBean
    public AdmissionStore admissionStore(BulwarkGovernanceProperties properties) {
        return new InMemoryAdmissionStore(properties.getAdmission().getMaxKeys());
    }

    @Bean
    @ConditionalOnMissingBean
    public AuditSink auditSink(@Value("${spring.application.name:unknown}") String serviceName) {
        return new LoggingAuditSink(serviceName);
    }

    @Bean
    @ConditionalOnMissingBean
    public AuditPublisher auditPublisher(AuditSink auditSink, GovernanceMetrics metrics) {
        return new AuditPublisher(auditSink, metrics);
    }

    @Bean
    @ConditionalOnMissingBean
    public AdmissionController admissionController(AdmissionStore store,
                                                   BulwarkGovernanceProperties properties,
                                                   GovernanceMetrics metrics,
                                                   Clock clock) {
        return new AdmissionController(store, properties, metrics, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public IncidentResponder incidentResponder(AuditPublisher auditPublisher) {
        return new IncidentResponder(auditPublisher);
    }

    @Bean
    @ConditionalOnMissingBean
    public AnomalyScorer anomalyScorer(BulwarkGovernanceProperties properties,
                                       AuditPublisher auditPublisher,
                                       IncidentResponder incidentResponder,
                                       GovernanceMetrics metrics,
                                       Clock clock) {
        return new AnomalyScorer(properties, auditPublisher, incidentResponder, metrics, clock);
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public GovernanceGateway governanceGateway(AdmissionController admissionController,
                                               AnomalyScorer anomalyScorer,
                                               AuditPublisher auditPublisher,
                                               GovernanceMetrics metrics,
                                               BulwarkGovernanceProperties properties) {
        var maintenance = properties.getMaintenance();
        GovernanceGateway gateway = new GovernanceGateway(
                admissionController, anomalyScorer, auditPublisher, metrics, maintenance.getTrimInterval());
        if (maintenance.isEnabled()) {
            gateway.start();
        }
        log.info("BULWARK governance gateway configured: defaultLimit={}, policies={}",
                properties.getAdmission().getDefaultLimit(), properties.getAdmission().getOperations().keySet());
        return gateway;
    }

    @Bean
    @ConditionalOnMissingBean
    public StateRecordCodec stateRecordCodec(ObjectProvider<ObjectMapper> objectMapper, Clock clock) {
        return new StateRecordCodec(objectMapper.getIfAvailable(ObjectMapper::new), clock);
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(name = "org.springframework.boot.actuate.health.HealthIndicator")
    public static class HealthConfiguration {

        @Bean
        @ConditionalOnMissingBean(name = "governanceHealthIndicator")
        public GovernanceHealthIndicator governanceHealthIndicator(AdmissionController admissionController,
                                                                   AnomalyScorer anomalyScorer,
                                                                   GovernanceGateway gateway,
                                                                   BulwarkGovernanceProperties properties) {
            return new GovernanceHealthIndicator(admissionController, anomalyScorer, gateway, properties);
        }
    }
}
