package com.z254.bulwark.governance.health;

import com.z254.bulwark.governance.admission.AdmissionController;
import com.z254.bulwark.governance.anomaly.AnomalyScorer;
import com.z254.bulwark.governance.config.BulwarkGovernanceProperties;
import com.z254.bulwark.governance.gateway.GovernanceGateway;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

/**
 * Health indicator for the governance gateway.
 * <p>
 * Reports tracked keys, open circuits, raised incidents and whether the maintenance
 * task runs. Too many open circuits at once marks the service OUT_OF_SERVICE.
 */
public class GovernanceHealthIndicator implements HealthIndicator {

    private final AdmissionController admissionController;
    private final AnomalyScorer anomalyScorer;
    private final GovernanceGateway gateway;
    private final int maxOpenCircuits;

    public GovernanceHealthIndicator(AdmissionController admissionController,
                                     AnomalyScorer anomalyScorer,
                                     GovernanceGateway gateway,
                                     BulwarkGovernanceProperties properties) {
        this.admissionController = admissionController;
        this.anomalyScorer = anomalyScorer;
        this.gateway = gateway;
        this.maxOpenCircuits = properties.getHealth().getMaxOpenCircuits();
    }

    @Override
    public Health health() {
        int openCircuits = admissionController.openCircuitCount();
        Health.Builder builder = openCircuits > maxOpenCircuits ? Health.outOfService() : Health.up();
        return builder
                .withDetail("trackedKeys", admissionController.trackedKeyCount())
                .withDetail("openCircuits", openCircuits)
                .withDetail("maxOpenCircuits", maxOpenCircuits)
                .withDetail("incidents", anomalyScorer.incidentCount())
                .withDetail("maintenanceRunning", gateway.isRunning())
                .build();
    }
}
