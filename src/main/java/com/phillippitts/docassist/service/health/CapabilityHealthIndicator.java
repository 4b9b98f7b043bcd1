package com.phillippitts.docassist.service.health;

import com.phillippitts.docassist.config.properties.CapabilityProperties;
import com.phillippitts.docassist.service.capability.CapabilityProbe;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Health indicator for the model server.
 *
 * <p>UP when at least one capability is installed, DOWN when the server is unreachable or
 * has no models. Exposed via /actuator/health endpoint.
 */
@Component
public class CapabilityHealthIndicator implements HealthIndicator {

    private final CapabilityProbe probe;
    private final CapabilityProperties props;

    public CapabilityHealthIndicator(CapabilityProbe probe, CapabilityProperties props) {
        this.probe = probe;
        this.props = props;
    }

    @Override
    public Health health() {
        List<String> available = probe.availableCapabilities();
        Health.Builder builder = available.isEmpty() ? Health.down() : Health.up();
        return builder
                .withDetail("baseUrl", props.getBaseUrl())
                .withDetail("capabilities", available)
                .withDetail("status", available.isEmpty()
                        ? "Model server unreachable or no models installed"
                        : available.size() + " capabilities available")
                .build();
    }
}
