package mediator.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the mediator.
 *
 * @see MediatorAutoConfiguration
 */
@ConfigurationProperties(prefix = "mediator")
public class MediatorProperties {

    /**
     * Packages scanned for request handlers. Scanning is off when unset.
     */
    private List<String> basePackages = new ArrayList<>();

    /**
     * Whether a later handler class may replace an earlier one for the same request and
     * response type instead of failing startup.
     */
    private boolean allowHandlerOverride = false;

    private final Metrics metrics = new Metrics();

    public List<String> getBasePackages() {
        return basePackages;
    }

    public void setBasePackages(List<String> basePackages) {
        this.basePackages = basePackages;
    }

    public boolean isAllowHandlerOverride() {
        return allowHandlerOverride;
    }

    public void setAllowHandlerOverride(boolean allowHandlerOverride) {
        this.allowHandlerOverride = allowHandlerOverride;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "mediator";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
