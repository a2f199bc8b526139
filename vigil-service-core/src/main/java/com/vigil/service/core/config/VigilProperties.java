package com.vigil.service.core.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "vigil")
public class VigilProperties {
    private Flapping flapping = new Flapping();
    private Acknowledgements acknowledgements = new Acknowledgements();
    private Retention retention = new Retention();

    public Flapping getFlapping() {
        return flapping;
    }

    public void setFlapping(Flapping flapping) {
        this.flapping = flapping;
    }

    public Acknowledgements getAcknowledgements() {
        return acknowledgements;
    }

    public void setAcknowledgements(Acknowledgements acknowledgements) {
        this.acknowledgements = acknowledgements;
    }

    public Retention getRetention() {
        return retention;
    }

    public void setRetention(Retention retention) {
        this.retention = retention;
    }

    public static class Flapping {
        /** Global switch; entities can only be reported flapping while this is on. */
        private boolean enabled = true;

        private double thresholdLow = 25.0;
        private double thresholdHigh = 30.0;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public double getThresholdLow() {
            return thresholdLow;
        }

        public void setThresholdLow(double thresholdLow) {
            this.thresholdLow = thresholdLow;
        }

        public double getThresholdHigh() {
            return thresholdHigh;
        }

        public void setThresholdHigh(double thresholdHigh) {
            this.thresholdHigh = thresholdHigh;
        }
    }

    public static class Acknowledgements {
        private Sweep sweep = new Sweep();

        public Sweep getSweep() {
            return sweep;
        }

        public void setSweep(Sweep sweep) {
            this.sweep = sweep;
        }
    }

    public static class Sweep {
        private boolean enabled;
        private Duration interval = Duration.ofMinutes(1);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getInterval() {
            return interval;
        }

        public void setInterval(Duration interval) {
            this.interval = interval;
        }
    }

    public static class Retention {
        private boolean enabled;
        private String path = "vigil-state.json";
        private Duration interval = Duration.ofMinutes(5);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }

        public Duration getInterval() {
            return interval;
        }

        public void setInterval(Duration interval) {
            this.interval = interval;
        }
    }
}
