package net.jobledger.bootstrap.props;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

@ConfigurationProperties("jobledger")
public class JobLedgerProperties {
    /** Overrides the random per-process id used in logs. */
    private String instanceId;
    private Scheduler scheduler = new Scheduler();
    /** Per-job overrides, keyed by job name. */
    private Map<String, JobOverride> jobs = new LinkedHashMap<>();

    public String getInstanceId() {
        return instanceId;
    }

    public void setInstanceId(String instanceId) {
        this.instanceId = instanceId;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public void setScheduler(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    public Map<String, JobOverride> getJobs() {
        return jobs;
    }

    public void setJobs(Map<String, JobOverride> jobs) {
        this.jobs = jobs;
    }

    public static class Scheduler {
        private boolean enabled = true;
        private Duration pollInterval = Duration.ofSeconds(60);
        private Duration shutdownGrace = Duration.ofSeconds(30);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getPollInterval() {
            return pollInterval;
        }

        public void setPollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
        }

        public Duration getShutdownGrace() {
            return shutdownGrace;
        }

        public void setShutdownGrace(Duration shutdownGrace) {
            this.shutdownGrace = shutdownGrace;
        }
    }

    public static class JobOverride {
        private Duration interval;

        public Duration getInterval() {
            return interval;
        }

        public void setInterval(Duration interval) {
            this.interval = interval;
        }

        @Override
        public String toString() {
            return "JobOverride{interval=" + interval + '}';
        }
    }
}
