package net.kairos.bootstrap.props;

import net.kairos.core.cron.ScanningCronCalculator;
import net.kairos.core.job.SchedulerSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties("kairos")
public class KairosProperties {
    private Catalog catalog = new Catalog();
    private String zone = "UTC";
    /** 비어 있으면 기동 시 UUID */
    private String instanceId;
    private Scheduler scheduler = new Scheduler();

    public Catalog getCatalog() {
        return catalog;
    }

    public void setCatalog(Catalog catalog) {
        this.catalog = catalog;
    }

    public String getZone() {
        return zone;
    }

    public void setZone(String zone) {
        this.zone = zone;
    }

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

    public static class Catalog {
        private boolean enabled = true;
        private List<JobDef> jobs = new ArrayList<>();

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public List<JobDef> getJobs() {
            return jobs;
        }

        public void setJobs(List<JobDef> jobs) {
            this.jobs = jobs;
        }
    }

    public static class JobDef {
        private String name;
        private String schedule;
        /** 비어 있으면 kairos.zone */
        private String timezone;
        private boolean catchUp = false;
        private int maxCatchUp = 10;
        /** CronHandler 빈 이름 */
        private String handler;

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getSchedule() {
            return schedule;
        }

        public void setSchedule(String schedule) {
            this.schedule = schedule;
        }

        public String getTimezone() {
            return timezone;
        }

        public void setTimezone(String timezone) {
            this.timezone = timezone;
        }

        public boolean isCatchUp() {
            return catchUp;
        }

        public void setCatchUp(boolean catchUp) {
            this.catchUp = catchUp;
        }

        public int getMaxCatchUp() {
            return maxCatchUp;
        }

        public void setMaxCatchUp(int maxCatchUp) {
            this.maxCatchUp = maxCatchUp;
        }

        public String getHandler() {
            return handler;
        }

        public void setHandler(String handler) {
            this.handler = handler;
        }

        @Override
        public String toString() {
            return "JobDef{" +
                    "name='" + name + '\'' +
                    ", schedule='" + schedule + '\'' +
                    ", timezone='" + timezone + '\'' +
                    ", catchUp=" + catchUp +
                    ", maxCatchUp=" + maxCatchUp +
                    ", handler='" + handler + '\'' +
                    '}';
        }
    }

    public static class Scheduler {
        /** false 면 catalog job 은 등록만 하고 시작하지 않으며 maintenance 도 돌지 않음 */
        private boolean enabled = true;
        private Duration tickInterval = SchedulerSettings.DEFAULT_TICK_INTERVAL;
        private Duration leaseDuration = SchedulerSettings.DEFAULT_LEASE_DURATION;
        /** 비어 있으면 leaseDuration / 3 */
        private Duration heartbeatInterval;
        private long maxSearchMinutes = ScanningCronCalculator.DEFAULT_MAX_SEARCH_MINUTES;
        /** scanning | cron-utils */
        private String cronEngine = "scanning";
        private long maintenanceDelayMs = 60_000;
        private Duration staleAfter = Duration.ofHours(1);

        public SchedulerSettings toSettings() {
            return new SchedulerSettings(tickInterval, leaseDuration, heartbeatInterval, maxSearchMinutes);
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getTickInterval() {
            return tickInterval;
        }

        public void setTickInterval(Duration tickInterval) {
            this.tickInterval = tickInterval;
        }

        public Duration getLeaseDuration() {
            return leaseDuration;
        }

        public void setLeaseDuration(Duration leaseDuration) {
            this.leaseDuration = leaseDuration;
        }

        public Duration getHeartbeatInterval() {
            return heartbeatInterval;
        }

        public void setHeartbeatInterval(Duration heartbeatInterval) {
            this.heartbeatInterval = heartbeatInterval;
        }

        public long getMaxSearchMinutes() {
            return maxSearchMinutes;
        }

        public void setMaxSearchMinutes(long maxSearchMinutes) {
            this.maxSearchMinutes = maxSearchMinutes;
        }

        public String getCronEngine() {
            return cronEngine;
        }

        public void setCronEngine(String cronEngine) {
            this.cronEngine = cronEngine;
        }

        public long getMaintenanceDelayMs() {
            return maintenanceDelayMs;
        }

        public void setMaintenanceDelayMs(long maintenanceDelayMs) {
            this.maintenanceDelayMs = maintenanceDelayMs;
        }

        public Duration getStaleAfter() {
            return staleAfter;
        }

        public void setStaleAfter(Duration staleAfter) {
            this.staleAfter = staleAfter;
        }
    }
}
