package net.kairos.bootstrap.catalog;

import net.kairos.bootstrap.props.KairosProperties;
import net.kairos.core.cron.InvalidCronExpressionException;
import net.kairos.core.cron.ScanningCronCalculator;
import net.kairos.core.job.CronHandler;
import net.kairos.core.job.CronJob;
import net.kairos.core.job.CronScheduler;
import net.kairos.core.job.SchedulerSettings;
import net.kairos.core.model.Job;
import net.kairos.core.spi.EventLog;
import net.kairos.core.support.InMemoryCronStore;
import net.kairos.core.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CatalogRegistrarTest {

    final MutableClock clock = MutableClock.at("2024-01-01T09:30:00Z");
    final InMemoryCronStore store = new InMemoryCronStore(clock);
    final CronScheduler scheduler = new CronScheduler();
    final Map<String, CronHandler<?>> handlers = Map.of(
            "reportHandler", ctx -> "report@" + ctx.scheduledTime(),
            "cleanupHandler", ctx -> null);

    final CatalogRegistrar registrar = new CatalogRegistrar(store, new ScanningCronCalculator(), clock,
            EventLog.discarding(), scheduler, handlers,
            SchedulerSettings.defaults().withTickInterval(Duration.ofHours(1)),
            "node-1", ZoneId.of("Asia/Seoul"));

    @AfterEach
    void tearDown() {
        scheduler.close();
    }

    private static KairosProperties.JobDef def(String name, String schedule, String handler) {
        KairosProperties.JobDef d = new KairosProperties.JobDef();
        d.setName(name);
        d.setSchedule(schedule);
        d.setHandler(handler);
        return d;
    }

    @Test
    void registerAndStart_buildsEveryDeclaredJob() throws Exception {
        KairosProperties.Catalog catalog = new KairosProperties.Catalog();
        KairosProperties.JobDef report = def("daily-report", "0 9 * * *", "reportHandler");
        report.setTimezone("UTC");
        report.setCatchUp(true);
        catalog.setJobs(List.of(report, def("cleanup", "*/15 * * * *", "cleanupHandler")));

        List<CronJob> jobs = registrar.registerAndStart(catalog);

        assertThat(jobs).extracting(CronJob::name).containsExactly("daily-report", "cleanup");
        assertThat(scheduler.jobs()).hasSize(2).allMatch(CronJob::isRunning);
        assertThat(jobs.get(0).instanceId()).isEqualTo("node-1");

        Job reportRow = store.job("daily-report").orElseThrow();
        assertThat(reportRow.timezone()).isEqualTo("UTC");
        assertThat(reportRow.catchUp()).isTrue();
        assertThat(reportRow.nextScheduledTime()).isEqualTo(Instant.parse("2024-01-02T09:00:00Z"));
        // timezone 미지정 → kairos.zone
        assertThat(store.job("cleanup").orElseThrow().timezone()).isEqualTo("Asia/Seoul");
    }

    @Test
    void registeredJob_canBeTriggeredThroughScheduler() throws Exception {
        KairosProperties.Catalog catalog = new KairosProperties.Catalog();
        catalog.setJobs(List.of(def("daily-report", "0 9 * * *", "reportHandler")));
        registrar.register(catalog);

        var e = scheduler.job("daily-report").orElseThrow().trigger();

        assertThat(e.succeeded()).isTrue();
        assertThat(e.output()).isEqualTo("report@2024-01-01T09:30:00Z");
    }

    @Test
    void unknownHandler_failsWithoutRegisteringAnything() {
        KairosProperties.Catalog catalog = new KairosProperties.Catalog();
        catalog.setJobs(List.of(
                def("daily-report", "0 9 * * *", "reportHandler"),
                def("orphan", "0 * * * *", "missingHandler")));

        assertThatThrownBy(() -> registrar.register(catalog))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("missingHandler");
        assertThat(scheduler.jobs()).isEmpty();
    }

    @Test
    void duplicateName_failsWithoutRegisteringAnything() {
        KairosProperties.Catalog catalog = new KairosProperties.Catalog();
        catalog.setJobs(List.of(
                def("daily-report", "0 9 * * *", "reportHandler"),
                def("cleanup", "*/15 * * * *", "cleanupHandler"),
                def("daily-report", "0 18 * * *", "reportHandler")));

        assertThatThrownBy(() -> registrar.register(catalog))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("daily-report");
        assertThat(scheduler.jobs()).isEmpty();
    }

    @Test
    void nameAlreadyInScheduler_isRejectedBeforeRegistering() {
        KairosProperties.Catalog first = new KairosProperties.Catalog();
        first.setJobs(List.of(def("daily-report", "0 9 * * *", "reportHandler")));
        registrar.register(first);

        KairosProperties.Catalog second = new KairosProperties.Catalog();
        second.setJobs(List.of(
                def("cleanup", "*/15 * * * *", "cleanupHandler"),
                def("daily-report", "0 18 * * *", "reportHandler")));

        assertThatThrownBy(() -> registrar.register(second)).isInstanceOf(IllegalArgumentException.class);
        assertThat(scheduler.jobs()).extracting(CronJob::name).containsExactly("daily-report");
    }

    @Test
    void invalidSchedule_isRejected() {
        KairosProperties.Catalog catalog = new KairosProperties.Catalog();
        catalog.setJobs(List.of(def("broken", "not a cron", "reportHandler")));

        assertThatThrownBy(() -> registrar.register(catalog)).isInstanceOf(InvalidCronExpressionException.class);
    }
}
