package net.kairos.bootstrap.catalog;

import net.kairos.bootstrap.props.KairosProperties;
import net.kairos.core.job.CronHandler;
import net.kairos.core.job.CronJob;
import net.kairos.core.job.CronScheduler;
import net.kairos.core.job.SchedulerSettings;
import net.kairos.core.spi.Clock;
import net.kairos.core.spi.CronCalculator;
import net.kairos.core.spi.CronStore;
import net.kairos.core.spi.EventLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.ZoneId;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** 설정(kairos.catalog.jobs)에 선언된 job 을 빌드해 스케줄러에 등록한다 */
public class CatalogRegistrar {
    private static final Logger log = LoggerFactory.getLogger(CatalogRegistrar.class);

    private final CronStore store;
    private final CronCalculator calculator;
    private final Clock clock;
    private final EventLog eventLog;
    private final CronScheduler scheduler;
    private final Map<String, CronHandler<?>> handlers;
    private final SchedulerSettings settings;
    private final String instanceId;
    private final ZoneId zone;

    public CatalogRegistrar(CronStore store,
                            CronCalculator calculator,
                            Clock clock,
                            EventLog eventLog,
                            CronScheduler scheduler,
                            Map<String, CronHandler<?>> handlers,
                            SchedulerSettings settings,
                            String instanceId,
                            ZoneId zone) {
        this.store = store;
        this.calculator = calculator;
        this.clock = clock;
        this.eventLog = eventLog;
        this.scheduler = scheduler;
        this.handlers = handlers;
        this.settings = settings;
        this.instanceId = instanceId;
        this.zone = zone;
    }

    /** 등록만. 잘못된 정의가 하나라도 있으면 아무것도 등록하지 않고 실패 */
    public List<CronJob> register(KairosProperties.Catalog catalog) {
        List<CronJob> built = new ArrayList<>();
        Set<String> names = new HashSet<>();
        for (var def : catalog.getJobs()) {
            CronJob job = build(def);
            if (!names.add(job.name()) || scheduler.job(job.name()).isPresent()) {
                throw new IllegalArgumentException("Duplicate cron job name in catalog: '" + job.name() + "'");
            }
            built.add(job);
        }
        for (CronJob job : built) {
            scheduler.register(job);
        }
        log.info("Catalog registered: {} job(s) {}", built.size(), built.stream().map(CronJob::name).toList());
        return built;
    }

    /** 등록 후 시작 */
    public List<CronJob> registerAndStart(KairosProperties.Catalog catalog) throws Exception {
        List<CronJob> jobs = register(catalog);
        for (CronJob job : jobs) {
            job.start();
        }
        return jobs;
    }

    private CronJob build(KairosProperties.JobDef def) {
        if (def.getName() == null || def.getSchedule() == null) {
            throw new IllegalArgumentException("job.name and job.schedule are required: " + def);
        }
        CronHandler<?> handler = handlers.get(def.getHandler());
        if (handler == null) {
            throw new IllegalArgumentException("No CronHandler bean named '" + def.getHandler()
                    + "' for job '" + def.getName() + "' (known: " + handlers.keySet() + ")");
        }
        ZoneId jobZone = def.getTimezone() == null || def.getTimezone().isBlank() ? zone : ZoneId.of(def.getTimezone());
        return CronJob.builder(def.getName())
                .schedule(def.getSchedule())
                .timezone(jobZone)
                .catchUp(def.isCatchUp())
                .maxCatchUp(def.getMaxCatchUp())
                .handler(handler)
                .store(store)
                .calculator(calculator)
                .clock(clock)
                .eventLog(eventLog)
                .settings(settings)
                .instanceId(instanceId)
                .build();
    }
}
