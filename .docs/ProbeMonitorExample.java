import io.github.byzatic.sqlprobe.ProbeMonitor;
import io.github.byzatic.sqlprobe.classifier.Status;
import io.github.byzatic.sqlprobe.model.DbSettings;
import io.github.byzatic.sqlprobe.model.JobDefinition;
import io.github.byzatic.sqlprobe.schedulers.JobEventListener;
import io.github.byzatic.sqlprobe.state.JobSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Paths;
import java.time.ZoneId;
import java.util.UUID;

class ProbeMonitorExample {
    private static final Logger logger = LoggerFactory.getLogger(ProbeMonitorExample.class);

    public static void main(String[] args) throws Exception {
        try (ProbeMonitor monitor = new ProbeMonitor.Builder()
                .dataDirectory(Paths.get("data"))
                .build()
        ) {
            monitor.addListener(new MyEventListener());

            // settings.json is written on change
            monitor.updateDbSettings(DbSettings.builder()
                    .host("localhost")
                    .dbname("postgres")
                    .user("postgres")
                    .password("postgres")
                    .build());

            JobDefinition lag = JobDefinition.builder()
                    .name("replication lag")
                    .description("standby is less than 30 seconds behind")
                    .query("SELECT coalesce(now() - pg_last_xact_replay_timestamp() < interval '30 seconds', true)")
                    .frequencySeconds(5)
                    .build();
            monitor.addJob(lag);

            // loaded and added jobs start disabled
            monitor.setEnabled(lag.getId(), true);

            Thread.sleep(12_000);

            for (JobSnapshot s : monitor.listJobs()) {
                logger.info("[MAIN] {} | {} | {} | last run {}",
                        s.definition.getName(),
                        s.state.isEnabled() ? "on" : "off",
                        s.state.getLastStatus().displayText(),
                        s.formattedLastRun(ZoneId.systemDefault()));
            }

            monitor.setEnabled(lag.getId(), false);
        }
    }

    public static class MyEventListener implements JobEventListener {
        @Override
        public void onStart(UUID jobId) {
            logger.debug("[EVENT] Probe started: " + jobId);
        }

        @Override
        public void onComplete(UUID jobId, Status status) {
            logger.debug("[EVENT] Probe finished: " + jobId + " -> " + status.displayText());
        }

        @Override
        public void onSkipped(UUID jobId) {
            logger.warn("[EVENT] Probe still running, cycle skipped: " + jobId);
        }
    }
}
