package io.github.byzatic.sqlprobe;

import io.github.byzatic.sqlprobe.base_exceptions.PersistenceException;
import io.github.byzatic.sqlprobe.classifier.Status;
import io.github.byzatic.sqlprobe.driver.ScriptedDriver;
import io.github.byzatic.sqlprobe.model.DbSettings;
import io.github.byzatic.sqlprobe.model.JobDefinition;
import io.github.byzatic.sqlprobe.persistence.JobDefinitionRepository;
import io.github.byzatic.sqlprobe.persistence.JsonDbSettingsRepository;
import io.github.byzatic.sqlprobe.persistence.JsonJobDefinitionRepository;
import io.github.byzatic.sqlprobe.state.JobSnapshot;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.UUID;
import java.util.function.BooleanSupplier;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

class ProbeMonitorTest {

    @TempDir
    Path dir;

    private final ScriptedDriver driver = new ScriptedDriver();
    private ProbeMonitor monitor;

    @AfterEach
    void tearDown() {
        if (monitor != null) monitor.close();
    }

    private ProbeMonitor open() throws Exception {
        monitor = new ProbeMonitor.Builder().dataDirectory(dir).driver(driver).build();
        return monitor;
    }

    private static JobDefinition job(String name, String query, int frequency) throws Exception {
        return JobDefinition.builder().name(name).query(query).frequencySeconds(frequency).build();
    }

    private static void waitUntil(BooleanSupplier condition, long timeoutMillis) throws InterruptedException {
        long deadline = System.currentTimeMillis() + timeoutMillis;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) fail("condition not met within " + timeoutMillis + " ms");
            Thread.sleep(20);
        }
    }

    private JobSnapshot snapshot(UUID id) {
        return monitor.listJobs().stream().filter(s -> s.definition.getId().equals(id)).findFirst().orElseThrow();
    }

    @Test
    void emptyDirectory_startsWithNoJobsAndDefaultSettings() throws Exception {
        open();
        assertTrue(monitor.listJobs().isEmpty());
        assertEquals(DbSettings.empty(), monitor.dbSettings());
    }

    @Test
    void loadsPersistedJobs_allDisabled_inFileOrder() throws Exception {
        JobDefinition a = job("a", "SELECT true", 5);
        JobDefinition b = job("b", "SELECT false", 10);
        JsonJobDefinitionRepository.forPath(dir.resolve(ProbeMonitor.JOBS_FILE)).save(Arrays.asList(a, b));
        DbSettings s = DbSettings.builder().host("db").dbname("app").user("probe").build();
        JsonDbSettingsRepository.forPath(dir.resolve(ProbeMonitor.SETTINGS_FILE)).save(s);

        open();

        List<JobSnapshot> jobs = monitor.listJobs();
        assertEquals(Arrays.asList(a, b), jobs.stream().map(j -> j.definition).collect(Collectors.toList()));
        for (JobSnapshot j : jobs) {
            assertFalse(j.state.isEnabled());
            assertEquals(Status.UNKNOWN, j.state.getLastStatus());
        }
        assertEquals(s, monitor.dbSettings());
    }

    @Test
    void jobsWithoutStoredId_keepTheirIdAcrossRestarts() throws Exception {
        Files.writeString(dir.resolve(ProbeMonitor.JOBS_FILE),
                "[{\"name\": \"ping\", \"description\": \"\", \"query\": \"SELECT true\", \"frequency\": 5}]");

        UUID first = open().listJobs().get(0).definition.getId();
        monitor.close();
        UUID second = open().listJobs().get(0).definition.getId();

        assertEquals(first, second);
    }

    @Test
    void removedJobId_cannotBeAddedAgain() throws Exception {
        open();
        JobDefinition a = job("a", "SELECT true", 5);
        monitor.addJob(a);
        assertTrue(monitor.removeJob(a.getId()));

        assertThrows(IllegalArgumentException.class, () -> monitor.addJob(a));
        assertTrue(monitor.listJobs().isEmpty());
    }

    @Test
    void addUpdateRemove_arePersisted() throws Exception {
        open();
        JobDefinition a = job("a", "SELECT true", 5);
        JobDefinition b = job("b", "SELECT true", 5);
        monitor.addJob(a);
        monitor.addJob(b);

        JobDefinition renamed = a.toBuilder().name("a2").frequencySeconds(7).build();
        monitor.updateJob(renamed);
        assertTrue(monitor.removeJob(b.getId()));
        assertFalse(monitor.removeJob(UUID.randomUUID()));

        List<JobDefinition> stored = JsonJobDefinitionRepository.forPath(dir.resolve(ProbeMonitor.JOBS_FILE)).load();
        assertEquals(Collections.singletonList(renamed), stored);
    }

    @Test
    void updateUnknownJob_isRejected() throws Exception {
        open();
        assertThrows(NoSuchElementException.class, () -> monitor.updateJob(job("x", "SELECT true", 1)));
    }

    @Test
    void setEnabled_unknownJob_isRejected() throws Exception {
        open();
        assertThrows(NoSuchElementException.class, () -> monitor.setEnabled(UUID.randomUUID(), true));
    }

    @Test
    void updateDbSettings_appliesAndPersists() throws Exception {
        open();
        DbSettings s = DbSettings.builder().host("replica").port(6432).dbname("app").user("u").password("p").build();
        monitor.updateDbSettings(s);

        assertEquals(s, monitor.dbSettings());
        assertEquals(s, JsonDbSettingsRepository.forPath(dir.resolve(ProbeMonitor.SETTINGS_FILE)).load());
    }

    @Test
    void failedSave_isReported_butChangeStaysApplied() throws Exception {
        JobDefinitionRepository failing = mock(JobDefinitionRepository.class);
        when(failing.load()).thenReturn(Collections.emptyList());
        doThrow(new PersistenceException("disk full")).when(failing).save(anyList());

        monitor = new ProbeMonitor.Builder().dataDirectory(dir).jobRepository(failing).driver(driver).build();
        JobDefinition a = job("a", "SELECT true", 5);

        PersistenceException e = assertThrows(PersistenceException.class, () -> monitor.addJob(a));
        assertEquals("disk full", e.getMessage());
        assertEquals(1, monitor.listJobs().size());
    }

    @Test
    void malformedJobsFile_failsStartup() throws Exception {
        Files.writeString(dir.resolve(ProbeMonitor.JOBS_FILE), "{oops");
        assertThrows(PersistenceException.class, () -> new ProbeMonitor.Builder().dataDirectory(dir).driver(driver).build());
    }

    @Test
    void enabledJobs_reportHealthAndErrors() throws Exception {
        open();
        JobDefinition ok = job("ok", "SELECT true", 1);
        JobDefinition bad = job("bad", "SELECT false", 1);
        JobDefinition odd = job("odd", "SELECT 42", 1);
        monitor.addJob(ok);
        monitor.addJob(bad);
        monitor.addJob(odd);
        monitor.setEnabled(ok.getId(), true);
        monitor.setEnabled(bad.getId(), true);
        monitor.setEnabled(odd.getId(), true);

        waitUntil(() -> monitor.listJobs().stream().allMatch(j -> j.state.getLastRunAt().isPresent()), 5000);
        assertEquals(Status.HEALTHY, snapshot(ok.getId()).state.getLastStatus());
        assertEquals(Status.UNHEALTHY, snapshot(bad.getId()).state.getLastStatus());
        assertEquals(Status.INDETERMINATE, snapshot(odd.getId()).state.getLastStatus());

        monitor.updateDbSettings(DbSettings.builder().host(ScriptedDriver.UNREACHABLE_HOST).build());
        waitUntil(() -> snapshot(ok.getId()).state.getLastStatus().isError(), 5000);
        assertTrue(snapshot(ok.getId()).state.getLastStatus().displayText().startsWith("Error: "));
        assertTrue(snapshot(ok.getId()).state.isEnabled());
    }
}
