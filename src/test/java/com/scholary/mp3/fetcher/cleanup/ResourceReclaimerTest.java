package com.scholary.mp3.fetcher.cleanup;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;

import com.scholary.mp3.fetcher.job.Job;
import com.scholary.mp3.fetcher.job.JobStore;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.TaskScheduler;

@ExtendWith(MockitoExtension.class)
class ResourceReclaimerTest {

  private static final Instant NOW = Instant.parse("2026-03-01T08:00:00Z");

  @Mock private TaskScheduler scheduler;

  @TempDir Path workDir;

  private JobStore jobStore;
  private ResourceReclaimer reclaimer;

  @BeforeEach
  void setUp() {
    jobStore = new JobStore();
    reclaimer = new ResourceReclaimer(jobStore, scheduler, Clock.fixed(NOW, ZoneOffset.UTC));
  }

  private Job registerJob(String token) throws IOException {
    Path dir = Files.createDirectory(workDir.resolve("ydl_" + token));
    Path output = Files.writeString(dir.resolve("song.mp3"), "audio");
    Job job = new Job(token, output, "song.mp3", Instant.now().plusSeconds(600));
    jobStore.put(job);
    return job;
  }

  private Runnable scheduledTask() {
    ArgumentCaptor<Runnable> task = ArgumentCaptor.forClass(Runnable.class);
    verify(scheduler).schedule(task.capture(), any(Instant.class));
    return task.getValue();
  }

  @Test
  void schedule_shouldDeleteUnclaimedJobWhenTimerFires() throws IOException {
    Job job = registerJob("t1");

    reclaimer.schedule("t1", Duration.ofMinutes(10));
    scheduledTask().run();

    assertThat(job.jobDirectory()).doesNotExist();
    assertThat(jobStore.takeIfPresent("t1")).isEmpty();
  }

  @Test
  void schedule_shouldUseInjectedClockForDeadline() {
    reclaimer.schedule("t0", Duration.ofMinutes(10));

    verify(scheduler).schedule(any(Runnable.class), eq(NOW.plus(Duration.ofMinutes(10))));
  }

  @Test
  void timer_shouldBeNoOpWhenJobAlreadyDownloaded() throws IOException {
    Job job = registerJob("t2");
    reclaimer.schedule("t2", Duration.ofMinutes(10));

    // the download endpoint got there first but has not deleted the files yet
    assertThat(jobStore.takeIfPresent("t2")).isPresent();

    assertThatCode(() -> scheduledTask().run()).doesNotThrowAnyException();
    assertThat(job.jobDirectory()).exists();
    assertThat(reclaimer.reclaim("t2")).isFalse();
  }

  @Test
  void reclaim_shouldReportWhetherItTookTheJob() throws IOException {
    registerJob("t3");

    assertThat(reclaimer.reclaim("t3")).isTrue();
    assertThat(reclaimer.reclaim("t3")).isFalse();
  }

  @Test
  void deleteDirectory_shouldNeverThrow() {
    assertThatCode(() -> reclaimer.deleteDirectory(workDir.resolve("does-not-exist")))
        .doesNotThrowAnyException();
    assertThatCode(() -> reclaimer.deleteDirectory(null)).doesNotThrowAnyException();
  }

  @Test
  void deleteJobDirectory_shouldRemoveNestedContent() throws IOException {
    Job job = registerJob("t4");
    Files.createDirectories(job.jobDirectory().resolve("nested/deeper"));
    Files.writeString(job.jobDirectory().resolve("nested/deeper/part.webm"), "x");

    reclaimer.deleteJobDirectory(job);

    assertThat(job.jobDirectory()).doesNotExist();
  }
}
