package com.scholary.mp3.fetcher.progress;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ProgressChannelTest {

  private static List<ProgressEvent> drain(ProgressChannel channel) {
    List<ProgressEvent> events = new ArrayList<>();
    Optional<ProgressEvent> next;
    while ((next = channel.tryPop()).isPresent()) {
      events.add(next.get());
    }
    return events;
  }

  @Test
  void tryPop_shouldDeliverEventsInEmissionOrder() {
    ProgressChannel channel = new ProgressChannel("job");
    channel.push(new ProgressEvent.Downloading(10.0, null, null, null));
    channel.push(new ProgressEvent.Downloading(50.0, null, null, null));
    channel.push(new ProgressEvent.StatusNote("converting"));
    channel.finish(new ProgressEvent.Done("job", "song.mp3"));

    List<ProgressEvent> events = drain(channel);

    assertThat(events)
        .containsExactly(
            new ProgressEvent.Downloading(10.0, null, null, null),
            new ProgressEvent.Downloading(50.0, null, null, null),
            new ProgressEvent.StatusNote("converting"),
            new ProgressEvent.Done("job", "song.mp3"));
  }

  @Test
  void finish_shouldOnlyAcceptFirstTerminalEvent() {
    ProgressChannel channel = new ProgressChannel("job");

    assertThat(channel.finish(new ProgressEvent.Failed("boom"))).isTrue();
    assertThat(channel.finish(new ProgressEvent.Done("job", "x.mp3"))).isFalse();

    assertThat(drain(channel)).containsExactly(new ProgressEvent.Failed("boom"));
  }

  @Test
  void push_shouldDropEventsAfterFinish() {
    ProgressChannel channel = new ProgressChannel("job");
    channel.finish(new ProgressEvent.Done("job", "x.mp3"));

    assertThat(channel.push(new ProgressEvent.StatusNote("late"))).isFalse();
    assertThat(drain(channel)).last().isEqualTo(new ProgressEvent.Done("job", "x.mp3"));
  }

  @Test
  void push_shouldRejectTerminalEvents() {
    ProgressChannel channel = new ProgressChannel("job");

    assertThatThrownBy(() -> channel.push(new ProgressEvent.Failed("x")))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> channel.finish(new ProgressEvent.StatusNote("x")))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void isDrained_shouldRequireCompletionAndEmptyQueue() {
    ProgressChannel channel = new ProgressChannel("job");
    assertThat(channel.isDrained()).isFalse();

    channel.finish(new ProgressEvent.Done("job", "x.mp3"));
    assertThat(channel.isComplete()).isTrue();
    assertThat(channel.isDrained()).isFalse();

    channel.tryPop();
    assertThat(channel.isDrained()).isTrue();
  }

  @Test
  void terminalEvent_shouldAlwaysBeLastWithConcurrentProducer() throws Exception {
    for (int round = 0; round < 50; round++) {
      ProgressChannel channel = new ProgressChannel("job-" + round);
      Thread producer =
          new Thread(
              () -> {
                for (int i = 0; i < 200; i++) {
                  channel.push(new ProgressEvent.StatusNote("n" + i));
                }
              });
      producer.start();
      channel.finish(new ProgressEvent.Done("job", "x.mp3"));
      producer.join();

      List<ProgressEvent> events = drain(channel);
      assertThat(events).last().matches(ProgressEvent::isTerminal);
      assertThat(events).filteredOn(ProgressEvent::isTerminal).hasSize(1);
    }
  }

  @Test
  void downloading_shouldRejectPercentOutOfRange() {
    assertThatThrownBy(() -> new ProgressEvent.Downloading(101.0, null, null, null))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void payload_shouldUseWireFieldNames() {
    assertThat(new ProgressEvent.Done("tok", "a.zip").payload())
        .containsEntry("token", "tok")
        .containsEntry("filename", "a.zip");
    assertThat(new ProgressEvent.Failed("bad").payload()).containsEntry("error", "bad");
    assertThat(new ProgressEvent.Failed("bad").eventName()).isEqualTo("error");
    assertThat(new ProgressEvent.Downloading(null, 1.5, 3L, "f.webm").payload())
        .containsEntry("status", "downloading")
        .containsEntry("percent", null)
        .containsEntry("speed", 1.5)
        .containsEntry("eta", 3L)
        .containsEntry("filename", "f.webm");
  }
}
