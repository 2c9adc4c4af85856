package com.consullo.castedit.session;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for the playback clock.
 *
 * @since 1.0
 */
public class PlaybackClockTest {

  @Test
  @DisplayName("Should not move the playhead while paused")
  void tick_Paused_Unchanged() {
    PlaybackClock clock = new PlaybackClock();

    assertThat(clock.tick(1.0, 2.0, 10.0)).isEqualTo(2.0);
  }

  @Test
  @DisplayName("Should advance by elapsed time times speed")
  void tick_Playing_AdvancesBySpeed() {
    PlaybackClock clock = new PlaybackClock();
    clock.setSpeed(2);
    clock.play();

    assertThat(clock.tick(0.5, 1.0, 10.0)).isEqualTo(2.0);
    assertThat(clock.isPlaying()).isTrue();
  }

  @Test
  @DisplayName("Should clamp at the end and stop playing")
  void tick_PastEnd_ClampsAndStops() {
    PlaybackClock clock = new PlaybackClock();
    clock.play();

    assertThat(clock.tick(5.0, 8.0, 10.0)).isEqualTo(10.0);
    assertThat(clock.isPlaying()).isFalse();
  }

  @Test
  @DisplayName("Should treat repeated pause and play calls as no-ops and fall back to speed 1")
  void playPause_Repeated_Idempotent() {
    PlaybackClock clock = new PlaybackClock();
    clock.pause();
    clock.pause();
    assertThat(clock.isPlaying()).isFalse();
    clock.play();
    clock.play();
    assertThat(clock.isPlaying()).isTrue();
    assertThat(clock.toggle()).isFalse();

    clock.setSpeed(-3);
    assertThat(clock.speed()).isEqualTo(1.0);
    clock.play();
    assertThat(clock.tick(-1, 3.0, 10.0)).isEqualTo(3.0);
  }
}
