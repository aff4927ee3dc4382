package dotfmt;

import org.junit.jupiter.api.Test;

import static com.google.common.truth.Truth.assertThat;

class MeasureTest {
  private static final long SPACE = Measure.PENDING_SPACE;

  @Test
  void packsWidthAndFlags() {
    long bits = Measure.toBits(Integer.MAX_VALUE, false, true);

    assertThat(Measure.width(bits)).isEqualTo(Integer.MAX_VALUE);
    assertThat(Measure.hasPendingSpace(bits)).isTrue();
    assertThat(Measure.isBroken(bits)).isFalse();
  }

  @Test
  void spaceFollowedByContentCountsOnce() {
    long bits = Measure.add(Measure.add(Measure.ofWidth(3), SPACE), Measure.ofWidth(2));

    assertThat(Measure.width(bits)).isEqualTo(6);
    assertThat(Measure.hasPendingSpace(bits)).isFalse();
  }

  @Test
  void trailingSpaceStaysPending() {
    long bits = Measure.add(Measure.ofWidth(3), SPACE);

    assertThat(Measure.width(bits)).isEqualTo(3);
    assertThat(Measure.hasPendingSpace(bits)).isTrue();
  }

  @Test
  void foldCountsEveryPendingSpaceThatIsFollowed() {
    long bits = Measure.add(Measure.add(Measure.add(Measure.ofWidth(1), SPACE), SPACE), Measure.ofWidth(1));

    // the builder never emits adjacent spaces, so the fold does not merge them
    assertThat(Measure.width(bits)).isEqualTo(4);
  }

  @Test
  void emptyChildKeepsSpacePending() {
    long bits = Measure.add(Measure.add(Measure.ofWidth(1), SPACE), Measure.EMPTY);

    assertThat(Measure.width(bits)).isEqualTo(1);
    assertThat(Measure.hasPendingSpace(bits)).isTrue();
  }

  @Test
  void brokenAbsorbsEverything() {
    long bits = Measure.add(Measure.add(SPACE, Measure.BROKEN), Measure.ofWidth(4));

    assertThat(Measure.isBroken(bits)).isTrue();
    assertThat(Measure.hasPendingSpace(bits)).isFalse();
    assertThat(Measure.toString(bits)).isEqualTo("broken");
  }
}
