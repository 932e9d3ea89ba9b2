package contentmodel.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;

import java.util.OptionalInt;
import org.junit.jupiter.api.Test;

final class OccursTest {

  @Test
  void constantsHaveExpectedBounds() {
    assertThat(Occurs.ONCE).isEqualTo(Occurs.of(1, 1));
    assertThat(Occurs.OPTIONAL).isEqualTo(Occurs.of(0, 1));
    assertThat(Occurs.ZERO_OR_MORE).isEqualTo(Occurs.atLeast(0));
    assertThat(Occurs.ONE_OR_MORE).isEqualTo(Occurs.atLeast(1));
    assertThat(Occurs.ZERO_OR_MORE.isUnbounded()).isTrue();
    assertThat(Occurs.OPTIONAL.isUnbounded()).isFalse();
  }

  @Test
  void onlyFourShapesAreCanonical() {
    assertThat(Occurs.ONCE.isCanonical()).isTrue();
    assertThat(Occurs.OPTIONAL.isCanonical()).isTrue();
    assertThat(Occurs.ZERO_OR_MORE.isCanonical()).isTrue();
    assertThat(Occurs.ONE_OR_MORE.isCanonical()).isTrue();

    assertThat(Occurs.of(0, 0).isCanonical()).isFalse();
    assertThat(Occurs.of(2, 3).isCanonical()).isFalse();
    assertThat(Occurs.of(1, 2).isCanonical()).isFalse();
    assertThat(Occurs.atLeast(2).isCanonical()).isFalse();
  }

  @Test
  void malformedBoundsAreRejected() {
    assertThatIllegalArgumentException().isThrownBy(() -> Occurs.of(-1, 1));
    assertThatIllegalArgumentException().isThrownBy(() -> Occurs.of(3, 2));
    assertThatIllegalArgumentException().isThrownBy(() -> new Occurs(-2, OptionalInt.empty()));
  }

  @Test
  void toStringSpellsOutUnbounded() {
    assertThat(Occurs.of(2, 3)).asString().isEqualTo("(2, 3)");
    assertThat(Occurs.ZERO_OR_MORE).asString().isEqualTo("(0, unbounded)");
  }
}
