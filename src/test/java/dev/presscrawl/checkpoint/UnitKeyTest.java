package dev.presscrawl.checkpoint;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.presscrawl.source.Granularity;
import java.time.LocalDate;
import org.junit.jupiter.api.Test;

class UnitKeyTest {

  @Test
  void dailyKeysAreCanonicalIsoDates() {
    UnitKey key = new UnitKey(Granularity.DAILY, " 2024-05-01 ");

    assertThat(key.value()).isEqualTo("2024-05-01");
    assertThat(key.asDate()).isEqualTo(LocalDate.of(2024, 5, 1));
    assertThat(key).isEqualTo(UnitKey.ofDate(LocalDate.of(2024, 5, 1)));
  }

  @Test
  void pageKeysDropLeadingZeros() {
    UnitKey key = new UnitKey(Granularity.PAGINATED, "007");

    assertThat(key.value()).isEqualTo("7");
    assertThat(key).isEqualTo(UnitKey.ofPage(7));
  }

  @Test
  void rejectsMalformedValues() {
    assertThatThrownBy(() -> new UnitKey(Granularity.DAILY, "01/05/2024"))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new UnitKey(Granularity.PAGINATED, "two"))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> UnitKey.ofPage(0))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void nextCrossesMonthAndYearBoundaries() {
    assertThat(UnitKey.ofDate(LocalDate.of(2024, 2, 28)).next())
        .isEqualTo(UnitKey.ofDate(LocalDate.of(2024, 2, 29)));
    assertThat(UnitKey.ofDate(LocalDate.of(2024, 12, 31)).next())
        .isEqualTo(UnitKey.ofDate(LocalDate.of(2025, 1, 1)));
    assertThat(UnitKey.ofPage(9).next()).isEqualTo(UnitKey.ofPage(10));
  }

  @Test
  void pagesCompareNumericallyNotLexically() {
    assertThat(UnitKey.ofPage(10).isAfter(UnitKey.ofPage(9))).isTrue();
    assertThat(UnitKey.ofPage(9).compareTo(UnitKey.ofPage(10))).isNegative();
  }

  @Test
  void comparingDifferentGranularitiesFails() {
    UnitKey day = UnitKey.ofDate(LocalDate.of(2024, 5, 1));
    UnitKey page = UnitKey.ofPage(1);

    assertThatThrownBy(() -> day.compareTo(page)).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void accessorOfTheOtherGranularityFails() {
    assertThatThrownBy(() -> UnitKey.ofPage(3).asDate()).isInstanceOf(IllegalStateException.class);
    assertThatThrownBy(() -> UnitKey.ofDate(LocalDate.of(2024, 5, 1)).asPage())
        .isInstanceOf(IllegalStateException.class);
  }

  @Test
  void toStringReadsNaturally() {
    assertThat(UnitKey.ofDate(LocalDate.of(2024, 5, 1))).hasToString("2024-05-01");
    assertThat(UnitKey.ofPage(4)).hasToString("page 4");
  }
}
