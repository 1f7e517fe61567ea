package AutomataKit.Model;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class SearchLimitsTest {
  @Test
  void testDefaults() {
    SearchLimits limits = SearchLimits.defaults();
    Assertions.assertEquals(1000, limits.getMaxEpsilonSteps());
    Assertions.assertEquals(10000, limits.getMaxSearchDepth());
    Assertions.assertEquals(1_000_000, limits.getMaxExpansions());
  }

  @Test
  void testWithers() {
    SearchLimits limits = SearchLimits.defaults().withMaxSearchDepth(7).withMaxExpansions(9);
    Assertions.assertEquals(1000, limits.getMaxEpsilonSteps());
    Assertions.assertEquals(7, limits.getMaxSearchDepth());
    Assertions.assertEquals(9, limits.getMaxExpansions());
    Assertions.assertEquals(10000, SearchLimits.defaults().getMaxSearchDepth());
  }

  @Test
  void testRejectsNonPositive() {
    Assertions.assertThrows(IllegalArgumentException.class, () -> new SearchLimits(0, 1, 1));
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> SearchLimits.defaults().withMaxExpansions(-1));
  }
}
