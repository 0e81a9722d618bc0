package com.ospicorp.dataops.semantic;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Optional;
import org.junit.jupiter.api.Test;

class IntentFamilyTest {

  @Test
  void percentileLevelsResolve() {
    assertEquals(Optional.of(AggregationFunction.P99), IntentFamily.match("p99 response time"));
    assertEquals(Optional.of(AggregationFunction.P90), IntentFamily.match("90th percentile"));
    assertEquals(Optional.of(AggregationFunction.P90), IntentFamily.match("top 10% of orders"));
    assertEquals(Optional.of(AggregationFunction.P95), IntentFamily.match("percentile"));
  }

  @Test
  void earlierFamilyWins() {
    assertEquals(Optional.of(AggregationFunction.MEAN),
        IntentFamily.match("average latency p95"));
    assertEquals(Optional.of(AggregationFunction.MEAN),
        IntentFamily.match("typical value without outliers"));
    assertEquals(Optional.of(AggregationFunction.MEDIAN),
        IntentFamily.match("median of the 95th percentile"));
    assertEquals(Optional.of(AggregationFunction.P95), IntentFamily.match("top 5% and max"));
    assertEquals(Optional.of(AggregationFunction.MEAN), IntentFamily.match("mean and max"));
  }

  @Test
  void wordsMapToFamilies() {
    assertEquals(Optional.of(AggregationFunction.MAX), IntentFamily.match("Highest revenue"));
    assertEquals(Optional.of(AggregationFunction.MIN), IntentFamily.match("lowest cost"));
    assertEquals(Optional.of(AggregationFunction.VAR), IntentFamily.match("variance"));
    assertEquals(Optional.of(AggregationFunction.STD), IntentFamily.match("price volatility"));
  }

  @Test
  void noKeywordsMeansNoHint() {
    assertTrue(IntentFamily.match("show me sales").isEmpty());
    assertTrue(IntentFamily.match(null).isEmpty());
    assertTrue(IntentFamily.match("  ").isEmpty());
  }
}
