package com.databricks.batcher;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.function.ToLongFunction;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/** Tests for how the batcher pulls from its source and calls its size function. */
@ExtendWith(MockitoExtension.class)
public class BatcherSourceTest {

  @Mock private Iterator<String> source;

  @Mock private ToLongFunction<String> sizeCalculator;

  @Test
  public void testNothingPulledBeforeIteration() {
    Batcher.builder(source).maxBatchLen(2).build();

    verifyNoInteractions(source);
  }

  @Test
  public void testFullBatchEmittedWithoutPullingNextRecord() {
    when(source.hasNext()).thenReturn(true);
    when(source.next()).thenReturn("a", "b", "c");

    Batcher<String> batcher = Batcher.builder(source).maxBatchLen(2).build();

    assertEquals(Arrays.asList("a", "b"), batcher.iterator().next());
    verify(source, times(2)).next();
  }

  @Test
  public void testSizeLimitedBatchPullsOnlyTheOverflowingRecord() {
    when(source.hasNext()).thenReturn(true);
    when(source.next()).thenReturn("aa", "bb", "cc", "dd");

    Batcher<String> batcher =
        Batcher.builder(source).maxBatchSize(4).sizeCalculator(RecordSizes.stringLength()).build();
    Iterator<List<String>> it = batcher.iterator();

    assertEquals(Arrays.asList("aa", "bb"), it.next());
    verify(source, times(3)).next();

    assertEquals(Arrays.asList("cc", "dd"), it.next());
    verify(source, times(5)).next();
  }

  @Test
  public void testSizeCalculatorCalledOncePerRecord() {
    when(sizeCalculator.applyAsLong(anyString())).thenReturn(1L);
    when(sizeCalculator.applyAsLong("huge")).thenReturn(100L);

    Batcher<String> batcher =
        Batcher.builder(Arrays.asList("a", "b", "huge", "c"))
            .maxBatchLen(2)
            .maxBatchSize(10)
            .sizeCalculator(sizeCalculator)
            .whenRecordSizeExceeded(OversizedRecordPolicy.SKIP)
            .build();
    batcher.batches();

    InOrder inOrder = inOrder(sizeCalculator);
    inOrder.verify(sizeCalculator).applyAsLong("a");
    inOrder.verify(sizeCalculator).applyAsLong("b");
    inOrder.verify(sizeCalculator).applyAsLong("huge");
    inOrder.verify(sizeCalculator).applyAsLong("c");
    verifyNoMoreInteractions(sizeCalculator);
  }

  @Test
  public void testSourceConsumedExactlyOnce() {
    when(source.hasNext()).thenReturn(true, true, true, false);
    when(source.next()).thenReturn("a", "b", "c");

    Batcher<String> batcher = Batcher.builder(source).maxBatchLen(2).build();

    assertEquals(2, batcher.batches().size());
    assertTrue(batcher.batches().isEmpty());
    verify(source, times(3)).next();
    verify(source, times(5)).hasNext();
  }

  @Test
  public void testSourceFailurePropagatesUnchanged() {
    IllegalStateException failure = new IllegalStateException("source broken");
    when(source.hasNext()).thenReturn(true);
    when(source.next()).thenReturn("a").thenThrow(failure);

    Batcher<String> batcher = Batcher.builder(source).maxBatchLen(5).build();

    assertSame(failure, assertThrows(IllegalStateException.class, batcher::batches));
    assertFalse(batcher.iterator().hasNext());
  }
}
