package com.databricks.batcher.examples;

import com.databricks.batcher.Batcher;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Example demonstrating lazy batching of an unbounded source.
 *
 * <p>The batcher pulls records only when the next batch is requested and holds at most one open
 * batch, so it can sit between an endless producer (a queue poller, a change feed) and a sink. The
 * consumer stops whenever it likes; the rest of the source is simply never read.
 */
public class UnboundedSourceExample {

  private static final int BATCH_LEN = 2;
  private static final int BATCHES_TO_TAKE = 3;

  /** Returns lazy batches over an endless sequence of records. */
  static Iterator<List<String>> endlessBatches(int batchLen) {
    Stream<String> endless = Stream.iterate(0L, i -> i + 1).map(i -> "record: " + i);
    return Batcher.builder(endless).maxBatchLen(batchLen).build().iterator();
  }

  public static void main(String[] args) {
    System.out.println("Starting unbounded source example...");

    Iterator<List<String>> batches = endlessBatches(BATCH_LEN);
    for (int i = 0; i < BATCHES_TO_TAKE && batches.hasNext(); i++) {
      System.out.println("Batch " + i + ": " + batches.next());
    }

    System.out.println("Stopped after " + BATCHES_TO_TAKE + " batches");
  }
}
