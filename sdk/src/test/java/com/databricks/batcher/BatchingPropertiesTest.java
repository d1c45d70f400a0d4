package com.databricks.batcher;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

/** Checks batch invariants over generated inputs and a range of limits. */
public class BatchingPropertiesTest {

  private static final int RECORD_COUNT = 500;
  private static final int MAX_RECORD_LENGTH = 12;

  private static List<String> randomRecords(long seed) {
    Random random = new Random(seed);
    List<String> records = new ArrayList<>(RECORD_COUNT);
    for (int i = 0; i < RECORD_COUNT; i++) {
      StringBuilder record = new StringBuilder();
      int length = random.nextInt(MAX_RECORD_LENGTH + 1);
      for (int j = 0; j < length; j++) {
        record.append((char) ('a' + random.nextInt(26)));
      }
      records.add(record.toString());
    }
    return records;
  }

  @ParameterizedTest
  @CsvSource({
    "1, 1, 20, 20",
    "2, 4, 20, 6",
    "3, 7, 10, 10",
    "4, 50, 12, 3",
    "5, 1000, 30, 11",
    "6, 3, 100, 8",
    "7, 5, 25, 1"
  })
  public void testInvariantsUnderSkip(
      long seed, int maxBatchLen, long maxBatchSize, long maxRecordSize) {
    List<String> records = randomRecords(seed);

    Batcher<String> batcher =
        Batcher.builder(records)
            .maxBatchLen(maxBatchLen)
            .maxBatchSize(maxBatchSize)
            .maxRecordSize(maxRecordSize)
            .sizeCalculator(RecordSizes.stringLength())
            .whenRecordSizeExceeded(OversizedRecordPolicy.SKIP)
            .build();
    List<List<String>> batches = batcher.batches();

    List<String> flattened = new ArrayList<>();
    for (List<String> batch : batches) {
      assertFalse(batch.isEmpty());
      assertTrue(batch.size() <= maxBatchLen);
      assertTrue(batch.stream().mapToLong(String::length).sum() <= maxBatchSize);
      assertTrue(batch.stream().allMatch(r -> r.length() <= maxRecordSize));
      flattened.addAll(batch);
    }

    List<String> kept =
        records.stream().filter(r -> r.length() <= maxRecordSize).collect(Collectors.toList());
    assertEquals(kept, flattened);
    assertEquals(records.size() - kept.size(), batcher.skippedRecords());
  }

  @ParameterizedTest
  @CsvSource({"11, 1", "12, 3", "13, 64"})
  public void testCountOnlyBatchesAreFullExceptLast(long seed, int maxBatchLen) {
    List<String> records = randomRecords(seed);

    List<List<String>> batches =
        Batcher.builder(records).maxBatchLen(maxBatchLen).build().batches();

    int expectedBatches = (RECORD_COUNT + maxBatchLen - 1) / maxBatchLen;
    assertEquals(expectedBatches, batches.size());
    for (int i = 0; i < batches.size() - 1; i++) {
      assertEquals(maxBatchLen, batches.get(i).size());
    }
  }

  @ParameterizedTest
  @CsvSource({"21, 15", "22, 40"})
  public void testSizeOnlyBatchesCannotAbsorbNextRecord(long seed, long maxBatchSize) {
    List<String> records = randomRecords(seed);

    List<List<String>> batches =
        Batcher.builder(records)
            .maxBatchSize(maxBatchSize)
            .sizeCalculator(RecordSizes.stringLength())
            .build()
            .batches();

    for (int i = 0; i < batches.size() - 1; i++) {
      long size = batches.get(i).stream().mapToLong(String::length).sum();
      long nextRecordSize = batches.get(i + 1).get(0).length();
      assertTrue(size + nextRecordSize > maxBatchSize);
    }
  }
}
