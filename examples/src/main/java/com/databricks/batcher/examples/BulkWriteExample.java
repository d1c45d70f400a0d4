package com.databricks.batcher.examples;

import com.databricks.batcher.Batcher;
import com.databricks.batcher.OversizedRecordPolicy;
import com.databricks.batcher.RecordSizes;
import com.databricks.batcher.RecordTooLargeException;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import java.util.stream.Stream;

/**
 * Example demonstrating batching of JSON records for a bulk write endpoint.
 *
 * <p>Bulk endpoints typically cap each request by both record count and payload bytes. This example
 * groups JSON strings into requests of at most {@link #MAX_RECORDS_PER_REQUEST} records and {@link
 * #MAX_REQUEST_BYTES} UTF-8 bytes, dropping records that could never fit in a request.
 *
 * <p><b>Use Case:</b> Feeding a bulk API from a finite export where an occasional oversized record
 * should be dropped rather than abort the whole run.
 */
public class BulkWriteExample {

  // Request limits of the target endpoint
  static final int MAX_RECORDS_PER_REQUEST = 100;
  static final long MAX_REQUEST_BYTES = 4 * 1024;
  static final long MAX_RECORD_BYTES = 1024;

  private static final int TOTAL_RECORDS = 1000;

  /** Sends one request per batch and returns the number of requests sent. */
  static int writeAll(Stream<String> records, List<List<String>> sentRequests) {
    Batcher<String> batcher =
        Batcher.builder(records)
            .maxBatchLen(MAX_RECORDS_PER_REQUEST)
            .maxBatchSize(MAX_REQUEST_BYTES)
            .maxRecordSize(MAX_RECORD_BYTES)
            .sizeCalculator(RecordSizes.utf8Length())
            .whenRecordSizeExceeded(OversizedRecordPolicy.SKIP)
            .build();

    int requests = 0;
    for (List<String> batch : batcher) {
      // Replace with a call to your bulk client
      sentRequests.add(batch);
      requests++;
    }
    System.out.println(
        "Sent " + requests + " requests, skipped " + batcher.skippedRecords() + " records");
    return requests;
  }

  static String jsonRecord(int id) {
    // Every 250th record carries a payload too large for any request
    int payloadLength = id % 250 == 249 ? 2048 : 10 + id % 40;
    String payload =
        IntStream.range(0, payloadLength).mapToObj(i -> "x").collect(Collectors.joining());
    return "{\"id\": " + id + ", \"payload\": \"" + payload + "\"}";
  }

  public static void main(String[] args) {
    System.out.println("Starting bulk write batching example...");
    System.out.println("=======================================");

    try {
      List<List<String>> sentRequests = new ArrayList<>();
      long startTime = System.currentTimeMillis();

      Stream<String> records =
          IntStream.range(0, TOTAL_RECORDS).mapToObj(BulkWriteExample::jsonRecord);
      int requests = writeAll(records, sentRequests);

      long duration = System.currentTimeMillis() - startTime;
      System.out.println("\n=======================================");
      System.out.println("Batched " + TOTAL_RECORDS + " records into " + requests + " requests");
      System.out.println("Duration: " + duration + " ms");
    } catch (RecordTooLargeException e) {
      System.err.println("\nRecord did not fit: " + e.getMessage());
      System.exit(1);
    }
  }
}
