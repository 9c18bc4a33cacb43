package org.budgetanalyzer.ratesync.service.dto;

/** Counts of an upsert batch, by distinct idempotency key. */
public record UpsertResult(int newRecords, int updatedRecords, int unchangedRecords) {

  public static final UpsertResult EMPTY = new UpsertResult(0, 0, 0);

  /**
   * Number of distinct keys the batch touched.
   *
   * @return new plus updated plus unchanged keys
   */
  public int keysWritten() {
    return newRecords + updatedRecords + unchangedRecords;
  }

  public UpsertResult plus(UpsertResult other) {
    return new UpsertResult(
        newRecords + other.newRecords,
        updatedRecords + other.updatedRecords,
        unchangedRecords + other.unchangedRecords);
  }
}
