package io.b2mash.possync.transaction;

public record ImportResult(int imported, int skippedDuplicates, int failed) {

  public static ImportResult empty() {
    return new ImportResult(0, 0, 0);
  }

  public ImportResult plus(ImportResult other) {
    return new ImportResult(
        imported + other.imported,
        skippedDuplicates + other.skippedDuplicates,
        failed + other.failed);
  }

  public int processed() {
    return imported + skippedDuplicates + failed;
  }
}
