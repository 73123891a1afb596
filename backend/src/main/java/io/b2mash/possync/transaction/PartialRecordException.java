package io.b2mash.possync.transaction;

/** A provider record lacks a field the import cannot do without. Counted, never fatal. */
public class PartialRecordException extends RuntimeException {

  private final String externalId;

  public PartialRecordException(String externalId, String reason) {
    super("Order " + (externalId != null ? externalId : "<no guid>") + ": " + reason);
    this.externalId = externalId;
  }

  public String getExternalId() {
    return externalId;
  }
}
