package io.b2mash.possync.transaction;

public enum TransactionStatus {
  COMPLETED,
  VOIDED,
  PENDING
}
