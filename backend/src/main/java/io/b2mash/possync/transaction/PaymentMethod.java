package io.b2mash.possync.transaction;

public enum PaymentMethod {
  CASH,
  CREDIT_CARD,
  DEBIT_CARD,
  GIFT_CARD,
  LOYALTY_POINTS,
  OTHER;

  public static PaymentMethod fromToastPaymentType(String paymentType) {
    if (paymentType == null) {
      return OTHER;
    }
    return switch (paymentType.toLowerCase()) {
      case "cash" -> CASH;
      case "credit", "credit_card" -> CREDIT_CARD;
      case "debit", "debit_card" -> DEBIT_CARD;
      case "gift_card" -> GIFT_CARD;
      case "loyalty" -> LOYALTY_POINTS;
      default -> OTHER;
    };
  }
}
