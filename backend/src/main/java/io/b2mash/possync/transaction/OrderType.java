package io.b2mash.possync.transaction;

public enum OrderType {
  DINE_IN,
  TAKEOUT,
  DELIVERY,
  DRIVE_THROUGH,
  CURBSIDE;

  /** Maps a Toast dining-option behavior. Unknown or missing behaviors count as dine-in. */
  public static OrderType fromDiningBehavior(String behavior) {
    if (behavior == null) {
      return DINE_IN;
    }
    return switch (behavior.toLowerCase()) {
      case "takeout", "take_out" -> TAKEOUT;
      case "delivery" -> DELIVERY;
      case "drive_thru", "drive_through" -> DRIVE_THROUGH;
      case "curbside" -> CURBSIDE;
      default -> DINE_IN;
    };
  }
}
