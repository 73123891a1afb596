package io.b2mash.possync.pos;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.math.BigDecimal;
import java.util.List;

/**
 * The subset of a Toast order the import needs. Unknown fields are ignored; everything else is
 * optional and validated during normalization.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PosOrder(
    String guid,
    String businessDate,
    String openedDate,
    String closedDate,
    Boolean voided,
    DiningOption diningOption,
    EntityRef server,
    EntityRef createdEmployee,
    List<Check> checks) {

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record DiningOption(String guid, String behavior) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record EntityRef(String guid) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Check(
      String guid,
      BigDecimal taxAmount,
      BigDecimal totalAmount,
      Boolean voided,
      String paymentStatus,
      List<Payment> payments,
      List<Selection> selections) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Payment(
      String guid,
      String paymentType,
      BigDecimal amount,
      BigDecimal tipAmount,
      String paidDate) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Selection(String guid, BigDecimal quantity, BigDecimal price, Boolean voided) {}
}
