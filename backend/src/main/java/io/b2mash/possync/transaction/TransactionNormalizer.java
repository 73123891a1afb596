package io.b2mash.possync.transaction;

import io.b2mash.possync.pos.PosOrder;
import io.b2mash.possync.restaurant.PosType;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.util.List;
import java.util.UUID;
import org.springframework.stereotype.Component;

/** Maps a Toast order onto a {@link PosTransaction}, using the order's primary check. */
@Component
public class TransactionNormalizer {

  // Toast writes offsets without a colon, e.g. 2024-01-15T18:30:00.000+0000
  private static final DateTimeFormatter TOAST_TIMESTAMP =
      new DateTimeFormatterBuilder()
          .appendPattern("yyyy-MM-dd'T'HH:mm:ss")
          .optionalStart()
          .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
          .optionalEnd()
          .appendOffset("+HHMM", "+0000")
          .toFormatter();

  public PosTransaction normalize(
      UUID restaurantId, String syncJobId, PosOrder order, Instant importedAt) {
    String externalId = order.guid();
    if (externalId == null || externalId.isBlank()) {
      throw new PartialRecordException(null, "missing order guid");
    }
    if (order.checks() == null || order.checks().isEmpty()) {
      throw new PartialRecordException(externalId, "no check data");
    }
    var check = order.checks().get(0);
    if (check.totalAmount() == null) {
      throw new PartialRecordException(externalId, "missing totalAmount");
    }
    if (order.openedDate() == null || order.openedDate().isBlank()) {
      throw new PartialRecordException(externalId, "missing openedDate");
    }
    Instant openedAt = parseTimestamp(order.openedDate());
    if (openedAt == null) {
      throw new PartialRecordException(
          externalId, "unparseable openedDate '" + order.openedDate() + "'");
    }

    BigDecimal total = money(check.totalAmount());
    BigDecimal tax = money(check.taxAmount());
    var amounts = new PosTransaction.Amounts(total.subtract(tax), tax, tipOf(check), total);

    return new PosTransaction(
        restaurantId,
        externalId,
        syncJobId,
        PosType.TOAST,
        OrderType.fromDiningBehavior(
            order.diningOption() != null ? order.diningOption().behavior() : null),
        statusOf(order, check),
        paymentMethodOf(check),
        amounts,
        itemCountOf(check),
        employeeOf(order),
        openedAt,
        order.closedDate() != null ? parseTimestamp(order.closedDate()) : null,
        businessDateOf(order.businessDate(), openedAt),
        importedAt);
  }

  static Instant parseTimestamp(String value) {
    try {
      return OffsetDateTime.parse(value, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant();
    } catch (DateTimeParseException e) {
      try {
        return OffsetDateTime.parse(value, TOAST_TIMESTAMP).toInstant();
      } catch (DateTimeParseException unparseable) {
        return null;
      }
    }
  }

  private static LocalDate businessDateOf(String businessDate, Instant openedAt) {
    LocalDate parsed = businessDate != null ? parseBusinessDate(businessDate.trim()) : null;
    return parsed != null ? parsed : openedAt.atZone(ZoneOffset.UTC).toLocalDate();
  }

  // Toast sends yyyyMMdd; ISO dates are accepted as well
  private static LocalDate parseBusinessDate(String value) {
    var formatter =
        value.contains("-") ? DateTimeFormatter.ISO_LOCAL_DATE : DateTimeFormatter.BASIC_ISO_DATE;
    try {
      return LocalDate.parse(value, formatter);
    } catch (DateTimeParseException e) {
      return null;
    }
  }

  private static TransactionStatus statusOf(PosOrder order, PosOrder.Check check) {
    if (Boolean.TRUE.equals(check.voided()) || Boolean.TRUE.equals(order.voided())) {
      return TransactionStatus.VOIDED;
    }
    return "PAID".equalsIgnoreCase(check.paymentStatus())
        ? TransactionStatus.COMPLETED
        : TransactionStatus.PENDING;
  }

  private static PaymentMethod paymentMethodOf(PosOrder.Check check) {
    if (check.payments() == null || check.payments().isEmpty()) {
      return null;
    }
    return PaymentMethod.fromToastPaymentType(check.payments().get(0).paymentType());
  }

  private static BigDecimal tipOf(PosOrder.Check check) {
    List<PosOrder.Payment> payments = check.payments() != null ? check.payments() : List.of();
    return payments.stream()
        .map(PosOrder.Payment::tipAmount)
        .map(TransactionNormalizer::money)
        .reduce(money(null), BigDecimal::add);
  }

  private static int itemCountOf(PosOrder.Check check) {
    if (check.selections() == null) {
      return 0;
    }
    return check.selections().stream()
        .filter(selection -> !Boolean.TRUE.equals(selection.voided()))
        .mapToInt(
            selection ->
                selection.quantity() != null
                    ? selection.quantity().setScale(0, RoundingMode.HALF_UP).intValue()
                    : 1)
        .sum();
  }

  private static String employeeOf(PosOrder order) {
    if (order.server() != null && order.server().guid() != null) {
      return order.server().guid();
    }
    return order.createdEmployee() != null ? order.createdEmployee().guid() : null;
  }

  private static BigDecimal money(BigDecimal value) {
    return (value != null ? value : BigDecimal.ZERO).setScale(2, RoundingMode.HALF_UP);
  }
}
