package io.b2mash.possync.transaction;

import io.b2mash.possync.restaurant.PosType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.math.BigDecimal;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.UUID;

/**
 * An imported POS order. {@code (restaurantId, externalId)} is unique, which makes re-imports
 * no-ops.
 */
@Entity
@Table(
    name = "pos_transactions",
    uniqueConstraints =
        @UniqueConstraint(
            name = "uq_pos_transactions_restaurant_external",
            columnNames = {"restaurant_id", "external_id"}))
public class PosTransaction {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "restaurant_id", nullable = false)
  private UUID restaurantId;

  @Column(name = "external_id", nullable = false, length = 100)
  private String externalId;

  @Column(name = "sync_job_id", length = 100)
  private String syncJobId;

  @Enumerated(EnumType.STRING)
  @Column(name = "pos_type", nullable = false, length = 20)
  private PosType posType;

  @Enumerated(EnumType.STRING)
  @Column(name = "order_type", nullable = false, length = 20)
  private OrderType orderType;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private TransactionStatus status;

  @Enumerated(EnumType.STRING)
  @Column(name = "payment_method", length = 20)
  private PaymentMethod paymentMethod;

  @Column(name = "subtotal", nullable = false, precision = 12, scale = 2)
  private BigDecimal subtotal;

  @Column(name = "tax", nullable = false, precision = 12, scale = 2)
  private BigDecimal tax;

  @Column(name = "tip", nullable = false, precision = 12, scale = 2)
  private BigDecimal tip;

  @Column(name = "total_amount", nullable = false, precision = 12, scale = 2)
  private BigDecimal totalAmount;

  @Column(name = "item_count", nullable = false)
  private int itemCount;

  @Column(name = "employee_external_id", length = 100)
  private String employeeExternalId;

  @Column(name = "opened_at", nullable = false)
  private Instant openedAt;

  @Column(name = "closed_at")
  private Instant closedAt;

  @Column(name = "business_date", nullable = false)
  private LocalDate businessDate;

  @Column(name = "hour_of_day", nullable = false)
  private int hourOfDay;

  @Enumerated(EnumType.STRING)
  @Column(name = "day_of_week", nullable = false, length = 10)
  private DayOfWeek dayOfWeek;

  @Column(name = "imported_at", nullable = false, updatable = false)
  private Instant importedAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected PosTransaction() {}

  PosTransaction(
      UUID restaurantId,
      String externalId,
      String syncJobId,
      PosType posType,
      OrderType orderType,
      TransactionStatus status,
      PaymentMethod paymentMethod,
      Amounts amounts,
      int itemCount,
      String employeeExternalId,
      Instant openedAt,
      Instant closedAt,
      LocalDate businessDate,
      Instant importedAt) {
    this.restaurantId = restaurantId;
    this.externalId = externalId;
    this.syncJobId = syncJobId;
    this.posType = posType;
    this.orderType = orderType;
    this.status = status;
    this.paymentMethod = paymentMethod;
    this.subtotal = amounts.subtotal();
    this.tax = amounts.tax();
    this.tip = amounts.tip();
    this.totalAmount = amounts.total();
    this.itemCount = itemCount;
    this.employeeExternalId = employeeExternalId;
    this.openedAt = openedAt;
    this.closedAt = closedAt;
    this.businessDate = businessDate;
    this.importedAt = importedAt;
    this.updatedAt = importedAt;
    deriveTimeFields();
  }

  /**
   * Recomputes the UTC analytic fields from {@code openedAt}.
   *
   * @return true if anything changed
   */
  public boolean refreshDerivedFields(Instant now) {
    int previousHour = hourOfDay;
    DayOfWeek previousDay = dayOfWeek;
    deriveTimeFields();
    boolean changed = previousHour != hourOfDay || previousDay != dayOfWeek;
    if (changed) {
      this.updatedAt = now;
    }
    return changed;
  }

  private void deriveTimeFields() {
    var utc = openedAt.atZone(ZoneOffset.UTC);
    this.hourOfDay = utc.getHour();
    this.dayOfWeek = utc.getDayOfWeek();
  }

  record Amounts(BigDecimal subtotal, BigDecimal tax, BigDecimal tip, BigDecimal total) {}

  public UUID getId() {
    return id;
  }

  public UUID getRestaurantId() {
    return restaurantId;
  }

  public String getExternalId() {
    return externalId;
  }

  public String getSyncJobId() {
    return syncJobId;
  }

  public PosType getPosType() {
    return posType;
  }

  public OrderType getOrderType() {
    return orderType;
  }

  public TransactionStatus getStatus() {
    return status;
  }

  public PaymentMethod getPaymentMethod() {
    return paymentMethod;
  }

  public BigDecimal getSubtotal() {
    return subtotal;
  }

  public BigDecimal getTax() {
    return tax;
  }

  public BigDecimal getTip() {
    return tip;
  }

  public BigDecimal getTotalAmount() {
    return totalAmount;
  }

  public int getItemCount() {
    return itemCount;
  }

  public String getEmployeeExternalId() {
    return employeeExternalId;
  }

  public Instant getOpenedAt() {
    return openedAt;
  }

  public Instant getClosedAt() {
    return closedAt;
  }

  public LocalDate getBusinessDate() {
    return businessDate;
  }

  public int getHourOfDay() {
    return hourOfDay;
  }

  public DayOfWeek getDayOfWeek() {
    return dayOfWeek;
  }

  public Instant getImportedAt() {
    return importedAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
