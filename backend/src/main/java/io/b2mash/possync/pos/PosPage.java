package io.b2mash.possync.pos;

import java.util.List;

/**
 * One page of provider orders. {@code nextCursor} is null on the last page; {@code
 * estimatedTotal} and {@code totalPages} are null when the provider does not say.
 */
public record PosPage(
    List<PosOrder> records, PageCursor nextCursor, Long estimatedTotal, Integer totalPages) {

  public boolean done() {
    return nextCursor == null;
  }
}
