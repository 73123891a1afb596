package io.b2mash.possync.pos;

/** Position in a page-numbered fetch, starting at page 1. */
public record PageCursor(int pageNumber) {

  public static PageCursor firstPage() {
    return new PageCursor(1);
  }

  public PageCursor nextPage() {
    return new PageCursor(pageNumber + 1);
  }
}
