package io.b2mash.possync.restaurant;

public enum PosType {
  TOAST
}
