package com.flamingo.richtext.exception;

import java.util.List;

/** Exception thrown in strict addressing mode when a request names an unbound address. */
public class AddressNotFoundException extends RuntimeException {

  private final List<String> addresses;

  public AddressNotFoundException(List<String> addresses) {
    super("Address not found: " + String.join(", ", addresses));
    this.addresses = List.copyOf(addresses);
  }

  public List<String> getAddresses() {
    return addresses;
  }
}
