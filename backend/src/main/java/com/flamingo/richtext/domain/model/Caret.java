package com.flamingo.richtext.domain.model;

/**
 * A caret position expressed against a stable address.
 *
 * @param address the address of the run holding the caret
 * @param offset character offset inside that run
 */
public record Caret(String address, int offset) {}
