package com.flamingo.richtext.service.editor;

/** Serialized document ready for download. */
public record ExportedDocument(byte[] content, String contentType, String fileName) {}
