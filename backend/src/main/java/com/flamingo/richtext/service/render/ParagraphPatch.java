package com.flamingo.richtext.service.render;

/**
 * Re-rendered single paragraph, sent instead of the whole page when an edit stays inside it.
 *
 * @param paragraphIndex zero-based position of the paragraph in the document
 * @param nodeId an address inside the paragraph, for locating it in the client's markup
 * @param html the {@code <p>} fragment
 */
public record ParagraphPatch(int paragraphIndex, String nodeId, String html) {}
