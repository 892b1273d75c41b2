package com.flamingo.richtext.service.render;

/**
 * Paging of a document by a fixed number of paragraphs per page.
 *
 * @param pageIndex one-based page actually served
 * @param pageCount total pages, at least one
 * @param fromParagraph first paragraph index on the page
 * @param toParagraph paragraph index one past the last on the page
 */
public record PageLayout(int pageIndex, int pageCount, int fromParagraph, int toParagraph) {

  /** Lays out {@code paragraphCount} paragraphs and clamps {@code requestedPage} into range. */
  public static PageLayout of(int paragraphCount, int paragraphsPerPage, int requestedPage) {
    int perPage = Math.max(1, paragraphsPerPage);
    int pageCount = Math.max(1, (paragraphCount + perPage - 1) / perPage);
    int pageIndex = Math.max(1, Math.min(requestedPage, pageCount));
    int from = Math.min((pageIndex - 1) * perPage, paragraphCount);
    int to = Math.min(from + perPage, paragraphCount);
    return new PageLayout(pageIndex, pageCount, from, to);
  }

  public boolean contains(int paragraphIndex) {
    return paragraphIndex >= fromParagraph && paragraphIndex < toParagraph;
  }
}
