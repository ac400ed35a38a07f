package com.flamingo.ai.studystructure.service.structure.provider;

/** Supplies a document's pages. */
public interface PageProvider {

  int pageCount();

  /**
   * Retrieves one page.
   *
   * <p>Implementations must tolerate calls from several threads.
   *
   * @param pageNumber 1-based page number
   * @return the page's text layer
   * @throws com.flamingo.ai.studystructure.exception.DocumentProviderException if the page cannot
   *     be read
   */
  RenderedPage getPage(int pageNumber);
}
