package com.flamingo.ai.studystructure.service.structure.provider;

import java.util.List;
import java.util.Optional;

/** Supplies a document's bookmark tree and resolves bookmark destinations to pages. */
public interface OutlineProvider {

  /**
   * Returns the top-level bookmarks.
   *
   * @return the roots of the bookmark tree; empty when the document has no outline
   */
  List<OutlineNode> getOutline();

  /**
   * Resolves a destination to the page it points at.
   *
   * @param destination a destination obtained from this provider's outline
   * @return the target page, or empty if the destination does not point at a page
   */
  Optional<PageRef> resolveDestination(DestinationRef destination);

  /**
   * Returns the zero-based index of a page.
   *
   * @param page a page obtained from {@link #resolveDestination}
   * @return the page index, or -1 if the page is not part of the document
   */
  int pageIndexOf(PageRef page);
}
