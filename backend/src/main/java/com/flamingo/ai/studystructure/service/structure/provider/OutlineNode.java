package com.flamingo.ai.studystructure.service.structure.provider;

import java.util.List;

/**
 * A node of a document's bookmark tree.
 *
 * <p>Implementations may load children lazily; callers must not assume the tree is finite or
 * acyclic.
 */
public interface OutlineNode {

  /** Returns the bookmark title, or {@code null} if the bookmark has none. */
  String title();

  /** Returns the bookmark destination, or {@code null} if the bookmark has none. */
  DestinationRef destination();

  /** Returns the child bookmarks in document order. */
  List<OutlineNode> children();
}
