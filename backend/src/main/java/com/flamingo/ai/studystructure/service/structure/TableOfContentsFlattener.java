package com.flamingo.ai.studystructure.service.structure;

import com.flamingo.ai.studystructure.config.StructureConfig;
import com.flamingo.ai.studystructure.service.structure.model.TocEntry;
import com.flamingo.ai.studystructure.service.structure.provider.DestinationRef;
import com.flamingo.ai.studystructure.service.structure.provider.OutlineNode;
import com.flamingo.ai.studystructure.service.structure.provider.OutlineProvider;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Flattens a bookmark tree into {@link TocEntry} values in document (pre-)order.
 *
 * <p>Traversal uses an explicit stack so arbitrarily deep outlines cannot exhaust the call stack.
 * Bookmarks without a title are skipped but their children are still visited one level deeper.
 * Bookmarks whose destination is missing or does not resolve to a page of the document point at
 * page 1.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TableOfContentsFlattener {

  private final StructureConfig structureConfig;

  /**
   * Flattens the outline of a document.
   *
   * @param outlineProvider the document's outline
   * @return entries in document order with ids {@code toc-0}, {@code toc-1}, ...
   */
  public List<TocEntry> flatten(OutlineProvider outlineProvider) {
    List<OutlineNode> roots = outlineProvider.getOutline();
    if (roots == null || roots.isEmpty()) {
      return List.of();
    }

    int maxEntries = structureConfig.getOutline().getMaxEntries();
    List<TocEntry> entries = new ArrayList<>();
    Deque<PendingNode> stack = new ArrayDeque<>();
    pushChildren(stack, roots, 0);

    int visited = 0;
    while (!stack.isEmpty()) {
      if (visited++ >= maxEntries) {
        log.warn("Outline exceeds {} bookmarks, ignoring the remainder", maxEntries);
        break;
      }
      PendingNode pending = stack.pop();
      OutlineNode node = pending.node();
      String title = node.title();
      if (title != null && !title.isEmpty()) {
        entries.add(
            new TocEntry(
                title,
                resolvePageNumber(outlineProvider, node.destination()),
                pending.level(),
                "toc-" + entries.size()));
      }
      pushChildren(stack, node.children(), pending.level() + 1);
    }

    log.debug("Flattened outline into {} entries", entries.size());
    return entries;
  }

  private static void pushChildren(Deque<PendingNode> stack, List<OutlineNode> nodes, int level) {
    if (nodes == null) {
      return;
    }
    // reverse so the first child is popped first
    for (int i = nodes.size() - 1; i >= 0; i--) {
      stack.push(new PendingNode(nodes.get(i), level));
    }
  }

  private static int resolvePageNumber(OutlineProvider outlineProvider, DestinationRef destination) {
    if (destination == null) {
      return 1;
    }
    int pageIndex =
        outlineProvider.resolveDestination(destination).map(outlineProvider::pageIndexOf).orElse(-1);
    return pageIndex >= 0 ? pageIndex + 1 : 1;
  }

  private record PendingNode(OutlineNode node, int level) {}
}
