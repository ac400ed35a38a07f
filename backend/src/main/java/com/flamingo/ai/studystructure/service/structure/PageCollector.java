package com.flamingo.ai.studystructure.service.structure;

import com.flamingo.ai.studystructure.config.StructureConfig;
import com.flamingo.ai.studystructure.exception.DocumentProviderException;
import com.flamingo.ai.studystructure.service.structure.model.PageContent;
import com.flamingo.ai.studystructure.service.structure.provider.PageProvider;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Retrieves every page of a document, in page order.
 *
 * <p>With {@code structure.page-retrieval.parallelism} above 1, pages are fetched concurrently on
 * the {@code pageRetrievalExecutor}, at most {@code parallelism} at a time, and reassembled in page
 * order. The first failed retrieval cancels the pages in flight and fails the whole collection;
 * later pages are never requested.
 */
@Service
@Slf4j
public class PageCollector {

  private final Executor pageRetrievalExecutor;
  private final StructureConfig structureConfig;

  public PageCollector(
      @Qualifier("pageRetrievalExecutor") Executor pageRetrievalExecutor,
      StructureConfig structureConfig) {
    this.pageRetrievalExecutor = pageRetrievalExecutor;
    this.structureConfig = structureConfig;
  }

  /**
   * Collects all pages.
   *
   * @param pageProvider the document's pages
   * @return one {@link PageContent} per page, ordered by page number
   * @throws DocumentProviderException if a page cannot be retrieved
   */
  public List<PageContent> collect(PageProvider pageProvider) {
    int pageCount = pageProvider.pageCount();
    if (pageCount <= 0) {
      return List.of();
    }
    int parallelism = structureConfig.getPageRetrieval().getParallelism();
    if (parallelism <= 1) {
      List<PageContent> pages = new ArrayList<>(pageCount);
      for (int pageNumber = 1; pageNumber <= pageCount; pageNumber++) {
        pages.add(fetch(pageProvider, pageNumber));
      }
      return pages;
    }
    return collectConcurrently(pageProvider, pageCount, parallelism);
  }

  private List<PageContent> collectConcurrently(
      PageProvider pageProvider, int pageCount, int parallelism) {
    List<PageContent> pages = new ArrayList<>(pageCount);
    for (int first = 1; first <= pageCount; first += parallelism) {
      int last = Math.min(pageCount, first + parallelism - 1);
      pages.addAll(collectWindow(pageProvider, first, last));
    }
    return pages;
  }

  private List<PageContent> collectWindow(PageProvider pageProvider, int first, int last) {
    List<CompletableFuture<PageContent>> futures = new ArrayList<>(last - first + 1);
    try {
      for (int pageNumber = first; pageNumber <= last; pageNumber++) {
        int current = pageNumber;
        futures.add(
            CompletableFuture.supplyAsync(
                () -> fetch(pageProvider, current), pageRetrievalExecutor));
      }
    } catch (RejectedExecutionException e) {
      cancelAll(futures);
      int rejectedPage = first + futures.size();
      throw new DocumentProviderException(
          "Page retrieval rejected at page " + rejectedPage, e, rejectedPage);
    }

    List<PageContent> pages = new ArrayList<>(futures.size());
    try {
      for (CompletableFuture<PageContent> future : futures) {
        pages.add(future.get());
      }
      return pages;
    } catch (InterruptedException e) {
      cancelAll(futures);
      Thread.currentThread().interrupt();
      throw new DocumentProviderException("Page retrieval interrupted", e);
    } catch (ExecutionException e) {
      cancelAll(futures);
      Throwable cause = e.getCause();
      if (cause instanceof RuntimeException runtimeException) {
        throw runtimeException;
      }
      if (cause instanceof Error error) {
        throw error;
      }
      throw new DocumentProviderException("Page retrieval failed: " + cause.getMessage(), cause);
    }
  }

  private static PageContent fetch(PageProvider pageProvider, int pageNumber) {
    return PageContent.of(pageNumber, pageProvider.getPage(pageNumber).getTextRuns());
  }

  private static void cancelAll(List<CompletableFuture<PageContent>> futures) {
    int cancelled = 0;
    for (CompletableFuture<PageContent> future : futures) {
      if (future.cancel(true)) {
        cancelled++;
      }
    }
    log.debug("Cancelled {} outstanding page retrievals", cancelled);
  }
}
