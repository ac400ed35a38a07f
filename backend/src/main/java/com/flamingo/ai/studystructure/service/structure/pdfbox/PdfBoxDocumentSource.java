package com.flamingo.ai.studystructure.service.structure.pdfbox;

import com.flamingo.ai.studystructure.exception.DocumentProviderException;
import com.flamingo.ai.studystructure.service.structure.model.TextRun;
import com.flamingo.ai.studystructure.service.structure.provider.DestinationRef;
import com.flamingo.ai.studystructure.service.structure.provider.DocumentMetadata;
import com.flamingo.ai.studystructure.service.structure.provider.DocumentSource;
import com.flamingo.ai.studystructure.service.structure.provider.OutlineNode;
import com.flamingo.ai.studystructure.service.structure.provider.PageRef;
import com.flamingo.ai.studystructure.service.structure.provider.RenderedPage;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.cos.COSDictionary;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.interactive.action.PDActionGoTo;
import org.apache.pdfbox.pdmodel.interactive.documentnavigation.outline.PDDocumentOutline;
import org.apache.pdfbox.pdmodel.interactive.documentnavigation.outline.PDOutlineItem;
import org.apache.pdfbox.pdmodel.interactive.documentnavigation.outline.PDOutlineNode;

/**
 * {@link DocumentSource} over a loaded {@link PDDocument}.
 *
 * <p>PDDocument is not thread-safe, so page retrieval and closing are serialised on this source. Every {@link
 * IOException} raised by PDFBox surfaces as a {@link DocumentProviderException}.
 */
@Slf4j
public class PdfBoxDocumentSource implements DocumentSource {

  private final PDDocument document;
  private final XmpMetadataReader xmpMetadataReader;

  PdfBoxDocumentSource(PDDocument document, XmpMetadataReader xmpMetadataReader) {
    this.document = document;
    this.xmpMetadataReader = xmpMetadataReader;
  }

  @Override
  public DocumentMetadata getMetadata() {
    PDDocumentInformation info = document.getDocumentInformation();
    DocumentMetadata declared = new DocumentMetadata(info.getTitle(), info.getAuthor());
    if (declared.title() != null && declared.author() != null) {
      return declared;
    }
    DocumentMetadata xmp = xmpMetadataReader.read(document.getDocumentCatalog().getMetadata());
    return new DocumentMetadata(
        declared.title() != null ? declared.title() : xmp.title(),
        declared.author() != null ? declared.author() : xmp.author());
  }

  @Override
  public List<OutlineNode> getOutline() {
    PDDocumentOutline outline = document.getDocumentCatalog().getDocumentOutline();
    if (outline == null) {
      return List.of();
    }
    return childrenOf(outline);
  }

  @Override
  public Optional<PageRef> resolveDestination(DestinationRef destination) {
    if (!(destination instanceof BookmarkDestination bookmarkDestination)) {
      throw new IllegalArgumentException("Destination was not produced by this document");
    }
    PDOutlineItem item = bookmarkDestination.item();
    try {
      return Optional.ofNullable(item.findDestinationPage(document)).map(PdfBoxPageRef::new);
    } catch (IndexOutOfBoundsException e) {
      log.debug("Bookmark '{}' targets a page outside the document", item.getTitle());
      return Optional.empty();
    } catch (IOException e) {
      throw new DocumentProviderException(
          "Failed to resolve bookmark '" + item.getTitle() + "': " + e.getMessage(), e);
    }
  }

  @Override
  public int pageIndexOf(PageRef page) {
    if (!(page instanceof PdfBoxPageRef pdfBoxPage)) {
      throw new IllegalArgumentException("Page was not produced by this document");
    }
    return document.getPages().indexOf(pdfBoxPage.page());
  }

  @Override
  public int pageCount() {
    return document.getNumberOfPages();
  }

  @Override
  public synchronized RenderedPage getPage(int pageNumber) {
    if (pageNumber < 1 || pageNumber > document.getNumberOfPages()) {
      throw new IllegalArgumentException(
          "Page " + pageNumber + " outside 1.." + document.getNumberOfPages());
    }
    try {
      TextRunStripper stripper = new TextRunStripper();
      stripper.setStartPage(pageNumber);
      stripper.setEndPage(pageNumber);
      stripper.getText(document);
      List<TextRun> runs = stripper.getRuns();
      return () -> runs;
    } catch (IOException e) {
      log.error("PDFBox failed to read page {}: {}", pageNumber, e.getMessage());
      throw new DocumentProviderException(
          "Failed to read page " + pageNumber + ": " + e.getMessage(), e, pageNumber);
    }
  }

  @Override
  public synchronized void close() {
    try {
      document.close();
    } catch (IOException e) {
      log.warn("Could not close PDF document: {}", e.getMessage());
    }
  }

  private static List<OutlineNode> childrenOf(PDOutlineNode parent) {
    List<OutlineNode> children = new ArrayList<>();
    Set<COSDictionary> seen = Collections.newSetFromMap(new IdentityHashMap<>());
    for (PDOutlineItem child : parent.children()) {
      if (!seen.add(child.getCOSObject())) {
        log.warn("Bookmark siblings form a cycle at '{}', stopping", child.getTitle());
        break;
      }
      children.add(new BookmarkNode(child));
    }
    return children;
  }

  private static boolean hasDestination(PDOutlineItem item) {
    try {
      return item.getDestination() != null || item.getAction() instanceof PDActionGoTo;
    } catch (IOException e) {
      throw new DocumentProviderException(
          "Failed to read bookmark '" + item.getTitle() + "': " + e.getMessage(), e);
    }
  }

  /** Lazily exposes a PDFBox bookmark; children are read on demand. */
  private record BookmarkNode(PDOutlineItem item) implements OutlineNode {

    @Override
    public String title() {
      return item.getTitle();
    }

    @Override
    public DestinationRef destination() {
      return hasDestination(item) ? new BookmarkDestination(item) : null;
    }

    @Override
    public List<OutlineNode> children() {
      return childrenOf(item);
    }
  }

  private record BookmarkDestination(PDOutlineItem item) implements DestinationRef {}

  private record PdfBoxPageRef(PDPage page) implements PageRef {}
}
