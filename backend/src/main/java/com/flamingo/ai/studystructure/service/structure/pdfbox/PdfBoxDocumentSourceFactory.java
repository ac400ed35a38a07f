package com.flamingo.ai.studystructure.service.structure.pdfbox;

import com.flamingo.ai.studystructure.exception.DocumentProviderException;
import com.flamingo.ai.studystructure.service.structure.provider.DocumentSource;
import com.flamingo.ai.studystructure.service.structure.provider.DocumentSourceFactory;
import java.io.IOException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.springframework.stereotype.Service;

/** {@link DocumentSourceFactory} for PDF documents, backed by Apache PDFBox 3.x. */
@Service
@RequiredArgsConstructor
@Slf4j
public class PdfBoxDocumentSourceFactory implements DocumentSourceFactory {

  private final XmpMetadataReader xmpMetadataReader;

  @Override
  public DocumentSource open(byte[] documentBytes) {
    try {
      PDDocument document = Loader.loadPDF(documentBytes);
      log.debug("Loaded PDF with {} pages", document.getNumberOfPages());
      return new PdfBoxDocumentSource(document, xmpMetadataReader);
    } catch (IOException e) {
      log.error("PDFBox failed to load document: {}", e.getMessage());
      throw new DocumentProviderException("Failed to load PDF: " + e.getMessage(), e);
    }
  }
}
