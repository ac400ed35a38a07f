package com.flamingo.ai.studystructure.service.structure.pdfbox;

import com.flamingo.ai.studystructure.service.structure.provider.DocumentMetadata;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.common.PDMetadata;
import org.apache.xmpbox.XMPMetadata;
import org.apache.xmpbox.schema.DublinCoreSchema;
import org.apache.xmpbox.type.BadFieldValueException;
import org.apache.xmpbox.xml.DomXmpParser;
import org.apache.xmpbox.xml.XmpParsingException;
import org.springframework.stereotype.Component;

/**
 * Reads title and author from a PDF's XMP packet (Dublin Core {@code dc:title} and the first {@code
 * dc:creator}).
 *
 * <p>XMP only backs up the document information dictionary, so an unreadable packet is logged and
 * treated as empty.
 */
@Component
@Slf4j
public class XmpMetadataReader {

  public DocumentMetadata read(PDMetadata metadata) {
    if (metadata == null) {
      return DocumentMetadata.empty();
    }
    try (InputStream xmpStream = metadata.exportXMPMetadata()) {
      DomXmpParser parser = new DomXmpParser();
      parser.setStrictParsing(false);
      XMPMetadata xmp = parser.parse(xmpStream);
      DublinCoreSchema dublinCore = xmp.getDublinCoreSchema();
      if (dublinCore == null) {
        return DocumentMetadata.empty();
      }
      List<String> creators = dublinCore.getCreators();
      String author = creators == null || creators.isEmpty() ? null : creators.get(0);
      return new DocumentMetadata(dublinCore.getTitle(), author);
    } catch (IOException | XmpParsingException | BadFieldValueException e) {
      log.warn("Ignoring unreadable XMP metadata: {}", e.getMessage());
      return DocumentMetadata.empty();
    }
  }
}
