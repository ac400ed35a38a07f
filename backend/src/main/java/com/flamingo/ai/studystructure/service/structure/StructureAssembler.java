package com.flamingo.ai.studystructure.service.structure;

import com.flamingo.ai.studystructure.service.structure.model.Chapter;
import com.flamingo.ai.studystructure.service.structure.model.DocumentStructure;
import com.flamingo.ai.studystructure.service.structure.model.TocEntry;
import com.flamingo.ai.studystructure.service.structure.provider.DocumentMetadata;
import java.util.List;
import org.springframework.stereotype.Service;

/** Combines the extraction results into the final {@link DocumentStructure}. */
@Service
public class StructureAssembler {

  static final String DEFAULT_TITLE = "Untitled Document";

  public DocumentStructure assemble(
      DocumentMetadata metadata,
      List<Chapter> chapters,
      List<TocEntry> tableOfContents,
      int totalPages) {
    int estimatedTokens = chapters.stream().mapToInt(Chapter::estimatedTokens).sum();
    String title = metadata.title() != null ? metadata.title() : DEFAULT_TITLE;
    return new DocumentStructure(
        title, metadata.author(), chapters, tableOfContents, totalPages, estimatedTokens);
  }
}
