package com.flamingo.ai.studystructure.service.structure;

import static com.flamingo.ai.studystructure.service.structure.FakeDocumentSource.bookmark;
import static com.flamingo.ai.studystructure.service.structure.StructureTestData.HEADING_FONT;
import static com.flamingo.ai.studystructure.service.structure.StructureTestData.body;
import static com.flamingo.ai.studystructure.service.structure.StructureTestData.bodyPages;
import static com.flamingo.ai.studystructure.service.structure.StructureTestData.page;
import static com.flamingo.ai.studystructure.service.structure.StructureTestData.run;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.studystructure.config.StructureConfig;
import com.flamingo.ai.studystructure.exception.DocumentProviderException;
import com.flamingo.ai.studystructure.service.structure.model.Chapter;
import com.flamingo.ai.studystructure.service.structure.model.DocumentStructure;
import com.flamingo.ai.studystructure.service.structure.model.PageContent;
import com.flamingo.ai.studystructure.service.structure.model.Section;
import com.flamingo.ai.studystructure.service.structure.provider.DocumentMetadata;
import com.flamingo.ai.studystructure.service.structure.provider.DocumentSource;
import com.flamingo.ai.studystructure.service.structure.provider.DocumentSourceFactory;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/** Runs the full {@link DocumentStructureExtractor} pipeline over in-memory sources. */
@ExtendWith(MockitoExtension.class)
class DocumentStructureExtractorTest {

  private static final byte[] DOCUMENT_BYTES = {'%', 'P', 'D', 'F'};

  @Mock private DocumentSourceFactory documentSourceFactory;

  private MeterRegistry meterRegistry;
  private DocumentStructureExtractor extractor;

  @BeforeEach
  void setUp() {
    StructureConfig config = new StructureConfig();
    meterRegistry = new SimpleMeterRegistry();
    extractor =
        new DocumentStructureExtractor(
            documentSourceFactory,
            new TableOfContentsFlattener(config),
            new PageCollector(Runnable::run, config),
            new HeadingPatternAnalyzer(),
            new ChapterBoundaryDetector(config),
            StructureTestData.chapterProcessor(config),
            new StructureAssembler(),
            meterRegistry);
  }

  private DocumentStructure extract(FakeDocumentSource source) {
    when(documentSourceFactory.open(any())).thenReturn(source);
    return extractor.extractStructure(DOCUMENT_BYTES);
  }

  private double boundaryCount(String source) {
    return meterRegistry.counter("structure.boundaries", "source", source).count();
  }

  @Nested
  @DisplayName("Chapter boundaries")
  class ChapterBoundaries {

    @Test
    @DisplayName("Single blank page yields one Chapter with one Content section")
    void shouldExtractSingleBlankPage() {
      DocumentStructure structure = extract(FakeDocumentSource.of(List.of(page(1))));

      assertThat(structure.totalPages()).isEqualTo(1);
      assertThat(structure.chapters()).hasSize(1);
      Chapter chapter = structure.chapters().get(0);
      assertThat(chapter.id()).isEqualTo("chapter-0");
      assertThat(chapter.title()).isEqualTo("Chapter");
      assertThat(chapter.sections())
          .extracting(Section::title, Section::startPage, Section::endPage, Section::concepts)
          .containsExactly(tuple("Content", 1, 1, List.of()));
      assertThat(boundaryCount("none")).isEqualTo(1.0);
    }

    @Test
    void shouldSplitChapters_atTopLevelBookmarks() {
      FakeDocumentSource source =
          new FakeDocumentSource(
              DocumentMetadata.empty(),
              List.of(bookmark("Part A", 1, bookmark("A.1", 3)), bookmark("Part B", 6)),
              bodyPages(10));

      DocumentStructure structure = extract(source);

      assertThat(structure.chapters())
          .extracting(Chapter::id, Chapter::startPage, Chapter::endPage)
          .containsExactly(tuple("chapter-0", 1, 5), tuple("chapter-1", 6, 10));
      assertThat(structure.tableOfContents()).hasSize(3);
      assertThat(boundaryCount("outline")).isEqualTo(1.0);
    }

    @Test
    void shouldSplitChapters_atKeywordHeadingsInDominantFont() {
      List<PageContent> pages =
          List.of(
              page(1, run("Chapter 1", 24f, HEADING_FONT), body("Cells are small.")),
              page(2, body("More about cells.")),
              page(3, run("CHAPTER 2", 24f, HEADING_FONT), body("Energy flows.")),
              page(4, body("Conclusion.")));

      DocumentStructure structure = extract(FakeDocumentSource.of(pages));

      assertThat(structure.chapters())
          .extracting(Chapter::title, Chapter::startPage, Chapter::endPage)
          .containsExactly(tuple("Chapter 1", 1, 2), tuple("CHAPTER 2", 3, 4));
      assertThat(boundaryCount("heading_font")).isEqualTo(1.0);
    }

    @Test
    void shouldReturnNoChapters_forEmptyDocument() {
      DocumentStructure structure = extract(FakeDocumentSource.of(List.of()));

      assertThat(structure.totalPages()).isZero();
      assertThat(structure.chapters()).isEmpty();
      assertThat(structure.estimatedTokens()).isZero();
    }
  }

  @Nested
  @DisplayName("Structure invariants")
  class Invariants {

    private FakeDocumentSource mixedDocument() {
      List<PageContent> pages = new ArrayList<>();
      pages.add(page(1, run("Chapter 1 Cells", 24f, HEADING_FONT), body("Intro text.")));
      pages.add(page(2, run("1.1 Membranes", 16f, HEADING_FONT), body("Osmosis refers to flow.")));
      pages.add(page(3, body("Still membranes.")));
      pages.add(page(4, run("Chapter 2 Energy", 24f, HEADING_FONT), body("ATP: Adenosine.")));
      pages.add(page(5, run("SUMMARY", 16f, HEADING_FONT), body("Energy is defined as work.")));
      pages.add(page(6, body("Appendix.")));
      return new FakeDocumentSource(
          new DocumentMetadata("Biology", "J. Doe"),
          List.of(bookmark("Cells", 1), bookmark("Energy", 4)),
          pages);
    }

    @Test
    void shouldPartitionPages_intoChaptersAndSections() {
      DocumentStructure structure = extract(mixedDocument());

      int expectedChapterStart = 1;
      for (Chapter chapter : structure.chapters()) {
        assertThat(chapter.startPage()).isEqualTo(expectedChapterStart);
        assertThat(chapter.sections()).isNotEmpty();
        int expectedSectionStart = chapter.startPage();
        for (Section section : chapter.sections()) {
          assertThat(section.startPage()).isEqualTo(expectedSectionStart);
          assertThat(section.endPage()).isBetween(section.startPage(), chapter.endPage());
          assertThat(section.concepts()).hasSizeLessThanOrEqualTo(10);
          expectedSectionStart = section.endPage() + 1;
        }
        assertThat(expectedSectionStart).isEqualTo(chapter.endPage() + 1);
        expectedChapterStart = chapter.endPage() + 1;
      }
      assertThat(expectedChapterStart).isEqualTo(structure.totalPages() + 1);
    }

    @Test
    void shouldSumTokens_acrossSectionsAndChapters() {
      DocumentStructure structure = extract(mixedDocument());

      for (Chapter chapter : structure.chapters()) {
        assertThat(chapter.estimatedTokens())
            .isEqualTo(chapter.sections().stream().mapToInt(Section::estimatedTokens).sum());
      }
      assertThat(structure.estimatedTokens())
          .isPositive()
          .isEqualTo(structure.chapters().stream().mapToInt(Chapter::estimatedTokens).sum());
    }

    @Test
    void shouldCarryMetadataAndConcepts() {
      DocumentStructure structure = extract(mixedDocument());

      assertThat(structure.title()).isEqualTo("Biology");
      assertThat(structure.author()).isEqualTo("J. Doe");
      assertThat(structure.chapters().get(0).sections())
          .extracting(Section::title)
          .containsExactly("Section 1", "1.1 Membranes");
      assertThat(structure.chapters().get(0).sections().get(1).concepts())
          .containsExactly("Osmosis");
      assertThat(structure.chapters().get(1).sections().get(1).concepts())
          .containsExactly("Energy");
    }

    @Test
    void shouldBeDeterministic() {
      DocumentStructure first = extract(mixedDocument());
      DocumentStructure second = extractor.extractStructure(mixedDocument());

      assertThat(second).isEqualTo(first);
    }
  }

  @Nested
  @DisplayName("Failures")
  class Failures {

    @Test
    void shouldRejectNullOrEmptyBytes() {
      assertThatThrownBy(() -> extractor.extractStructure((byte[]) null))
          .isInstanceOf(IllegalArgumentException.class);
      assertThatThrownBy(() -> extractor.extractStructure(new byte[0]))
          .isInstanceOf(IllegalArgumentException.class);
      verify(documentSourceFactory, never()).open(any());
    }

    @Test
    void shouldPropagateLoadFailure_unchanged() {
      DocumentProviderException failure = new DocumentProviderException("not a PDF");
      when(documentSourceFactory.open(any())).thenThrow(failure);

      assertThatThrownBy(() -> extractor.extractStructure(DOCUMENT_BYTES)).isSameAs(failure);
    }

    @Test
    void shouldPropagatePageFailure_andCloseSource() {
      DocumentProviderException failure = new DocumentProviderException("bad page", null, 2);
      DocumentSource source = mock(DocumentSource.class);
      when(source.getMetadata()).thenReturn(DocumentMetadata.empty());
      when(source.getOutline()).thenReturn(List.of());
      when(source.pageCount()).thenReturn(3);
      when(source.getPage(anyInt())).thenThrow(failure);
      when(documentSourceFactory.open(any())).thenReturn(source);

      assertThatThrownBy(() -> extractor.extractStructure(DOCUMENT_BYTES)).isSameAs(failure);
      verify(source).close();
    }

    @Test
    void shouldCloseSource_afterSuccessfulExtraction() {
      FakeDocumentSource source = FakeDocumentSource.of(List.of(page(1)));

      extract(source);

      assertThat(source.isClosed()).isTrue();
    }
  }
}
