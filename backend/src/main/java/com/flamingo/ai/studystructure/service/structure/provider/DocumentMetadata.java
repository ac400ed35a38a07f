package com.flamingo.ai.studystructure.service.structure.provider;

/**
 * Descriptive metadata declared by a document.
 *
 * @param title declared title; {@code null} when absent or blank
 * @param author declared author; {@code null} when absent or blank
 */
public record DocumentMetadata(String title, String author) {

  public DocumentMetadata {
    title = blankToNull(title);
    author = blankToNull(author);
  }

  public static DocumentMetadata empty() {
    return new DocumentMetadata(null, null);
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value;
  }
}
