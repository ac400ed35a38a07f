package com.flamingo.ai.studystructure.service.structure.provider;

/** Supplies a document's declared title and author. */
public interface MetadataProvider {

  /**
   * Returns the document's metadata.
   *
   * @return metadata, never {@code null}; fields are {@code null} when the document declares none
   * @throws com.flamingo.ai.studystructure.exception.DocumentProviderException if the metadata
   *     cannot be read
   */
  DocumentMetadata getMetadata();
}
