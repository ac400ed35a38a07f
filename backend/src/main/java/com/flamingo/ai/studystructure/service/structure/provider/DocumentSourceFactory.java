package com.flamingo.ai.studystructure.service.structure.provider;

/** Opens raw document bytes as a {@link DocumentSource}. */
public interface DocumentSourceFactory {

  /**
   * Opens a document.
   *
   * <p>The caller owns the returned source and must close it.
   *
   * @param documentBytes raw document bytes
   * @return the opened document
   * @throws com.flamingo.ai.studystructure.exception.DocumentProviderException if the bytes cannot
   *     be decoded
   */
  DocumentSource open(byte[] documentBytes);
}
