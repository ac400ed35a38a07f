package com.flamingo.ai.studystructure.service.structure.provider;

/**
 * An opened document exposing all three provider capabilities. Owned by a single extraction run and
 * closed when the run finishes.
 */
public interface DocumentSource
    extends MetadataProvider, OutlineProvider, PageProvider, AutoCloseable {

  @Override
  void close();
}
