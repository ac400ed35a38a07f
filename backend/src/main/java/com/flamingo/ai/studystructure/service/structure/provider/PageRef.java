package com.flamingo.ai.studystructure.service.structure.provider;

/** Opaque handle to a page, only meaningful to the {@link OutlineProvider} that produced it. */
public interface PageRef {}
