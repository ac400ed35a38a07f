package com.flamingo.ai.studystructure.service.structure.model;

/**
 * Font size and name assumed to mark a heading.
 *
 * @param fontSize size rounded to one decimal
 * @param fontName font name
 */
public record HeadingSignature(float fontSize, String fontName) {}
