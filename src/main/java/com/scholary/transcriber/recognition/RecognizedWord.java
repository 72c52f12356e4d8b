package com.scholary.transcriber.recognition;

/**
 * One word as returned by the speech service.
 *
 * <p>Times are seconds from the start of the submitted audio. {@code speakerTag} is 0 when the
 * service did not diarize the word.
 */
public record RecognizedWord(String word, double startSeconds, double endSeconds, int speakerTag) {}
