package com.rackplay.common.frequency;

/**
 * A row of a word frequency list.
 *
 * @param lemma the base form of the word, lowercase
 * @param zipf the Zipf frequency score, higher is more common
 * @param rank the position in the list, 1 being the most common
 */
public record FrequencyEntry(String lemma, double zipf, int rank) {}
