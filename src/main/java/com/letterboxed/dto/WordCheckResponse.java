package com.letterboxed.dto;

/**
 * How a word relates to a board.
 *
 * @param word the normalized word
 * @param inDictionary whether the base dictionary holds it
 * @param greedyPlayable whether the solver's greedy placement accepts it
 * @param playable whether any placement on the board exists
 */
public record WordCheckResponse(
    String word, boolean inDictionary, boolean greedyPlayable, boolean playable) {}
