package com.flamingo.ai.pagereader.service.retrieval;

/**
 * A page that matched a query.
 *
 * @param pageNumber 1-based page
 * @param content page text
 * @param similarity cosine similarity of the best chunk on the page
 */
public record PageHit(int pageNumber, String content, double similarity) {}
