package com.flamingo.ai.pagereader.service.ingestion;

/**
 * Counts from one ingestion run.
 *
 * @param pagesSubmitted non-blank pages handed to the page phase
 * @param pagesPersisted page rows written
 * @param embeddingsStored embeddings written
 */
public record IngestionReport(int pagesSubmitted, int pagesPersisted, int embeddingsStored) {}
