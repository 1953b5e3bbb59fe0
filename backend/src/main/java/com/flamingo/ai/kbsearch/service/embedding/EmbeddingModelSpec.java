package com.flamingo.ai.kbsearch.service.embedding;

/** A configured embedding model as exposed to the rest of the application. */
public record EmbeddingModelSpec(
    String name, EmbeddingProvider provider, String modelName, int dimensions, String collection) {}
