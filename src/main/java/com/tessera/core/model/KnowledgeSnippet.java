package com.tessera.core.model;

public record KnowledgeSnippet(String text, String provenance, double relevanceScore) {}
