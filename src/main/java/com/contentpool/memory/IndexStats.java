package com.contentpool.memory;

public record IndexStats(int totalDocs, double avgDocLength, int vocabularySize) {}
