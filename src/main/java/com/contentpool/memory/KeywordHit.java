package com.contentpool.memory;

import java.util.Map;

public record KeywordHit(int id, double bm25Score, int rank, Map<String, String> payload) {}
