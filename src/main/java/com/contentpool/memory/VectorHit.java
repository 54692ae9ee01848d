package com.contentpool.memory;

import java.util.Map;

public record VectorHit(int id, double score, Map<String, String> payload) {}
