package com.contentpool.memory;

import java.util.Map;

public record HybridHit(int id, double rrfScore, Map<String, String> payload) {}
