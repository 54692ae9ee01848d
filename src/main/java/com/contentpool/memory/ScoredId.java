package com.contentpool.memory;

import java.util.Comparator;

record ScoredId(int id, double score) {

    // score desc, then id asc so equal scores always come back in the same order
    static final Comparator<ScoredId> RANKING = Comparator
            .comparingDouble(ScoredId::score).reversed()
            .thenComparingInt(ScoredId::id);
}
