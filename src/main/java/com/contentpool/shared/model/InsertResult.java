package com.contentpool.shared.model;

import java.util.List;

public record InsertResult(
    int accepted,
    int rejected,
    List<String> rejections
) {
    public static InsertResult empty() {
        return new InsertResult(0, 0, List.of());
    }
}
