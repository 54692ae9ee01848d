package com.contentpool.memory;

import com.contentpool.shared.model.ContentRecord;

import java.util.List;
import java.util.Map;

final class Fixtures {

    static final List<String> TEXT_FIELDS = List.of("title", "content");

    static final float[] QUERY_NEAR_DOC_3 = {0.1f, 0.1f, 0.8f, 0.8f, 0.1f, 0.1f, 0.2f, 0.2f};

    private Fixtures() {}

    /** Ids 1-3 are about python and finance, 4-5 about robotics. */
    static List<ContentRecord> financeAndRobotics() {
        return List.of(
            record(new float[]{0.9f, 0.1f, 0.1f, 0.1f, 0.1f, 0.1f, 0.1f, 0.1f},
                    "python", "finance lecture notes for beginners today"),
            record(new float[]{0.1f, 0.9f, 0.1f, 0.1f, 0.1f, 0.1f, 0.1f, 0.1f},
                    "python", "finance reading list and other material here"),
            record(new float[]{0.1f, 0.1f, 0.9f, 0.9f, 0.1f, 0.1f, 0.1f, 0.1f},
                    "python finance", "python finance"),
            record(new float[]{0.1f, 0.1f, 0.1f, 0.1f, 0.9f, 0.9f, 0.1f, 0.1f},
                    "robotics", "robot arms and sensors"),
            record(new float[]{0.1f, 0.1f, 0.1f, 0.1f, 0.1f, 0.1f, 0.9f, 0.9f},
                    "robotics", "robot perception systems")
        );
    }

    static MemoryContentPool loadedPool() {
        var pool = new MemoryContentPool(8, TEXT_FIELDS, new WhitespaceTokenizer());
        pool.insert(financeAndRobotics());
        return pool;
    }

    static ContentRecord record(float[] vector, String title, String content) {
        return new ContentRecord(vector, Map.of("title", title, "content", content));
    }

    static float[] unit(int dims, int hot) {
        var v = new float[dims];
        v[hot] = 1f;
        return v;
    }
}
