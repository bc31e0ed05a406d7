package me.golemcore.cadence.port.outbound;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Text embedding provider behind the vector path of knowledge retrieval.
 * Callers bound every call with their own timeout and fall back to keyword
 * scoring when it fails.
 */
public interface EmbeddingPort {

    CompletableFuture<float[]> embed(String text);

    /**
     * Embeds several texts in one call. Vectors come back in input order.
     */
    CompletableFuture<List<float[]>> embedBatch(List<String> texts);

    int getDimension();

    String getModel();

    /**
     * False when embeddings are disabled or no API key is configured.
     */
    boolean isAvailable();

    /**
     * Cosine of the angle between two vectors of equal length, in [-1, 1]. A
     * zero vector is similar to nothing.
     */
    default double cosineSimilarity(float[] left, float[] right) {
        if (left.length != right.length) {
            throw new IllegalArgumentException("Vector lengths differ: " + left.length + " vs " + right.length);
        }
        double dot = 0;
        double leftSquares = 0;
        double rightSquares = 0;
        for (int i = 0; i < left.length; i++) {
            dot += left[i] * right[i];
            leftSquares += left[i] * left[i];
            rightSquares += right[i] * right[i];
        }
        if (leftSquares == 0 || rightSquares == 0) {
            return 0;
        }
        return dot / Math.sqrt(leftSquares * rightSquares);
    }
}
