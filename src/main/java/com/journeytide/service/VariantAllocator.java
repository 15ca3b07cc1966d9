package com.journeytide.service;

import com.journeytide.model.graph.Variant;
import org.springframework.stereotype.Component;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.List;

/**
 * Deterministic weighted assignment of enrollments to experiment variants.
 *
 * HOW IT WORKS:
 *   1. SHA-256("{enrollmentId}:{nodeId}") → first 8 bytes as an unsigned number
 *   2. number mod 1,000,000 → bucket, bucket / 10,000 → point in [0, 100)
 *   3. Walk the variants adding up weights; the first variant whose running
 *      total exceeds the point wins
 *
 * The same enrollment always lands on the same variant of a node, and across
 * many enrollments the split converges on the stored weights. Weights are
 * used as stored; a total under 100 lets the overflow fall to the last variant.
 */
@Component
public class VariantAllocator {

    static final long BUCKETS = 1_000_000L;

    public Variant allocate(Object enrollmentId, String nodeId, List<Variant> variants) {
        if (variants == null || variants.size() < 2) {
            throw new IllegalArgumentException("Experiment needs at least two variants, got "
                    + (variants == null ? 0 : variants.size()));
        }

        double point = pointFor(String.valueOf(enrollmentId), nodeId);
        double cumulative = 0;
        for (Variant variant : variants) {
            cumulative += Math.max(variant.getWeight(), 0);
            if (point < cumulative) {
                return variant;
            }
        }
        return variants.get(variants.size() - 1);
    }

    /**
     * @return a stable point in [0, 100) for this enrollment at this node
     */
    double pointFor(String enrollmentId, String nodeId) {
        byte[] hash = sha256(enrollmentId + ":" + nodeId);
        long head = ByteBuffer.wrap(hash, 0, 8).getLong();
        long bucket = Long.remainderUnsigned(head, BUCKETS);
        return bucket / (BUCKETS / 100.0);
    }

    /**
     * Rescales weights to sum to 100. All-zero weights become an equal split.
     * Called when a journey is saved, never while walking.
     */
    public List<Variant> normalizeWeights(List<Variant> variants) {
        if (variants == null || variants.isEmpty()) {
            return new ArrayList<>();
        }
        double total = variants.stream().mapToDouble(v -> Math.max(v.getWeight(), 0)).sum();

        List<Variant> normalized = new ArrayList<>(variants.size());
        for (Variant variant : variants) {
            double weight = total > 0
                    ? Math.max(variant.getWeight(), 0) * 100.0 / total
                    : 100.0 / variants.size();
            normalized.add(new Variant(variant.getId(), variant.getLabel(), weight));
        }
        return normalized;
    }

    private static byte[] sha256(String input) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(input.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException(e);
        }
    }
}
