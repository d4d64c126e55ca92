package ch.so.arp.scenesearch.search;

/**
 * Small helpers for embedding vectors.
 */
public final class Vectors {

    private Vectors() {
    }

    /**
     * Cosine similarity, {@code 0} if either vector has no length.
     *
     * @throws IllegalArgumentException if the dimensions differ
     */
    public static double cosine(float[] left, float[] right) {
        if (left.length != right.length) {
            throw new IllegalArgumentException(
                    "embedding dimension mismatch: " + left.length + " vs " + right.length);
        }
        double dot = 0.0d;
        double leftNorm = 0.0d;
        double rightNorm = 0.0d;
        for (int i = 0; i < left.length; i++) {
            dot += left[i] * right[i];
            leftNorm += left[i] * left[i];
            rightNorm += right[i] * right[i];
        }
        if (leftNorm == 0.0d || rightNorm == 0.0d) {
            return 0.0d;
        }
        return dot / (Math.sqrt(leftNorm) * Math.sqrt(rightNorm));
    }
}
