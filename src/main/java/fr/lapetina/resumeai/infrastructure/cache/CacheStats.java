package fr.lapetina.resumeai.infrastructure.cache;

/**
 * Point-in-time statistics of one cache instance.
 */
public record CacheStats(String name, int size, int maxSize, long hits, long misses) {

    public double hitRate() {
        long total = hits + misses;
        return total == 0 ? 0.0 : (double) hits / total;
    }
}
