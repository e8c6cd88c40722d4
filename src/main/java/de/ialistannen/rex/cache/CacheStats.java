package de.ialistannen.rex.cache;

/**
 * @param diskEntries the number of entries on disk
 * @param diskBytes the bytes used by those entries
 * @param memoryEntries the (approximate) number of entries held in memory
 */
public record CacheStats(long diskEntries, long diskBytes, long memoryEntries) {

}
