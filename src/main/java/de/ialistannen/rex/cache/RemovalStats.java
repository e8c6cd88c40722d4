package de.ialistannen.rex.cache;

/**
 * @param removedEntries how many entries were deleted from disk
 * @param reclaimedBytes how many bytes that freed
 */
public record RemovalStats(long removedEntries, long reclaimedBytes) {

}
