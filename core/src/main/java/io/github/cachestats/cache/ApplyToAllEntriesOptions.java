package io.github.cachestats.cache;

/**
 * Tuning for {@link Cache#applyToAllEntries}.
 *
 * @param averageEntriesPerLock how many entries a traversal copies out of a
 *        shard per lock acquisition
 */
public record ApplyToAllEntriesOptions(int averageEntriesPerLock) {

    public static final ApplyToAllEntriesOptions DEFAULT = new ApplyToAllEntriesOptions(256);

    public ApplyToAllEntriesOptions {
        if (averageEntriesPerLock <= 0) {
            throw new IllegalArgumentException("averageEntriesPerLock must be positive: " + averageEntriesPerLock);
        }
    }
}
