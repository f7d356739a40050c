package io.github.cachestats.cache;

import java.util.Locale;

/**
 * Classification of cache entries by what they hold.
 *
 * <p>An entry's role is carried by its {@link Deleter}; see
 * {@link Deleter#forRole(CacheEntryRole)}.</p>
 */
public enum CacheEntryRole {
    /** Block of key-value data */
    DATA_BLOCK("DataBlock"),

    /** Block of a (partitioned or full) filter */
    FILTER_BLOCK("FilterBlock"),

    /** Index over the partitions of a partitioned filter */
    FILTER_META_BLOCK("FilterMetaBlock"),

    /** Filter block in a format no longer written */
    DEPRECATED_FILTER_BLOCK("DeprecatedFilterBlock"),

    /** Block of an index */
    INDEX_BLOCK("IndexBlock"),

    /** Any other kind of table block */
    OTHER_BLOCK("OtherBlock"),

    /** Memory reserved for write buffers */
    WRITE_BUFFER("WriteBuffer"),

    /** Memory reserved while building compression dictionaries */
    COMPRESSION_DICTIONARY_BUILDING_BUFFER("CompressionDictionaryBuildingBuffer"),

    /** Memory reserved while constructing filters */
    FILTER_CONSTRUCTION("FilterConstruction"),

    /** Memory reserved for open table readers */
    BLOCK_BASED_TABLE_READER("BlockBasedTableReader"),

    /** Everything else, including internal bookkeeping entries */
    MISC("Misc");

    private final String displayName;

    CacheEntryRole(String displayName) {
        this.displayName = displayName;
    }

    /**
     * CamelCase name, e.g. {@code DataBlock}.
     */
    public String displayName() {
        return displayName;
    }

    /**
     * Lower-case hyphenated name, e.g. {@code data-block}.
     */
    public String hyphenatedName() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
