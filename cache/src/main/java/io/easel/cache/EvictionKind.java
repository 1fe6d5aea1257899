package io.easel.cache;

/**
 * What a full cache drops to admit a new key.
 */
public enum EvictionKind {
    /** Least recently read or written entry. */
    LRU,
    /** Oldest inserted entry. */
    FIFO,
    /** Every entry: the cache is emptied and starts over. */
    BULK_CLEAR
}
