package io.shelfdb.storage;

/**
 * One position of a cursor walk.
 *
 * @param key        the store key, or the index key for index cursors
 * @param primaryKey the store key of the record
 * @param value      a private copy of the record
 */
public record CursorEntry(Object key, Object primaryKey, Object value) {}
