/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.audit.json;


/**
 * A two-way JSON codec for an entity type. Entities expose theirs as a
 * {@code PARSER} constant.
 *
 * @param <T> the entity type
 */
public interface JsonEntityParser<T> extends JsonEntityWriter<T>, JsonEntityReader<T> {

}
