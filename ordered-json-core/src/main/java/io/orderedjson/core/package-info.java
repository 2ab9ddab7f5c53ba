/**
 * Insertion-ordered JSON object model.
 *
 * <p>This module has no dependency on jackson-databind. It contains only:
 * <ul>
 *   <li>{@link io.orderedjson.core.OrderedMap}, a string-keyed map that keeps key order for
 *       iteration, positional access and serialization</li>
 *   <li>the {@link io.orderedjson.core.JsonValue} union of values it can hold</li>
 *   <li>{@link io.orderedjson.core.OrderedMapCodec}, a streaming encoder and recursive-descent
 *       decoder over jackson-core tokens</li>
 * </ul>
 *
 * <p>Nothing here is thread-safe except the codec.
 */
package io.orderedjson.core;
