/**
 * Protocol-centric core for weather event streams.
 *
 * <p>This module is deliberately transport-neutral. It contains only:
 * <ul>
 *   <li>Wire constants and the {@link io.weatherstreams.core.StreamFrame} model</li>
 *   <li>The frame parser and the incremental buffer/reader that survive arbitrary chunking</li>
 *   <li>Connection state, reconnect policy and the typed RAG event model</li>
 * </ul>
 *
 * <p>HTTP bindings and JSON decoding live in other modules.
 */
package io.weatherstreams.core;
