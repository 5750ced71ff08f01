package dev.storyeval.remote;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One network call that turns a piece of text into a structured result.
 *
 * <p>Implementations may be slow and may fail. They must not touch shared state: the batch
 * pipeline runs many calls concurrently and does its own bookkeeping with the returned values. A
 * single call is never retried here. Retries happen a whole pass at a time.
 */
@FunctionalInterface
public interface RemoteCaller {
    /**
     * Perform the call.
     *
     * @param text the text to evaluate, or the prompt to generate from
     * @return the structured result
     * @throws Exception on any transport, protocol or response-shape failure. The caller records
     *     the message as an error sub-result.
     */
    JsonNode call(String text) throws Exception;
}
