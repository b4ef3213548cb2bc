package com.smurthy.ai.insights.rpc;

import com.fasterxml.jackson.databind.node.ArrayNode;

/**
 * One length-prefixed chunk of a batchexecute response.
 *
 * @param byteCount the declared length, which matched the payload's UTF-8 size
 * @param payload   the chunk parsed as a JSON array
 */
public record RpcFrame(int byteCount, ArrayNode payload) {
}
