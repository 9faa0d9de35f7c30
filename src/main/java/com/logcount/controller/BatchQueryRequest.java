package com.logcount.controller;

import java.util.List;

/**
 * Several count queries submitted together, each identified by a caller-chosen {@code refId}.
 *
 * <pre>
 * {
 *   "queries": [
 *     {"refId": "A", "queryText": "status:error", "from": 1704103200000, "to": 1704103800000}
 *   ]
 * }
 * </pre>
 */
public record BatchQueryRequest(List<Query> queries) {

    /**
     * @param refId     Identifier echoed back in the response
     * @param queryText Raw query text
     * @param from      Inclusive start, epoch milliseconds
     * @param to        Exclusive end, epoch milliseconds
     */
    public record Query(String refId, String queryText, Long from, Long to) {}
}
