package com.example.acl.request.model;

import java.util.List;

/**
 * A read request made of independent named blocks.
 */
public record QueryRequest(List<QueryBlock> blocks) {

    public QueryRequest {
        blocks = blocks == null ? List.of() : List.copyOf(blocks);
    }

    public static QueryRequest of(QueryBlock... blocks) {
        return new QueryRequest(List.of(blocks));
    }
}
