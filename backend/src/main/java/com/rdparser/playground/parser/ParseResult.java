package com.rdparser.playground.parser;

import java.util.List;

/**
 * Output of {@link Parser#parse(List)}.
 *
 * <p>{@code nodes} is the arena of the tree, indexed by node id. On failure the
 * tree is null, the arena is empty and {@code steps} holds the partial trace
 * ending with the failure step.
 */
public record ParseResult(
        ParseTreeNode tree,
        List<ParseTreeNode> nodes,
        List<Step> steps,
        String error,
        Integer errorPos,
        ErrorKind errorKind) {

    static ParseResult success(ParseTreeNode tree, List<ParseTreeNode> nodes, List<Step> steps) {
        return new ParseResult(tree, List.copyOf(nodes), List.copyOf(steps), null, null, null);
    }

    static ParseResult failure(List<Step> steps, ParseError error) {
        return new ParseResult(null, List.of(), List.copyOf(steps), error.message(), error.position(), error.kind());
    }

    public boolean hasError() {
        return error != null;
    }

    ParseTreeNode node(int id) {
        return nodes.get(id);
    }
}
