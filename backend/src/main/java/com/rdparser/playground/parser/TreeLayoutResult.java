package com.rdparser.playground.parser;

import java.util.List;

public record TreeLayoutResult(
        List<LayoutNode> nodes,
        List<Edge> edges,
        double width,
        double height) {

    public static TreeLayoutResult empty() {
        return new TreeLayoutResult(List.of(), List.of(), 0, 0);
    }
}
