package com.kookykangaroo.persistence;

import com.kookykangaroo.markdown.NodeType;

import java.util.Optional;

/**
 * A node as read back from the store. {@code level} is null when the property is absent.
 */
public record StoredNode(String id, String type, String content, Integer level) {

    public Optional<NodeType> nodeType() {
        return NodeType.fromValue(type);
    }
}
