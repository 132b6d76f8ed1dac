package com.example.flowmutator.domain;

/**
 * One entry of a connection target list: the addressed node (id or name), the
 * connection type and the input index on the target.
 */
public record ConnectionTarget(String node, String type, int index) {

    public ConnectionTarget withNode(String newNode) {
        return new ConnectionTarget(newNode, type, index);
    }
}
