package org.dma.gbdt4j.tree.basic;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public abstract class TNode<Node extends TNode<Node>> implements Serializable {
    private final int branch;  // index of the parent's branch this node covers, -1 for root
    protected List<Node> children;  // children in branch order
    protected NodeContent content;  // null until trained
    protected double nodeGain;  // gain of the node, see subclasses

    public TNode(int branch) {
        this.branch = branch;
        this.children = new ArrayList<>();
    }

    public int getBranch() {
        return branch;
    }

    public List<Node> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public NodeContent getContent() {
        return content;
    }

    public double getNodeGain() {
        return nodeGain;
    }

    public boolean isTrained() {
        return content != null;
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }

    /**
     * Number of levels below and including this node.
     */
    public int getDepth() {
        int depth = 0;
        for (Node child : children)
            depth = Math.max(depth, child.getDepth());
        return depth + 1;
    }

    public int getNumNodes() {
        int num = 1;
        for (Node child : children)
            num += child.getNumNodes();
        return num;
    }

    public int getNumLeaves() {
        if (children.isEmpty())
            return 1;
        int num = 0;
        for (Node child : children)
            num += child.getNumLeaves();
        return num;
    }
}
