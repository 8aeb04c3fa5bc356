package org.dma.gbdt4j.tree.basic;

import org.dma.gbdt4j.tree.param.TreeParam;

import java.io.Serializable;

public abstract class Tree<TParam extends TreeParam, Node extends TNode<Node>> implements Serializable {
    protected final TParam param;
    protected Node root;

    public Tree(TParam param) {
        this.param = param;
    }

    public TParam getParam() {
        return param;
    }

    public Node getRoot() {
        return root;
    }

    public int getDepth() {
        return root.getDepth();
    }

    public int getNumNodes() {
        return root.getNumNodes();
    }

    public int getNumLeaves() {
        return root.getNumLeaves();
    }
}
