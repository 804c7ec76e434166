package org.verify.cfg;

/**
 * CFG 节点的种类（封闭集合）
 */
public enum NodeKind {
    FUNCTION("", "Mdiamond"),
    PRECONDITION("Pre: ", "ellipse"),
    POSTCONDITION("Post: ", "ellipse"),
    INVARIANT("@Inv: ", "ellipse"),
    CUTOFF("@Cutoff ", "ellipse"),
    STATEMENT("", "box"),
    CONDITION("", "diamond"),
    RETURN("return: ", "ellipse"),
    MERGE_POINT("", "circle");

    private final String labelPrefix;
    private final String shape;

    NodeKind(String labelPrefix, String shape) {
        this.labelPrefix = labelPrefix;
        this.shape = shape;
    }

    public String labelPrefix() {
        return labelPrefix;
    }

    public String shape() {
        return shape;
    }

    /**
     * 是否是"携带条件"的节点：路径只能从这类节点开始，也只能在这类节点结束
     */
    public boolean isConditionBearing() {
        return this == PRECONDITION || this == POSTCONDITION || this == INVARIANT || this == CUTOFF;
    }
}
