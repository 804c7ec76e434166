package org.verify.cfg;

/**
 * 有向边：source -> target，带一个文本标签（"true" / "false" / "back to loop" / 空串 ...）
 */
public record CfgEdge(int source, int target, String label) {

    public static final String TRUE = "true";
    public static final String FALSE = "false";
    public static final String BACK_TO_LOOP = "back to loop";
    public static final String BREAK = "break";

    public CfgEdge {
        label = label == null ? "" : label;
    }

    public boolean hasLabel() {
        return !label.isEmpty();
    }
}
