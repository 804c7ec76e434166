package org.verify.cfg;

import java.util.Objects;

/**
 * CFG 中的一个节点：种类 + 文本（条件文本不做任何解释，原样保留）
 */
public record CfgNode(NodeKind kind, String text) {

    public CfgNode {
        Objects.requireNonNull(kind, "kind");
        text = text == null ? "" : text;
    }

    public static CfgNode function(String name) {
        return new CfgNode(NodeKind.FUNCTION, name);
    }

    public static CfgNode precondition(String text) {
        return new CfgNode(NodeKind.PRECONDITION, text);
    }

    public static CfgNode postcondition(String text) {
        return new CfgNode(NodeKind.POSTCONDITION, text);
    }

    public static CfgNode invariant(String text) {
        return new CfgNode(NodeKind.INVARIANT, text);
    }

    public static CfgNode cutoff() {
        return new CfgNode(NodeKind.CUTOFF, "");
    }

    public static CfgNode statement(String text) {
        return new CfgNode(NodeKind.STATEMENT, text);
    }

    public static CfgNode condition(String text) {
        return new CfgNode(NodeKind.CONDITION, text);
    }

    public static CfgNode returns(String text) {
        return new CfgNode(NodeKind.RETURN, text);
    }

    public static CfgNode mergePoint() {
        return new CfgNode(NodeKind.MERGE_POINT, "");
    }

    public boolean isConditionBearing() {
        return kind.isConditionBearing();
    }

    public boolean is(NodeKind k) {
        return kind == k;
    }

    /**
     * 输出到图描述文件时显示的标签
     */
    public String displayLabel() {
        if (kind == NodeKind.MERGE_POINT) {
            return "Merge";
        }
        return kind.labelPrefix() + text;
    }

    /**
     * 同种类节点返回一个替换了文本的新节点
     */
    public CfgNode withText(String newText) {
        return new CfgNode(kind, newText);
    }
}
