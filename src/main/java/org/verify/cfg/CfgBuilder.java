package org.verify.cfg;

import static com.google.common.base.Preconditions.checkState;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.expr.VariableDeclarationExpr;
import com.github.javaparser.ast.stmt.*;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 把一个方法的 AST 翻译成控制流图
 * <p>
 * 翻译过程中维护两个状态：
 * <ul>
 *     <li>cursor：下一个节点要从哪个节点连过来</li>
 *     <li>pendingLabel：下一条边的标签，用一次就清空</li>
 * </ul>
 * return / break / continue / throw 之后 cursor 被标记为 terminated，所在代码块剩下的语句不再产生节点。
 * 每个 CfgBuilder 只能翻译一个方法。
 */
public class CfgBuilder {

    private static final Logger LOG = LogManager.getLogger(CfgBuilder.class);

    static final String PRE = "pre";
    static final String POST = "post";
    static final String INVARIANT = "invariant";

    private final ContractRegistry registry;
    private final ControlFlowGraph graph = new ControlFlowGraph();

    private int cursor = -1;
    private String pendingLabel;
    private boolean terminated;
    private boolean used;

    // 循环栈（以及带标签的代码块），用于 break / continue 找目标
    private final Deque<JumpFrame> frames = new ArrayDeque<>();
    // LabeledStmt 的标签，交给紧接着的循环使用
    private String pendingFrameName;

    public CfgBuilder(ContractRegistry registry) {
        this.registry = registry;
    }

    /**
     * 翻译整个方法，返回以 Function 节点为根的 CFG
     *
     * @param md 要翻译的方法（必须有方法体）
     * @return 未化简的控制流图
     */
    public ControlFlowGraph build(MethodDeclaration md) {
        checkState(!used, "a CfgBuilder translates exactly one method");
        used = true;
        BlockStmt body = md.getBody()
                .orElseThrow(() -> new IllegalArgumentException("method " + md.getNameAsString() + " has no body"));

        addNode(CfgNode.function(md.getNameAsString()));
        translateBlock(body);

        // 方法正常执行到结尾：等价于一个隐式的 return
        if (!terminated) {
            addNode(CfgNode.returns(""));
        }
        LOG.debug("Translated {} into {} nodes and {} edges",
                md.getNameAsString(), graph.nodeCount(), graph.edgeCount());
        return graph;
    }

    // ---------------------------------------------------------------- 节点与边

    private int addNode(CfgNode node) {
        int index = graph.addNode(node);
        if (cursor >= 0) {
            graph.addEdge(cursor, index, takeLabel(""));
        }
        cursor = index;
        terminated = false;
        return index;
    }

    /**
     * 只加节点不连边（合并点的入边由调用者显式添加）
     */
    private int addNodeWithoutEdge(CfgNode node) {
        int index = graph.addNode(node);
        cursor = index;
        return index;
    }

    /**
     * 取出待用的边标签；没有时使用给定的默认值
     */
    private String takeLabel(String defaultLabel) {
        String label = pendingLabel != null ? pendingLabel : defaultLabel;
        pendingLabel = null;
        return label;
    }

    // ---------------------------------------------------------------- 语句

    private void translateBlock(BlockStmt block) {
        translateStatements(block.getStatements());
    }

    private void translateStatements(List<Statement> statements) {
        for (Statement s : statements) {
            if (terminated) {
                LOG.debug("Skipping unreachable statement: {}", SourceText.of(s));
                break;
            }
            translateStatement(s);
        }
    }

    private void translateStatement(Statement s) {
        if (s instanceof BlockStmt block) {
            translateBlock(block);
        } else if (s instanceof ExpressionStmt exprStmt) {
            translateExpression(exprStmt.getExpression());
        } else if (s instanceof IfStmt ifStmt) {
            translateIf(ifStmt);
        } else if (s instanceof WhileStmt whileStmt) {
            translateLoop("while: " + SourceText.of(whileStmt.getCondition()),
                    List.of(whileStmt.getCondition()), List.of(), whileStmt.getBody());
        } else if (s instanceof ForStmt forStmt) {
            // 初始化只执行一次，放在回边目标之前
            forStmt.getInitialization().forEach(this::emitNested);
            translateLoop(forLabel(forStmt), forStmt.getCompare().stream().collect(Collectors.toList()),
                    forStmt.getUpdate(), forStmt.getBody());
        } else if (s instanceof ForEachStmt forEach) {
            emitNested(forEach.getIterable());
            String label = "for " + forEach.getVariable().getVariables().get(0).getNameAsString()
                    + " in " + SourceText.of(forEach.getIterable());
            translateLoop(label, List.of(), List.of(), forEach.getBody());
        } else if (s instanceof DoStmt doStmt) {
            translateDoWhile(doStmt);
        } else if (s instanceof ReturnStmt ret) {
            translateReturn(ret);
        } else if (s instanceof BreakStmt breakStmt) {
            translateBreak(breakStmt);
        } else if (s instanceof ContinueStmt continueStmt) {
            translateContinue(continueStmt);
        } else if (s instanceof ThrowStmt throwStmt) {
            emitNested(throwStmt.getExpression());
            addNode(CfgNode.statement(statementText(throwStmt)));
            terminated = true;
        } else if (s instanceof LabeledStmt labeled) {
            translateLabeled(labeled);
        } else if (s instanceof TryStmt tryStmt) {
            translateTry(tryStmt);
        } else if (s instanceof SynchronizedStmt sync) {
            emitNested(sync.getExpression());
            translateBlock(sync.getBody());
        } else if (s instanceof EmptyStmt) {
            // 空语句不产生节点
        } else {
            // 其它语句（switch、assert、局部类 ...）整体作为一个普通语句节点
            emitNested(s);
            addNode(CfgNode.statement(statementText(s)));
        }
    }

    /**
     * if / else if / else
     */
    private void translateIf(IfStmt s) {
        String cond = SourceText.of(s.getCondition());
        String label = CfgEdge.FALSE.equals(pendingLabel) ? "else if: " + cond : "if: " + cond;
        emitNested(s.getCondition());
        int condNode = addNode(CfgNode.condition(label));

        // true 分支
        pendingLabel = CfgEdge.TRUE;
        translateStatement(s.getThenStmt());
        int thenEnd = cursor;
        boolean thenTerminated = terminated;
        String thenLabel = takeLabel("");

        int merge = addNodeWithoutEdge(CfgNode.mergePoint());
        boolean reached = false;
        if (!thenTerminated) {
            graph.addEdge(thenEnd, merge, thenLabel);
            reached = true;
        }

        if (s.getElseStmt().isPresent()) {
            // false 分支；嵌套的 IfStmt 会因为 pendingLabel == "false" 得到 "else if" 标签
            cursor = condNode;
            terminated = false;
            pendingLabel = CfgEdge.FALSE;
            translateStatement(s.getElseStmt().get());
            String elseLabel = takeLabel("");
            if (!terminated) {
                graph.addEdge(cursor, merge, elseLabel);
                reached = true;
            }
        } else {
            graph.addEdge(condNode, merge, CfgEdge.FALSE);
            reached = true;
        }

        if (reached) {
            cursor = merge;
            terminated = false;
        } else {
            // 两个分支都 return 了，合并点没有用
            graph.removeNode(merge);
            terminated = true;
        }
    }

    /**
     * while / for / for-each：回边指向紧挨着的 invariant，没有时插入一个 cutoff
     *
     * @param header 每次求值条件前都要执行的表达式（条件本身），放在回边目标和条件节点之间
     * @param update 循环体正常结束后执行的表达式（for 的更新部分）
     */
    private void translateLoop(String condLabel, List<? extends Expression> header,
                               List<? extends Expression> update, Statement body) {
        int backTarget = loopBackTarget();
        header.forEach(this::emitNested);
        int condNode = addNode(CfgNode.condition(condLabel));

        JumpFrame frame = pushLoopFrame(backTarget, false);
        pendingLabel = CfgEdge.TRUE;
        translateStatement(body);
        if (!terminated) {
            update.forEach(this::emitNested);
        }
        closeLoopBody(backTarget);
        frames.pop();

        int merge = addNodeWithoutEdge(CfgNode.mergePoint());
        graph.addEdge(condNode, merge, CfgEdge.FALSE);
        frame.linkBreaks(graph, merge);
        terminated = false;
    }

    /**
     * do { body } while (cond)：循环体从回边目标开始，条件在循环体之后
     */
    private void translateDoWhile(DoStmt s) {
        int backTarget = loopBackTarget();

        JumpFrame frame = pushLoopFrame(backTarget, true);
        translateStatement(s.getBody());
        frames.pop();

        Integer condNode = null;
        if (!terminated || !frame.continues.isEmpty()) {
            if (terminated) {
                // 循环体不会正常结束，条件只能从 continue 到达
                cursor = -1;
                pendingLabel = null;
            }
            // continue 跳到条件求值的第一个节点（条件里有契约调用时是它的前置条件）
            int head = graph.nextIndex();
            emitNested(s.getCondition());
            condNode = addNode(CfgNode.condition("do while: " + SourceText.of(s.getCondition())));
            frame.linkContinues(graph, head);
            graph.addEdge(condNode, backTarget, CfgEdge.BACK_TO_LOOP);
        }

        if (condNode == null && frame.breaks.isEmpty()) {
            // 循环体总是 return，循环后面不可达
            terminated = true;
            return;
        }
        int merge = addNodeWithoutEdge(CfgNode.mergePoint());
        if (condNode != null) {
            graph.addEdge(condNode, merge, CfgEdge.FALSE);
        }
        frame.linkBreaks(graph, merge);
        terminated = false;
    }

    private int loopBackTarget() {
        if (!terminated && cursor >= 0 && graph.node(cursor).is(NodeKind.INVARIANT)) {
            return cursor;
        }
        return addNode(CfgNode.cutoff());
    }

    private void closeLoopBody(int backTarget) {
        String label = takeLabel(CfgEdge.BACK_TO_LOOP);
        if (!terminated) {
            graph.addEdge(cursor, backTarget, label);
        }
    }

    private JumpFrame pushLoopFrame(int backTarget, boolean deferContinues) {
        JumpFrame frame = new JumpFrame(pendingFrameName, true, backTarget, deferContinues);
        pendingFrameName = null;
        frames.push(frame);
        return frame;
    }

    private void translateReturn(ReturnStmt ret) {
        String text = "";
        if (ret.getExpression().isPresent()) {
            Expression expr = ret.getExpression().get();
            emitNested(expr);
            text = SourceText.of(expr);
        }
        addNode(CfgNode.returns(text));
        terminated = true;
    }

    private void translateBreak(BreakStmt s) {
        Optional<JumpFrame> target = findFrame(s.getLabel().map(l -> l.asString()).orElse(null));
        if (target.isEmpty()) {
            LOG.warn("break without an enclosing loop: {}", SourceText.of(s));
            addNode(CfgNode.statement(statementText(s)));
            return;
        }
        target.get().breaks.add(new PendingJump(cursor, takeLabel(CfgEdge.BREAK)));
        terminated = true;
    }

    private void translateContinue(ContinueStmt s) {
        Optional<JumpFrame> target = findFrame(s.getLabel().map(l -> l.asString()).orElse(null))
                .filter(f -> f.loop);
        if (target.isEmpty()) {
            LOG.warn("continue without an enclosing loop: {}", SourceText.of(s));
            addNode(CfgNode.statement(statementText(s)));
            return;
        }
        JumpFrame frame = target.get();
        if (frame.deferContinues) {
            frame.continues.add(new PendingJump(cursor, takeLabel("")));
        } else {
            graph.addEdge(cursor, frame.backTarget, takeLabel(CfgEdge.BACK_TO_LOOP));
        }
        terminated = true;
    }

    /**
     * 不带标签时找最内层循环，带标签时按名字找
     */
    private Optional<JumpFrame> findFrame(String name) {
        for (JumpFrame f : frames) {
            if (name == null ? f.loop : name.equals(f.name)) {
                return Optional.of(f);
            }
        }
        return Optional.empty();
    }

    private void translateLabeled(LabeledStmt labeled) {
        Statement inner = labeled.getStatement();
        String name = labeled.getLabel().asString();
        if (inner instanceof WhileStmt || inner instanceof ForStmt
                || inner instanceof ForEachStmt || inner instanceof DoStmt) {
            pendingFrameName = name;
            translateStatement(inner);
            return;
        }

        // 带标签的普通代码块：break label 跳到代码块之后
        JumpFrame frame = new JumpFrame(name, false, -1, false);
        frames.push(frame);
        translateStatement(inner);
        frames.pop();
        if (frame.breaks.isEmpty()) {
            return;
        }
        boolean completes = !terminated;
        int end = cursor;
        String label = takeLabel("");
        int merge = addNodeWithoutEdge(CfgNode.mergePoint());
        if (completes) {
            graph.addEdge(end, merge, label);
        }
        frame.linkBreaks(graph, merge);
        terminated = false;
    }

    /**
     * try 块之后接 finally 块；catch 属于异常路径，不翻译
     */
    private void translateTry(TryStmt s) {
        for (Expression resource : s.getResources()) {
            translateExpression(resource);
        }
        translateBlock(s.getTryBlock());
        if (!terminated) {
            s.getFinallyBlock().ifPresent(this::translateBlock);
        }
    }

    private static String forLabel(ForStmt s) {
        String init = s.getInitialization().stream().map(SourceText::of).collect(Collectors.joining(", "));
        String compare = s.getCompare().map(SourceText::of).orElse("");
        String update = s.getUpdate().stream().map(SourceText::of).collect(Collectors.joining(", "));
        return "for: " + init + "; " + compare + "; " + update;
    }

    private static String statementText(Statement s) {
        String text = SourceText.of(s);
        return text.endsWith(";") ? text.substring(0, text.length() - 1) : text;
    }

    // ---------------------------------------------------------------- 表达式

    private void translateExpression(Expression expr) {
        if (expr instanceof MethodCallExpr call) {
            if (isMarker(call)) {
                emitMarker(call);
                return;
            }
            call.getScope().ifPresent(this::emitNested);
            call.getArguments().forEach(this::emitNested);
            emitCall(call.getNameAsString(), call);
            return;
        }
        if (expr instanceof ObjectCreationExpr creation) {
            creation.getScope().ifPresent(this::emitNested);
            creation.getArguments().forEach(this::emitNested);
            emitCall(creation.getType().getNameAsString(), creation);
            return;
        }
        if (expr instanceof VariableDeclarationExpr decl
                && decl.getVariables().stream().allMatch(v -> v.getInitializer().isEmpty())) {
            // int r; 这样没有初始化的声明不产生节点
            return;
        }
        emitNested(expr);
        addNode(CfgNode.statement(SourceText.of(expr)));
    }

    /**
     * 在子表达式中按求值顺序查找注解调用和有契约的调用，并为它们产生节点。
     * lambda 和匿名类的方法体在这里不会执行，不进入。
     */
    private void emitNested(Node node) {
        if (node instanceof LambdaExpr) {
            return;
        }
        if (node instanceof MethodCallExpr call) {
            if (isMarker(call)) {
                emitMarker(call);
                return;
            }
            call.getScope().ifPresent(this::emitNested);
            call.getArguments().forEach(this::emitNested);
            registry.find(call.getNameAsString()).ifPresent(m -> emitContractCall(m, call));
            return;
        }
        if (node instanceof ObjectCreationExpr creation) {
            creation.getScope().ifPresent(this::emitNested);
            creation.getArguments().forEach(this::emitNested);
            registry.find(creation.getType().getNameAsString()).ifPresent(m -> emitContractCall(m, creation));
            return;
        }
        if (node instanceof Statement && !(node instanceof ExpressionStmt)) {
            // 复合语句（switch 等）只看它自己的表达式部分
            for (Node child : node.getChildNodes()) {
                if (child instanceof Expression) {
                    emitNested(child);
                }
            }
            return;
        }
        for (Node child : node.getChildNodes()) {
            emitNested(child);
        }
    }

    private void emitCall(String name, Expression call) {
        Optional<ExternalMethod> contract = registry.find(name);
        if (contract.isPresent()) {
            emitContractCall(contract.get(), call);
        } else {
            addNode(CfgNode.statement(SourceText.of(call)));
        }
    }

    /**
     * 前置条件 -> Call 节点 -> 后置条件
     */
    private void emitContractCall(ExternalMethod contract, Expression call) {
        for (String pre : contract.getPreconditions()) {
            addNode(CfgNode.precondition(pre));
        }
        addNode(CfgNode.statement("Call: " + SourceText.of(call)));
        for (String post : contract.getPostconditions()) {
            addNode(CfgNode.postcondition(post));
        }
    }

    static boolean isMarker(MethodCallExpr call) {
        if (call.getScope().isPresent()) {
            return false;
        }
        String name = call.getNameAsString();
        return PRE.equals(name) || POST.equals(name) || INVARIANT.equals(name);
    }

    private void emitMarker(MethodCallExpr call) {
        String text = markerText(call);
        switch (call.getNameAsString()) {
            case PRE -> addNode(CfgNode.precondition(text));
            case POST -> addNode(CfgNode.postcondition(text));
            case INVARIANT -> addNode(CfgNode.invariant(text));
            default -> throw new IllegalStateException("not an annotation marker: " + call);
        }
    }

    /**
     * 注解的文本：字符串字面量取其内容，其它参数按源码打印，多个参数用 ", " 连接
     */
    private static String markerText(MethodCallExpr call) {
        List<String> parts = new ArrayList<>();
        for (Expression arg : call.getArguments()) {
            if (arg.isStringLiteralExpr()) {
                parts.add(arg.asStringLiteralExpr().asString());
            } else {
                parts.add(SourceText.of(arg));
            }
        }
        return String.join(", ", parts);
    }

    // ---------------------------------------------------------------- 跳转目标

    private record PendingJump(int source, String label) {
    }

    /**
     * 循环（或带标签的代码块）的跳转信息。break 的目标（循环出口的合并点）要等循环体翻译完才创建，
     * 所以先记下来，之后再连边。
     */
    private static final class JumpFrame {
        final String name;
        final boolean loop;
        final int backTarget;
        final boolean deferContinues;
        final List<PendingJump> breaks = new ArrayList<>();
        final List<PendingJump> continues = new ArrayList<>();

        JumpFrame(String name, boolean loop, int backTarget, boolean deferContinues) {
            this.name = name;
            this.loop = loop;
            this.backTarget = backTarget;
            this.deferContinues = deferContinues;
        }

        void linkBreaks(ControlFlowGraph graph, int exit) {
            for (PendingJump j : breaks) {
                graph.addEdge(j.source(), exit, j.label());
            }
        }

        void linkContinues(ControlFlowGraph graph, int condition) {
            for (PendingJump j : continues) {
                graph.addEdge(j.source(), condition, j.label());
            }
        }
    }
}
