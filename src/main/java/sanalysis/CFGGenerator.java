package sanalysis;

import com.github.javaparser.StaticJavaParser;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.expr.SimpleName;
import com.github.javaparser.ast.stmt.*;
import flowgraph.FlowGraph;
import flowgraph.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.*;

/**
 * CFGGenerator builds a statement-level control flow graph for every method of a Java
 * source file. Each method contributes a "Method Start" and a "Method End" node; the
 * methods are not connected to each other.
 */
public class CFGGenerator {

    private static final Logger logger = LoggerFactory.getLogger(CFGGenerator.class);

    public static class CFGNode implements Node {
        private final long id;
        private String label;

        CFGNode(long id, String label) {
            this.id = id;
            this.label = clean(label);
        }

        @Override
        public long getId() { return id; }
        public String getName() { return "node" + id; }
        public String getLabel() { return label; }
        public void setLabel(String newLabel) { this.label = clean(newLabel); }

        private static String clean(String label) {
            return label == null ? "" : label.replace("\n", " ").trim();
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj) return true;
            if (!(obj instanceof CFGNode)) return false;
            return id == ((CFGNode) obj).id;
        }

        @Override
        public int hashCode() {
            return Long.hashCode(id);
        }

        @Override
        public String toString() { return getName(); }
    }

    // Edges are kept in a set: a branch to the same target twice is still one edge.
    public static class CFGEdge {
        public final CFGNode from;
        public final CFGNode to;
        public CFGEdge(CFGNode from, CFGNode to) {
            this.from = from;
            this.to = to;
        }
        @Override
        public boolean equals(Object obj) {
            if (this == obj) return true;
            if (!(obj instanceof CFGEdge)) return false;
            CFGEdge other = (CFGEdge) obj;
            return from.getId() == other.from.getId() && to.getId() == other.to.getId();
        }
        @Override
        public int hashCode() {
            return Objects.hash(from.getId(), to.getId());
        }
    }

    public static class ControlFlowGraph implements FlowGraph<CFGNode> {
        private final List<CFGNode> nodes = new ArrayList<>();
        private final Set<CFGEdge> edges = new LinkedHashSet<>();
        private final Map<Long, List<CFGNode>> successors = new HashMap<>();
        private long nextId = 0;

        /** Creates a node with the next free id and adds it to the graph. */
        public CFGNode createNode(String label) {
            CFGNode node = new CFGNode(nextId++, label);
            addNode(node);
            return node;
        }

        public void addNode(CFGNode node) {
            if (successors.putIfAbsent(node.getId(), new ArrayList<>()) == null) {
                nodes.add(node);
                nextId = Math.max(nextId, node.getId() + 1);
            }
        }

        public void addEdge(CFGNode from, CFGNode to) {
            if (edges.add(new CFGEdge(from, to))) {
                addNode(from);
                addNode(to);
                successors.get(from.getId()).add(to);
            }
        }

        public List<CFGNode> getNodes() {
            return nodes;
        }

        public Set<CFGEdge> getEdges() {
            return edges;
        }

        @Override
        public List<CFGNode> getSuccessors(CFGNode node) {
            List<CFGNode> out = successors.get(node.getId());
            return out == null ? Collections.emptyList() : Collections.unmodifiableList(out);
        }

        public Optional<CFGNode> findByLabelPrefix(String prefix) {
            return nodes.stream().filter(n -> n.getLabel().startsWith(prefix)).findFirst();
        }

        public void logGraph() {
            logger.debug("Nodes:");
            for (CFGNode node : nodes) {
                logger.debug("  {}: {}", node.getName(), node.getLabel());
            }
            logger.debug("Edges:");
            for (CFGEdge edge : edges) {
                logger.debug("  {} -> {}", edge.from.getName(), edge.to.getName());
            }
        }

        public void exportToDotFile(String graphName, Path filePath) throws IOException {
            try (PrintWriter writer = new PrintWriter(Files.newBufferedWriter(filePath, StandardCharsets.UTF_8))) {
                writer.printf("digraph %s {%n", graphName);
                for (CFGNode node : nodes) {
                    String safeLabel = node.getLabel()
                            .replace("\\", "\\\\")
                            .replace("\"", "\\\"");
                    writer.printf("  \"%s\" [label=\"%s\"];%n", node.getName(), safeLabel);
                }
                for (CFGEdge edge : edges) {
                    writer.printf("  \"%s\" -> \"%s\";%n", edge.from.getName(), edge.to.getName());
                }
                writer.println("}");
            }
            logger.info("{} exported to: {}", graphName, filePath);
        }
    }

    // Entry and exit of a CFG fragment.
    public static class EntryExit {
        public CFGNode entry;
        public CFGNode exit;
        public EntryExit(CFGNode entry, CFGNode exit) {
            this.entry = entry;
            this.exit = exit;
        }
    }

    // Targets for break/continue. A labeled block has no continue target and
    // only answers to a labeled break.
    private static class LoopContext {
        final String label;
        final CFGNode continueTarget;
        final CFGNode exitNode;
        final boolean acceptsPlainBreak;
        LoopContext(String label, CFGNode continueTarget, CFGNode exitNode, boolean acceptsPlainBreak) {
            this.label = label;
            this.continueTarget = continueTarget;
            this.exitNode = exitNode;
            this.acceptsPlainBreak = acceptsPlainBreak;
        }
    }

    private final Deque<LoopContext> loopStack = new ArrayDeque<>();
    private final Set<CFGNode> terminals = new HashSet<>();
    private CFGNode currentMethodEnd = null;
    private String pendingLabel = null;

    /**
     * Parses the given file and builds the CFG of all its methods.
     *
     * @param sourcePath path to a Java source file.
     * @return the control flow graph.
     * @throws IOException if the file cannot be read.
     */
    public ControlFlowGraph generateCFG(String sourcePath) throws IOException {
        CompilationUnit cu = StaticJavaParser.parse(Paths.get(sourcePath));
        return generateCFG(cu);
    }

    public ControlFlowGraph generateCFG(CompilationUnit cu) {
        ControlFlowGraph cfg = new ControlFlowGraph();
        loopStack.clear();
        terminals.clear();
        pendingLabel = null;
        cu.findAll(MethodDeclaration.class).forEach(method -> {
            CFGNode startNode = cfg.createNode("Method Start: " + method.getName());
            CFGNode endNode = cfg.createNode("Method End: " + method.getName());
            if (method.getBody().isPresent()) {
                currentMethodEnd = endNode;
                EntryExit ee = processBlock(method.getBody().get(), cfg);
                cfg.addEdge(startNode, ee.entry);
                if (!terminals.contains(ee.exit)) {
                    cfg.addEdge(ee.exit, endNode);
                }
            } else {
                cfg.addEdge(startNode, endNode);
            }
        });
        logger.info("Generated CFG with {} nodes and {} edges", cfg.getNodes().size(), cfg.getEdges().size());
        cfg.logGraph();
        return cfg;
    }

    private EntryExit processBlock(BlockStmt block, ControlFlowGraph cfg) {
        EntryExit result = null;
        for (Statement stmt : block.getStatements()) {
            EntryExit current = processStatement(stmt, cfg);
            if (result == null) {
                result = current;
            } else {
                if (!terminals.contains(result.exit)) {
                    cfg.addEdge(result.exit, current.entry);
                }
                result.exit = current.exit;
            }
        }
        if (result == null) {
            CFGNode dummy = cfg.createNode("empty block");
            result = new EntryExit(dummy, dummy);
        }
        return result;
    }

    private EntryExit processStatement(Statement stmt, ControlFlowGraph cfg) {
        if (stmt.isBlockStmt()) {
            return processBlock(stmt.asBlockStmt(), cfg);
        } else if (stmt.isLabeledStmt()) {
            return processLabeledStmt(stmt.asLabeledStmt(), cfg);
        } else if (stmt.isIfStmt()) {
            return processIfStmt(stmt.asIfStmt(), cfg);
        } else if (stmt.isWhileStmt()) {
            return processWhileStmt(stmt.asWhileStmt(), cfg);
        } else if (stmt.isForStmt()) {
            return processForStmt(stmt.asForStmt(), cfg);
        } else if (stmt.isForEachStmt()) {
            return processForEachStmt(stmt.asForEachStmt(), cfg);
        } else if (stmt.isDoStmt()) {
            return processDoStmt(stmt.asDoStmt(), cfg);
        } else if (stmt.isSwitchStmt()) {
            return processSwitchStmt(stmt.asSwitchStmt(), cfg);
        } else if (stmt.isTryStmt()) {
            return processTryStmt(stmt.asTryStmt(), cfg);
        } else if (stmt.isSynchronizedStmt()) {
            return processSynchronizedStmt(stmt.asSynchronizedStmt(), cfg);
        } else if (stmt.isReturnStmt() || stmt.isThrowStmt()) {
            return processExitStmt(stmt, cfg);
        } else if (stmt.isBreakStmt()) {
            BreakStmt breakStmt = stmt.asBreakStmt();
            return processJump(stmt, cfg, breakTarget(breakStmt.getLabel().map(SimpleName::asString).orElse(null)));
        } else if (stmt.isContinueStmt()) {
            ContinueStmt continueStmt = stmt.asContinueStmt();
            return processJump(stmt, cfg, continueTarget(continueStmt.getLabel().map(SimpleName::asString).orElse(null)));
        } else {
            CFGNode node = cfg.createNode(stmt.toString());
            return new EntryExit(node, node);
        }
    }

    private EntryExit processLabeledStmt(LabeledStmt labeledStmt, ControlFlowGraph cfg) {
        String label = labeledStmt.getLabel().asString();
        Statement body = labeledStmt.getStatement();
        if (body.isWhileStmt() || body.isForStmt() || body.isForEachStmt() || body.isDoStmt()) {
            // Picked up by the loop when it pushes its context.
            pendingLabel = label;
            return processStatement(body, cfg);
        }
        CFGNode exitNode = cfg.createNode(label + "-exit");
        loopStack.push(new LoopContext(label, null, exitNode, false));
        EntryExit bodyEE;
        try {
            bodyEE = processStatement(body, cfg);
        } finally {
            loopStack.pop();
        }
        if (!terminals.contains(bodyEE.exit)) {
            cfg.addEdge(bodyEE.exit, exitNode);
        }
        return new EntryExit(bodyEE.entry, exitNode);
    }

    private EntryExit processIfStmt(IfStmt ifStmt, ControlFlowGraph cfg) {
        CFGNode condNode = cfg.createNode("if " + ifStmt.getCondition());

        EntryExit thenEE = processStatement(ifStmt.getThenStmt(), cfg);
        cfg.addEdge(condNode, thenEE.entry);

        EntryExit elseEE = null;
        if (ifStmt.getElseStmt().isPresent()) {
            elseEE = processStatement(ifStmt.getElseStmt().get(), cfg);
            cfg.addEdge(condNode, elseEE.entry);
        }

        boolean thenTerminal = terminals.contains(thenEE.exit);
        boolean elseTerminal = elseEE != null && terminals.contains(elseEE.exit);

        // Both branches jump away, so the terminal exit stops any fall-through edge.
        if (elseEE != null && thenTerminal && elseTerminal) {
            return new EntryExit(condNode, thenEE.exit);
        }

        CFGNode mergeNode = cfg.createNode("if-merge");
        if (!thenTerminal) {
            cfg.addEdge(thenEE.exit, mergeNode);
        }
        if (elseEE == null) {
            cfg.addEdge(condNode, mergeNode);
        } else if (!elseTerminal) {
            cfg.addEdge(elseEE.exit, mergeNode);
        }
        return new EntryExit(condNode, mergeNode);
    }

    private EntryExit processWhileStmt(WhileStmt whileStmt, ControlFlowGraph cfg) {
        CFGNode condNode = cfg.createNode("while " + whileStmt.getCondition());
        CFGNode exitNode = cfg.createNode("while-exit");
        EntryExit bodyEE = processLoopBody(whileStmt.getBody(), condNode, exitNode, cfg);
        cfg.addEdge(condNode, bodyEE.entry);
        linkBack(bodyEE, condNode, cfg);
        cfg.addEdge(condNode, exitNode);
        return new EntryExit(condNode, exitNode);
    }

    private EntryExit processForStmt(ForStmt forStmt, ControlFlowGraph cfg) {
        CFGNode initNode = null;
        if (!forStmt.getInitialization().isEmpty()) {
            initNode = cfg.createNode("for-init: " + forStmt.getInitialization());
        }
        String cond = forStmt.getCompare().map(Object::toString).orElse("true");
        CFGNode condNode = cfg.createNode("for-cond: " + cond);
        CFGNode updateNode = null;
        if (!forStmt.getUpdate().isEmpty()) {
            updateNode = cfg.createNode("for-update: " + forStmt.getUpdate());
        }
        CFGNode exitNode = cfg.createNode("for-exit");

        if (initNode != null) {
            cfg.addEdge(initNode, condNode);
        }

        CFGNode continueTarget = updateNode != null ? updateNode : condNode;
        EntryExit bodyEE = processLoopBody(forStmt.getBody(), continueTarget, exitNode, cfg);
        cfg.addEdge(condNode, bodyEE.entry);
        linkBack(bodyEE, continueTarget, cfg);
        if (updateNode != null) {
            cfg.addEdge(updateNode, condNode);
        }
        cfg.addEdge(condNode, exitNode);

        return new EntryExit(initNode != null ? initNode : condNode, exitNode);
    }

    private EntryExit processForEachStmt(ForEachStmt forEachStmt, ControlFlowGraph cfg) {
        CFGNode condNode = cfg.createNode("for-each (" + forEachStmt.getVariable() + ")");
        CFGNode exitNode = cfg.createNode("for-each-exit");
        EntryExit bodyEE = processLoopBody(forEachStmt.getBody(), condNode, exitNode, cfg);
        cfg.addEdge(condNode, bodyEE.entry);
        linkBack(bodyEE, condNode, cfg);
        cfg.addEdge(condNode, exitNode);
        return new EntryExit(condNode, exitNode);
    }

    private EntryExit processDoStmt(DoStmt doStmt, ControlFlowGraph cfg) {
        CFGNode condNode = cfg.createNode("do-while " + doStmt.getCondition());
        CFGNode exitNode = cfg.createNode("do-while-exit");
        EntryExit bodyEE = processLoopBody(doStmt.getBody(), condNode, exitNode, cfg);
        linkBack(bodyEE, condNode, cfg);
        cfg.addEdge(condNode, bodyEE.entry);
        cfg.addEdge(condNode, exitNode);
        return new EntryExit(bodyEE.entry, exitNode);
    }

    private EntryExit processLoopBody(Statement body, CFGNode continueTarget, CFGNode exitNode, ControlFlowGraph cfg) {
        String label = pendingLabel;
        pendingLabel = null;
        loopStack.push(new LoopContext(label, continueTarget, exitNode, true));
        try {
            return processStatement(body, cfg);
        } finally {
            loopStack.pop();
        }
    }

    private void linkBack(EntryExit bodyEE, CFGNode target, ControlFlowGraph cfg) {
        if (!terminals.contains(bodyEE.exit)) {
            cfg.addEdge(bodyEE.exit, target);
        }
    }

    private EntryExit processSwitchStmt(SwitchStmt switchStmt, ControlFlowGraph cfg) {
        CFGNode switchNode = cfg.createNode("switch(" + switchStmt.getSelector() + ")");
        CFGNode mergeNode = cfg.createNode("switch-merge");
        boolean hasDefault = false;
        // Nodes that flow into the first statement of the next case: its own case
        // label plus whatever fell out of the previous case without a jump.
        List<CFGNode> fallThrough = new ArrayList<>();
        loopStack.push(new LoopContext(null, null, mergeNode, true));
        try {
            for (SwitchEntry entry : switchStmt.getEntries()) {
                String label;
                if (entry.getLabels().isEmpty()) {
                    label = "default:";
                    hasDefault = true;
                } else {
                    label = "case " + entry.getLabels().toString().replace("[", "").replace("]", "");
                }
                CFGNode caseNode = cfg.createNode(label);
                cfg.addEdge(switchNode, caseNode);
                fallThrough.add(caseNode);
                CFGNode last = null;
                for (Statement s : entry.getStatements()) {
                    EntryExit stmtEE = processStatement(s, cfg);
                    if (last == null) {
                        for (CFGNode from : fallThrough) {
                            cfg.addEdge(from, stmtEE.entry);
                        }
                        fallThrough.clear();
                    } else if (!terminals.contains(last)) {
                        cfg.addEdge(last, stmtEE.entry);
                    }
                    last = stmtEE.exit;
                }
                if (last != null && !terminals.contains(last)) {
                    fallThrough.add(last);
                }
            }
        } finally {
            loopStack.pop();
        }
        for (CFGNode from : fallThrough) {
            cfg.addEdge(from, mergeNode);
        }
        if (!hasDefault) {
            cfg.addEdge(switchNode, mergeNode);
        }
        return new EntryExit(switchNode, mergeNode);
    }

    /**
     * try/catch/finally. Any statement of the try block may throw, so every catch
     * clause is entered from the try node. Normal exits of the try block and the
     * handlers run through finally; finally also continues to the method end for
     * exceptions nobody catches.
     */
    private EntryExit processTryStmt(TryStmt tryStmt, ControlFlowGraph cfg) {
        String header = tryStmt.getResources().isEmpty() ? "try" : "try " + tryStmt.getResources();
        CFGNode tryNode = cfg.createNode(header);
        EntryExit bodyEE = processBlock(tryStmt.getTryBlock(), cfg);
        cfg.addEdge(tryNode, bodyEE.entry);

        List<CFGNode> normalExits = new ArrayList<>();
        if (!terminals.contains(bodyEE.exit)) {
            normalExits.add(bodyEE.exit);
        }
        for (CatchClause clause : tryStmt.getCatchClauses()) {
            CFGNode catchNode = cfg.createNode("catch (" + clause.getParameter() + ")");
            cfg.addEdge(tryNode, catchNode);
            EntryExit handlerEE = processBlock(clause.getBody(), cfg);
            cfg.addEdge(catchNode, handlerEE.entry);
            if (!terminals.contains(handlerEE.exit)) {
                normalExits.add(handlerEE.exit);
            }
        }

        if (tryStmt.getFinallyBlock().isPresent()) {
            EntryExit finallyEE = processBlock(tryStmt.getFinallyBlock().get(), cfg);
            cfg.addEdge(tryNode, finallyEE.entry);
            for (CFGNode from : normalExits) {
                cfg.addEdge(from, finallyEE.entry);
            }
            if (!terminals.contains(finallyEE.exit) && currentMethodEnd != null) {
                cfg.addEdge(finallyEE.exit, currentMethodEnd);
                if (normalExits.isEmpty()) {
                    terminals.add(finallyEE.exit);
                }
            }
            return new EntryExit(tryNode, finallyEE.exit);
        }

        if (normalExits.isEmpty()) {
            return new EntryExit(tryNode, bodyEE.exit);
        }
        CFGNode mergeNode = cfg.createNode("try-merge");
        for (CFGNode from : normalExits) {
            cfg.addEdge(from, mergeNode);
        }
        return new EntryExit(tryNode, mergeNode);
    }

    private EntryExit processSynchronizedStmt(SynchronizedStmt syncStmt, ControlFlowGraph cfg) {
        CFGNode lockNode = cfg.createNode("synchronized (" + syncStmt.getExpression() + ")");
        EntryExit bodyEE = processBlock(syncStmt.getBody(), cfg);
        cfg.addEdge(lockNode, bodyEE.entry);
        return new EntryExit(lockNode, bodyEE.exit);
    }

    private EntryExit processExitStmt(Statement stmt, ControlFlowGraph cfg) {
        CFGNode node = cfg.createNode(stmt.toString());
        if (currentMethodEnd != null) {
            cfg.addEdge(node, currentMethodEnd);
        }
        terminals.add(node);
        return new EntryExit(node, node);
    }

    // Innermost loop or switch for a plain break, the matching label otherwise.
    private CFGNode breakTarget(String label) {
        for (LoopContext ctx : loopStack) {
            if (label == null ? ctx.acceptsPlainBreak : label.equals(ctx.label)) {
                return ctx.exitNode;
            }
        }
        return null;
    }

    private CFGNode continueTarget(String label) {
        for (LoopContext ctx : loopStack) {
            if (ctx.continueTarget == null) {
                continue;
            }
            if (label == null || label.equals(ctx.label)) {
                return ctx.continueTarget;
            }
        }
        return null;
    }

    private EntryExit processJump(Statement stmt, ControlFlowGraph cfg, CFGNode target) {
        CFGNode node = cfg.createNode(stmt.toString());
        if (target != null) {
            cfg.addEdge(node, target);
            terminals.add(node);
        }
        return new EntryExit(node, node);
    }
}
