package sanalysis;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import dominance.DominatorTree;
import dominance.Dominators;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.*;

/**
 * DominatorTreeGenerator computes the dominator tree of a whole source file.
 *
 * The per-method CFGs produced by {@link CFGGenerator} are joined under a virtual
 * entry node. The main method hangs directly off the virtual entry. Any other method
 * is entered from its first call site when one can be identified (a statement that
 * calls the method), and from the virtual entry otherwise.
 */
public class DominatorTreeGenerator {

    private static final Logger logger = LoggerFactory.getLogger(DominatorTreeGenerator.class);

    static final String VIRTUAL_ENTRY_LABEL = "Virtual Entry";
    private static final String METHOD_START = "Method Start: ";

    private final CFGGenerator cfgGenerator = new CFGGenerator();

    /**
     * Builds the CFG of the given file with a virtual entry and computes its dominator tree.
     *
     * @param sourcePath path to a Java source file.
     * @return the dominator tree rooted at the virtual entry.
     * @throws IOException if the file cannot be read.
     */
    public DominatorTree<CFGGenerator.CFGNode> generate(String sourcePath) throws IOException {
        CFGGenerator.ControlFlowGraph cfg = cfgGenerator.generateCFG(sourcePath);
        CFGGenerator.CFGNode entry = addVirtualEntry(cfg);
        return computeDominatorTree(cfg, entry);
    }

    /**
     * Adds a virtual entry node and connects it (or a call site) to every method start.
     *
     * @param cfg the CFG to extend.
     * @return the virtual entry node.
     */
    public static CFGGenerator.CFGNode addVirtualEntry(CFGGenerator.ControlFlowGraph cfg) {
        List<CFGGenerator.CFGNode> methodStarts = new ArrayList<>();
        for (CFGGenerator.CFGNode node : cfg.getNodes()) {
            if (node.getLabel().startsWith(METHOD_START)) {
                methodStarts.add(node);
            }
        }
        CFGGenerator.CFGNode virtualEntry = cfg.createNode(VIRTUAL_ENTRY_LABEL);

        for (CFGGenerator.CFGNode start : methodStarts) {
            String methodName = start.getLabel().substring(METHOD_START.length()).trim();
            if (methodName.equals("main")) {
                cfg.addEdge(virtualEntry, start);
                continue;
            }
            Optional<CFGGenerator.CFGNode> callSite = cfg.getNodes().stream()
                    .filter(n -> !n.getLabel().startsWith(METHOD_START))
                    .filter(n -> n.getLabel().contains(methodName + "("))
                    .findFirst();
            if (callSite.isPresent()) {
                logger.debug("Entering {} from call site {}", methodName, callSite.get().getLabel());
                cfg.addEdge(callSite.get(), start);
            } else {
                cfg.addEdge(virtualEntry, start);
            }
        }
        return virtualEntry;
    }

    public static DominatorTree<CFGGenerator.CFGNode> computeDominatorTree(
            CFGGenerator.ControlFlowGraph cfg, CFGGenerator.CFGNode entry) {
        DominatorTree<CFGGenerator.CFGNode> tree = Dominators.compute(entry, cfg);
        int unreachable = cfg.getNodes().size() - tree.size();
        if (unreachable > 0) {
            logger.info("{} CFG nodes are unreachable from {} and are left out", unreachable, entry.getLabel());
        }
        return tree;
    }

    /**
     * Converts a dominator tree into a graph with one edge from every immediate
     * dominator to each node it dominates.
     */
    public static CFGGenerator.ControlFlowGraph toGraph(DominatorTree<CFGGenerator.CFGNode> tree) {
        CFGGenerator.ControlFlowGraph domTree = new CFGGenerator.ControlFlowGraph();
        for (CFGGenerator.CFGNode node : tree.getNodes()) {
            domTree.addNode(node);
        }
        for (CFGGenerator.CFGNode node : tree.getNodes()) {
            for (CFGGenerator.CFGNode child : tree.getDominatedBy(node)) {
                domTree.addEdge(node, child);
            }
        }
        return domTree;
    }

    /**
     * Writes the tree as JSON: the root id, a label per node id, the immediate
     * dominator of every non-root node and the children of every node that has any.
     */
    public static void exportToJson(DominatorTree<CFGGenerator.CFGNode> tree, Path jsonPath) throws IOException {
        TreeJson json = new TreeJson();
        json.root = tree.getRoot().getId();
        for (CFGGenerator.CFGNode node : tree.getNodes()) {
            String key = String.valueOf(node.getId());
            json.labels.put(key, node.getLabel());
            CFGGenerator.CFGNode idom = tree.getDominatorOf(node);
            if (idom != null) {
                json.immediateDominators.put(key, idom.getId());
            }
            List<CFGGenerator.CFGNode> children = tree.getDominatedBy(node);
            if (!children.isEmpty()) {
                List<Long> ids = new ArrayList<>();
                for (CFGGenerator.CFGNode child : children) {
                    ids.add(child.getId());
                }
                json.children.put(key, ids);
            }
        }
        Gson gson = new GsonBuilder().setPrettyPrinting().create();
        try (Writer writer = Files.newBufferedWriter(jsonPath, StandardCharsets.UTF_8)) {
            gson.toJson(json, writer);
        }
        logger.info("Dominator tree JSON saved to: {}", jsonPath);
    }

    static class TreeJson {
        long root;
        Map<String, String> labels = new LinkedHashMap<>();
        Map<String, Long> immediateDominators = new LinkedHashMap<>();
        Map<String, List<Long>> children = new LinkedHashMap<>();
    }

    /**
     * Usage: DominatorTreeGenerator &lt;source_file&gt; [&lt;dot_output&gt;] [&lt;json_output&gt;]
     */
    public static void main(String[] args) {
        if (args.length < 1) {
            logger.error("Usage: java sanalysis.DominatorTreeGenerator <source_file> [<dot_output>] [<json_output>]");
            System.exit(2);
        }
        String sourcePath = args[0];
        Path dotPath = Paths.get(args.length >= 2 ? args[1] : sourcePath + ".dom.dot");
        Path jsonPath = Paths.get(args.length >= 3 ? args[2] : sourcePath + ".dom.json");

        try {
            DominatorTree<CFGGenerator.CFGNode> tree = new DominatorTreeGenerator().generate(sourcePath);
            logger.info("Dominator tree has {} nodes", tree.size());
            toGraph(tree).exportToDotFile("DominatorTree", dotPath);
            exportToJson(tree, jsonPath);
        } catch (Exception e) {
            logger.error("Failed to generate dominator tree for {}: {}", sourcePath, e.getMessage(), e);
            System.exit(1);
        }
    }
}
