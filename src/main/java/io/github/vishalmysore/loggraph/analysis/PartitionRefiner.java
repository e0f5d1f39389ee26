package io.github.vishalmysore.loggraph.analysis;

import io.github.vishalmysore.loggraph.graph.LabeledGraph;
import io.github.vishalmysore.loggraph.util.Checks;

import java.util.*;
import java.util.logging.Logger;

/**
 * Computes the relational coarsest stable refinement of a partition of a
 * graph's nodes, using the algorithm of Paige and Tarjan.
 *
 * A partition is stable if, for any two blocks B1 and B2, either every node of
 * B1 has an edge into B2 or none does. Refinement only ever splits blocks, so
 * the result refines the initial partition, and it is the coarsest stable
 * partition that does so.
 *
 * Blocks are grouped into super-blocks. Each super-block tracks, for every
 * node, how many distinct successors the node has inside the super-block. A
 * super-block with more than one block is compound; refinement repeatedly
 * takes the smaller of the first two blocks of a compound super-block as a
 * splitter and splits every block by the splitter and by the rest of its old
 * super-block. Blocks and super-blocks live in arenas and refer to each other
 * by index.
 */
public class PartitionRefiner {
    private static final Logger log = Logger.getLogger(PartitionRefiner.class.getName());

    private final LabeledGraph graph;
    private final List<Block> blocks = new ArrayList<>();
    private final List<SuperBlock> superBlocks = new ArrayList<>();
    private final Deque<Integer> compoundSuperBlocks = new ArrayDeque<>();
    private final Map<Integer, Integer> blockOfNode = new HashMap<>();

    private static class Block {
        final Set<Integer> nodes = new TreeSet<>();
        int parent;
        boolean removed;

        Block(int parent) {
            this.parent = parent;
        }
    }

    private static class SuperBlock {
        // Insertion ordered so that the first two children are well defined.
        final Set<Integer> children = new LinkedHashSet<>();
        final Map<Integer, Integer> count = new HashMap<>();
    }

    private PartitionRefiner(LabeledGraph graph) {
        this.graph = graph;
    }

    /**
     * Refines {@code partition}, which must assign a block id to every node of
     * {@code graph}. Block ids in the result are dense, starting at 0.
     */
    public static Map<Integer, Integer> refinePartition(LabeledGraph graph, Map<Integer, Integer> partition) {
        PartitionRefiner refiner = new PartitionRefiner(graph);
        refiner.initialize(partition);
        refiner.refine();
        Map<Integer, Integer> refined = refiner.toPartition();
        log.info("Refined " + new HashSet<>(partition.values()).size() + " blocks into "
                + new HashSet<>(refined.values()).size() + " blocks");
        return refined;
    }

    private void initialize(Map<Integer, Integer> partition) {
        for (int node : graph.nodeIds()) {
            Checks.check(partition.containsKey(node), "The following node is missing from the partition: " + node);
        }
        int whole = newSuperBlock();
        SuperBlock wholeSet = superBlocks.get(whole);
        Map<Integer, Integer> blockOfId = new TreeMap<>();
        for (Map.Entry<Integer, Integer> entry : new TreeMap<>(partition).entrySet()) {
            int node = entry.getKey();
            Checks.check(graph.hasNode(node), "Invalid node id: " + node);
            int block = blockOfId.computeIfAbsent(entry.getValue(), k -> newBlock(whole));
            blocks.get(block).nodes.add(node);
            blockOfNode.put(node, block);
            wholeSet.count.put(node, graph.getSuccessors(node).size());
        }

        // Nodes without successors are never in a preimage, so they are split off
        // up front.
        int numInitialBlocks = blocks.size();
        for (int b = 0; b < numInitialBlocks; ++b) {
            Block block = blocks.get(b);
            Integer sink = null;
            for (Iterator<Integer> it = block.nodes.iterator(); it.hasNext(); ) {
                int node = it.next();
                if (wholeSet.count.get(node) != 0) {
                    continue;
                }
                if (sink == null) {
                    sink = newBlock(whole);
                }
                it.remove();
                blocks.get(sink).nodes.add(node);
                blockOfNode.put(node, sink);
            }
            if (block.nodes.isEmpty()) {
                removeBlock(b);
            }
        }
        if (wholeSet.children.size() > 1) {
            compoundSuperBlocks.add(whole);
        }
    }

    private void refine() {
        while (!compoundSuperBlocks.isEmpty()) {
            int s = compoundSuperBlocks.poll();
            SuperBlock superBlock = superBlocks.get(s);
            if (superBlock.children.size() < 2) {
                continue;
            }
            int splitter = pickSplitter(superBlock);
            if (superBlock.children.size() > 1) {
                compoundSuperBlocks.add(s);
            }
            int sPrime = newSuperBlock();
            SuperBlock splitterSet = superBlocks.get(sPrime);
            splitterSet.children.add(splitter);
            blocks.get(splitter).parent = sPrime;

            SortedSet<Integer> preimage = new TreeSet<>();
            for (int node : blocks.get(splitter).nodes) {
                for (int predecessor : graph.getPredecessors(node)) {
                    preimage.add(predecessor);
                    splitterSet.count.merge(predecessor, 1, Integer::sum);
                }
            }
            threeWaySplit(superBlock, splitterSet, preimage);
            updateCounts(superBlock, splitterSet, preimage);
        }
    }

    /** Removes and returns the smaller of the first two children. */
    private int pickSplitter(SuperBlock superBlock) {
        Iterator<Integer> it = superBlock.children.iterator();
        int first = it.next();
        int second = it.next();
        int splitter = blocks.get(first).nodes.size() > blocks.get(second).nodes.size() ? second : first;
        superBlock.children.remove(splitter);
        return splitter;
    }

    /**
     * Splits every block meeting the preimage of the splitter. Nodes with
     * edges into both the splitter and the rest of the old super-block go to
     * one new block; nodes with edges only into the splitter go to another;
     * the remaining nodes stay.
     */
    private void threeWaySplit(SuperBlock superBlock, SuperBlock splitterSet, SortedSet<Integer> preimage) {
        Map<Integer, int[]> splits = new LinkedHashMap<>();
        for (int node : preimage) {
            int b = blockOfNode.get(node);
            Block block = blocks.get(b);
            int[] newBlocks = splits.computeIfAbsent(b, k -> new int[]{-1, -1});
            int countIntoSplitter = splitterSet.count.get(node);
            int countIntoSuperBlock = superBlock.count.getOrDefault(node, 0);
            int slot = countIntoSplitter != countIntoSuperBlock ? 0 : 1;
            if (newBlocks[slot] < 0) {
                newBlocks[slot] = newBlock(block.parent);
            }
            block.nodes.remove(node);
            blocks.get(newBlocks[slot]).nodes.add(node);
            blockOfNode.put(node, newBlocks[slot]);
        }

        for (Map.Entry<Integer, int[]> split : splits.entrySet()) {
            int b = split.getKey();
            Block block = blocks.get(b);
            int numNewBlocks = 0;
            for (int newBlock : split.getValue()) {
                if (newBlock >= 0) {
                    ++numNewBlocks;
                }
            }
            SuperBlock parent = superBlocks.get(block.parent);
            if (block.nodes.isEmpty()) {
                removeBlock(b);
                --numNewBlocks;
            }
            // The parent becomes compound if it had a single child before the split.
            if (numNewBlocks > 0 && parent.children.size() - numNewBlocks == 1) {
                compoundSuperBlocks.add(block.parent);
            }
        }
    }

    /** Edges into the splitter no longer count as edges into the old super-block. */
    private void updateCounts(SuperBlock superBlock, SuperBlock splitterSet, SortedSet<Integer> preimage) {
        for (int node : preimage) {
            int remaining = superBlock.count.getOrDefault(node, 0) - splitterSet.count.get(node);
            if (remaining < 1) {
                superBlock.count.remove(node);
            } else {
                superBlock.count.put(node, remaining);
            }
        }
    }

    private Map<Integer, Integer> toPartition() {
        Map<Integer, Integer> refined = new TreeMap<>();
        int blockId = 0;
        for (Block block : blocks) {
            if (block.removed) {
                continue;
            }
            for (int node : block.nodes) {
                refined.put(node, blockId);
            }
            ++blockId;
        }
        return refined;
    }

    private int newSuperBlock() {
        superBlocks.add(new SuperBlock());
        return superBlocks.size() - 1;
    }

    private int newBlock(int parent) {
        blocks.add(new Block(parent));
        int b = blocks.size() - 1;
        superBlocks.get(parent).children.add(b);
        return b;
    }

    private void removeBlock(int b) {
        Block block = blocks.get(b);
        block.removed = true;
        superBlocks.get(block.parent).children.remove(b);
    }
}
