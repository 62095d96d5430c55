///////////////////////////////////////////////////////////////////////////////
// For information as to what this class does, see the Javadoc, below.       //
// Copyright (C) 1998, 1999, 2000, 2001, 2002, 2003, 2004, 2005, 2006,       //
// 2007, 2008, 2009, 2010, 2014, 2015 by Peter Spirtes, Richard Scheines, Joseph   //
// Ramsey, and Clark Glymour.                                                //
//                                                                           //
// This program is free software; you can redistribute it and/or modify      //
// it under the terms of the GNU General Public License as published by      //
// the Free Software Foundation; either version 2 of the License, or         //
// (at your option) any later version.                                       //
//                                                                           //
// This program is distributed in the hope that it will be useful,           //
// but WITHOUT ANY WARRANTY; without even the implied warranty of            //
// MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the             //
// GNU General Public License for more details.                              //
//                                                                           //
// You should have received a copy of the GNU General Public License         //
// along with this program; if not, write to the Free Software               //
// Foundation, Inc., 59 Temple Place, Suite 330, Boston, MA  02111-1307  USA //
///////////////////////////////////////////////////////////////////////////////

package edu.cmu.causalinfo.graph;

import edu.cmu.causalinfo.util.DiagnosticEvent;
import edu.cmu.causalinfo.util.DiagnosticSink;
import org.apache.commons.lang3.Validate;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedList;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Adjacency and path queries over a {@link TimeLagGraph}. A causal path is a simple directed path, possibly a single
 * edge, from a source to a target.
 * <p>
 * All methods validate their nodes first and work on fresh local sets; the graph is only read.
 *
 * @author Joseph Ramsey
 */
public final class GraphPaths {
    private final TimeLagGraph graph;
    private final NodeCodec codec;
    private final DiagnosticSink sink;

    //=============================CONSTRUCTORS==========================//

    public GraphPaths(TimeLagGraph graph) {
        this(graph, DiagnosticSink.NONE);
    }

    public GraphPaths(TimeLagGraph graph, DiagnosticSink sink) {
        Validate.notNull(graph, "Graph is null.");
        Validate.notNull(sink, "Diagnostic sink is null.");
        this.graph = graph;
        this.codec = graph.getCodec();
        this.sink = sink;
    }

    //==============================PUBLIC METHODS========================//

    public TimeLagGraph getGraph() {
        return graph;
    }

    /**
     * @return the parents of any node in the set that are not themselves in the set.
     */
    public SortedSet<LaggedNode> parentsOf(Collection<LaggedNode> nodes) {
        return neighbors(nodes, true);
    }

    /**
     * @return the children of any node in the set that are not themselves in the set.
     */
    public SortedSet<LaggedNode> childrenOf(Collection<LaggedNode> nodes) {
        return neighbors(nodes, false);
    }

    /**
     * Parents of a single node. Reports NO_PARENTS if there are none.
     */
    public SortedSet<LaggedNode> searchParents(LaggedNode node) {
        SortedSet<LaggedNode> parents = parentsOf(Collections.singletonList(node));

        if (parents.isEmpty()) {
            sink.report(new DiagnosticEvent(DiagnosticEvent.Type.NO_PARENTS, "No parents for the node " + node, node));
        }

        return parents;
    }

    /**
     * Children of a single node. Reports NO_CHILDREN if there are none.
     */
    public SortedSet<LaggedNode> searchChildren(LaggedNode node) {
        SortedSet<LaggedNode> children = childrenOf(Collections.singletonList(node));

        if (children.isEmpty()) {
            sink.report(new DiagnosticEvent(DiagnosticEvent.Type.NO_CHILDREN, "No children for the node " + node,
                    node));
        }

        return children;
    }

    /**
     * All simple directed paths from source to target, each listed from source to target. The list is empty if there
     * are none or if source equals target. No particular order.
     */
    public List<List<LaggedNode>> simplePaths(LaggedNode source, LaggedNode target) {
        int s = codec.encode(source);
        int t = codec.encode(target);

        List<List<LaggedNode>> paths = new ArrayList<>();
        if (s == t) return paths;

        BitSet toTarget = ancestorsOf(t);
        if (!toTarget.get(s)) return paths;

        LinkedList<Integer> path = new LinkedList<>();
        BitSet onPath = new BitSet(codec.getNumNodes());
        path.add(s);
        onPath.set(s);

        collectPaths(s, t, toTarget, path, onPath, paths);
        return paths;
    }

    /**
     * The nodes on any causal path from source to target, the source included and the target excluded. Equal to the
     * union of {@link #simplePaths} with the target removed.
     */
    public SortedSet<LaggedNode> causalPathNodes(LaggedNode source, LaggedNode target) {
        int s = codec.encode(source);
        int t = codec.encode(target);

        SortedSet<LaggedNode> nodes = new TreeSet<>();
        if (s == t) return nodes;

        BitSet between = descendantsOf(s);
        between.and(ancestorsOf(t));

        if (!between.get(s)) return nodes;

        if (isAcyclic(between)) {
            // On a DAG every node reachable from s that reaches t lies on some simple s-t path.
            between.clear(t);

            for (int id = between.nextSetBit(0); id >= 0; id = between.nextSetBit(id + 1)) {
                nodes.add(codec.decode(id));
            }

            return nodes;
        }

        for (List<LaggedNode> path : simplePaths(source, target)) {
            nodes.addAll(path.subList(0, path.size() - 1));
        }

        return nodes;
    }

    /**
     * @return true iff there is a causal path from source to target.
     */
    public boolean hasCausalPath(LaggedNode source, LaggedNode target) {
        int s = codec.encode(source);
        int t = codec.encode(target);
        return s != t && ancestorsOf(t).get(s);
    }

    /**
     * @return true iff some causal path from source to target has at least one node between them.
     */
    public boolean hasMultiHopPath(LaggedNode source, LaggedNode target) {
        int s = codec.encode(source);
        int t = codec.encode(target);
        if (s == t) return false;

        for (int c : graph.childIds(s)) {
            if (c == t || c == s) continue;

            BitSet blocked = new BitSet(codec.getNumNodes());
            blocked.set(s);

            if (reaches(c, t, blocked)) {
                return true;
            }
        }

        return false;
    }

    /**
     * The causal path nodes from source to target and their parents.
     */
    public PathAndParents pathAndParents(LaggedNode source, LaggedNode target) {
        SortedSet<LaggedNode> pathNodes = causalPathNodes(source, target);
        return new PathAndParents(parentsOf(pathNodes), pathNodes);
    }

    //==============================PRIVATE METHODS========================//

    private SortedSet<LaggedNode> neighbors(Collection<LaggedNode> nodes, boolean parents) {
        Validate.notNull(nodes, "Nodes are null.");
        BitSet members = new BitSet(codec.getNumNodes());

        for (LaggedNode node : nodes) {
            members.set(codec.encode(node));
        }

        BitSet found = new BitSet(codec.getNumNodes());

        for (int id = members.nextSetBit(0); id >= 0; id = members.nextSetBit(id + 1)) {
            for (int n : parents ? graph.parentIds(id) : graph.childIds(id)) {
                found.set(n);
            }
        }

        found.andNot(members);

        SortedSet<LaggedNode> result = new TreeSet<>();

        for (int id = found.nextSetBit(0); id >= 0; id = found.nextSetBit(id + 1)) {
            result.add(codec.decode(id));
        }

        return result;
    }

    private void collectPaths(int u, int t, BitSet toTarget, LinkedList<Integer> path, BitSet onPath,
                              List<List<LaggedNode>> paths) {
        for (int c : graph.childIds(u)) {
            if (c == t) {
                path.addLast(t);
                paths.add(codec.decodePath(path));
                path.removeLast();
            } else if (toTarget.get(c) && !onPath.get(c)) {
                path.addLast(c);
                onPath.set(c);
                collectPaths(c, t, toTarget, path, onPath, paths);
                onPath.clear(c);
                path.removeLast();
            }
        }
    }

    /**
     * The node and every node it reaches.
     */
    private BitSet descendantsOf(int id) {
        return closure(id, false);
    }

    /**
     * The node and every node that reaches it.
     */
    private BitSet ancestorsOf(int id) {
        return closure(id, true);
    }

    private BitSet closure(int start, boolean backward) {
        BitSet seen = new BitSet(codec.getNumNodes());
        Deque<Integer> queue = new ArrayDeque<>();
        seen.set(start);
        queue.add(start);

        while (!queue.isEmpty()) {
            int u = queue.poll();

            for (int v : backward ? graph.parentIds(u) : graph.childIds(u)) {
                if (!seen.get(v)) {
                    seen.set(v);
                    queue.add(v);
                }
            }
        }

        return seen;
    }

    private boolean reaches(int from, int to, BitSet blocked) {
        BitSet seen = new BitSet(codec.getNumNodes());
        Deque<Integer> queue = new ArrayDeque<>();
        seen.set(from);
        queue.add(from);

        while (!queue.isEmpty()) {
            int u = queue.poll();
            if (u == to) return true;

            for (int v : graph.childIds(u)) {
                if (!seen.get(v) && !blocked.get(v)) {
                    seen.set(v);
                    queue.add(v);
                }
            }
        }

        return false;
    }

    /**
     * Kahn's algorithm restricted to the induced subgraph on the given ids.
     */
    private boolean isAcyclic(BitSet ids) {
        int[] inDegree = new int[codec.getNumNodes()];
        Deque<Integer> ready = new ArrayDeque<>();

        for (int id = ids.nextSetBit(0); id >= 0; id = ids.nextSetBit(id + 1)) {
            for (int p : graph.parentIds(id)) {
                if (ids.get(p)) inDegree[id]++;
            }

            if (inDegree[id] == 0) ready.add(id);
        }

        int removed = 0;

        while (!ready.isEmpty()) {
            int u = ready.poll();
            removed++;

            for (int c : graph.childIds(u)) {
                if (ids.get(c) && --inDegree[c] == 0) {
                    ready.add(c);
                }
            }
        }

        return removed == ids.cardinality();
    }
}
