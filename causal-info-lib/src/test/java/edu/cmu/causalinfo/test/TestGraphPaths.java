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

package edu.cmu.causalinfo.test;

import edu.cmu.causalinfo.graph.CausalDeclaration;
import edu.cmu.causalinfo.graph.GraphPaths;
import edu.cmu.causalinfo.graph.LaggedNode;
import edu.cmu.causalinfo.graph.PathAndParents;
import edu.cmu.causalinfo.graph.TimeLagGraph;
import edu.cmu.causalinfo.graph.TimeLagGraphBuilder;
import edu.cmu.causalinfo.util.DiagnosticEvent;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class TestGraphPaths {

    @Test
    public void testParentsAndChildren() {
        GraphPaths paths = new GraphPaths(ExampleGraphs.twoVariables(10));

        assertEquals(nodes(0, -1, 1, -1), paths.parentsOf(Collections.singletonList(new LaggedNode(0, 0))));
        assertEquals(nodes(0, 0, 1, -1), paths.parentsOf(Collections.singletonList(new LaggedNode(1, 0))));
        assertEquals(nodes(0, 0, 1, -1), paths.childrenOf(Collections.singletonList(new LaggedNode(0, -1))));
    }

    @Test
    public void testNeighborsExcludeMembers() {
        GraphPaths paths = new GraphPaths(ExampleGraphs.twoVariables(10));

        List<LaggedNode> set = Arrays.asList(new LaggedNode(0, 0), new LaggedNode(1, 0));
        SortedSet<LaggedNode> parents = paths.parentsOf(set);
        assertEquals(nodes(0, -1, 1, -1), parents);

        List<LaggedNode> set2 = Arrays.asList(new LaggedNode(0, -1), new LaggedNode(1, -1));
        SortedSet<LaggedNode> children = paths.childrenOf(set2);
        assertEquals(nodes(0, 0, 1, 0), children);

        for (LaggedNode node : set2) {
            assertFalse(children.contains(node));
        }
    }

    @Test
    public void testSearchParentsReportsEmpty() {
        RecordingSink sink = new RecordingSink();
        GraphPaths paths = new GraphPaths(ExampleGraphs.twoVariables(2), sink);

        assertTrue(paths.searchParents(new LaggedNode(0, -2)).isEmpty());
        assertEquals(1, sink.count(DiagnosticEvent.Type.NO_PARENTS));

        assertTrue(paths.searchChildren(new LaggedNode(1, 0)).isEmpty());
        assertEquals(1, sink.count(DiagnosticEvent.Type.NO_CHILDREN));

        assertFalse(paths.searchParents(new LaggedNode(0, 0)).isEmpty());
        assertEquals(1, sink.count(DiagnosticEvent.Type.NO_PARENTS));
    }

    @Test
    public void testPathNodesAcrossSixLags() {
        GraphPaths paths = new GraphPaths(ExampleGraphs.twoVariables(10));
        LaggedNode source = new LaggedNode(1, -6);
        LaggedNode target = new LaggedNode(0, 0);

        SortedSet<LaggedNode> expected = new TreeSet<>();
        expected.add(source);

        for (int k = 1; k <= 5; k++) {
            expected.add(new LaggedNode(0, -k));
            expected.add(new LaggedNode(1, -k));
        }

        SortedSet<LaggedNode> flat = paths.causalPathNodes(source, target);
        assertEquals(expected, flat);
        assertEquals(11, flat.size());
        assertFalse(flat.contains(new LaggedNode(1, 0)));
        assertFalse(flat.contains(target));

        assertEquals(flat, flatten(paths.simplePaths(source, target), target));
    }

    @Test
    public void testNestedPathsAreSimpleAndDirected() {
        TimeLagGraph graph = ExampleGraphs.twoVariables(4);
        GraphPaths paths = new GraphPaths(graph);
        LaggedNode source = new LaggedNode(1, -3);
        LaggedNode target = new LaggedNode(0, 0);

        List<List<LaggedNode>> nested = paths.simplePaths(source, target);
        assertFalse(nested.isEmpty());

        for (List<LaggedNode> path : nested) {
            assertEquals(source, path.get(0));
            assertEquals(target, path.get(path.size() - 1));
            assertEquals(path.size(), new TreeSet<>(path).size());

            for (int i = 0; i + 1 < path.size(); i++) {
                assertTrue(graph.isParentOf(path.get(i), path.get(i + 1)));
            }
        }
    }

    @Test
    public void testNoPath() {
        GraphPaths paths = new GraphPaths(ExampleGraphs.twoVariables(10));

        assertFalse(paths.hasCausalPath(new LaggedNode(1, 0), new LaggedNode(0, 0)));
        assertTrue(paths.simplePaths(new LaggedNode(1, 0), new LaggedNode(0, 0)).isEmpty());
        assertTrue(paths.causalPathNodes(new LaggedNode(1, 0), new LaggedNode(0, 0)).isEmpty());
        assertTrue(paths.causalPathNodes(new LaggedNode(0, 0), new LaggedNode(0, -1)).isEmpty());

        LaggedNode node = new LaggedNode(0, -2);
        assertFalse(paths.hasCausalPath(node, node));
        assertTrue(paths.simplePaths(node, node).isEmpty());
    }

    @Test
    public void testMultiHopPath() {
        GraphPaths paths = new GraphPaths(ExampleGraphs.twoVariables(3));
        assertTrue(paths.hasMultiHopPath(new LaggedNode(0, -1), new LaggedNode(0, 0)));
        assertFalse(paths.hasMultiHopPath(new LaggedNode(1, -1), new LaggedNode(0, 0)));
        assertFalse(paths.hasMultiHopPath(new LaggedNode(1, 0), new LaggedNode(0, 0)));
    }

    @Test
    public void testCycleFallsBackToEnumeration() {
        // 0 --> 1, 1 --> 2, 2 --> 1, 1 --> 3. Node 2 reaches the target only through 1, so it is on no simple path.
        CausalDeclaration declaration = new CausalDeclaration(4)
                .addParent(1, 0, 0)
                .addParent(2, 1, 0)
                .addParent(1, 2, 0)
                .addParent(3, 1, 0);

        GraphPaths paths = new GraphPaths(TimeLagGraphBuilder.build(declaration, 0));
        LaggedNode source = new LaggedNode(0, 0);
        LaggedNode target = new LaggedNode(3, 0);

        assertEquals(nodes(0, 0, 1, 0), paths.causalPathNodes(source, target));
        assertEquals(1, paths.simplePaths(source, target).size());
        assertEquals(paths.causalPathNodes(source, target), flatten(paths.simplePaths(source, target), target));
    }

    @Test
    public void testPathAndParents() {
        GraphPaths paths = new GraphPaths(ExampleGraphs.twoVariables(10));
        PathAndParents pp = paths.pathAndParents(new LaggedNode(0, -1), new LaggedNode(0, 0));

        assertEquals(nodes(0, -1, 1, -1), pp.getPathNodes());
        assertEquals(nodes(0, -2, 1, -2), pp.getParents());
    }

    private static SortedSet<LaggedNode> flatten(List<List<LaggedNode>> paths, LaggedNode target) {
        SortedSet<LaggedNode> nodes = new TreeSet<>();

        for (List<LaggedNode> path : paths) {
            nodes.addAll(path);
        }

        nodes.remove(target);
        return nodes;
    }

    /**
     * Nodes from pairs of (variable, lag).
     */
    static SortedSet<LaggedNode> nodes(int... pairs) {
        SortedSet<LaggedNode> nodes = new TreeSet<>();

        for (int i = 0; i < pairs.length; i += 2) {
            nodes.add(new LaggedNode(pairs[i], pairs[i + 1]));
        }

        return nodes;
    }
}
