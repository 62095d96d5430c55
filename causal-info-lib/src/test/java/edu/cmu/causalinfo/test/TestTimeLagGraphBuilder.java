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
import edu.cmu.causalinfo.graph.Edge;
import edu.cmu.causalinfo.graph.LagFunctions;
import edu.cmu.causalinfo.graph.LaggedNode;
import edu.cmu.causalinfo.graph.TimeLagGraph;
import edu.cmu.causalinfo.graph.TimeLagGraphBuilder;
import org.apache.commons.math3.linear.RealMatrix;
import org.junit.Test;

import java.util.Arrays;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class TestTimeLagGraphBuilder {

    @Test
    public void testUnrolling() {
        TimeLagGraph graph = ExampleGraphs.twoVariables(10);

        assertEquals(22, graph.getNumNodes());

        // X0 <-- lag 1 parents exist in layers 0..9, X1 <-- (0, 0) in all 11 layers, X1 <-- (1, -1) in 10.
        assertEquals(2 * 10 + 11 + 10, graph.getNumEdges());

        assertTrue(graph.isParentOf(new LaggedNode(0, -1), new LaggedNode(0, 0)));
        assertTrue(graph.isParentOf(new LaggedNode(1, -10), new LaggedNode(0, -9)));
        assertTrue(graph.isParentOf(new LaggedNode(0, -10), new LaggedNode(1, -10)));
        assertFalse(graph.isParentOf(new LaggedNode(0, 0), new LaggedNode(0, -1)));
        assertTrue(graph.getParents(new LaggedNode(0, -10)).isEmpty());
        assertEquals(0.0, graph.getOffset(), 0.0);
        assertEquals(1.0, graph.getWeight(new LaggedNode(1, -1), new LaggedNode(0, 0)), 0.0);
    }

    @Test
    public void testEdgesStayInsideWindow() {
        TimeLagGraph graph = ExampleGraphs.twoVariables(3);

        for (Edge edge : graph.getEdges()) {
            assertTrue(edge.getParent().getLag() >= -3);
            assertTrue(edge.getParent().getLag() <= edge.getChild().getLag());
        }
    }

    @Test
    public void testSingleLayer() {
        TimeLagGraph graph = ExampleGraphs.twoVariables(0);

        assertEquals(2, graph.getNumNodes());
        assertEquals(1, graph.getNumEdges());
        assertTrue(graph.isParentOf(new LaggedNode(0, 0), new LaggedNode(1, 0)));
    }

    @Test
    public void testParentBeyondTaumaxIsDropped() {
        CausalDeclaration declaration = new CausalDeclaration(1).addParent(0, 0, -3);

        assertEquals(3, declaration.getMaxLag());
        assertEquals(0, TimeLagGraphBuilder.build(declaration, 2).getNumEdges());
        assertEquals(1, TimeLagGraphBuilder.build(declaration, 3).getNumEdges());
    }

    @Test
    public void testDuplicateParentsCollapse() {
        CausalDeclaration declaration = new CausalDeclaration(2)
                .addParent(1, 0, -1)
                .addParent(1, new LaggedNode(0, -1));

        assertEquals(1, declaration.getParents(1).size());
        assertEquals(1, TimeLagGraphBuilder.build(declaration, 1).getNumEdges());
    }

    @Test
    public void testNegativeLagFunctionsAreShifted() {
        double[][][] values = new double[2][2][2];
        values[0][1][1] = 1.0;
        values[1][0][0] = -0.5;

        CausalDeclaration declaration = new CausalDeclaration(2).addParent(1, 0, -1);
        TimeLagGraph graph = TimeLagGraphBuilder.build(declaration, new LagFunctions(values), 1);

        assertEquals(-0.5, graph.getOffset(), 0.0);
        assertEquals(1.5, graph.getWeight(new LaggedNode(0, -1), new LaggedNode(1, 0)), 1e-12);

        for (Edge edge : graph.getEdges()) {
            assertTrue(edge.getWeight() >= 0);
        }
    }

    @Test
    public void testWeightMatrixIsACopy() {
        TimeLagGraph graph = ExampleGraphs.twoVariables(2);
        RealMatrix weights = graph.getWeightMatrix();
        weights.setEntry(2, 0, 42.0);

        assertEquals(1.0, graph.getWeight(new LaggedNode(0, -1), new LaggedNode(0, 0)), 0.0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRejectsNegativeTaumax() {
        ExampleGraphs.twoVariables(-1);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRejectsShortLagFunctions() {
        TimeLagGraphBuilder.build(ExampleGraphs.twoVariables(), LagFunctions.uniform(2, 1), 3);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRejectsRaggedLagFunctions() {
        new LagFunctions(new double[][][]{{{1, 1}, {1, 1}}, {{1, 1}, {1}}});
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRejectsFutureParent() {
        new CausalDeclaration(2).addParent(0, 1, 1);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRejectsUndeclaredParent() {
        new CausalDeclaration(Arrays.asList("a", "b")).addParent(0, 2, -1);
    }
}
