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

import org.apache.commons.math3.linear.RealMatrix;

import java.util.ArrayList;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * The time-unrolled causal graph over numVariables * (taumax + 1) nodes, together with its dense, non-negative weight
 * matrix. Instances are produced by {@link TimeLagGraphBuilder} and never change afterwards, so a single graph may be
 * shared by any number of readers.
 *
 * @author Joseph Ramsey
 */
public final class TimeLagGraph {
    private final CausalDeclaration declaration;
    private final NodeCodec codec;

    /**
     * parents[id] and children[id] hold the adjacent ids in increasing order.
     */
    private final int[][] parents;
    private final int[][] children;

    private final RealMatrix weights;
    private final double offset;

    //=============================CONSTRUCTORS==========================//

    TimeLagGraph(CausalDeclaration declaration, NodeCodec codec, int[][] parents, int[][] children,
                 RealMatrix weights, double offset) {
        this.declaration = declaration;
        this.codec = codec;
        this.parents = parents;
        this.children = children;
        this.weights = weights;
        this.offset = offset;
    }

    //==============================PUBLIC METHODS========================//

    public CausalDeclaration getDeclaration() {
        return declaration;
    }

    public NodeCodec getCodec() {
        return codec;
    }

    public int getNumVariables() {
        return codec.getNumVariables();
    }

    public int getTaumax() {
        return codec.getTaumax();
    }

    public int getNumNodes() {
        return codec.getNumNodes();
    }

    /**
     * @return the amount subtracted from every lag function value to make the weights non-negative; 0 if none were
     * negative.
     */
    public double getOffset() {
        return offset;
    }

    /**
     * @return a copy of the nnodes x nnodes weight matrix; entry (i, j) is the weight of the edge from id i to id j, or
     * 0 if there is none.
     */
    public RealMatrix getWeightMatrix() {
        return weights.copy();
    }

    public double getWeight(LaggedNode parent, LaggedNode child) {
        return weights.getEntry(codec.encode(parent), codec.encode(child));
    }

    public boolean isParentOf(LaggedNode parent, LaggedNode child) {
        int p = codec.encode(parent);

        for (int q : parents[codec.encode(child)]) {
            if (q == p) return true;
        }

        return false;
    }

    public SortedSet<LaggedNode> getParents(LaggedNode node) {
        return toNodes(parents[codec.encode(node)]);
    }

    public SortedSet<LaggedNode> getChildren(LaggedNode node) {
        return toNodes(children[codec.encode(node)]);
    }

    public List<Edge> getEdges() {
        List<Edge> edges = new ArrayList<>();

        for (int child = 0; child < parents.length; child++) {
            for (int parent : parents[child]) {
                edges.add(new Edge(codec.decode(parent), codec.decode(child), weights.getEntry(parent, child)));
            }
        }

        return edges;
    }

    public int getNumEdges() {
        int n = 0;

        for (int[] p : parents) {
            n += p.length;
        }

        return n;
    }

    @Override
    public String toString() {
        StringBuilder b = new StringBuilder();
        b.append("Time lag graph: ").append(getNumVariables()).append(" variables, taumax = ").append(getTaumax())
                .append(", ").append(getNumEdges()).append(" edges\n");

        for (Edge edge : getEdges()) {
            b.append(edge).append("\n");
        }

        return b.toString();
    }

    //==============================PACKAGE METHODS========================//

    int[] parentIds(int id) {
        return parents[id];
    }

    int[] childIds(int id) {
        return children[id];
    }

    private SortedSet<LaggedNode> toNodes(int[] ids) {
        SortedSet<LaggedNode> nodes = new TreeSet<>();

        for (int id : ids) {
            nodes.add(codec.decode(id));
        }

        return nodes;
    }
}
