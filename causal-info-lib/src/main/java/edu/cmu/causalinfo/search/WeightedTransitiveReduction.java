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

package edu.cmu.causalinfo.search;

import edu.cmu.causalinfo.graph.Edge;
import edu.cmu.causalinfo.graph.LaggedNode;
import edu.cmu.causalinfo.graph.NodeCodec;
import edu.cmu.causalinfo.graph.TimeLagGraph;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.IntStream;

/**
 * Weighted transitive reduction of the unrolled graph. The max-min closure
 * <pre>
 *     C[i][j] = max(C[i][j], min(C[i][k], C[k][j]))   for k, then i, then j
 * </pre>
 * gives for every pair the strongest bottleneck over all paths. A direct edge whose closure exceeds its own weight is
 * dominated by an indirect path and is zeroed. A candidate node is then kept only if the sum of its remaining weights
 * to the reference set is non-zero.
 * <p>
 * The test is for an exact zero: a node whose several small direct edges are each dominated is dropped, even if
 * those edges are not jointly redundant. An empty reference set drops every candidate.
 * <p>
 * The closure is O(n^3) in the number of unrolled nodes and depends only on the graph, so it is computed on first use
 * and shared by later calls.
 *
 * @author Joseph Ramsey
 */
public final class WeightedTransitiveReduction {
    private static final Logger LOGGER = LoggerFactory.getLogger(WeightedTransitiveReduction.class);

    private final TimeLagGraph graph;
    private final NodeCodec codec;
    private final double[][] weights;
    private final boolean parallel;

    /**
     * Weights with every dominated entry set to zero; null until first needed.
     */
    private volatile double[][] reduced;
    private volatile double[][] closure;

    //=============================CONSTRUCTORS==========================//

    public WeightedTransitiveReduction(TimeLagGraph graph) {
        this(graph, false);
    }

    /**
     * @param parallel whether rows are relaxed in parallel for each intermediate node. The result is the same.
     */
    public WeightedTransitiveReduction(TimeLagGraph graph, boolean parallel) {
        Validate.notNull(graph, "Graph is null.");
        this.graph = graph;
        this.codec = graph.getCodec();
        this.weights = graph.getWeightMatrix().getData();
        this.parallel = parallel;
    }

    //==============================PUBLIC METHODS========================//

    /**
     * Removes from v1 every node with no undominated edge into v2.
     *
     * @param v1 the candidate set.
     * @param v2 the reference set.
     * @return the kept subset of v1 and the dominated v1 --> v2 edges.
     */
    public ReductionResult reduce(Collection<LaggedNode> v1, Collection<LaggedNode> v2) {
        Validate.notNull(v1, "Candidate set is null.");
        Validate.notNull(v2, "Reference set is null.");

        codec.checkNodes(v1);
        codec.checkNodes(v2);

        SortedSet<LaggedNode> candidates = new TreeSet<>(v1);
        SortedSet<LaggedNode> references = new TreeSet<>(v2);

        int[] refIds = codec.encodeAll(references);
        double[][] c = getClosure();
        double[][] r = getReduced();

        SortedSet<LaggedNode> kept = new TreeSet<>();
        List<Edge> removed = new ArrayList<>();

        for (LaggedNode node : candidates) {
            int i = codec.encode(node);
            double sum = 0.0;

            for (int j : refIds) {
                sum += r[i][j];

                if (c[i][j] > weights[i][j] && graph.isParentOf(node, codec.decode(j))) {
                    removed.add(new Edge(node, codec.decode(j), weights[i][j]));
                }
            }

            if (sum != 0.0) {
                kept.add(node);
            }
        }

        LOGGER.debug("Transitive reduction kept {} of {} candidates against {} references",
                kept.size(), candidates.size(), references.size());

        return new ReductionResult(kept, removed);
    }

    /**
     * @return a copy of the max-min closure of the weight matrix.
     */
    public double[][] closure() {
        double[][] c = getClosure();
        double[][] copy = new double[c.length][];

        for (int i = 0; i < c.length; i++) {
            copy[i] = c[i].clone();
        }

        return copy;
    }

    //==============================PRIVATE METHODS========================//

    private double[][] getClosure() {
        double[][] c = closure;

        if (c == null) {
            synchronized (this) {
                c = closure;

                if (c == null) {
                    c = computeClosure();
                    closure = c;
                }
            }
        }

        return c;
    }

    private double[][] getReduced() {
        double[][] r = reduced;

        if (r == null) {
            synchronized (this) {
                r = reduced;

                if (r == null) {
                    double[][] c = getClosure();
                    int n = weights.length;
                    r = new double[n][n];

                    for (int i = 0; i < n; i++) {
                        for (int j = 0; j < n; j++) {
                            r[i][j] = c[i][j] > weights[i][j] ? 0.0 : weights[i][j];
                        }
                    }

                    reduced = r;
                }
            }
        }

        return r;
    }

    private double[][] computeClosure() {
        int n = weights.length;
        double[][] c = new double[n][];

        for (int i = 0; i < n; i++) {
            c[i] = weights[i].clone();
        }

        long start = System.currentTimeMillis();

        for (int k = 0; k < n; k++) {
            // Row k and column k do not change while k is the intermediate node, so rows can be relaxed in place
            // and independently.
            final double[] rowK = c[k];
            final int _k = k;

            if (parallel) {
                IntStream.range(0, n).parallel().forEach(i -> relax(c[i], _k, rowK));
            } else {
                for (int i = 0; i < n; i++) {
                    relax(c[i], k, rowK);
                }
            }
        }

        LOGGER.debug("Max-min closure over {} nodes took {} ms", n, System.currentTimeMillis() - start);
        return c;
    }

    private static void relax(double[] rowI, int k, double[] rowK) {
        double ik = rowI[k];
        if (ik == 0.0) return;

        for (int j = 0; j < rowI.length; j++) {
            double m = Math.min(ik, rowK[j]);
            if (m > rowI[j]) rowI[j] = m;
        }
    }
}
