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

import org.apache.commons.lang3.Validate;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Unrolls a causal declaration over taumax + 1 time layers. For layer i, variable j and every declared parent p of j,
 * the edge (p.variable, -(i + |p.lag|)) --> (j, -i) is added with weight lagFunctions[p.variable][j][|p.lag|],
 * provided the parent still falls inside the window; parents older than taumax are dropped without complaint.
 * <p>
 * If any lag function value is negative, all weights are shifted up by the minimum so that the weight matrix is
 * non-negative. The shift is recorded on the graph.
 *
 * @author Joseph Ramsey
 */
public final class TimeLagGraphBuilder {
    private static final Logger LOGGER = LoggerFactory.getLogger(TimeLagGraphBuilder.class);

    private TimeLagGraphBuilder() {
    }

    /**
     * Builds the graph with uniform lag functions.
     */
    public static TimeLagGraph build(CausalDeclaration declaration, int taumax) {
        return build(declaration, null, taumax);
    }

    /**
     * @param lagFunctions the coupling strengths, or null for uniform weights of 1.0.
     */
    public static TimeLagGraph build(CausalDeclaration declaration, LagFunctions lagFunctions, int taumax) {
        Validate.notNull(declaration, "Causal declaration is null.");

        if (taumax < 0) {
            throw new IllegalArgumentException("taumax must be non-negative: " + taumax);
        }

        int nvar = declaration.getNumVariables();

        if (lagFunctions == null) {
            lagFunctions = LagFunctions.uniform(nvar, taumax);
        } else {
            if (lagFunctions.getNumVariables() != nvar) {
                throw new IllegalArgumentException("Lag functions cover " + lagFunctions.getNumVariables()
                        + " variables but the declaration has " + nvar + ".");
            }

            if (lagFunctions.getTaumax() < taumax) {
                throw new IllegalArgumentException("Lag functions go back " + lagFunctions.getTaumax()
                        + " steps but taumax is " + taumax + ".");
            }
        }

        NodeCodec codec = new NodeCodec(nvar, taumax);
        int nnodes = codec.getNumNodes();

        double min = lagFunctions.min();
        double offset = min < 0 ? min : 0;

        List<SortedSet<Integer>> parents = new ArrayList<>();
        List<SortedSet<Integer>> children = new ArrayList<>();

        for (int i = 0; i < nnodes; i++) {
            parents.add(new TreeSet<>());
            children.add(new TreeSet<>());
        }

        RealMatrix weights = MatrixUtils.createRealMatrix(nnodes, nnodes);
        int truncated = 0;

        for (int i = 0; i <= taumax; i++) {
            for (int j = 0; j < nvar; j++) {
                int end = codec.encodeUnchecked(j, -i);

                for (LaggedNode parent : declaration.getParents(j)) {
                    int lag = Math.abs(parent.getLag());
                    int start = codec.encodeUnchecked(parent.getVariable(), -(i + lag));

                    if (start >= nnodes) {
                        truncated++;
                        continue;
                    }

                    parents.get(end).add(start);
                    children.get(start).add(end);
                    weights.setEntry(start, end, lagFunctions.get(parent.getVariable(), j, lag) - offset);
                }
            }
        }

        TimeLagGraph graph = new TimeLagGraph(declaration, codec, toArrays(parents), toArrays(children),
                weights, offset);

        LOGGER.debug("Built time lag graph with {} nodes and {} edges; {} parent references fell outside "
                + "taumax = {}; weight offset = {}", nnodes, graph.getNumEdges(), truncated, taumax, offset);

        return graph;
    }

    private static int[][] toArrays(List<SortedSet<Integer>> sets) {
        int[][] arrays = new int[sets.size()][];

        for (int i = 0; i < sets.size(); i++) {
            SortedSet<Integer> set = sets.get(i);
            arrays[i] = new int[set.size()];
            int k = 0;

            for (int id : set) {
                arrays[i][k++] = id;
            }
        }

        return arrays;
    }
}
