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

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Maps lagged nodes to flat ids and back. Layer L of the unrolled graph holds the ids of lag -L, so
 * id = variable + numVariables * |lag|.
 * <p>
 * No other class does this arithmetic.
 *
 * @author Joseph Ramsey
 */
public final class NodeCodec {
    private final int numVariables;
    private final int taumax;

    //=============================CONSTRUCTORS==========================//

    public NodeCodec(int numVariables, int taumax) {
        if (numVariables < 1) {
            throw new IllegalArgumentException("Need at least one variable: " + numVariables);
        }

        if (taumax < 0) {
            throw new IllegalArgumentException("taumax must be non-negative: " + taumax);
        }

        this.numVariables = numVariables;
        this.taumax = taumax;
    }

    //==============================PUBLIC METHODS========================//

    public int getNumVariables() {
        return numVariables;
    }

    public int getTaumax() {
        return taumax;
    }

    /**
     * @return numVariables * (taumax + 1).
     */
    public int getNumNodes() {
        return numVariables * (taumax + 1);
    }

    public int encode(LaggedNode node) {
        checkNode(node);
        return encodeUnchecked(node.getVariable(), node.getLag());
    }

    public int encode(int variable, int lag) {
        return encode(new LaggedNode(variable, lag));
    }

    public LaggedNode decode(int id) {
        checkId(id);
        return new LaggedNode(id % numVariables, -(id / numVariables));
    }

    /**
     * Encodes without checking the lag horizon. The result may be >= getNumNodes(); the graph builder uses this to
     * detect parents that fall off the end of the unrolled window.
     */
    int encodeUnchecked(int variable, int lag) {
        return variable + numVariables * Math.abs(lag);
    }

    public void checkNode(LaggedNode node) {
        if (node == null) {
            throw new NullPointerException("Node is null.");
        }

        if (node.getVariable() < 0 || node.getVariable() >= numVariables) {
            throw new InvalidNodeException("The variable " + node.getVariable()
                    + " of node " + node + " is not in the declared variable set [0, " + numVariables + ").");
        }

        if (node.getLag() > 0) {
            throw new InvalidNodeException("The lag of node " + node + " is in the future.");
        }

        if (-node.getLag() > taumax) {
            throw new InvalidNodeException("The lag of node " + node + " is larger than taumax = " + taumax + ".");
        }
    }

    public void checkNodes(Collection<LaggedNode> nodes) {
        for (LaggedNode node : nodes) {
            checkNode(node);
        }
    }

    public void checkId(int id) {
        if (id < 0 || id >= getNumNodes()) {
            throw new InvalidNodeException("Node id " + id + " is out of range [0, " + getNumNodes() + ").");
        }
    }

    public int[] encodeAll(Collection<LaggedNode> nodes) {
        int[] ids = new int[nodes.size()];
        int i = 0;

        for (LaggedNode node : nodes) {
            ids[i++] = encode(node);
        }

        return ids;
    }

    public SortedSet<LaggedNode> decodeAll(Iterable<Integer> ids) {
        SortedSet<LaggedNode> nodes = new TreeSet<>();

        for (int id : ids) {
            nodes.add(decode(id));
        }

        return nodes;
    }

    public List<LaggedNode> decodePath(List<Integer> path) {
        List<LaggedNode> nodes = new ArrayList<>(path.size());

        for (int id : path) {
            nodes.add(decode(id));
        }

        return nodes;
    }
}
