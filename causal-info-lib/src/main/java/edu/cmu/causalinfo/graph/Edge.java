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

import java.util.Objects;

/**
 * A directed, weighted parent --> child edge of the unrolled graph.
 *
 * @author Joseph Ramsey
 */
public final class Edge {
    private final LaggedNode parent;
    private final LaggedNode child;
    private final double weight;

    public Edge(LaggedNode parent, LaggedNode child, double weight) {
        this.parent = parent;
        this.child = child;
        this.weight = weight;
    }

    public LaggedNode getParent() {
        return parent;
    }

    public LaggedNode getChild() {
        return child;
    }

    public double getWeight() {
        return weight;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Edge)) return false;
        Edge edge = (Edge) o;
        return Double.compare(edge.weight, weight) == 0 && parent.equals(edge.parent) && child.equals(edge.child);
    }

    @Override
    public int hashCode() {
        return Objects.hash(parent, child, weight);
    }

    @Override
    public String toString() {
        return parent + " --> " + child + " [" + weight + "]";
    }
}
