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

import java.util.Collections;
import java.util.List;
import java.util.SortedSet;

/**
 * The outcome of a weighted transitive reduction: the members of the candidate set that keep a direct influence on
 * the reference set, and the candidate-to-reference edges that were found to be dominated by an indirect path.
 *
 * @author Joseph Ramsey
 */
public final class ReductionResult {
    private final SortedSet<LaggedNode> kept;
    private final List<Edge> removedEdges;

    ReductionResult(SortedSet<LaggedNode> kept, List<Edge> removedEdges) {
        this.kept = Collections.unmodifiableSortedSet(kept);
        this.removedEdges = Collections.unmodifiableList(removedEdges);
    }

    public SortedSet<LaggedNode> getKept() {
        return kept;
    }

    /**
     * @return the removed edges, each carrying its original weight.
     */
    public List<Edge> getRemovedEdges() {
        return removedEdges;
    }

    @Override
    public String toString() {
        return "kept = " + kept + ", removed edges = " + removedEdges;
    }
}
