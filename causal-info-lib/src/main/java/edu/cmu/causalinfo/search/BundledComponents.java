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
 * Elements for the information transfer from a bundle of source variables to a target, with the source history split
 * at tau into an immediate part (lags 1..tau before the target) and a distant part (older).
 *
 * @author Joseph Ramsey
 */
public final class BundledComponents {
    private final SortedSet<LaggedNode> distantConditions;
    private final SortedSet<LaggedNode> targetParentsInSources;
    private final SortedSet<LaggedNode> remainingConditions;
    private final SortedSet<LaggedNode> secondOrderParents;
    private final List<Edge> removedEdges;
    private final List<Edge> secondOrderRemovedEdges;

    BundledComponents(SortedSet<LaggedNode> distantConditions, SortedSet<LaggedNode> targetParentsInSources,
                      SortedSet<LaggedNode> remainingConditions, SortedSet<LaggedNode> secondOrderParents,
                      List<Edge> removedEdges, List<Edge> secondOrderRemovedEdges) {
        this.distantConditions = Collections.unmodifiableSortedSet(distantConditions);
        this.targetParentsInSources = Collections.unmodifiableSortedSet(targetParentsInSources);
        this.remainingConditions = Collections.unmodifiableSortedSet(remainingConditions);
        this.secondOrderParents = Collections.unmodifiableSortedSet(secondOrderParents);
        this.removedEdges = Collections.unmodifiableList(removedEdges);
        this.secondOrderRemovedEdges = Collections.unmodifiableList(secondOrderRemovedEdges);
    }

    /**
     * @return w, the distant-history nodes of the source variables that are parents of the immediate history.
     */
    public SortedSet<LaggedNode> getDistantConditions() {
        return distantConditions;
    }

    /**
     * @return the parents of the target in the source variables, no older than tau.
     */
    public SortedSet<LaggedNode> getTargetParentsInSources() {
        return targetParentsInSources;
    }

    /**
     * @return f, the condition set in the other variables at the chosen level.
     */
    public SortedSet<LaggedNode> getRemainingConditions() {
        return remainingConditions;
    }

    /**
     * @return at level 2, the parents of w and of the target's source parents that lie outside the source variables;
     * empty otherwise.
     */
    public SortedSet<LaggedNode> getSecondOrderParents() {
        return secondOrderParents;
    }

    /**
     * @return the edges found dominated when w was reduced; empty without transitive reduction.
     */
    public List<Edge> getRemovedEdges() {
        return removedEdges;
    }

    public List<Edge> getSecondOrderRemovedEdges() {
        return secondOrderRemovedEdges;
    }

    @Override
    public String toString() {
        return "w = " + distantConditions + ", ptc = " + targetParentsInSources + ", f = " + remainingConditions;
    }
}
