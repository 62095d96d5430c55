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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Elements for the cumulative information transfer from several source nodes to a target.
 *
 * @author Joseph Ramsey
 */
public final class CitComponents {
    private final ConditionSet conditions;
    private final SortedSet<LaggedNode> targetParentsOnPaths;
    private final SortedSet<LaggedNode> pathNodes;
    private final List<LaggedNode> sources;
    private final List<Edge> removedEdges;

    CitComponents(ConditionSet conditions, SortedSet<LaggedNode> targetParentsOnPaths,
                  SortedSet<LaggedNode> pathNodes, List<LaggedNode> sources, List<Edge> removedEdges) {
        this.conditions = conditions;
        this.targetParentsOnPaths = Collections.unmodifiableSortedSet(targetParentsOnPaths);
        this.pathNodes = Collections.unmodifiableSortedSet(pathNodes);
        this.sources = Collections.unmodifiableList(sources);
        this.removedEdges = Collections.unmodifiableList(removedEdges);
    }

    static CitComponents unlinked() {
        return new CitComponents(ConditionSet.unlinked(), new TreeSet<>(), new TreeSet<>(), new ArrayList<>(),
                new ArrayList<>());
    }

    public ConditionSet getConditions() {
        return conditions;
    }

    public SortedSet<LaggedNode> getTargetParentsOnPaths() {
        return targetParentsOnPaths;
    }

    public SortedSet<LaggedNode> getPathNodes() {
        return pathNodes;
    }

    /**
     * @return the sources linked to the target, in the order given.
     */
    public List<LaggedNode> getSources() {
        return sources;
    }

    public List<Edge> getRemovedEdges() {
        return removedEdges;
    }

    @Override
    public String toString() {
        return "sources " + sources + ", conditions " + conditions + ", ptc " + targetParentsOnPaths;
    }
}
