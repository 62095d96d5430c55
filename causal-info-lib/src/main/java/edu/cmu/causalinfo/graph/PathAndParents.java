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

import java.util.Collections;
import java.util.SortedSet;

/**
 * The nodes on the causal paths from a source to a target (target excluded) and the parents of those nodes that are
 * not themselves on a path.
 *
 * @author Joseph Ramsey
 */
public final class PathAndParents {
    private final SortedSet<LaggedNode> parents;
    private final SortedSet<LaggedNode> pathNodes;

    public PathAndParents(SortedSet<LaggedNode> parents, SortedSet<LaggedNode> pathNodes) {
        this.parents = Collections.unmodifiableSortedSet(parents);
        this.pathNodes = Collections.unmodifiableSortedSet(pathNodes);
    }

    public SortedSet<LaggedNode> getParents() {
        return parents;
    }

    public SortedSet<LaggedNode> getPathNodes() {
        return pathNodes;
    }

    @Override
    public String toString() {
        return "path nodes = " + pathNodes + ", parents = " + parents;
    }
}
