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

import edu.cmu.causalinfo.graph.LaggedNode;

import java.util.Collections;
import java.util.List;
import java.util.SortedSet;

/**
 * Conditions for the partial information decomposition of two sets of sources and a target, with the sources of each
 * set that are actually linked to the target.
 *
 * @author Joseph Ramsey
 */
public final class MpidSetCondition {
    private final List<LaggedNode> firstSources;
    private final List<LaggedNode> secondSources;
    private final ConditionSet conditions;
    private final SortedSet<LaggedNode> pathNodes;

    MpidSetCondition(List<LaggedNode> firstSources, List<LaggedNode> secondSources, ConditionSet conditions,
                     SortedSet<LaggedNode> pathNodes) {
        this.firstSources = Collections.unmodifiableList(firstSources);
        this.secondSources = Collections.unmodifiableList(secondSources);
        this.conditions = conditions;
        this.pathNodes = Collections.unmodifiableSortedSet(pathNodes);
    }

    /**
     * @return the retained sources of the first set, in the order given.
     */
    public List<LaggedNode> getFirstSources() {
        return firstSources;
    }

    public List<LaggedNode> getSecondSources() {
        return secondSources;
    }

    public ConditionSet getConditions() {
        return conditions;
    }

    public SortedSet<LaggedNode> getPathNodes() {
        return pathNodes;
    }

    @Override
    public String toString() {
        return "sources " + firstSources + " / " + secondSources + ", conditions " + conditions;
    }
}
