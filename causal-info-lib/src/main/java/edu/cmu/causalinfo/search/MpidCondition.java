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
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Conditions for the momentary partial information decomposition of two sources and a target. The condition set is
 * the union of three terms:
 * <ul>
 * <li>the target's parents off both sources' causal paths,</li>
 * <li>the parents of the first source's paths that are not on the second source's paths,</li>
 * <li>the parents of the second source's paths that are not on the first source's paths,</li>
 * </ul>
 * possibly pruned by transitive reduction. The terms are kept as derived, before any pruning.
 *
 * @author Joseph Ramsey
 */
public final class MpidCondition {
    private final ConditionSet conditions;
    private final SortedSet<LaggedNode> targetTerm;
    private final SortedSet<LaggedNode> firstSourceTerm;
    private final SortedSet<LaggedNode> secondSourceTerm;
    private final SortedSet<LaggedNode> pathNodes;

    MpidCondition(ConditionSet conditions, SortedSet<LaggedNode> targetTerm, SortedSet<LaggedNode> firstSourceTerm,
                  SortedSet<LaggedNode> secondSourceTerm, SortedSet<LaggedNode> pathNodes) {
        this.conditions = conditions;
        this.targetTerm = Collections.unmodifiableSortedSet(targetTerm);
        this.firstSourceTerm = Collections.unmodifiableSortedSet(firstSourceTerm);
        this.secondSourceTerm = Collections.unmodifiableSortedSet(secondSourceTerm);
        this.pathNodes = Collections.unmodifiableSortedSet(pathNodes);
    }

    static MpidCondition unlinked() {
        return new MpidCondition(ConditionSet.unlinked(), new TreeSet<>(), new TreeSet<>(), new TreeSet<>(),
                new TreeSet<>());
    }

    public ConditionSet getConditions() {
        return conditions;
    }

    public SortedSet<LaggedNode> getTargetTerm() {
        return targetTerm;
    }

    public SortedSet<LaggedNode> getFirstSourceTerm() {
        return firstSourceTerm;
    }

    public SortedSet<LaggedNode> getSecondSourceTerm() {
        return secondSourceTerm;
    }

    /**
     * @return the nodes on the causal paths of either source, targets excluded.
     */
    public SortedSet<LaggedNode> getPathNodes() {
        return pathNodes;
    }

    @Override
    public String toString() {
        return "MPID conditions " + conditions + " (paths " + pathNodes + ")";
    }
}
